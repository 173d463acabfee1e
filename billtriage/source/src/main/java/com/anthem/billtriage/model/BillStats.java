package com.anthem.billtriage.model;

import lombok.Value;

import java.util.Map;

/**
 * Bill counts per group. Each bill is counted once per map.
 */
@Value
public class BillStats {
    Map<String, Long> byKind;
    Map<String, Long> byProvider;
    Map<String, Long> byAgeBucket;
}
