package com.anthem.billtriage.query;

import com.anthem.billtriage.model.FailedBill;

/**
 * Chooses the single kind group a bill is placed in for grouping and kind statistics.
 */
public interface KindGroupingPolicy {

    String kindKey(FailedBill bill);
}
