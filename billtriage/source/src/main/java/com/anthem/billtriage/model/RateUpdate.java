package com.anthem.billtriage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A rate applied to a (procedure code, modifier) pair.
 */
@Value
public class RateUpdate {

    String procedureCode;
    BigDecimal rate;
    String modifier;

    /** Category that supplied the rate; null in individual mode. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String category;
}
