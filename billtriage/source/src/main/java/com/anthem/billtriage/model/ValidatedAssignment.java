package com.anthem.billtriage.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mode-tagged request that passed validation. Procedure codes and modifiers are trimmed,
 * blank modifiers are null.
 */
@Value
public class ValidatedAssignment {

    AssignmentMode mode;
    List<RateEntry> rates;
    Map<String, BigDecimal> categoryRates;
    List<AssignmentWarning> warnings;

    public static ValidatedAssignment individual(List<RateEntry> rates, List<AssignmentWarning> warnings) {
        return new ValidatedAssignment(AssignmentMode.INDIVIDUAL, List.copyOf(rates), Map.of(), List.copyOf(warnings));
    }

    public static ValidatedAssignment category(Map<String, BigDecimal> categoryRates, List<AssignmentWarning> warnings) {
        return new ValidatedAssignment(AssignmentMode.CATEGORY, List.of(),
                Collections.unmodifiableMap(new LinkedHashMap<>(categoryRates)), List.copyOf(warnings));
    }
}
