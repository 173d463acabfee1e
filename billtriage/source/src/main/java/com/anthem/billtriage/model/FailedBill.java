package com.anthem.billtriage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized view of a bill awaiting manual rate resolution. Keyed by {@link #filename}.
 */
@Value
@Builder
public class FailedBill {

    public static final String UNKNOWN_PROVIDER = "Unknown Provider";

    String filename;

    /** Provider display name; null when absent. */
    String provider;

    @Singular
    List<ServiceLine> serviceLines;

    @Singular
    List<FailureReason> failureReasons;

    public String providerName() {
        return provider != null ? provider : UNKNOWN_PROVIDER;
    }

    /**
     * Minimum parseable date of service. Empty when no line carries a usable date.
     */
    public Optional<LocalDate> earliestServiceDate() {
        return serviceLines.stream()
                .map(ServiceLine::getDateOfService)
                .filter(Objects::nonNull)
                .min(LocalDate::compareTo);
    }

    /**
     * Days between the earliest date of service and {@code today}; empty when undefined.
     */
    public Optional<Long> ageDays(LocalDate today) {
        return earliestServiceDate().map(dos -> ChronoUnit.DAYS.between(dos, today));
    }

    /**
     * Procedure codes named by failure reasons, distinct, in reason order.
     */
    public List<String> failingCodes() {
        Set<String> codes = new LinkedHashSet<>();
        for (FailureReason reason : failureReasons) {
            if (reason.hasProcedureCode()) {
                codes.add(reason.getProcedureCode());
            }
        }
        return new ArrayList<>(codes);
    }

    /**
     * Distinct kind tokens in reason order.
     */
    public List<String> failureKindTokens() {
        Set<String> tokens = new LinkedHashSet<>();
        failureReasons.forEach(r -> tokens.add(r.getKindToken()));
        return new ArrayList<>(tokens);
    }
}
