package com.anthem.billtriage.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Flat per-bill row handed to the presentation layer.
 */
@Value
@Builder
public class BillSummary {

    String filename;
    String provider;
    LocalDate earliestDateOfService;

    /** Null when the bill has no usable date of service. */
    Long ageDays;

    String ageBucket;
    List<String> failureKinds;
    List<FailureKindDisplay> failureKindDisplays;
    List<String> failingCodes;
    List<String> failureReasons;

    public static BillSummary from(FailedBill bill, LocalDate today) {
        List<String> kinds = bill.failureKindTokens();
        return BillSummary.builder()
                .filename(bill.getFilename())
                .provider(bill.providerName())
                .earliestDateOfService(bill.earliestServiceDate().orElse(null))
                .ageDays(bill.ageDays(today).orElse(null))
                .ageBucket(AgeBucket.forAge(bill.ageDays(today))
                        .map(AgeBucket::getLabel)
                        .orElse(AgeBucket.UNKNOWN_LABEL))
                .failureKinds(kinds)
                .failureKindDisplays(kinds.stream().map(FailureKindDisplay::of).toList())
                .failingCodes(bill.failingCodes())
                .failureReasons(bill.getFailureReasons().stream().map(FailureReason::getRaw).toList())
                .build();
    }
}
