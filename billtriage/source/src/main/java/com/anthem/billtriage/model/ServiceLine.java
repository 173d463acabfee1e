package com.anthem.billtriage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A billed line item.
 */
@Value
@Builder
public class ServiceLine {

    String procedureCode;

    /** Date of service as received. */
    String rawDateOfService;

    /** Parsed date of service; null when missing or unparsable. */
    LocalDate dateOfService;

    @Builder.Default
    int units = 1;

    @Singular
    List<String> modifiers;
}
