package com.anthem.billtriage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum AssignmentMode {

    /** Rates listed per procedure code (and modifier). */
    INDIVIDUAL("individual"),

    /** One rate per category, applied to the bill's failing codes in that category. */
    CATEGORY("category");

    private final String value;

    AssignmentMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<AssignmentMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AssignmentMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
