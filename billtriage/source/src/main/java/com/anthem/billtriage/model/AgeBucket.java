package com.anthem.billtriage.model;

import java.util.Optional;

/**
 * Fixed age ranges in days, measured from a bill's earliest date of service.
 */
public enum AgeBucket {

    DAYS_0_30("0–30"),
    DAYS_31_60("31–60"),
    DAYS_61_PLUS("61+");

    /** Group key for bills whose age is undefined. */
    public static final String UNKNOWN_LABEL = "Unknown";

    private final String label;

    AgeBucket(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Bucket for an age in days. Ages up to 30 (future-dated service included) fall in 0–30.
     */
    public static AgeBucket forAge(long days) {
        if (days <= 30) {
            return DAYS_0_30;
        }
        if (days <= 60) {
            return DAYS_31_60;
        }
        return DAYS_61_PLUS;
    }

    public static Optional<AgeBucket> forAge(Optional<Long> days) {
        return days.map(AgeBucket::forAge);
    }

    public boolean matches(Optional<Long> days) {
        return days.isPresent() && forAge(days.get()) == this;
    }

    /**
     * Accepts the label (en dash or ASCII hyphen) or the constant name.
     */
    public static Optional<AgeBucket> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '–');
        for (AgeBucket bucket : values()) {
            if (bucket.label.equals(normalized) || bucket.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(bucket);
            }
        }
        return Optional.empty();
    }
}
