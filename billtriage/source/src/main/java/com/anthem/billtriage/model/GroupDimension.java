package com.anthem.billtriage.model;

import java.util.Locale;
import java.util.Optional;

public enum GroupDimension {
    KIND,
    PROVIDER,
    AGE_BUCKET;

    /**
     * Accepts {@code kind}, {@code provider}, {@code ageBucket} or the constant name.
     */
    public static Optional<GroupDimension> fromParam(String param) {
        if (param == null) {
            return Optional.empty();
        }
        String normalized = param.trim().replace("_", "").toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "kind":
            case "type":
                return Optional.of(KIND);
            case "provider":
                return Optional.of(PROVIDER);
            case "agebucket":
            case "age":
                return Optional.of(AGE_BUCKET);
            default:
                return Optional.empty();
        }
    }
}
