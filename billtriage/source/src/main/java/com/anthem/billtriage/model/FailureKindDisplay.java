package com.anthem.billtriage.model;

import lombok.Value;

/**
 * Display metadata for a failure kind token, including tokens outside {@link FailureKind}.
 */
@Value
public class FailureKindDisplay {

    public static final String FALLBACK_COLOR = "#6c757d";
    public static final String FALLBACK_ICON = "fa-question-circle";

    String token;
    String label;
    String color;
    String icon;

    public static FailureKindDisplay of(String token) {
        return FailureKind.fromToken(token)
                .map(kind -> new FailureKindDisplay(kind.name(), kind.getLabel(), kind.getColor(), kind.getIcon()))
                .orElseGet(() -> new FailureKindDisplay(token, token, FALLBACK_COLOR, FALLBACK_ICON));
    }
}
