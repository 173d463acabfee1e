package com.anthem.billtriage.model;

import java.util.Optional;

/**
 * Closed set of reasons a bill can fail automated adjudication.
 *
 * Label, color and icon are presentation hints only.
 */
public enum FailureKind {

    RATE_MISSING("Missing Rate", "#dc3545", "fa-dollar-sign"),

    UNMATCHED_CPT("Unmatched CPT", "#fd7e14", "fa-code"),

    TOO_MANY_UNITS("Too Many Units", "#ffc107", "fa-list-ol"),

    READ_ERROR("Read Error", "#6c757d", "fa-file-circle-exclamation");

    private final String label;
    private final String color;
    private final String icon;

    FailureKind(String label, String color, String icon) {
        this.label = label;
        this.color = color;
        this.icon = icon;
    }

    public String getLabel() { return label; }
    public String getColor() { return color; }
    public String getIcon() { return icon; }

    /**
     * Case-sensitive lookup of a reason token. Unknown tokens yield empty.
     */
    public static Optional<FailureKind> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (FailureKind kind : values()) {
            if (kind.name().equals(token)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
