package com.anthem.billtriage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * One parsed failure reason, e.g. {@code "RATE_MISSING: 70551"}.
 *
 * The kind is either one of the closed {@link FailureKind} values or an ad-hoc token
 * passed through verbatim ({@link #kind} is then null).
 */
@Value
public class FailureReason {

    public static final String UNKNOWN_TOKEN = "Unknown";

    /** Original reason text. */
    String raw;

    /** Left side of the first ':' (trimmed). */
    String kindToken;

    /** Matched kind, or null for an ad-hoc token. */
    FailureKind kind;

    /** Trimmed right side of the first ':', or null when absent or blank. */
    String detail;

    /** First whitespace-delimited token of the detail, or null. */
    String procedureCode;

    @JsonIgnore
    public boolean isKnownKind() {
        return kind != null;
    }

    public boolean hasProcedureCode() {
        return procedureCode != null;
    }

    /**
     * Parse a raw reason string. Never throws.
     */
    public static FailureReason parse(String raw) {
        String text = raw == null ? "" : raw;
        int colon = text.indexOf(':');

        String token = (colon < 0 ? text : text.substring(0, colon)).trim();
        if (token.isEmpty()) {
            token = UNKNOWN_TOKEN;
        }

        String detail = null;
        String code = null;
        if (colon >= 0) {
            String right = text.substring(colon + 1).trim();
            if (!right.isEmpty()) {
                detail = right;
                code = right.split("\\s+", 2)[0];
            }
        }

        return new FailureReason(text, token, FailureKind.fromToken(token).orElse(null), detail, code);
    }
}
