package com.anthem.billtriage.model;

import lombok.Value;

/**
 * Rejection of a rate assignment: violated rule plus the offending field, code or category.
 */
@Value
public class AssignmentError {

    AssignmentErrorCode code;
    String message;
    String field;

    /** Offending procedure code or category key, when there is one. */
    String subject;

    public static AssignmentError of(AssignmentErrorCode code, String message, String field) {
        return new AssignmentError(code, message, field, null);
    }

    public static AssignmentError of(AssignmentErrorCode code, String message, String field, String subject) {
        return new AssignmentError(code, message, field, subject);
    }
}
