package com.anthem.billtriage.model;

/**
 * Reasons a rate assignment is rejected. All are recoverable by resubmitting a corrected request.
 */
public enum AssignmentErrorCode {

    /** Mode missing, unknown, or inconsistent with the populated fields. */
    MALFORMED_REQUEST,

    /** Blank procedure code or missing/non-positive rate. */
    INVALID_RATE,

    /** Nothing to apply. */
    EMPTY_SUBMISSION,

    /** Inconsistency found while applying; nothing was recorded. */
    APPLY_FAILED
}
