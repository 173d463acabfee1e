package com.anthem.billtriage.service;

import com.anthem.billtriage.model.AssignmentError;
import com.anthem.billtriage.model.AssignmentErrorCode;

/**
 * A rejected or aborted rate assignment. Nothing was recorded.
 */
public class RateAssignmentException extends RuntimeException {

    private final AssignmentError error;

    public RateAssignmentException(AssignmentError error) {
        super(error.getMessage());
        this.error = error;
    }

    public AssignmentError getError() {
        return error;
    }

    public AssignmentErrorCode getCode() {
        return error.getCode();
    }
}
