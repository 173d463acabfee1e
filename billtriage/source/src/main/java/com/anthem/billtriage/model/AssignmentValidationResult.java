package com.anthem.billtriage.model;

import lombok.Value;

/**
 * Either a {@link ValidatedAssignment} or the first {@link AssignmentError} found.
 */
@Value
public class AssignmentValidationResult {

    ValidatedAssignment assignment;
    AssignmentError error;

    public boolean isValid() {
        return error == null;
    }

    public static AssignmentValidationResult accepted(ValidatedAssignment assignment) {
        return new AssignmentValidationResult(assignment, null);
    }

    public static AssignmentValidationResult rejected(AssignmentError error) {
        return new AssignmentValidationResult(null, error);
    }
}
