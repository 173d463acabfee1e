package com.anthem.billtriage.model;

import lombok.Value;

/**
 * Non-blocking note attached to an accepted assignment.
 */
@Value
public class AssignmentWarning {

    public static final String CATEGORY_NO_MATCH = "CATEGORY_NO_MATCH";

    String code;
    String message;
    String field;
}
