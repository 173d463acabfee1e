package com.anthem.billtriage.service;

/**
 * A rate assignment was already recorded for the bill.
 */
public class AssignmentConflictException extends RuntimeException {

    private final String filename;

    public AssignmentConflictException(String filename, Throwable cause) {
        super("Rates were already assigned for " + filename, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
