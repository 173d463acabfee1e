package com.anthem.billtriage.service;

public class BillNotFoundException extends RuntimeException {

    private final String filename;

    public BillNotFoundException(String filename) {
        super("Failed bill not found: " + filename);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
