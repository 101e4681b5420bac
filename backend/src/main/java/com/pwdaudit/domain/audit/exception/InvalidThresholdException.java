package com.pwdaudit.domain.audit.exception;

/**
 * A threshold value that would make every verdict meaningless. Raised before any record is read.
 */
public class InvalidThresholdException extends RuntimeException {

    private final String threshold;

    public InvalidThresholdException(String threshold, String message) {
        super("Invalid threshold '" + threshold + "': " + message);
        this.threshold = threshold;
    }

    public String getThreshold() {
        return threshold;
    }
}
