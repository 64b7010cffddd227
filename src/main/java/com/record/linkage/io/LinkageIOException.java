package com.record.linkage.io;

/**
 * Unchecked wrapper for CSV input/output failures.
 */
public class LinkageIOException extends RuntimeException {

    public LinkageIOException(String message) {
        super(message);
    }

    public LinkageIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
