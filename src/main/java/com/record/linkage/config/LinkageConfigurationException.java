package com.record.linkage.config;

/**
 * Thrown when linkage configuration cannot be loaded or holds an invalid value.
 */
public class LinkageConfigurationException extends RuntimeException {

    public LinkageConfigurationException(String message) {
        super(message);
    }

    public LinkageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
