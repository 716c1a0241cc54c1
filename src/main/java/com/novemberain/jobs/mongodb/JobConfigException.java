package com.novemberain.jobs.mongodb;

/**
 * Raised when a scheduler or its MongoDB connection cannot be configured.
 */
public class JobConfigException extends Exception {

    private static final long serialVersionUID = 1L;

    public JobConfigException(String message) {
        super(message);
    }

    public JobConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
