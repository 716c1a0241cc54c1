package com.novemberain.jobs.mongodb;

/**
 * Raised when the backing store is unreachable or rejects a read or write.
 */
public class JobStoreException extends Exception {

    private static final long serialVersionUID = 1L;

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
