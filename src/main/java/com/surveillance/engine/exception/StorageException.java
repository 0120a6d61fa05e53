package com.surveillance.engine.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;

/**
 * A query or write against the detection store failed.
 *
 * Always propagated so the caller (HTTP client or trigger mechanism) can retry.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps a Spring data-access failure, keeping deadline expiry distinguishable.
     *
     * @param operation short description of what was attempted, used in the message
     */
    public static StorageException translate(String operation, DataAccessException cause) {
        if (cause instanceof QueryTimeoutException) {
            return new StorageTimeoutException("Timed out during: " + operation, cause);
        }
        return new StorageException("Failed to " + operation + ": " + cause.getMostSpecificCause().getMessage(), cause);
    }
}
