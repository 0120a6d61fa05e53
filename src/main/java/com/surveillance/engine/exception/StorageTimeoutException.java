package com.surveillance.engine.exception;

/**
 * A store call or a whole invocation ran past its deadline. Safe to retry.
 */
public class StorageTimeoutException extends StorageException {

    public StorageTimeoutException(String message) {
        super(message);
    }

    public StorageTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
