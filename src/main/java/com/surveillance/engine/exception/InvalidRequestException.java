package com.surveillance.engine.exception;

/**
 * Caller supplied input the engine cannot act on.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
