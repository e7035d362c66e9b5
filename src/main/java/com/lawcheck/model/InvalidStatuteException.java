package com.lawcheck.model;

/**
 * Thrown when statute input is malformed and no verification can run on it.
 */
public class InvalidStatuteException extends RuntimeException {

    public InvalidStatuteException(String message) {
        super(message);
    }

    public InvalidStatuteException(String message, Throwable cause) {
        super(message, cause);
    }
}
