package com.peargent.shared.error;

/**
 * Root of every failure raised by the orchestration core.
 */
public class PeargentException extends RuntimeException {

    public PeargentException(String message) {
        super(message);
    }

    public PeargentException(String message, Throwable cause) {
        super(message, cause);
    }
}
