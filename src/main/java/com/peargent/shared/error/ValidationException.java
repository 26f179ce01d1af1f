package com.peargent.shared.error;

/**
 * Tool arguments are missing or do not match the declared schema. Never retried.
 */
public class ValidationException extends PeargentException {

    private final String parameter;

    public ValidationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }
}
