package com.peargent.shared.error;

public class ModelException extends PeargentException {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
