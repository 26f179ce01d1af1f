package com.peargent.shared.error;

import java.time.Duration;

/**
 * A tool or model call exceeded its time bound and was cancelled.
 */
public class OperationTimeoutException extends PeargentException {

    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
