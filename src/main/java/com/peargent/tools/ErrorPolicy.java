package com.peargent.tools;

import java.util.Locale;

/**
 * What a tool does once its retries are exhausted.
 */
public enum ErrorPolicy {
    /** Propagate the failure to the invoking agent. */
    RAISE,
    /** Absorb the failure into a {@code success=false} {@link ToolResult}. */
    RETURN_ERROR;

    public static ErrorPolicy parse(String value) {
        if (value == null || value.isBlank()) return RAISE;
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown on_error policy: " + value, e);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
