package com.peargent.shared.config;

import java.util.Locale;

public enum ContextStrategy {
    /** Full history. */
    NONE,
    /** Newest {@code maxContextMessages} entries. */
    TRUNCATE_OLDEST,
    /** Summary of the older entries, then system messages and the newest entries. */
    SMART;

    public static ContextStrategy parse(String value) {
        if (value == null || value.isBlank()) return NONE;
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown history strategy: " + value, e);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
