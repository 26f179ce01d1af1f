package com.peargent.shared.config;

public record HistoryConfig(
    boolean autoManageContext,
    int maxContextMessages,
    ContextStrategy strategy,
    boolean compactStore
) {
    public HistoryConfig {
        if (maxContextMessages < 1) {
            throw new IllegalArgumentException("maxContextMessages must be >= 1, got " + maxContextMessages);
        }
        strategy = strategy != null ? strategy : ContextStrategy.NONE;
    }

    public HistoryConfig(boolean autoManageContext, int maxContextMessages, ContextStrategy strategy) {
        this(autoManageContext, maxContextMessages, strategy, false);
    }

    public static HistoryConfig defaults() {
        return new HistoryConfig(false, 20, ContextStrategy.NONE, false);
    }
}
