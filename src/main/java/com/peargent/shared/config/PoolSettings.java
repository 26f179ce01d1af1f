package com.peargent.shared.config;

public record PoolSettings(int maxIter, boolean tracing) {
    public PoolSettings {
        if (maxIter < 0) throw new IllegalArgumentException("maxIter must be >= 0, got " + maxIter);
    }

    public static PoolSettings defaults() {
        return new PoolSettings(5, false);
    }
}
