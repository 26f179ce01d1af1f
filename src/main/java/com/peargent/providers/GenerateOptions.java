package com.peargent.providers;

import java.util.Map;

public record GenerateOptions(
    Double temperature,
    Integer maxTokens,
    Map<String, Object> extra
) {
    public GenerateOptions {
        extra = extra != null ? Map.copyOf(extra) : Map.of();
    }

    public static GenerateOptions defaults() {
        return new GenerateOptions(null, null, Map.of());
    }
}
