package com.peargent.shared.config;

import com.peargent.tools.ErrorPolicy;

import java.util.List;

public record ToolsConfig(
    ToolDefaults defaults,
    List<String> builtin,
    HttpRequestConfig httpRequest
) {
    public ToolsConfig {
        builtin = builtin != null ? List.copyOf(builtin) : List.of();
    }

    /**
     * Runtime settings applied to tools that do not declare their own.
     * A null {@code timeoutSeconds} means unbounded.
     */
    public record ToolDefaults(Double timeoutSeconds, int maxRetries, double retryDelaySeconds,
                               boolean retryBackoff, ErrorPolicy onError) {
        public static ToolDefaults defaults() {
            return new ToolDefaults(null, 0, 1.0, true, ErrorPolicy.RAISE);
        }
    }

    public record HttpRequestConfig(double timeoutSeconds, int maxResponseSize) {
        public static HttpRequestConfig defaults() {
            return new HttpRequestConfig(10.0, 1_000_000);
        }
    }

    public static ToolsConfig standard() {
        return new ToolsConfig(ToolDefaults.defaults(), List.of(), HttpRequestConfig.defaults());
    }
}
