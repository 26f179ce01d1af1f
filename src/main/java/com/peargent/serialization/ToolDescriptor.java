package com.peargent.serialization;

import java.util.List;

/** Tool settings in a package. Durations are seconds; the function itself is not serialized. */
public record ToolDescriptor(
    String name,
    String description,
    List<ParameterDescriptor> parameters,
    Double timeout,
    int maxRetries,
    double retryDelay,
    boolean retryBackoff,
    String onError
) {
    public ToolDescriptor {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }
}
