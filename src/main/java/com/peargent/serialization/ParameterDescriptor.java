package com.peargent.serialization;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ParameterDescriptor(
    String name,
    String type,
    String description,
    boolean required,
    @JsonProperty("default") Object defaultValue
) {}
