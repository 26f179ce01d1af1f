package com.peargent.tools;

import java.util.Objects;

/**
 * One declared tool argument. Optional parameters are filled with
 * {@code defaultValue} when the caller omits them.
 */
public record ToolParameter(
    String name,
    ParamType type,
    String description,
    boolean required,
    Object defaultValue
) {
    public ToolParameter {
        Objects.requireNonNull(name, "name");
        type = type != null ? type : ParamType.ANY;
        description = description != null ? description : "";
    }

    public static ToolParameter required(String name, ParamType type) {
        return new ToolParameter(name, type, "", true, null);
    }

    public static ToolParameter optional(String name, ParamType type, Object defaultValue) {
        return new ToolParameter(name, type, "", false, defaultValue);
    }

    public ToolParameter describedAs(String text) {
        return new ToolParameter(name, type, text, required, defaultValue);
    }
}
