package com.peargent.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standard tool invocation result: {@code {success, status_code?, data?, error?, url?, headers?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
    boolean success,
    @JsonProperty("status_code") Integer statusCode,
    Object data,
    String error,
    String url,
    Map<String, String> headers
) {
    public static ToolResult success(Object data) {
        return new ToolResult(true, null, data, null, null, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, null, error, null, null);
    }

    public static ToolResult failure(String error, Integer statusCode) {
        return new ToolResult(false, statusCode, null, error, null, null);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("success", success);
        if (statusCode != null) map.put("status_code", statusCode);
        if (data != null) map.put("data", data);
        if (error != null) map.put("error", error);
        if (url != null) map.put("url", url);
        if (headers != null) map.put("headers", headers);
        return map;
    }
}
