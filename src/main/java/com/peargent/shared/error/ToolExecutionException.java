package com.peargent.shared.error;

public class ToolExecutionException extends PeargentException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
