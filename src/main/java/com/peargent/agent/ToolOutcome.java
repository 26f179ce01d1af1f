package com.peargent.agent;

import com.peargent.tools.ToolResult;

public record ToolOutcome(String tool, ToolResult result) {}
