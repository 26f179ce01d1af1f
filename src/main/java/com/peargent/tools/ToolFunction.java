package com.peargent.tools;

import java.util.Map;

@FunctionalInterface
public interface ToolFunction {
    Object apply(Map<String, Object> args) throws Exception;
}
