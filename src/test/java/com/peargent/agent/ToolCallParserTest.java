package com.peargent.agent;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallParserTest {

    @Test
    void parsesSingleCall() {
        var calls = ToolCallParser.parse("{\"tool\": \"search\", \"args\": {\"query\": \"pears\", \"limit\": 3}}");

        assertEquals(1, calls.size());
        assertEquals("search", calls.get(0).name());
        assertEquals(Map.of("query", "pears", "limit", 3), calls.get(0).args());
    }

    @Test
    void parsesCallListInsideFence() {
        var reply = """
                ```json
                {"tools": [
                  {"tool": "a", "args": {}},
                  {"name": "b", "arguments": {"x": true}}
                ]}
                ```""";

        var calls = ToolCallParser.parse(reply);

        assertEquals(2, calls.size());
        assertEquals("a", calls.get(0).name());
        assertEquals("b", calls.get(1).name());
        assertEquals(Map.of("x", true), calls.get(1).args());
    }

    @Test
    void missingArgsBecomeEmpty() {
        var calls = ToolCallParser.parse("{\"tool\": \"now\"}");

        assertTrue(calls.get(0).args().isEmpty());
    }

    @Test
    void plainTextIsAFinalAnswer() {
        assertTrue(ToolCallParser.parse("The answer is 42.").isEmpty());
        assertTrue(ToolCallParser.parse("").isEmpty());
        assertTrue(ToolCallParser.parse(null).isEmpty());
    }

    @Test
    void jsonWithoutToolKeyIsAFinalAnswer() {
        assertTrue(ToolCallParser.parse("{\"result\": 42}").isEmpty());
        assertTrue(ToolCallParser.parse("{not json").isEmpty());
    }
}
