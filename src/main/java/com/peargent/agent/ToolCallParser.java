package com.peargent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recognizes tool requests in a model reply: {@code {"tool": name, "args": {...}}}
 * or {@code {"tools": [...]}}, bare or inside a json code fence. Any other reply is
 * a final answer and yields no calls.
 */
public class ToolCallParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> ARGS = new TypeReference<>() {};
    private static final Pattern FENCE = Pattern.compile("^```(?:json)?\\s*(\\{.*})\\s*```$", Pattern.DOTALL);

    public static List<ToolCall> parse(String reply) {
        if (reply == null) return List.of();
        var text = reply.strip();
        var fenced = FENCE.matcher(text);
        if (fenced.matches()) text = fenced.group(1);
        if (!text.startsWith("{")) return List.of();

        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            return List.of();
        }

        var calls = new ArrayList<ToolCall>();
        if (root.path("tool").isTextual()) {
            calls.add(toCall(root));
        } else if (root.path("tools").isArray()) {
            for (var node : root.path("tools")) {
                if (node.path("tool").isTextual() || node.path("name").isTextual()) calls.add(toCall(node));
            }
        }
        return calls;
    }

    private static ToolCall toCall(JsonNode node) {
        var name = node.path("tool").isTextual() ? node.path("tool").asText() : node.path("name").asText();
        var argsNode = node.has("args") ? node.path("args") : node.path("arguments");
        Map<String, Object> args = argsNode.isObject() ? MAPPER.convertValue(argsNode, ARGS) : Map.of();
        return new ToolCall(name, args);
    }
}
