package com.peargent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peargent.shared.model.Message;
import com.peargent.tools.Tool;

import java.util.Collection;
import java.util.List;

public class PromptBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String TOOL_PROTOCOL = """
            To call tools, reply with ONLY a JSON object and nothing else: \
            {"tool": "<name>", "args": {...}} for one call, or \
            {"tools": [{"tool": "<name>", "args": {...}}, ...]} for several. \
            When no tool is needed, reply with the final answer as plain text.""";

    public String build(String persona, Collection<Tool> tools, List<Message> context, String input) {
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        var sb = new StringBuilder();
        if (persona != null && !persona.isBlank()) sb.append(persona.strip()).append("\n\n");

        if (tools != null && !tools.isEmpty()) {
            sb.append("Available tools:\n");
            for (var tool : tools) {
                sb.append("- ").append(tool.name()).append("(");
                var first = true;
                for (var p : tool.parameters()) {
                    if (!first) sb.append(", ");
                    sb.append(p.name()).append(": ").append(p.type().wireName());
                    if (!p.required()) sb.append("?");
                    first = false;
                }
                sb.append("): ").append(tool.description()).append("\n");
            }
            sb.append(TOOL_PROTOCOL).append("\n\n");
        }

        if (context != null && !context.isEmpty()) {
            sb.append("Conversation so far:\n");
            for (var m : context) {
                sb.append(m.role().wireName());
                if (m.agent() != null) sb.append(" (").append(m.agent()).append(")");
                sb.append(": ").append(m.content()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("Current input:\n").append(input);
        return sb.toString();
    }

    public String followUp(String previousPrompt, String modelReply, List<ToolOutcome> outcomes) {
        var sb = new StringBuilder(previousPrompt)
                .append("\n\nYou requested:\n").append(modelReply.strip())
                .append("\n\nTool results:\n");
        for (var o : outcomes) {
            sb.append("- ").append(o.tool()).append(": ").append(render(o)).append("\n");
        }
        sb.append("\nContinue. Call more tools if needed, otherwise reply with the final answer.");
        return sb.toString();
    }

    public String finalAnswer(String prompt) {
        return prompt + "\n\nThe tool budget is exhausted. Reply with the final answer now, without calling tools.";
    }

    private static String render(ToolOutcome outcome) {
        try {
            return MAPPER.writeValueAsString(outcome.result().toMap());
        } catch (JsonProcessingException e) {
            return String.valueOf(outcome.result().toMap());
        }
    }
}
