package com.peargent.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peargent.agent.Agent;
import com.peargent.providers.GenerateOptions;
import com.peargent.providers.ModelProvider;
import com.peargent.shared.model.Message;
import com.peargent.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Model-backed router. Each decision is one classification call that must name a
 * known agent or the {@value #STOP} sentinel; anything it cannot read is treated as
 * stop.
 */
public class RoutingAgent implements DecisionRouter {

    private static final Logger log = LoggerFactory.getLogger(RoutingAgent.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern JSON_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final int CONTEXT_MESSAGES = 6;
    private static final int SNIPPET_CHARS = 300;

    public static final String STOP = "STOP";

    private static final String INSTRUCTIONS = """
            Decide which agent should act next.
            Reply with ONLY the agent name, or STOP when the task is complete.
            Alternatively reply with JSON: {"next": "<agent name or STOP>"}""";

    private final String name;
    private final String persona;
    private final ModelProvider model;
    private final List<String> agentNames;
    private volatile Map<String, Agent> agents = Map.of();

    public RoutingAgent(String name, String persona, ModelProvider model, List<String> agentNames) {
        if (model == null) throw new IllegalArgumentException("Routing agent '" + name + "' needs a model");
        if (agentNames == null || agentNames.isEmpty()) {
            throw new IllegalArgumentException("Routing agent '" + name + "' needs at least one agent name");
        }
        this.name = name;
        this.persona = persona != null ? persona : "";
        this.model = model;
        this.agentNames = List.copyOf(agentNames);
    }

    public String name() { return name; }

    public String persona() { return persona; }

    public ModelProvider model() { return model; }

    public List<String> agentNames() { return agentNames; }

    @Override
    public void bindAgents(Map<String, Agent> agents) {
        this.agents = agents != null ? agents : Map.of();
    }

    @Override
    public Optional<String> decide(State state, LastResult lastResult) {
        var prompt = buildPrompt(state, lastResult);
        log.debug("[{}] routing prompt:\n{}", name, prompt);
        var reply = model.generate(prompt, GenerateOptions.defaults());
        var choice = parse(reply);
        if (choice.isEmpty()) {
            log.info("[{}] stopping", name);
        } else {
            log.info("[{}] next agent: {}", name, choice.get());
        }
        return choice;
    }

    String buildPrompt(State state, LastResult lastResult) {
        var sb = new StringBuilder();
        if (!persona.isBlank()) sb.append(persona.strip()).append("\n\n");

        sb.append("Agents:\n");
        for (var agentName : agentNames) {
            sb.append("- ").append(agentName);
            var agent = agents.get(agentName);
            if (agent != null && !agent.description().isBlank()) sb.append(": ").append(agent.description());
            sb.append("\n");
        }

        var history = state != null ? state.history() : List.<Message>of();
        if (!history.isEmpty()) {
            sb.append("\nRecent conversation:\n");
            for (var m : history.subList(Math.max(0, history.size() - CONTEXT_MESSAGES), history.size())) {
                sb.append("- ").append(m.agent() != null ? m.agent() : m.role().wireName())
                        .append(": ").append(truncate(m.content())).append("\n");
            }
        }
        if (lastResult != null) {
            sb.append("\nLast agent: ").append(lastResult.agent()).append("\n");
        }
        sb.append("\n").append(INSTRUCTIONS);
        return sb.toString();
    }

    Optional<String> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            log.warn("[{}] empty routing reply, stopping", name);
            return Optional.empty();
        }
        var text = reply.strip();
        var fenced = JSON_PATTERN.matcher(text);
        if (fenced.find()) text = fenced.group(1);

        if (text.startsWith("{")) {
            try {
                var node = MAPPER.readTree(text);
                var next = node.has("next") ? node.path("next") : node.path("agent");
                if (!next.isTextual()) {
                    log.warn("[{}] routing reply has no agent field, stopping: {}", name, reply);
                    return Optional.empty();
                }
                text = next.asText();
            } catch (JsonProcessingException e) {
                log.warn("[{}] unreadable routing reply, stopping: {}", name, e.getOriginalMessage());
                return Optional.empty();
            }
        }

        var token = text.lines().findFirst().orElse("").strip()
                .replaceAll("^[\"'`*\\s]+|[\"'`*.!\\s]+$", "");
        if (token.equalsIgnoreCase(STOP) || token.equalsIgnoreCase("none")) return Optional.empty();
        for (var agentName : agentNames) {
            if (agentName.toLowerCase(Locale.ROOT).equals(token.toLowerCase(Locale.ROOT))) {
                return Optional.of(agentName);
            }
        }
        log.warn("[{}] routing reply names no known agent, stopping: {}", name, reply);
        return Optional.empty();
    }

    @Override
    public RouterDescriptor describe() {
        return new RouterDescriptor(RouterDescriptor.ROUTING_AGENT, name, persona, agentNames);
    }

    private static String truncate(String s) {
        return s.length() <= SNIPPET_CHARS ? s : s.substring(0, SNIPPET_CHARS) + "...";
    }
}
