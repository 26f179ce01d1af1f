package com.peargent.agent;

import com.peargent.observability.PoolMetrics;
import com.peargent.providers.GenerateOptions;
import com.peargent.providers.ModelProvider;
import com.peargent.providers.TimeLimitedProvider;
import com.peargent.shared.config.AgentSettings;
import com.peargent.shared.error.ModelException;
import com.peargent.shared.error.PeargentException;
import com.peargent.shared.model.Message;
import com.peargent.state.State;
import com.peargent.tools.Tool;
import com.peargent.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Named participant in a pool: a persona, a model and a set of tools. One call to
 * {@link #run} is one turn; the model may request tools for up to
 * {@code maxToolRounds} rounds before it must answer.
 */
public class Agent {

    private static final Logger log = LoggerFactory.getLogger(Agent.class);

    private final String name;
    private final String description;
    private final String persona;
    private final Map<String, Tool> tools;
    private final GenerateOptions options;
    private final PromptBuilder promptBuilder;
    private final PoolMetrics metrics;
    private volatile ModelProvider model;
    private volatile Boolean tracing;
    private volatile int maxToolRounds;
    private volatile Duration modelTimeout;
    // guarded by this
    private boolean maxToolRoundsSet;
    private boolean modelTimeoutSet;

    private Agent(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.persona = b.persona;
        this.tools = b.tools;
        this.maxToolRounds = b.maxToolRounds != null ? b.maxToolRounds : AgentSettings.defaults().maxToolRounds();
        this.maxToolRoundsSet = b.maxToolRounds != null;
        this.modelTimeout = b.modelTimeout;
        this.modelTimeoutSet = b.modelTimeoutSet;
        this.options = b.options;
        this.promptBuilder = b.promptBuilder;
        this.metrics = b.metrics;
        this.model = b.model;
        this.tracing = b.tracing;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }

    public String description() { return description; }

    public String persona() { return persona; }

    public ModelProvider model() { return model; }

    public List<Tool> tools() { return List.copyOf(tools.values()); }

    public Tool tool(String toolName) { return tools.get(toolName); }

    public int maxToolRounds() { return maxToolRounds; }

    public Duration modelTimeout() { return modelTimeout; }

    public GenerateOptions options() { return options; }

    public boolean tracing() { return Boolean.TRUE.equals(tracing); }

    /** Raw tracing setting; null when never set explicitly. */
    public Boolean tracingSetting() { return tracing; }

    /** Gives the agent a model only if it has none. Returns true when assigned. */
    public synchronized boolean assignModelIfAbsent(ModelProvider fallback) {
        if (model != null || fallback == null) return false;
        model = fallback;
        return true;
    }

    /** Turns tracing on unless the agent has an explicit setting. */
    public synchronized void enableTracingIfUnset() {
        if (tracing == null) tracing = true;
    }

    /** Takes each of the given settings the agent was not explicitly built with. */
    public synchronized void applySettingsIfUnset(AgentSettings settings) {
        if (settings == null) return;
        if (!maxToolRoundsSet) maxToolRounds = settings.maxToolRounds();
        if (!modelTimeoutSet) modelTimeout = settings.modelTimeout();
    }

    public AgentOutput run(String input, State state) {
        return run(input, state, null);
    }

    /**
     * Runs one turn. When {@code onChunk} is given, the final answer is also
     * delivered to it incrementally.
     */
    public AgentOutput run(String input, State state, Consumer<String> onChunk) {
        var provider = effectiveModel();
        var context = state != null ? state.contextView() : List.<Message>of();
        var prompt = promptBuilder.build(persona, tools.values(), context, input);
        var toolsUsed = new ArrayList<String>();
        int maxRounds = maxToolRounds;

        for (int round = 0; ; round++) {
            boolean allowTools = !tools.isEmpty() && round < maxRounds;
            if (!allowTools && onChunk != null) {
                var reply = streamFinal(provider, prompt, onChunk);
                return finish(reply, toolsUsed);
            }

            var reply = generate(provider, prompt);
            var calls = allowTools ? ToolCallParser.parse(reply) : List.<ToolCall>of();
            if (calls.isEmpty()) {
                if (onChunk != null && !reply.isEmpty()) onChunk.accept(reply);
                return finish(reply, toolsUsed);
            }

            var outcomes = new ArrayList<ToolOutcome>();
            for (var call : calls) {
                var tool = tools.get(call.name());
                if (tool == null) {
                    log.warn("Agent '{}' requested unknown tool '{}'", name, call.name());
                    outcomes.add(new ToolOutcome(call.name(), ToolResult.failure("Unknown tool: " + call.name())));
                    continue;
                }
                toolsUsed.add(tool.name());
                if (tracing()) log.info("[{}] tool {} args={}", name, tool.name(), call.args());
                outcomes.add(new ToolOutcome(tool.name(), tool.run(call.args())));
            }
            prompt = promptBuilder.followUp(prompt, reply, outcomes);
            if (round + 1 >= maxRounds) prompt = promptBuilder.finalAnswer(prompt);
        }
    }

    private AgentOutput finish(String reply, List<String> toolsUsed) {
        if (tracing()) log.info("[{}] answered ({} chars, tools={})", name, reply.length(), toolsUsed);
        return new AgentOutput(reply, toolsUsed);
    }

    private ModelProvider effectiveModel() {
        var current = model;
        if (current == null) {
            throw new ModelException("Agent '" + name + "' has no model");
        }
        var timeout = modelTimeout;
        return timeout != null ? new TimeLimitedProvider(current, timeout) : current;
    }

    private String generate(ModelProvider provider, String prompt) {
        var reply = timed(() -> provider.generate(prompt, options), provider);
        return reply != null ? reply : "";
    }

    private String streamFinal(ModelProvider provider, String prompt, Consumer<String> onChunk) {
        return timed(() -> {
            var sb = new StringBuilder();
            var chunks = provider.generateStream(prompt, options);
            while (chunks.hasNext()) {
                var chunk = chunks.next();
                if (chunk == null || chunk.isEmpty()) continue;
                sb.append(chunk);
                onChunk.accept(chunk);
            }
            return sb.toString();
        }, provider);
    }

    private String timed(Supplier<String> call, ModelProvider provider) {
        long start = System.nanoTime();
        try {
            return call.get();
        } catch (PeargentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelException("Model '" + provider.id() + "' failed for agent '" + name + "': "
                    + e.getMessage(), e);
        } finally {
            if (metrics != null) metrics.modelLatency().record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public String toString() {
        return "Agent[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private String persona = "";
        private ModelProvider model;
        private final Map<String, Tool> tools = new LinkedHashMap<>();
        private Boolean tracing;
        private Integer maxToolRounds;
        private Duration modelTimeout;
        private boolean modelTimeoutSet;
        private GenerateOptions options = GenerateOptions.defaults();
        private PromptBuilder promptBuilder = new PromptBuilder();
        private PoolMetrics metrics;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Agent name must not be blank");
            }
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder persona(String persona) {
            this.persona = persona != null ? persona : "";
            return this;
        }

        public Builder model(ModelProvider model) {
            this.model = model;
            return this;
        }

        public Builder tool(Tool tool) {
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool '" + tool.name() + "' on agent '" + name + "'");
            }
            return this;
        }

        public Builder tools(Collection<Tool> tools) {
            tools.forEach(this::tool);
            return this;
        }

        public Builder tracing(boolean tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder maxToolRounds(int maxToolRounds) {
            if (maxToolRounds < 0) throw new IllegalArgumentException("maxToolRounds must be >= 0");
            this.maxToolRounds = maxToolRounds;
            return this;
        }

        public Builder modelTimeout(Duration modelTimeout) {
            if (modelTimeout != null && (modelTimeout.isZero() || modelTimeout.isNegative())) {
                throw new IllegalArgumentException("modelTimeout must be positive");
            }
            this.modelTimeout = modelTimeout;
            this.modelTimeoutSet = true;
            return this;
        }

        public Builder settings(AgentSettings settings) {
            maxToolRounds(settings.maxToolRounds());
            return modelTimeout(settings.modelTimeout());
        }

        public Builder options(GenerateOptions options) {
            this.options = options != null ? options : GenerateOptions.defaults();
            return this;
        }

        public Builder promptBuilder(PromptBuilder promptBuilder) {
            this.promptBuilder = promptBuilder;
            return this;
        }

        public Builder metrics(PoolMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Agent build() {
            return new Agent(this);
        }
    }
}
