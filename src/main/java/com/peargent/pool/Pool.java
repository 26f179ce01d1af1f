package com.peargent.pool;

import com.peargent.agent.Agent;
import com.peargent.observability.PoolMetrics;
import com.peargent.providers.ModelProvider;
import com.peargent.routing.DecisionRouter;
import com.peargent.routing.LastResult;
import com.peargent.routing.Router;
import com.peargent.routing.Routers;
import com.peargent.shared.config.PeargentConfig;
import com.peargent.shared.config.PoolSettings;
import com.peargent.shared.error.RoutingException;
import com.peargent.shared.model.Role;
import com.peargent.state.ConversationHistory;
import com.peargent.state.InMemoryHistoryStore;
import com.peargent.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Runs a group of agents over one shared {@link State}. Each run appends the user
 * input, then asks the router for the next agent until it stops or {@code maxIter}
 * turns have run; every agent output becomes the next agent's input. Runs on the
 * same pool are serialized.
 */
public class Pool {

    private static final Logger log = LoggerFactory.getLogger(Pool.class);

    private final List<String> agentNames;
    private final Router router;
    private final ModelProvider defaultModel;
    private final State state;
    private final int maxIter;
    private final boolean tracing;
    private final PoolMetrics metrics;
    private final Executor executor;
    private final ReentrantLock runLock = new ReentrantLock();

    private Pool(Builder b) {
        var registry = new LinkedHashMap<String, Agent>();
        for (var agent : b.agents) {
            if (registry.put(agent.name(), agent) != null) {
                log.warn("Duplicate agent name '{}': the last registration wins", agent.name());
            }
        }
        this.agentNames = List.copyOf(registry.keySet());
        this.defaultModel = b.defaultModel;
        this.maxIter = b.maxIter != null ? b.maxIter
                : b.config != null ? b.config.pool().maxIter() : PoolSettings.defaults().maxIter();
        if (maxIter < 0) {
            throw new IllegalArgumentException("maxIter must be >= 0, got " + maxIter);
        }
        this.tracing = b.tracing != null ? b.tracing
                : b.config != null && b.config.pool().tracing();
        this.router = b.router != null ? b.router : Routers.stop();
        this.metrics = b.metrics;
        this.executor = b.executor != null ? b.executor : ForkJoinPool.commonPool();

        for (var agent : registry.values()) {
            if (agent.assignModelIfAbsent(defaultModel)) {
                log.debug("Agent '{}' uses the pool default model {}", agent.name(), defaultModel.id());
            }
            if (tracing) agent.enableTracingIfUnset();
            if (b.config != null) agent.applySettingsIfUnset(b.config.agent());
        }

        this.state = b.state != null ? b.state : new State();
        if (b.history != null) {
            state.setHistoryManager(b.history);
        } else if (state.historyManager() == null && b.config != null && b.config.history().autoManageContext()) {
            state.setHistoryManager(new ConversationHistory(new InMemoryHistoryStore(), b.config.history()));
        }
        state.setAgents(registry);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String run(String input) {
        return execute(input, null);
    }

    /** Runs like {@link #run} and hands each chunk of every agent's final answer to {@code onChunk}. */
    public String stream(String input, Consumer<String> onChunk) {
        Objects.requireNonNull(onChunk, "onChunk");
        return execute(input, event -> {
            if (event.type() == PoolEvent.Type.CHUNK) onChunk.accept(event.text());
        });
    }

    public String streamObserve(String input, PoolObserver observer) {
        return execute(input, Objects.requireNonNull(observer, "observer"));
    }

    public CompletableFuture<String> runAsync(String input) {
        return CompletableFuture.supplyAsync(() -> run(input), executor);
    }

    public CompletableFuture<String> streamAsync(String input, Consumer<String> onChunk) {
        return CompletableFuture.supplyAsync(() -> stream(input, onChunk), executor);
    }

    public CompletableFuture<String> streamObserveAsync(String input, PoolObserver observer) {
        return CompletableFuture.supplyAsync(() -> streamObserve(input, observer), executor);
    }

    private String execute(String input, PoolObserver observer) {
        Objects.requireNonNull(input, "input");
        runLock.lock();
        try {
            emit(observer, PoolEvent.poolStart(input));
            if (tracing) log.info("Pool run started: {} agent(s), maxIter={}", agentNames.size(), maxIter);

            state.addMessage(Role.USER, input, null);
            var registry = state.agents();
            router.bindAgents(registry);

            int callCount = 0;
            LastResult lastResult = null;
            String currentInput = input;
            String result = "";

            while (callCount < maxIter) {
                var decision = router.decide(state, callCount, lastResult);
                if (decision == null || decision.isStop()) {
                    if (metrics != null) metrics.routerStops().increment();
                    log.debug("Router stopped after {} turn(s)", callCount);
                    break;
                }
                var agent = registry.get(decision.nextAgent());
                if (agent == null) {
                    throw new RoutingException(decision.nextAgent());
                }

                emit(observer, PoolEvent.agentStart(agent.name(), currentInput));
                Consumer<String> onChunk = observer == null ? null
                        : chunk -> observer.onEvent(PoolEvent.chunk(agent.name(), chunk));
                var output = agent.run(currentInput, state, onChunk);

                state.addMessage(Role.ASSISTANT, output.output(), agent.name());
                if (metrics != null) metrics.agentTurns().increment();
                lastResult = new LastResult(agent.name(), output.output(), output.toolsUsed());
                currentInput = output.output();
                result = output.output();
                callCount++;
                emit(observer, PoolEvent.agentEnd(agent.name(), output.output(), output.toolsUsed()));
                if (tracing) log.info("Turn {}: {} used {}", callCount, agent.name(), output.toolsUsed());
            }

            emit(observer, PoolEvent.poolEnd(result));
            if (tracing) log.info("Pool run finished after {} turn(s)", callCount);
            return result;
        } finally {
            runLock.unlock();
        }
    }

    private static void emit(PoolObserver observer, PoolEvent event) {
        if (observer != null) observer.onEvent(event);
    }

    /** Registered names in registration order, duplicates collapsed. */
    public List<String> agentNames() { return agentNames; }

    public Map<String, Agent> agents() { return state.agents(); }

    public State state() { return state; }

    public Router router() { return router; }

    public int maxIter() { return maxIter; }

    public boolean tracing() { return tracing; }

    public ConversationHistory history() { return state.historyManager(); }

    public ModelProvider defaultModel() { return defaultModel; }

    public PoolMetrics metrics() { return metrics; }

    public static final class Builder {
        private final List<Agent> agents = new ArrayList<>();
        private Router router;
        private ModelProvider defaultModel;
        private State state;
        private ConversationHistory history;
        private Integer maxIter;
        private Boolean tracing;
        private PeargentConfig config;
        private PoolMetrics metrics;
        private Executor executor;

        private Builder() {}

        public Builder agent(Agent agent) {
            agents.add(Objects.requireNonNull(agent, "agent"));
            return this;
        }

        public Builder agents(Collection<Agent> agents) {
            agents.forEach(this::agent);
            return this;
        }

        public Builder router(Router router) {
            this.router = router;
            return this;
        }

        public Builder router(DecisionRouter router) {
            this.router = router != null ? Routers.adapt(router) : null;
            return this;
        }

        public Builder defaultModel(ModelProvider defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder state(State state) {
            this.state = state;
            return this;
        }

        public Builder history(ConversationHistory history) {
            this.history = history;
            return this;
        }

        public Builder maxIter(int maxIter) {
            this.maxIter = maxIter;
            return this;
        }

        public Builder tracing(boolean tracing) {
            this.tracing = tracing;
            return this;
        }

        /** Supplies maxIter, tracing and history settings not given explicitly. */
        public Builder config(PeargentConfig config) {
            this.config = config;
            return this;
        }

        public Builder metrics(PoolMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Pool build() {
            return new Pool(this);
        }
    }
}
