package com.peargent.routing;

import com.peargent.agent.Agent;
import com.peargent.providers.EmbeddingProvider;
import com.peargent.shared.model.Role;
import com.peargent.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes by embedding similarity. Agent embeddings ("name: description") are
 * computed once at construction; each decision embeds only the latest user
 * instruction and picks the closest agent.
 */
public class SemanticRouter implements DecisionRouter {

    private static final Logger log = LoggerFactory.getLogger(SemanticRouter.class);

    private final String name;
    private final EmbeddingProvider embeddings;
    private final Map<String, float[]> agentEmbeddings = new LinkedHashMap<>();
    private final double minScore;

    public SemanticRouter(String name, EmbeddingProvider embeddings, List<Agent> agents) {
        this(name, embeddings, agents, Double.NEGATIVE_INFINITY);
    }

    /**
     * @param minScore best similarity below this stops the pool
     */
    public SemanticRouter(String name, EmbeddingProvider embeddings, List<Agent> agents, double minScore) {
        if (embeddings == null) throw new IllegalArgumentException("Semantic router '" + name + "' needs an embedding provider");
        if (agents == null || agents.isEmpty()) {
            throw new IllegalArgumentException("Semantic router '" + name + "' needs at least one agent");
        }
        this.name = name;
        this.embeddings = embeddings;
        this.minScore = minScore;

        var texts = new ArrayList<String>(agents.size());
        for (var agent : agents) texts.add(agent.name() + ": " + agent.description());
        var vectors = embeddings.embedBatch(texts);
        for (int i = 0; i < agents.size(); i++) {
            agentEmbeddings.put(agents.get(i).name(), vectors.get(i));
        }
        log.info("[{}] indexed {} agent(s)", name, agentEmbeddings.size());
    }

    public String name() { return name; }

    public List<String> agentNames() { return List.copyOf(agentEmbeddings.keySet()); }

    public double minScore() { return minScore; }

    @Override
    public Optional<String> decide(State state, LastResult lastResult) {
        var instruction = latestInstruction(state);
        if (instruction == null || instruction.isBlank()) {
            log.warn("[{}] no user instruction to route on, stopping", name);
            return Optional.empty();
        }
        var query = embeddings.embed(instruction);

        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (var entry : agentEmbeddings.entrySet()) {
            double score = EmbeddingProvider.cosineSimilarity(query, entry.getValue());
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }
        if (best == null || bestScore < minScore) {
            log.info("[{}] best score {} below threshold, stopping", name, String.format("%.3f", bestScore));
            return Optional.empty();
        }
        log.debug("[{}] selected {} (score {})", name, best, String.format("%.3f", bestScore));
        return Optional.of(best);
    }

    @Override
    public RouterDescriptor describe() {
        return new RouterDescriptor(RouterDescriptor.SEMANTIC, name, null, agentNames());
    }

    private static String latestInstruction(State state) {
        if (state == null) return null;
        var history = state.history();
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).role() == Role.USER) return history.get(i).content();
        }
        return null;
    }
}
