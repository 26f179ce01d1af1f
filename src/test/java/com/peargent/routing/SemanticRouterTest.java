package com.peargent.routing;

import com.peargent.agent.Agent;
import com.peargent.providers.EmbeddingProvider;
import com.peargent.shared.model.Role;
import com.peargent.state.State;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SemanticRouterTest {

    private final AtomicInteger embedCalls = new AtomicInteger();

    // Two-dimensional keyword embedding: [math, writing].
    private final EmbeddingProvider keywords = text -> {
        embedCalls.incrementAndGet();
        var lower = text.toLowerCase();
        float math = 0, writing = 0;
        for (var word : List.of("math", "calculation", "square", "root")) if (lower.contains(word)) math++;
        for (var word : List.of("poem", "poet", "writer", "story", "sea")) if (lower.contains(word)) writing++;
        return new float[]{math, writing};
    };

    private final List<Agent> agents = List.of(
            Agent.builder("MathAgent").description("Expert in mathematics and calculation").build(),
            Agent.builder("WriterAgent").description("A creative writer and poet").build());

    private State stateWith(String instruction) {
        var state = new State();
        state.addMessage(Role.USER, instruction, null);
        return state;
    }

    @Test
    void precomputesAgentEmbeddingsOnce() {
        new SemanticRouter("Semantic", keywords, agents);

        assertEquals(2, embedCalls.get());
    }

    @Test
    void picksMostSimilarAgentWithOneEmbeddingPerDecision() {
        var router = new SemanticRouter("Semantic", keywords, agents);
        embedCalls.set(0);

        assertEquals(Optional.of("MathAgent"), router.decide(stateWith("What is the square root of 144?"), null));
        assertEquals(Optional.of("WriterAgent"), router.decide(stateWith("Write a poem about the sea."), null));
        assertEquals(2, embedCalls.get());
    }

    @Test
    void routesOnLatestUserInstruction() {
        var router = new SemanticRouter("Semantic", keywords, agents);
        var state = stateWith("square root please");
        state.addMessage(Role.ASSISTANT, "a poem about the sea", "WriterAgent");

        assertEquals(Optional.of("MathAgent"), router.decide(state, null));
    }

    @Test
    void stopsBelowThresholdOrWithoutInstruction() {
        var router = new SemanticRouter("Semantic", keywords, agents, 0.5);

        assertEquals(Optional.empty(), router.decide(stateWith("hello there"), null));
        assertEquals(Optional.empty(), router.decide(new State(), null));
    }

    @Test
    void describesItself() {
        var router = new SemanticRouter("Semantic", keywords, agents);

        assertEquals(new RouterDescriptor(RouterDescriptor.SEMANTIC, "Semantic", null,
                List.of("MathAgent", "WriterAgent")), router.describe());
    }
}
