package com.peargent.pool;

import com.peargent.agent.Agent;
import com.peargent.observability.PoolMetrics;
import com.peargent.providers.ModelProvider;
import com.peargent.providers.ScriptedModel;
import com.peargent.routing.DecisionRouter;
import com.peargent.routing.LastResult;
import com.peargent.routing.RouterResult;
import com.peargent.routing.Routers;
import com.peargent.shared.config.AgentSettings;
import com.peargent.shared.config.HistoryConfig;
import com.peargent.shared.config.PeargentConfig;
import com.peargent.shared.config.PoolSettings;
import com.peargent.shared.config.ContextStrategy;
import com.peargent.shared.error.RoutingException;
import com.peargent.shared.model.Message;
import com.peargent.shared.model.Role;
import com.peargent.state.ConversationHistory;
import com.peargent.state.InMemoryHistoryStore;
import com.peargent.state.JsonLinesHistoryStore;
import com.peargent.state.State;
import com.peargent.tools.ToolBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PoolTest {

    /** Agent whose model always answers with a fixed text. */
    private static Agent fixed(String name, String reply) {
        ModelProvider model = (prompt, options) -> reply;
        return Agent.builder(name).model(model).build();
    }

    private static List<String> assistantAgents(State state) {
        return state.history().stream()
                .filter(m -> m.role() == Role.ASSISTANT)
                .map(Message::agent)
                .toList();
    }

    @Test
    void roundRobinRunsExactlyMaxIterTurnsInOrder() {
        var pool = Pool.builder()
                .agents(List.of(fixed("A", "a-out"), fixed("B", "b-out"), fixed("C", "c-out")))
                .router(Routers.roundRobin(List.of("A", "B", "C")))
                .maxIter(6)
                .build();

        var result = pool.run("start");

        assertEquals("c-out", result);
        assertEquals(List.of("A", "B", "C", "A", "B", "C"), assistantAgents(pool.state()));
        assertEquals(7, pool.state().historySize());
    }

    @Test
    void maxIterZeroNeverRunsTheLoop() {
        var pool = Pool.builder()
                .agent(fixed("A", "unused"))
                .router(Routers.roundRobin(List.of("A")))
                .maxIter(0)
                .build();

        assertEquals("", pool.run("hello"));
        assertEquals(1, pool.state().historySize());
        assertEquals(Role.USER, pool.state().history().get(0).role());
    }

    @Test
    void defaultRouterStopsImmediately() {
        var pool = Pool.builder().agent(fixed("A", "unused")).build();

        assertEquals("", pool.run("hello"));
        assertEquals(List.of("hello"), pool.state().history().stream().map(Message::content).toList());
        assertNull(pool.state().history().get(0).agent());
    }

    @Test
    void routerStopEndsTheRunEarly() {
        var pool = Pool.builder()
                .agents(List.of(fixed("A", "first"), fixed("B", "second")))
                .router((state, callCount, last) -> callCount == 0 ? RouterResult.next("A") : RouterResult.stop())
                .maxIter(10)
                .build();

        assertEquals("first", pool.run("go"));
        assertEquals(List.of("A"), assistantAgents(pool.state()));
    }

    @Test
    void duplicateNamesKeepTheLastAgent() {
        var first = fixed("Twin", "from first");
        var second = fixed("Twin", "from second");
        var pool = Pool.builder()
                .agents(List.of(first, second))
                .router(Routers.roundRobin(List.of("Twin")))
                .maxIter(1)
                .build();

        assertEquals(List.of("Twin"), pool.agentNames());
        assertEquals(1, pool.agents().size());
        assertSame(second, pool.agents().get("Twin"));
        assertEquals("from second", pool.run("go"));
    }

    @Test
    void unknownAgentIsFatalAndKeepsTheUserMessage() {
        var pool = Pool.builder()
                .agent(fixed("A", "unused"))
                .router((state, callCount, last) -> RouterResult.next("Ghost"))
                .build();

        var ex = assertThrows(RoutingException.class, () -> pool.run("hello"));

        assertEquals("Ghost", ex.agentName());
        assertThat(ex.getMessage()).contains("unknown agent").contains("Ghost");
        assertEquals(1, pool.state().historySize());
        assertEquals("hello", pool.state().history().get(0).content());
    }

    @Test
    void eachOutputBecomesTheNextInput() {
        var writerModel = new ScriptedModel("polished draft");
        var pool = Pool.builder()
                .agents(List.of(fixed("Researcher", "raw facts"), Agent.builder("Writer").model(writerModel).build()))
                .router(Routers.roundRobin(List.of("Researcher", "Writer")))
                .maxIter(2)
                .build();

        assertEquals("polished draft", pool.run("write about pears"));
        assertThat(writerModel.prompts().get(0)).endsWith("Current input:\nraw facts");
    }

    @Test
    void routerReceivesCallCountAndLastResult() {
        var seen = new ArrayList<LastResult>();
        var counts = new ArrayList<Integer>();
        var tool = ToolBuilder.builder("lookup").function(args -> "found").build();
        var toolModel = new ScriptedModel("{\"tool\": \"lookup\"}", "looked it up");
        var pool = Pool.builder()
                .agent(Agent.builder("A").model(toolModel).tool(tool).build())
                .router((state, callCount, last) -> {
                    counts.add(callCount);
                    seen.add(last);
                    return callCount < 1 ? RouterResult.next("A") : RouterResult.stop();
                })
                .maxIter(5)
                .build();

        pool.run("go");

        assertEquals(List.of(0, 1), counts);
        assertNull(seen.get(0));
        assertEquals(new LastResult("A", "looked it up", List.of("lookup")), seen.get(1));
    }

    @Test
    void successiveRunsAccumulateHistory() {
        var pool = Pool.builder()
                .agent(fixed("A", "answer"))
                .router(Routers.roundRobin(List.of("A")))
                .maxIter(1)
                .build();

        pool.run("first");
        var afterFirst = pool.state().history();
        pool.run("second");
        var afterSecond = pool.state().history();

        assertEquals(2, afterFirst.size());
        assertEquals(4, afterSecond.size());
        assertEquals(afterFirst, afterSecond.subList(0, 2));
        assertEquals("second", afterSecond.get(2).content());
    }

    @Test
    void defaultModelFillsOnlyMissingModels() {
        var own = new ScriptedModel("own");
        var fallback = new ScriptedModel("fallback");
        var withModel = Agent.builder("Own").model(own).build();
        var without = Agent.builder("Bare").build();

        var pool = Pool.builder().agents(List.of(withModel, without)).defaultModel(fallback).build();

        assertSame(own, withModel.model());
        assertSame(fallback, without.model());
        assertSame(fallback, pool.defaultModel());
    }

    @Test
    void poolTracingOnlyFillsUnsetAgentTracing() {
        var unset = Agent.builder("Unset").build();
        var off = Agent.builder("Off").tracing(false).build();

        var pool = Pool.builder().agents(List.of(unset, off)).tracing(true).build();

        assertTrue(pool.tracing());
        assertTrue(unset.tracing());
        assertFalse(off.tracing());
    }

    @Test
    void decisionRouterIsBoundToTheRegistryBeforeTheLoop() {
        var bound = new ArrayList<Map<String, Agent>>();
        var router = new DecisionRouter() {
            @Override
            public Optional<String> decide(State state, LastResult lastResult) {
                assertFalse(bound.isEmpty(), "registry must be bound before the first decision");
                return lastResult == null ? Optional.of("A") : Optional.empty();
            }

            @Override
            public void bindAgents(Map<String, Agent> agents) {
                bound.add(agents);
            }
        };
        var pool = Pool.builder().agent(fixed("A", "done")).router(router).build();

        assertEquals("done", pool.run("go"));
        assertEquals(List.of("A"), List.copyOf(bound.get(0).keySet()));
    }

    @Test
    void suppliedStateIsReusedAndRegistryIsInstalled() {
        var state = new State();
        state.set("topic", "pears");
        var pool = Pool.builder().state(state).agent(fixed("A", "x")).build();

        assertSame(state, pool.state());
        assertEquals("pears", pool.state().get("topic"));
        assertTrue(state.agents().containsKey("A"));
    }

    @Test
    void historyManagerPrecedence() {
        var carried = new ConversationHistory();
        var given = new ConversationHistory();

        var keeps = Pool.builder().state(new State(carried)).build();
        var overrides = Pool.builder().state(new State(carried)).history(given).build();

        assertSame(carried, keeps.history());
        assertSame(given, overrides.history());
    }

    @Test
    void messagesAreForwardedToTheHistoryStore() {
        var store = new InMemoryHistoryStore();
        var pool = Pool.builder()
                .agent(fixed("A", "reply"))
                .router(Routers.roundRobin(List.of("A")))
                .maxIter(1)
                .history(new ConversationHistory(store))
                .build();

        pool.run("hi");

        assertEquals(List.of("hi", "reply"), store.load().stream().map(Message::content).toList());
    }

    @Test
    void newPoolContinuesAConversationFromAFileStore(@TempDir Path dir) {
        var file = dir.resolve("chat.jsonl");
        var first = Pool.builder().agent(fixed("A", "noted"))
                .router(Routers.roundRobin(List.of("A"))).maxIter(1)
                .history(new ConversationHistory(new JsonLinesHistoryStore(file)))
                .build();
        first.run("the secret word is PEAR");

        var model = new ScriptedModel("PEAR");
        var second = Pool.builder().agent(Agent.builder("A").model(model).build())
                .router(Routers.roundRobin(List.of("A"))).maxIter(1)
                .history(new ConversationHistory(new JsonLinesHistoryStore(file)))
                .build();

        assertEquals(List.of("the secret word is PEAR", "noted"),
                second.state().history().stream().map(Message::content).toList());
        assertEquals("PEAR", second.run("what was the word?"));
        assertThat(model.prompts().get(0)).contains("the secret word is PEAR");
        assertEquals(4, new JsonLinesHistoryStore(file).load().size());
    }

    @Test
    void configSuppliesDefaultsUnlessOverridden() {
        var config = new PeargentConfig(new PoolSettings(3, true),
                new HistoryConfig(true, 4, ContextStrategy.TRUNCATE_OLDEST),
                PeargentConfig.defaults().tools(), PeargentConfig.defaults().agent());

        var fromConfig = Pool.builder().config(config).build();
        var overridden = Pool.builder().config(config).maxIter(1).tracing(false).build();

        assertEquals(3, fromConfig.maxIter());
        assertTrue(fromConfig.tracing());
        assertNotNull(fromConfig.history());
        assertEquals(4, fromConfig.history().config().maxContextMessages());
        assertEquals(1, overridden.maxIter());
        assertFalse(overridden.tracing());
    }

    @Test
    void agentSettingsFromConfigFillOnlyWhatAgentsLeaveUnset() {
        var config = new PeargentConfig(PoolSettings.defaults(), HistoryConfig.defaults(),
                PeargentConfig.defaults().tools(), new AgentSettings(0, 2.5));
        var calls = new AtomicInteger();
        var tool = ToolBuilder.builder("ping").function(args -> calls.incrementAndGet()).build();
        var model = new ScriptedModel("{\"tool\": \"ping\", \"args\": {}}");
        var plain = Agent.builder("Plain").model(model).tool(tool).build();
        var explicit = Agent.builder("Explicit").model((prompt, options) -> "y")
                .maxToolRounds(7).modelTimeout(null).build();

        var pool = Pool.builder().agent(plain).agent(explicit)
                .router(Routers.roundRobin(List.of("Plain"))).maxIter(1).config(config).build();

        assertEquals(0, plain.maxToolRounds());
        assertEquals(Duration.ofMillis(2500), plain.modelTimeout());
        assertEquals(7, explicit.maxToolRounds());
        assertNull(explicit.modelTimeout());

        // With no tool rounds left, the tool-call reply is the final answer.
        assertEquals("{\"tool\": \"ping\", \"args\": {}}", pool.run("go"));
        assertEquals(0, calls.get());
    }

    @Test
    void defaultsWithoutConfig() {
        var pool = Pool.builder().build();

        assertEquals(5, pool.maxIter());
        assertFalse(pool.tracing());
        assertNull(pool.history());
        assertTrue(pool.agentNames().isEmpty());
    }

    @Test
    void negativeMaxIterIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Pool.builder().maxIter(-1).build());
    }

    @Test
    void countsTurnsAndStops() {
        var metrics = new PoolMetrics();
        var pool = Pool.builder()
                .agent(fixed("A", "x"))
                .router((state, callCount, last) -> callCount < 2 ? RouterResult.next("A") : RouterResult.stop())
                .metrics(metrics)
                .build();

        pool.run("go");

        assertEquals(2.0, metrics.agentTurns().count());
        assertEquals(1.0, metrics.routerStops().count());
    }
}
