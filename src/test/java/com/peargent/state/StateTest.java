package com.peargent.state;

import com.peargent.agent.Agent;
import com.peargent.shared.config.ContextStrategy;
import com.peargent.shared.config.HistoryConfig;
import com.peargent.shared.model.Message;
import com.peargent.shared.model.Role;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StateTest {

    @Test
    void appendsMessagesInOrder() {
        var state = new State();

        state.addMessage(Role.USER, "hi", null);
        state.addMessage(Role.ASSISTANT, "hello", "Greeter");

        assertEquals(2, state.historySize());
        assertEquals("Greeter", state.lastMessage().orElseThrow().agent());
        assertNull(state.history().get(0).agent());
    }

    @Test
    void historySnapshotIsDetached() {
        var state = new State();
        state.addMessage(Role.USER, "one", null);
        var snapshot = state.history();

        state.addMessage(Role.USER, "two", null);

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
    }

    @Test
    void keyValueStore() {
        var state = new State();
        state.set("count", 3);
        state.set("topic", "pears");

        assertEquals(3, state.get("count"));
        assertEquals("pears", state.get("topic", String.class));
        assertNull(state.get("count", String.class));
        assertEquals("none", state.getOrDefault("missing", "none"));
        assertTrue(state.containsKey("topic"));
        assertEquals(Set.of("count", "topic"), state.keys());
        assertEquals("pears", state.remove("topic"));
        assertFalse(state.containsKey("topic"));
    }

    @Test
    void registryIsAnUnmodifiableCopy() {
        var source = new HashMap<String, Agent>();
        source.put("A", Agent.builder("A").build());
        var state = new State();

        state.setAgents(source);
        source.clear();

        assertTrue(state.agents().containsKey("A"));
        assertThrows(UnsupportedOperationException.class, () -> state.agents().remove("A"));
    }

    @Test
    void contextViewUsesTheHistoryManager() {
        var manager = new ConversationHistory(new InMemoryHistoryStore(),
                new HistoryConfig(true, 2, ContextStrategy.TRUNCATE_OLDEST));
        var state = new State(manager);
        for (int i = 0; i < 5; i++) state.addMessage(Role.USER, "m" + i, null);

        assertEquals(5, state.history().size());
        assertEquals(2, state.contextView().size());
        assertEquals("m4", state.contextView().get(1).content());
        assertEquals(5, manager.messages().size());
    }

    @Test
    void installingAManagerRestoresItsStoredConversation() {
        var store = new InMemoryHistoryStore();
        store.append(Message.user("earlier"));
        store.append(Message.assistant("reply", "A"));

        var restored = new State(new ConversationHistory(store));
        var busy = new State();
        busy.addMessage(Role.USER, "current", null);
        busy.setHistoryManager(new ConversationHistory(store));

        assertEquals(store.load(), restored.history());
        assertEquals(1, busy.history().size());

        restored.addMessage(Role.USER, "next", null);
        assertEquals(3, store.load().size());
    }

    @Test
    void compactionReplacesTheCanonicalHistory() {
        var store = new InMemoryHistoryStore();
        var state = new State(new ConversationHistory(store,
                new HistoryConfig(true, 3, ContextStrategy.SMART, true)));
        for (int i = 0; i < 7; i++) {
            state.addMessage(i % 2 == 0 ? Role.USER : Role.ASSISTANT, "m" + i, i % 2 == 0 ? null : "A");
        }

        var view = state.contextView();

        assertEquals(3, view.size());
        assertEquals(Role.SYSTEM, view.get(0).role());
        assertEquals("m6", view.get(2).content());
        assertEquals(view, state.history());
        assertEquals(view, store.load());
        assertEquals(view, state.contextView());
    }
}
