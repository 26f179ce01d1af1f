package com.peargent.state;

import com.peargent.agent.Agent;
import com.peargent.shared.model.Message;
import com.peargent.shared.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared mutable conversation state of a pool: append-only message history, a
 * key/value store, the agent registry and an optional history manager.
 * All mutators are synchronized so concurrent callers cannot interleave appends.
 */
public class State {

    private static final Logger log = LoggerFactory.getLogger(State.class);

    private final List<Message> history = new ArrayList<>();
    private final Map<String, Object> kv = new LinkedHashMap<>();
    private Map<String, Agent> agents = Map.of();
    private ConversationHistory historyManager;

    public State() {
        this(null);
    }

    public State(ConversationHistory historyManager) {
        adopt(historyManager);
    }

    public Message addMessage(Role role, String content, String agent) {
        return append(new Message(role, content, agent, null));
    }

    public synchronized Message append(Message message) {
        history.add(message);
        if (historyManager != null) historyManager.append(message);
        return message;
    }

    /** Snapshot of the canonical history, oldest first. */
    public synchronized List<Message> history() {
        return List.copyOf(history);
    }

    public synchronized int historySize() {
        return history.size();
    }

    public synchronized Optional<Message> lastMessage() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    /**
     * What an agent invocation may see: the manager's pruned view, or the full history.
     * When the manager compacts its store, the compacted view replaces the history here too.
     */
    public synchronized List<Message> contextView() {
        var snapshot = List.copyOf(history);
        if (historyManager == null) return snapshot;
        var pruned = historyManager.prune(snapshot);
        if (pruned.compacted()) {
            history.clear();
            history.addAll(pruned.view());
        }
        return pruned.view();
    }

    public synchronized void set(String key, Object value) {
        kv.put(key, value);
    }

    public synchronized Object get(String key) {
        return kv.get(key);
    }

    public synchronized <T> T get(String key, Class<T> type) {
        var value = kv.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public synchronized Object getOrDefault(String key, Object fallback) {
        return kv.getOrDefault(key, fallback);
    }

    public synchronized boolean containsKey(String key) {
        return kv.containsKey(key);
    }

    public synchronized Object remove(String key) {
        return kv.remove(key);
    }

    public synchronized Set<String> keys() {
        return Set.copyOf(kv.keySet());
    }

    public synchronized Map<String, Agent> agents() {
        return agents;
    }

    public synchronized void setAgents(Map<String, Agent> agents) {
        this.agents = Collections.unmodifiableMap(new LinkedHashMap<>(agents));
    }

    public synchronized ConversationHistory historyManager() {
        return historyManager;
    }

    /**
     * Installs a manager. If this state has no messages yet, it continues the
     * conversation already held by the manager's store.
     */
    public synchronized void setHistoryManager(ConversationHistory historyManager) {
        adopt(historyManager);
    }

    private void adopt(ConversationHistory manager) {
        this.historyManager = manager;
        if (manager == null || !history.isEmpty()) return;
        var stored = manager.messages();
        if (!stored.isEmpty()) {
            history.addAll(stored);
            log.info("Restored {} message(s) from the history store", stored.size());
        }
    }
}
