package com.peargent.state;

import com.peargent.shared.config.ContextStrategy;
import com.peargent.shared.config.HistoryConfig;
import com.peargent.shared.model.Message;
import com.peargent.shared.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Bounded-context policy over the conversation history. {@link #contextView} returns
 * a pruned copy; the canonical history passed in is never modified. Only when
 * {@link HistoryConfig#compactStore()} is set does the smart strategy rewrite the
 * backing store, and {@link State} then adopts the compacted history as canonical.
 */
public class ConversationHistory {

    private static final Logger log = LoggerFactory.getLogger(ConversationHistory.class);

    private final HistoryStore store;
    private final HistoryConfig config;
    private final Summarizer summarizer;

    public ConversationHistory() {
        this(new InMemoryHistoryStore());
    }

    public ConversationHistory(HistoryStore store) {
        this(store, HistoryConfig.defaults());
    }

    public ConversationHistory(HistoryStore store, HistoryConfig config) {
        this(store, config, Summarizer.digest(200));
    }

    public ConversationHistory(HistoryStore store, HistoryConfig config, Summarizer summarizer) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
    }

    public HistoryStore store() { return store; }

    public HistoryConfig config() { return config; }

    public void append(Message message) {
        store.append(message);
    }

    public List<Message> messages() {
        return store.load();
    }

    public void clear() {
        store.clear();
    }

    public List<Message> contextView() {
        return contextView(store.load());
    }

    public List<Message> contextView(List<Message> canonical) {
        return prune(canonical).view();
    }

    /**
     * The view of {@code canonical} an agent gets. {@code compacted} is true when the
     * backing store was rewritten to hold exactly that view.
     */
    public Pruned prune(List<Message> canonical) {
        var max = config.maxContextMessages();
        if (!config.autoManageContext() || config.strategy() == ContextStrategy.NONE || canonical.size() <= max) {
            return new Pruned(List.copyOf(canonical), false);
        }
        if (config.strategy() == ContextStrategy.TRUNCATE_OLDEST || max < 2) {
            return new Pruned(List.copyOf(canonical.subList(canonical.size() - max, canonical.size())), false);
        }
        var view = smartView(canonical, max);
        if (!config.compactStore()) return new Pruned(view, false);

        log.debug("Compacting history store from {} to {} messages", canonical.size(), view.size());
        store.clear();
        view.forEach(store::append);
        return new Pruned(view, true);
    }

    public record Pruned(List<Message> view, boolean compacted) {}

    // One slot for the summary, then pinned system messages, then the newest entries.
    private List<Message> smartView(List<Message> canonical, int max) {
        var pinnedIdx = new ArrayList<Integer>();
        for (int i = 0; i < canonical.size(); i++) {
            if (canonical.get(i).role() == Role.SYSTEM) pinnedIdx.add(i);
        }
        var pinnedKept = pinnedIdx.subList(Math.max(0, pinnedIdx.size() - Math.max(0, max - 2)), pinnedIdx.size());
        var recentSlots = Math.max(1, max - 1 - pinnedKept.size());

        var keep = new boolean[canonical.size()];
        pinnedKept.forEach(i -> keep[i] = true);
        for (int i = canonical.size() - 1, taken = 0; i >= 0 && taken < recentSlots; i--) {
            if (canonical.get(i).role() == Role.SYSTEM) continue;
            keep[i] = true;
            taken++;
        }

        var dropped = new ArrayList<Message>();
        var kept = new ArrayList<Message>();
        for (int i = 0; i < canonical.size(); i++) {
            (keep[i] ? kept : dropped).add(canonical.get(i));
        }
        if (dropped.isEmpty()) return Collections.unmodifiableList(kept);

        var view = new ArrayList<Message>(kept.size() + 1);
        view.add(Message.system(summarizer.summarize(dropped)));
        view.addAll(kept);
        return Collections.unmodifiableList(view);
    }
}
