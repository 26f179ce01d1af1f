package com.peargent.state;

import com.peargent.shared.model.Message;

import java.util.List;

/**
 * Persistence behind a {@link ConversationHistory}.
 */
public interface HistoryStore {
    void append(Message message);
    List<Message> load();
    void clear();
}
