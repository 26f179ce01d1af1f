package com.peargent.state;

import com.peargent.shared.model.Message;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryHistoryStore implements HistoryStore {

    private final List<Message> messages = new CopyOnWriteArrayList<>();

    @Override
    public void append(Message message) {
        messages.add(message);
    }

    @Override
    public List<Message> load() {
        return List.copyOf(messages);
    }

    @Override
    public void clear() {
        messages.clear();
    }
}
