package com.deepansh.gateway.core;

import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The message list owned by one exchange. Append-only: the caller's messages
 * first, then each assistant turn and its tool results as the exchange runs.
 */
public class Conversation {

    private final List<Message> messages;

    @Getter
    private final List<ToolCall> executedToolCalls = new ArrayList<>();

    @Getter
    private int toolIterations;

    public Conversation(List<Message> initial) {
        this.messages = new ArrayList<>(initial);
    }

    public void append(Message message) {
        messages.add(message);
    }

    public void recordToolIteration(List<ToolCall> calls) {
        executedToolCalls.addAll(calls);
        toolIterations++;
    }

    /** Read-only view; grows as the exchange proceeds. */
    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /** Immutable snapshot, safe to hand to an adapter for one request. */
    public List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }
}
