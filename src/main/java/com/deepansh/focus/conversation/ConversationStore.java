package com.deepansh.focus.conversation;

import com.deepansh.focus.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only message log of one chat session.
 *
 * Index 0 always holds the system message. Only the owning orchestrator appends;
 * the lock only keeps readers (history endpoint, persistence) consistent with it.
 */
public class ConversationStore {

    private final Message systemMessage;
    private final int maxRecent;
    private final List<Message> messages = new ArrayList<>();

    public ConversationStore(String systemPrompt, int maxRecent) {
        if (maxRecent < 1) {
            throw new IllegalArgumentException("maxRecent must be at least 1, was " + maxRecent);
        }
        this.systemMessage = Message.system(systemPrompt);
        this.maxRecent = maxRecent;
        messages.add(systemMessage);
    }

    public synchronized void append(Message message) {
        if (message.getRole() == Message.Role.system) {
            throw new IllegalArgumentException("System message is fixed at the head of the log");
        }
        messages.add(message);
    }

    /** Appends a whole turn at once; readers never observe half of it. */
    public synchronized void appendAll(List<Message> turn) {
        turn.forEach(this::append);
    }

    public synchronized List<Message> fullHistory() {
        return List.copyOf(messages);
    }

    /** Window of history to send next, see {@link ConversationTruncator}. */
    public synchronized List<Message> window() {
        return ConversationTruncator.window(messages, maxRecent);
    }

    /**
     * Window for the committed log followed by messages of a turn still in progress.
     */
    public synchronized List<Message> window(List<Message> pending) {
        List<Message> combined = new ArrayList<>(messages.size() + pending.size());
        combined.addAll(messages);
        combined.addAll(pending);
        return ConversationTruncator.window(combined, maxRecent);
    }

    /** Clears the conversation, keeping the system message. */
    public synchronized void reset() {
        messages.clear();
        messages.add(systemMessage);
    }

    /**
     * Replaces the log with a persisted one. Any stored system message is replaced by the
     * configured one and the pairing invariant is repaired.
     */
    public synchronized void load(List<Message> persisted) {
        List<Message> body = persisted.stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .toList();
        messages.clear();
        messages.add(systemMessage);
        messages.addAll(ConversationRepair.repair(body));
    }

    public synchronized int size() {
        return messages.size();
    }

    public int getMaxRecent() {
        return maxRecent;
    }
}
