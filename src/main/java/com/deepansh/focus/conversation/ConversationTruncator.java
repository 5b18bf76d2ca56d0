package com.deepansh.focus.conversation;

import com.deepansh.focus.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the window of history sent to a backend.
 *
 * The window is the leading system message plus a contiguous tail of the log. The tail
 * starts at most {@code maxRecent} messages back, and is stretched further back whenever
 * it contains a tool message whose requesting assistant message would be cut off. Because
 * the tail is contiguous, pulling in an assistant message pulls in all of its tool responses.
 *
 * The log itself is never modified.
 */
@Slf4j
public final class ConversationTruncator {

    private ConversationTruncator() {
    }

    public static List<Message> window(List<Message> history, int maxRecent) {
        if (maxRecent < 1) {
            throw new IllegalArgumentException("maxRecent must be at least 1, was " + maxRecent);
        }
        if (history.isEmpty()) {
            return List.of();
        }

        boolean hasSystem = history.get(0).getRole() == Message.Role.system;
        int bodyStart = hasSystem ? 1 : 0;
        int size = history.size();
        int start = Math.max(bodyStart, size - maxRecent);

        int[] owners = new int[size];
        for (int i = bodyStart; i < size; i++) {
            owners[i] = history.get(i).getRole() == Message.Role.tool ? ownerOf(history, i, bodyStart) : -1;
        }

        // Repeat until no tool message in the tail points before its start.
        boolean moved = true;
        while (moved) {
            moved = false;
            for (int i = start; i < size; i++) {
                if (owners[i] >= 0 && owners[i] < start) {
                    start = owners[i];
                    moved = true;
                    break;
                }
            }
        }

        List<Message> window = new ArrayList<>(size - start + 1);
        if (hasSystem) {
            window.add(history.get(0));
        }
        for (int i = start; i < size; i++) {
            Message message = history.get(i);
            if (message.getRole() == Message.Role.tool && owners[i] < 0) {
                log.warn("Leaving orphan tool message out of the window [toolCallId={}]", message.getToolCallId());
                continue;
            }
            window.add(message);
        }
        return window;
    }

    /**
     * Index of the nearest earlier assistant message that requested this tool call, or -1.
     */
    static int ownerOf(List<Message> history, int toolIndex, int bodyStart) {
        String callId = history.get(toolIndex).getToolCallId();
        for (int j = toolIndex - 1; j >= bodyStart; j--) {
            if (history.get(j).requested(callId)) {
                return j;
            }
        }
        return -1;
    }
}
