package com.deepansh.focus.conversation;

import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Restores the pairing invariant on a log loaded from storage.
 *
 * A persisted log can violate it when a write was interrupted or the data was edited.
 * Rules:
 * <ul>
 *   <li>An assistant tool-call message stays only if every one of its calls is answered by
 *       the tool messages directly after it. Otherwise it is dropped with those partial answers.</li>
 *   <li>A tool message that does not answer a call of the assistant message right before its
 *       group is dropped. So is a second answer to the same call.</li>
 * </ul>
 * Everything else is kept in order.
 */
@Slf4j
public final class ConversationRepair {

    private ConversationRepair() {
    }

    public static List<Message> repair(List<Message> history) {
        List<Message> repaired = new ArrayList<>(history.size());
        int i = 0;
        while (i < history.size()) {
            Message message = history.get(i);

            if (message.carriesToolCalls()) {
                int end = i + 1;
                while (end < history.size() && history.get(end).getRole() == Message.Role.tool) {
                    end++;
                }
                appendGroup(message, history.subList(i + 1, end), repaired);
                i = end;
                continue;
            }

            if (message.getRole() == Message.Role.tool) {
                log.warn("Dropping orphan tool message [toolCallId={}]", message.getToolCallId());
            } else {
                repaired.add(message);
            }
            i++;
        }

        if (repaired.size() != history.size()) {
            log.warn("Conversation repaired: {} -> {} messages", history.size(), repaired.size());
        }
        return repaired;
    }

    private static void appendGroup(Message assistant, List<Message> responses, List<Message> out) {
        Set<String> requested = new HashSet<>();
        for (ToolCall call : assistant.getToolCalls()) {
            requested.add(call.getId());
        }

        Set<String> answered = new HashSet<>();
        List<Message> kept = new ArrayList<>(responses.size());
        for (Message response : responses) {
            String id = response.getToolCallId();
            if (requested.contains(id) && answered.add(id)) {
                kept.add(response);
            } else {
                log.warn("Dropping unpaired tool message [toolCallId={}]", id);
            }
        }

        if (!answered.containsAll(requested)) {
            log.warn("Dropping assistant tool-call message with {} of {} calls answered",
                    answered.size(), requested.size());
            return;
        }
        out.add(assistant);
        out.addAll(kept);
    }
}
