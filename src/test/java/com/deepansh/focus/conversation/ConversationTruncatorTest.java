package com.deepansh.focus.conversation;

import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationTruncatorTest {

    @Test
    void window_toolPairStraddlingCut_extendsBackToOwningAssistant() {
        // 0 system, 1..28 chat, 29 assistant with two calls, 30-31 answers, 32..40 chat
        List<Message> log = new ArrayList<>();
        log.add(Message.system("sys"));
        for (int i = 1; i <= 28; i++) {
            log.add(i % 2 == 1 ? Message.user("u" + i) : Message.assistant("a" + i));
        }
        log.add(Message.assistantToolCalls(List.of(call("c1", "addTaskToList"), call("c2", "listCurrentTasks"))));
        log.add(Message.tool("c1", "addTaskToList", "added"));
        log.add(Message.tool("c2", "listCurrentTasks", "listed"));
        for (int i = 32; i <= 40; i++) {
            log.add(i % 2 == 0 ? Message.user("u" + i) : Message.assistant("a" + i));
        }
        assertThat(log).hasSize(41);

        List<Message> window = ConversationTruncator.window(log, 10);

        List<Message> expected = new ArrayList<>();
        expected.add(log.get(0));
        expected.addAll(log.subList(29, 41));
        assertThat(window).containsExactlyElementsOf(expected);
    }

    @Test
    void window_shortLog_returnsEverything() {
        List<Message> log = List.of(Message.system("sys"), Message.user("hi"), Message.assistant("hello"));

        assertThat(ConversationTruncator.window(log, 20)).containsExactlyElementsOf(log);
    }

    @Test
    void window_alwaysKeepsSystemMessageFirst() {
        List<Message> log = new ArrayList<>();
        log.add(Message.system("sys"));
        for (int i = 0; i < 50; i++) {
            log.add(Message.user("u" + i));
        }

        List<Message> window = ConversationTruncator.window(log, 5);

        assertThat(window).hasSize(6);
        assertThat(window.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(window.get(5).getContent()).isEqualTo("u49");
    }

    @Test
    void window_nestedGroups_repeatsExtensionUntilStable() {
        // assistant A(c1) at 1, tool c1 at 2, assistant B(c2,c3) at 3, tool c2 at 4, tool c3 at 5
        List<Message> log = List.of(
                Message.system("sys"),
                Message.assistantToolCalls(List.of(call("c1", "listCurrentTasks"))),
                Message.tool("c1", "listCurrentTasks", "none"),
                Message.assistantToolCalls(List.of(call("c2", "addTaskToList"), call("c3", "addTaskToList"))),
                Message.tool("c2", "addTaskToList", "ok"),
                Message.tool("c3", "addTaskToList", "ok"),
                Message.assistant("done"));

        List<Message> window = ConversationTruncator.window(log, 2);

        assertThat(window).containsExactly(log.get(0), log.get(3), log.get(4), log.get(5), log.get(6));
    }

    @Test
    void window_everyToolMessageHasItsAssistantAndEveryCallIsAnswered() {
        List<Message> log = new ArrayList<>();
        log.add(Message.system("sys"));
        int id = 0;
        for (int round = 0; round < 12; round++) {
            log.add(Message.user("request " + round));
            int calls = (round % 3) + 1;
            List<ToolCall> toolCalls = new ArrayList<>();
            for (int c = 0; c < calls; c++) {
                toolCalls.add(call("id" + (id + c), "verifySystem"));
            }
            log.add(Message.assistantToolCalls(toolCalls));
            for (int c = 0; c < calls; c++) {
                log.add(Message.tool("id" + (id + c), "verifySystem", "ok"));
            }
            id += calls;
            log.add(Message.assistant("answer " + round));
        }

        for (int maxRecent = 1; maxRecent <= log.size(); maxRecent++) {
            List<Message> window = ConversationTruncator.window(log, maxRecent);
            assertPaired(window);
            assertThat(ConversationTruncator.window(window, maxRecent))
                    .as("idempotent for maxRecent=%d", maxRecent)
                    .containsExactlyElementsOf(window);
        }
    }

    @Test
    void window_orphanToolMessage_isLeftOut() {
        List<Message> log = List.of(
                Message.system("sys"),
                Message.user("hi"),
                Message.tool("ghost", "verifySystem", "stray"),
                Message.assistant("hello"));

        assertThat(ConversationTruncator.window(log, 10))
                .extracting(Message::getRole)
                .containsExactly(Message.Role.system, Message.Role.user, Message.Role.assistant);
    }

    @Test
    void window_doesNotModifyLog() {
        List<Message> log = new ArrayList<>(List.of(Message.system("sys"), Message.user("a"), Message.user("b")));
        List<Message> copy = List.copyOf(log);

        ConversationTruncator.window(log, 1);

        assertThat(log).containsExactlyElementsOf(copy);
    }

    @Test
    void window_maxRecentBelowOne_isRejected() {
        assertThatThrownBy(() -> ConversationTruncator.window(List.of(Message.system("s")), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void assertPaired(List<Message> window) {
        Set<String> seenCalls = new HashSet<>();
        for (int i = 0; i < window.size(); i++) {
            Message m = window.get(i);
            if (m.getRole() == Message.Role.tool) {
                assertThat(seenCalls).as("tool message %s has its assistant", m.getToolCallId())
                        .contains(m.getToolCallId());
            }
            if (m.carriesToolCalls()) {
                for (ToolCall tc : m.getToolCalls()) {
                    seenCalls.add(tc.getId());
                    assertThat(window.subList(i + 1, window.size()))
                            .as("call %s is answered", tc.getId())
                            .anyMatch(later -> tc.getId().equals(later.getToolCallId()));
                }
            }
        }
    }

    private static ToolCall call(String id, String name) {
        return ToolCall.builder().id(id).toolName(name).argumentsJson("{}").build();
    }
}
