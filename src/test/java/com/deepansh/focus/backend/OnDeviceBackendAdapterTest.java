package com.deepansh.focus.backend;

import com.deepansh.focus.config.FocusProperties;
import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.ToolCall;
import com.deepansh.focus.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OnDeviceBackendAdapterTest {

    private static final String URL = "http://ollama.test/api/chat";

    private MockRestServiceServer server;
    private OnDeviceBackendAdapter adapter;

    @BeforeEach
    void setUp() {
        FocusProperties.Backend props = new FocusProperties.Backend();
        props.setBaseUrl("http://ollama.test");
        props.setModel("llama3.1");
        props.setMaxTokens(256);
        props.setTimeoutMs(5_000);
        props.setComplexTimeoutMs(5_000);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new OnDeviceBackendAdapter(props, new ObjectMapper(), builder, new SimpleAsyncTaskExecutor("test-local-"));
    }

    @Test
    void send_buildsNativePayload() {
        ToolCall call = ToolCall.builder().id("call_1").toolName("addTaskToList")
                .argumentsJson("{\"taskDescription\":\"Buy milk\"}").build();
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.model").value("llama3.1"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.options.num_predict").value(256))
                .andExpect(jsonPath("$.tools[0].function.name").value("addTaskToList"))
                .andExpect(jsonPath("$.messages[1].tool_calls[0].function.arguments.taskDescription").value("Buy milk"))
                .andExpect(jsonPath("$.messages[2].tool_name").value("addTaskToList"))
                .andRespond(withSuccess("""
                        {"message":{"role":"assistant","content":"Added it."},"done":true,
                         "prompt_eval_count":40,"eval_count":5}
                        """, MediaType.APPLICATION_JSON));

        BackendOutcome outcome = adapter.send(List.of(
                Message.user("add milk"),
                Message.assistantToolCalls(List.of(call)),
                Message.tool("call_1", "addTaskToList", "Task 'Buy milk' added successfully.")),
                List.of(ToolDefinition.builder().name("addTaskToList").description("Adds a task")
                        .inputSchema(Map.of("type", "object")).build()));

        assertThat(outcome.getContent()).isEqualTo("Added it.");
        assertThat(outcome.getPromptTokens()).isEqualTo(40);
        assertThat(outcome.getCompletionTokens()).isEqualTo(5);
        server.verify();
    }

    @Test
    void send_toolCallsWithoutIds_getMintedIdsAndStringArguments() {
        server.expect(requestTo(URL)).andRespond(withSuccess("""
                {"message":{"role":"assistant","content":"","tool_calls":[
                  {"function":{"name":"addTaskToList","arguments":{"taskDescription":"Buy milk"}}},
                  {"function":{"name":"listCurrentTasks","arguments":{}}}
                ]}}
                """, MediaType.APPLICATION_JSON));

        BackendOutcome outcome = adapter.send(List.of(Message.user("add milk")), List.of());

        assertThat(outcome.getToolCalls()).hasSize(2);
        assertThat(outcome.getToolCalls()).allSatisfy(c -> assertThat(c.getId()).startsWith("call_"));
        assertThat(outcome.getToolCalls().get(0).getId()).isNotEqualTo(outcome.getToolCalls().get(1).getId());
        assertThat(outcome.getToolCalls().get(0).getArgumentsJson()).isEqualTo("{\"taskDescription\":\"Buy milk\"}");
    }

    @Test
    void send_errorField_isClassified() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"error\":\"model not loaded\"}", MediaType.APPLICATION_JSON));

        assertThat(adapter.send(List.of(Message.user("hi")), List.of()).getFailureKind())
                .isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
    }

    @Test
    void send_refusal_isContentFiltered() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"message\":{\"role\":\"assistant\",\"content\":\"I’m sorry, I cannot fulfill that request.\"}}",
                MediaType.APPLICATION_JSON));

        assertThat(adapter.send(List.of(Message.user("hi")), List.of()).getFailureKind())
                .isEqualTo(ErrorKind.CONTENT_FILTERED);
    }

    @Test
    void send_emptyReply_isMalformed() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"message\":{\"role\":\"assistant\",\"content\":\"  \"}}", MediaType.APPLICATION_JSON));

        assertThat(adapter.send(List.of(Message.user("hi")), List.of()).getFailureKind())
                .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void isRefusal_ignoresOrdinaryApologies() {
        assertThat(OnDeviceBackendAdapter.isRefusal("Sorry, I couldn't find that task.")).isFalse();
        assertThat(OnDeviceBackendAdapter.isRefusal("I cannot assist with that.")).isTrue();
    }
}
