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
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CloudBackendAdapterTest {

    private static final String URL = "https://llm.test/v1/chat/completions";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private CloudBackendAdapter adapter;

    @BeforeEach
    void setUp() {
        FocusProperties.Backend props = new FocusProperties.Backend();
        props.setBaseUrl("https://llm.test/v1");
        props.setApiKey("test-key");
        props.setModel("gpt-test");
        props.setTimeoutMs(5_000);
        props.setComplexTimeoutMs(5_000);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new CloudBackendAdapter(props, builder, new SimpleAsyncTaskExecutor("test-cloud-"));
    }

    @Test
    void send_textReply_returnsTextWithUsage() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("gpt-test"))
                .andExpect(jsonPath("$.messages[1].content").value("hi"))
                .andExpect(jsonPath("$.tools").doesNotExist())
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"Hello!"},"finish_reason":"stop"}],
                         "usage":{"prompt_tokens":12,"completion_tokens":3}}
                        """, MediaType.APPLICATION_JSON));

        BackendOutcome outcome = adapter.send(List.of(Message.system("sys"), Message.user("hi")), List.of());

        assertThat(outcome.isText()).isTrue();
        assertThat(outcome.getContent()).isEqualTo("Hello!");
        assertThat(outcome.getPromptTokens()).isEqualTo(12);
        assertThat(outcome.getCompletionTokens()).isEqualTo(3);
        server.verify();
    }

    @Test
    void send_withTools_offersThemAndParsesEveryCall() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andExpect(jsonPath("$.tools[0].function.name").value("addTaskToList"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
                          {"id":"call_1","type":"function","function":{"name":"addTaskToList","arguments":"{\\"taskDescription\\":\\"Buy milk\\"}"}},
                          {"id":"call_2","type":"function","function":{"name":"listCurrentTasks","arguments":"{}"}}
                        ]},"finish_reason":"tool_calls"}]}
                        """, MediaType.APPLICATION_JSON));

        BackendOutcome outcome = adapter.send(List.of(Message.user("add milk")), List.of(addTaskDefinition()));

        assertThat(outcome.isToolCalls()).isTrue();
        assertThat(outcome.getToolCalls()).extracting(ToolCall::getId).containsExactly("call_1", "call_2");
        assertThat(outcome.getToolCalls().get(0).getArgumentsJson()).isEqualTo("{\"taskDescription\":\"Buy milk\"}");
        server.verify();
    }

    @Test
    void send_replaysToolRoundWithCallIds() {
        ToolCall call = ToolCall.builder().id("call_1").toolName("addTaskToList").argumentsJson("{}").build();
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages[1].tool_calls[0].id").value("call_1"))
                .andExpect(jsonPath("$.messages[2].tool_call_id").value("call_1"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"content":"Added."},"finish_reason":"stop"}]}
                        """, MediaType.APPLICATION_JSON));

        BackendOutcome outcome = adapter.send(List.of(
                Message.user("add milk"),
                Message.assistantToolCalls(List.of(call)),
                Message.tool("call_1", "addTaskToList", "ok")), List.of());

        assertThat(outcome.getContent()).isEqualTo("Added.");
    }

    @Test
    void send_serverError_isBackendUnavailable() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        BackendOutcome outcome = adapter.send(List.of(Message.user("hi")), List.of());

        assertThat(outcome.getFailureKind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
    }

    @Test
    void send_policyRejection_isContentFiltered() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"code\":\"content_policy_violation\"}}"));

        BackendOutcome outcome = adapter.send(List.of(Message.user("hi")), List.of());

        assertThat(outcome.getFailureKind()).isEqualTo(ErrorKind.CONTENT_FILTERED);
    }

    @Test
    void send_gatewayTimeout_isTimeout() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.GATEWAY_TIMEOUT));

        assertThat(adapter.send(List.of(Message.user("hi")), List.of()).getFailureKind())
                .isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    void parseResponse_contentFilterFinish_isContentFiltered() throws Exception {
        BackendOutcome outcome = adapter.parseResponse(objectMapper.readTree("""
                {"choices":[{"message":{"content":""},"finish_reason":"content_filter"}]}
                """));

        assertThat(outcome.getFailureKind()).isEqualTo(ErrorKind.CONTENT_FILTERED);
    }

    @Test
    void send_noChoices_isMalformed() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThat(adapter.send(List.of(Message.user("hi")), List.of()).getFailureKind())
                .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void send_notJson_isMalformed() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>oops</html>", MediaType.APPLICATION_JSON));

        assertThat(adapter.send(List.of(Message.user("hi")), List.of()).getFailureKind())
                .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void parseResponse_toolCallWithoutId_getsOne() throws Exception {
        BackendOutcome outcome = adapter.parseResponse(objectMapper.readTree("""
                {"choices":[{"message":{"tool_calls":[{"function":{"name":"listCurrentTasks","arguments":{}}}]}}]}
                """));

        assertThat(outcome.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getId()).startsWith("call_");
            assertThat(call.getArgumentsJson()).isEqualTo("{}");
        });
    }

    private static ToolDefinition addTaskDefinition() {
        return ToolDefinition.builder()
                .name("addTaskToList")
                .description("Adds a task")
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }
}
