package com.deepansh.focus.backend;

import com.deepansh.focus.config.FocusProperties;
import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.ToolCall;
import com.deepansh.focus.tool.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * OpenAI-compatible chat-completions backend.
 *
 * Error handling:
 *
 * | Condition                         | Outcome              |
 * |-----------------------------------|----------------------|
 * | 408 / 504, deadline passed        | TIMEOUT              |
 * | finish_reason=content_filter      | CONTENT_FILTERED     |
 * | 4xx naming a content policy       | CONTENT_FILTERED     |
 * | other 4xx / 5xx / network error   | BACKEND_UNAVAILABLE  |
 * | no choices, empty reply, bad JSON | MALFORMED_RESPONSE   |
 */
@Slf4j
public class CloudBackendAdapter extends TimedBackendAdapter {

    public static final String ID = "cloud";

    private final RestClient restClient;

    public CloudBackendAdapter(FocusProperties.Backend props,
                               RestClient.Builder restClientBuilder,
                               AsyncTaskExecutor callExecutor) {
        super(props, callExecutor);
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public String id() {
        return ID;
    }

    /** Reasoning models always think for a long time, whatever the request. */
    @Override
    protected boolean isComplex(List<Message> window) {
        return props.getReasoningModels().contains(props.getModel()) || super.isComplex(window);
    }

    @Override
    protected BackendOutcome exchange(List<Message> window, List<ToolDefinition> tools) {
        JsonNode response = restClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(buildRequestBody(window, tools))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    int status = res.getStatusCode().value();
                    log.warn("{} returned {}: {}", ID, status, body);
                    throw new BackendCallException(BackendFailureClassifier.classifyStatus(status, body),
                            ID + " returned HTTP " + status);
                })
                .body(JsonNode.class);

        return parseResponse(response);
    }

    Map<String, Object> buildRequestBody(List<Message> window, List<ToolDefinition> tools) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", window.stream().map(this::formatMessage).toList());

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toFunctionSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent());
        } else if (msg.carriesToolCalls()) {
            // content may be null here; tool_calls is what lets the model pair the results
            m.put("content", msg.getContent());
            m.put("tool_calls", msg.getToolCalls().stream()
                    .map(tc -> Map.of(
                            "id", tc.getId(),
                            "type", "function",
                            "function", Map.of(
                                    "name", tc.getToolName(),
                                    "arguments", tc.getArgumentsJson() != null ? tc.getArgumentsJson() : "{}")))
                    .toList());
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    BackendOutcome parseResponse(JsonNode response) {
        if (response == null) {
            throw new BackendCallException(ErrorKind.MALFORMED_RESPONSE, ID + " returned an empty body");
        }
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new BackendCallException(ErrorKind.MALFORMED_RESPONSE, ID + " returned no choices");
        }

        int promptTokens = response.path("usage").path("prompt_tokens").asInt(0);
        int completionTokens = response.path("usage").path("completion_tokens").asInt(0);
        log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);

        JsonNode choice = choices.get(0);
        String finishReason = choice.path("finish_reason").asText("");
        if ("content_filter".equals(finishReason)) {
            return BackendOutcome.failure(ErrorKind.CONTENT_FILTERED, ID + " filtered the reply");
        }

        JsonNode message = choice.path("message");
        JsonNode toolCalls = message.path("tool_calls");
        if (toolCalls.isArray() && !toolCalls.isEmpty()) {
            List<ToolCall> calls = new ArrayList<>(toolCalls.size());
            for (JsonNode node : toolCalls) {
                calls.add(parseToolCall(node));
            }
            log.debug("{} requested {} tool call(s) [finish_reason={}]", ID, calls.size(), finishReason);
            return BackendOutcome.toolCalls(calls, promptTokens, completionTokens);
        }

        String content = message.path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new BackendCallException(ErrorKind.MALFORMED_RESPONSE,
                    ID + " returned neither text nor tool calls [finish_reason=" + finishReason + "]");
        }
        return BackendOutcome.text(content, promptTokens, completionTokens);
    }

    private ToolCall parseToolCall(JsonNode node) {
        JsonNode function = node.path("function");
        String name = function.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new BackendCallException(ErrorKind.MALFORMED_RESPONSE, ID + " sent a tool call without a name");
        }

        JsonNode arguments = function.path("arguments");
        String argumentsJson;
        if (arguments.isTextual()) {
            argumentsJson = arguments.asText();
        } else if (arguments.isMissingNode() || arguments.isNull()) {
            argumentsJson = "{}";
        } else {
            argumentsJson = arguments.toString();
        }

        String id = node.path("id").asText(null);
        return ToolCall.builder()
                .id(id != null && !id.isBlank() ? id : "call_" + UUID.randomUUID())
                .toolName(name)
                .argumentsJson(argumentsJson)
                .build();
    }
}
