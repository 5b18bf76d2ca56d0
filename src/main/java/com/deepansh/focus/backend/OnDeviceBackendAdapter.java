package com.deepansh.focus.backend;

import com.deepansh.focus.config.FocusProperties;
import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.model.ToolCall;
import com.deepansh.focus.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Local model runtime speaking the Ollama {@code /api/chat} protocol.
 *
 * Tools are sent as native structured definitions and arguments travel as JSON
 * objects, not strings. The runtime does not assign tool call ids, so this adapter
 * mints them. Small local models sometimes refuse instead of answering; such
 * replies count as {@link ErrorKind#CONTENT_FILTERED} so the turn can degrade.
 */
@Slf4j
public class OnDeviceBackendAdapter extends TimedBackendAdapter {

    public static final String ID = "on-device";

    static final List<String> REFUSAL_PHRASES = List.of(
            "i'm sorry i cannot fulfill",
            "i'm sorry, i cannot fulfill",
            "i can't help with that",
            "i cannot assist");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public OnDeviceBackendAdapter(FocusProperties.Backend props,
                                  ObjectMapper objectMapper,
                                  RestClient.Builder restClientBuilder,
                                  AsyncTaskExecutor callExecutor) {
        super(props, callExecutor);
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl() != null ? props.getBaseUrl() : "http://localhost:11434")
                .build();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected BackendOutcome exchange(List<Message> window, List<ToolDefinition> tools) {
        JsonNode response = restClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .body(buildPayload(window, tools))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    int status = res.getStatusCode().value();
                    log.warn("{} returned {}: {}", ID, status, body);
                    throw new BackendCallException(BackendFailureClassifier.classifyStatus(status, body),
                            ID + " returned HTTP " + status + ": " + body);
                })
                .body(JsonNode.class);

        return parseResponse(response);
    }

    ObjectNode buildPayload(List<Message> window, List<ToolDefinition> tools) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", props.getModel());
        payload.put("stream", false);

        ArrayNode messages = payload.putArray("messages");
        for (Message message : window) {
            messages.add(formatMessage(message));
        }

        if (!tools.isEmpty()) {
            ArrayNode toolArray = payload.putArray("tools");
            for (ToolDefinition tool : tools) {
                toolArray.add(objectMapper.valueToTree(tool.toFunctionSchema()));
            }
        }

        ObjectNode options = payload.putObject("options");
        options.put("temperature", props.getTemperature());
        options.put("num_predict", props.getMaxTokens());
        return payload;
    }

    private ObjectNode formatMessage(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.getRole().name());
        node.put("content", message.getContent() != null ? message.getContent() : "");

        if (message.getRole() == Message.Role.tool && message.getName() != null) {
            node.put("tool_name", message.getName());
        }
        if (message.carriesToolCalls()) {
            ArrayNode calls = node.putArray("tool_calls");
            for (ToolCall call : message.getToolCalls()) {
                ObjectNode function = calls.addObject().putObject("function");
                function.put("name", call.getToolName());
                function.set("arguments", argumentsObject(call.getArgumentsJson()));
            }
        }
        return node;
    }

    /** The runtime wants arguments as an object; unreadable text becomes an empty one. */
    private JsonNode argumentsObject(String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(argumentsJson);
            return parsed.isObject() ? parsed : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            log.debug("Replaying unreadable tool arguments as an empty object: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    BackendOutcome parseResponse(JsonNode response) {
        if (response != null && response.hasNonNull("error")) {
            String error = response.path("error").asText();
            ErrorKind kind = BackendFailureClassifier.classifyMessage(error);
            return BackendOutcome.failure(kind != null ? kind : ErrorKind.BACKEND_UNAVAILABLE, error);
        }
        if (response == null || !response.path("message").isObject()) {
            throw new BackendCallException(ErrorKind.MALFORMED_RESPONSE, ID + " returned no message");
        }

        int promptTokens = response.path("prompt_eval_count").asInt(0);
        int completionTokens = response.path("eval_count").asInt(0);

        JsonNode message = response.path("message");
        JsonNode toolCalls = message.path("tool_calls");
        if (toolCalls.isArray() && !toolCalls.isEmpty()) {
            List<ToolCall> calls = new ArrayList<>(toolCalls.size());
            for (JsonNode node : toolCalls) {
                calls.add(parseToolCall(node));
            }
            return BackendOutcome.toolCalls(calls, promptTokens, completionTokens);
        }

        String content = message.path("content").asText("");
        if (content.isBlank()) {
            throw new BackendCallException(ErrorKind.MALFORMED_RESPONSE, ID + " returned an empty reply");
        }
        if (isRefusal(content)) {
            log.warn("{} refused the request: {}", ID, content);
            return BackendOutcome.failure(ErrorKind.CONTENT_FILTERED, "model refused: " + content);
        }
        return BackendOutcome.text(content, promptTokens, completionTokens);
    }

    private ToolCall parseToolCall(JsonNode node) {
        JsonNode function = node.path("function");
        String name = function.path("name").asText("");
        if (name.isBlank()) {
            throw new BackendCallException(ErrorKind.MALFORMED_RESPONSE, ID + " sent a tool call without a name");
        }

        JsonNode arguments = function.path("arguments");
        String argumentsJson;
        if (arguments.isObject()) {
            argumentsJson = arguments.toString();
        } else if (arguments.isTextual()) {
            argumentsJson = arguments.asText();
        } else {
            argumentsJson = "{}";
        }

        String id = node.path("id").asText("");
        return ToolCall.builder()
                .id(id.isBlank() ? "call_" + UUID.randomUUID() : id)
                .toolName(name)
                .argumentsJson(argumentsJson)
                .build();
    }

    static boolean isRefusal(String content) {
        String normalized = content.toLowerCase(Locale.ROOT).replace('’', '\'');
        return REFUSAL_PHRASES.stream().anyMatch(normalized::contains);
    }
}
