package com.deepansh.focus.backend;

import com.deepansh.focus.model.ErrorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.UnknownContentTypeException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps backend failures onto the shared {@link ErrorKind} taxonomy.
 *
 * Walks the cause chain; at each level the exception type wins over its message.
 * Anything unrecognised counts as the backend being unavailable.
 */
public final class BackendFailureClassifier {

    private static final List<String> CONTENT_FILTER_MARKERS = List.of(
            "content_filter", "content_policy", "content policy", "safety", "sensitive", "guardrail");

    private static final List<String> CRASH_MARKERS = List.of(
            "inference provider crashed", "ipc error", "connection interrupted",
            "connection refused", "connection reset", "model not loaded", "out of memory");

    private static final List<String> TIMEOUT_MARKERS = List.of("timed out", "timeout");

    private BackendFailureClassifier() {
    }

    public static ErrorKind classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            ErrorKind byType = classifyKnownThrowable(current);
            if (byType != null) {
                return byType;
            }
            ErrorKind byMessage = classifyMessage(current.getMessage());
            if (byMessage != null) {
                return byMessage;
            }
            current = current.getCause();
        }
        return ErrorKind.BACKEND_UNAVAILABLE;
    }

    /**
     * Classifies an HTTP error status and its body.
     */
    public static ErrorKind classifyStatus(int status, String body) {
        if (status == 408 || status == 504) {
            return ErrorKind.TIMEOUT;
        }
        if (containsAny(body, CONTENT_FILTER_MARKERS)) {
            return ErrorKind.CONTENT_FILTERED;
        }
        return ErrorKind.BACKEND_UNAVAILABLE;
    }

    /**
     * Classifies a free-form error text. Returns null when nothing is recognised.
     */
    static ErrorKind classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        if (containsAny(message, CONTENT_FILTER_MARKERS)) {
            return ErrorKind.CONTENT_FILTERED;
        }
        if (containsAny(message, CRASH_MARKERS)) {
            return ErrorKind.BACKEND_UNAVAILABLE;
        }
        if (containsAny(message, TIMEOUT_MARKERS)) {
            return ErrorKind.TIMEOUT;
        }
        return null;
    }

    private static ErrorKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof BackendCallException classified) {
            return classified.getKind();
        }
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return ErrorKind.CANCELLED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (throwable instanceof ConnectException
                || throwable instanceof UnknownHostException
                || throwable instanceof NoRouteToHostException) {
            return ErrorKind.BACKEND_UNAVAILABLE;
        }
        if (throwable instanceof RestClientResponseException response) {
            return classifyStatus(response.getStatusCode().value(), response.getResponseBodyAsString());
        }
        if (throwable instanceof JsonProcessingException
                || throwable instanceof HttpMessageNotReadableException
                || throwable instanceof UnknownContentTypeException) {
            return ErrorKind.MALFORMED_RESPONSE;
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> markers) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }
}
