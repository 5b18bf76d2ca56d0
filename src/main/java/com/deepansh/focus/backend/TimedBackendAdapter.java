package com.deepansh.focus.backend;

import com.deepansh.focus.config.FocusProperties;
import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing for HTTP backends: tool allowlist, adaptive deadline and
 * failure classification. Subclasses only implement the wire exchange and may throw.
 *
 * The exchange runs on a separate executor so the deadline holds even when the
 * underlying I/O is not interruptible; on timeout or cancellation the call is
 * abandoned and its result discarded.
 */
@Slf4j
public abstract class TimedBackendAdapter implements BackendAdapter {

    protected final FocusProperties.Backend props;
    private final AsyncTaskExecutor callExecutor;

    protected TimedBackendAdapter(FocusProperties.Backend props, AsyncTaskExecutor callExecutor) {
        this.props = props;
        this.callExecutor = callExecutor;
    }

    /**
     * Performs the request and parses the reply. Exceptions are classified by the caller.
     */
    protected abstract BackendOutcome exchange(List<Message> window, List<ToolDefinition> tools);

    /** True when this request should get the extended deadline. */
    protected boolean isComplex(List<Message> window) {
        return ComplexityClassifier.isComplex(window);
    }

    @Override
    public final BackendOutcome send(List<Message> window, List<ToolDefinition> tools) {
        List<ToolDefinition> offered = restrict(tools);
        boolean complex = isComplex(window);
        long timeoutMs = complex ? props.getComplexTimeoutMs() : props.getTimeoutMs();

        log.debug("Sending {} messages and {} tools to [{}] [model={}, complex={}, timeout={}ms]",
                window.size(), offered.size(), id(), props.getModel(), complex, timeoutMs);

        Future<BackendOutcome> call;
        try {
            call = callExecutor.submit(() -> exchange(window, offered));
        } catch (TaskRejectedException e) {
            log.warn("Backend call executor is saturated, rejecting call to [{}]", id());
            return BackendOutcome.failure(ErrorKind.BACKEND_UNAVAILABLE, "call executor saturated");
        }

        try {
            return call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Backend [{}] gave no answer within {}ms", id(), timeoutMs);
            return BackendOutcome.failure(ErrorKind.TIMEOUT, "no answer within " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return BackendOutcome.failure(ErrorKind.CANCELLED, "interrupted while waiting for " + id());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ErrorKind kind = BackendFailureClassifier.classify(cause);
            log.warn("Backend [{}] failed with {}: {}", id(), kind, cause.getMessage());
            return BackendOutcome.failure(kind, cause.getMessage());
        }
    }

    private List<ToolDefinition> restrict(List<ToolDefinition> tools) {
        List<String> allowed = props.getAllowedTools();
        if (allowed == null || allowed.isEmpty()) {
            return tools;
        }
        return tools.stream().filter(tool -> allowed.contains(tool.getName())).toList();
    }
}
