package com.deepansh.focus.backend;

import com.deepansh.focus.config.FocusProperties;
import com.deepansh.focus.model.BackendOutcome;
import com.deepansh.focus.model.ErrorKind;
import com.deepansh.focus.model.Message;
import com.deepansh.focus.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Decorator that adds bounded retries and a circuit breaker around a backend.
 *
 * Adapters report failures as results rather than exceptions, so retries are
 * driven by the result's {@link ErrorKind}: only the configured kinds are retried,
 * with a fixed wait. When attempts run out the last failure is returned as is.
 *
 * Each attempt passes through the circuit breaker. Transport-level failures
 * (unavailable, timeout) count against it; while it is open, calls fail fast
 * with {@link ErrorKind#BACKEND_UNAVAILABLE} and the ladder moves on.
 */
@Slf4j
public class ResilientBackendAdapter implements BackendAdapter {

    private static final Set<ErrorKind> BREAKER_FAILURES =
            EnumSet.of(ErrorKind.BACKEND_UNAVAILABLE, ErrorKind.TIMEOUT);

    private final BackendAdapter delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientBackendAdapter(BackendAdapter delegate, Retry retry, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
    }

    public static ResilientBackendAdapter wrap(BackendAdapter delegate,
                                               FocusProperties.Backend props,
                                               RetryRegistry retryRegistry,
                                               CircuitBreakerRegistry circuitBreakerRegistry) {
        String name = "backend-" + delegate.id();
        Retry retry = retryRegistry.retry(name, retryConfig(props.getRetry()));

        CircuitBreaker breaker = null;
        FocusProperties.CircuitBreaker cb = props.getCircuitBreaker();
        if (cb.isEnabled()) {
            breaker = circuitBreakerRegistry.circuitBreaker(name, CircuitBreakerConfig.custom()
                    .failureRateThreshold(cb.getFailureRateThreshold())
                    .slidingWindowSize(cb.getSlidingWindowSize())
                    .minimumNumberOfCalls(cb.getMinimumNumberOfCalls())
                    .waitDurationInOpenState(Duration.ofMillis(cb.getOpenStateWaitMs()))
                    .build());
        }

        log.info("Backend [{}] wrapped: maxAttempts={}, wait={}ms, retryOn={}, circuitBreaker={}",
                delegate.id(), props.getRetry().getMaxAttempts(), props.getRetry().getWaitMs(),
                props.getRetry().getRetryOn(), cb.isEnabled());
        return new ResilientBackendAdapter(delegate, retry, breaker);
    }

    static RetryConfig retryConfig(FocusProperties.Retry props) {
        Set<ErrorKind> retryOn = props.getRetryOn().isEmpty()
                ? EnumSet.noneOf(ErrorKind.class)
                : EnumSet.copyOf(props.getRetryOn());
        retryOn.remove(ErrorKind.CANCELLED);

        return RetryConfig.<BackendOutcome>custom()
                .maxAttempts(Math.max(1, props.getMaxAttempts()))
                .waitDuration(Duration.ofMillis(props.getWaitMs()))
                .retryOnResult(outcome -> outcome.isFailure()
                        && retryOn.contains(outcome.getFailureKind())
                        && !Thread.currentThread().isInterrupted())
                .build();
    }

    @Override
    public String id() {
        return delegate.id();
    }

    @Override
    public BackendOutcome send(List<Message> window, List<ToolDefinition> tools) {
        Supplier<BackendOutcome> attempt = () -> guarded(window, tools);
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (RuntimeException e) {
            // an interrupt during the retry wait surfaces here
            ErrorKind kind = Thread.currentThread().isInterrupted()
                    ? ErrorKind.CANCELLED
                    : BackendFailureClassifier.classify(e);
            log.warn("Retry around [{}] aborted with {}: {}", delegate.id(), kind, e.getMessage());
            return BackendOutcome.failure(kind, e.getMessage());
        }
    }

    private BackendOutcome guarded(List<Message> window, List<ToolDefinition> tools) {
        if (Thread.currentThread().isInterrupted()) {
            return BackendOutcome.failure(ErrorKind.CANCELLED, "cancelled before calling " + delegate.id());
        }
        if (circuitBreaker == null) {
            return delegate.send(window, tools);
        }
        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("Circuit breaker for [{}] is {}, skipping call", delegate.id(), circuitBreaker.getState());
            return BackendOutcome.failure(ErrorKind.BACKEND_UNAVAILABLE, "circuit open for " + delegate.id());
        }

        long start = System.nanoTime();
        BackendOutcome outcome = delegate.send(window, tools);
        long elapsed = System.nanoTime() - start;

        if (outcome.isFailure() && BREAKER_FAILURES.contains(outcome.getFailureKind())) {
            circuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS,
                    new BackendCallException(outcome.getFailureKind(), outcome.getDetail()));
        } else if (outcome.isFailure() && outcome.getFailureKind() == ErrorKind.CANCELLED) {
            circuitBreaker.releasePermission();
        } else {
            circuitBreaker.onSuccess(elapsed, TimeUnit.NANOSECONDS);
        }
        return outcome;
    }
}
