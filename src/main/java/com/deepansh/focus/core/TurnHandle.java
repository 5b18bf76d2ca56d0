package com.deepansh.focus.core;

import com.deepansh.focus.model.TurnResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Caller's view of a turn in flight: its eventual result and a way to cancel it.
 *
 * Cancellation and commit are mutually exclusive under this object's monitor: either
 * the turn's messages are appended in full, or the cancel wins and nothing is appended.
 */
public class TurnHandle {

    private final String sessionId;
    private final CompletableFuture<TurnResult> result = new CompletableFuture<>();

    private boolean cancelled;
    private boolean committed;
    private Thread runner;

    TurnHandle(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public CompletableFuture<TurnResult> result() {
        return result;
    }

    /** Blocks until the turn has finished. */
    public TurnResult await() throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Turn for session " + sessionId + " failed unexpectedly", e.getCause());
        }
    }

    /**
     * Requests cancellation. Returns false when the turn has already committed or finished.
     */
    public synchronized boolean cancel() {
        if (committed || result.isDone()) {
            return false;
        }
        cancelled = true;
        if (runner != null) {
            runner.interrupt();
        }
        return true;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    synchronized void attach(Thread thread) {
        this.runner = thread;
    }

    synchronized void detach() {
        this.runner = null;
    }

    /**
     * Runs the commit unless the turn was cancelled first.
     *
     * @return false when cancellation won
     */
    synchronized boolean commit(Runnable append) {
        if (cancelled) {
            return false;
        }
        append.run();
        committed = true;
        return true;
    }

    void complete(TurnResult turnResult) {
        result.complete(turnResult);
    }

    void fail(Throwable error) {
        result.completeExceptionally(error);
    }
}
