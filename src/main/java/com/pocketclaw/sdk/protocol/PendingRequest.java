package com.pocketclaw.sdk.protocol;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * An in-flight request awaiting its response. The future completes exactly once.
 */
public final class PendingRequest {

    private final String id;
    private final String method;
    private final Instant deadline;
    private final CompletableFuture<ResponseFrame> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    PendingRequest(String id, String method, Instant deadline) {
        this.id = id;
        this.method = method;
        this.deadline = deadline;
    }

    public String getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public CompletableFuture<ResponseFrame> getFuture() {
        return future;
    }

    void setTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
        if (future.isDone()) {
            timer.cancel(false);
        }
    }

    void cancelTimer() {
        ScheduledFuture<?> current = timer;
        if (current != null) {
            current.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "PendingRequest{id='" + id + "', method='" + method + "'}";
    }
}
