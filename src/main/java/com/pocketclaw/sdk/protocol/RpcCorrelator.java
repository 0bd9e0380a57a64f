package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketclaw.sdk.exceptions.GatewayException;
import com.pocketclaw.sdk.exceptions.RequestTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Matches responses to requests by id.
 *
 * <p>Ids are decimal strings, strictly increasing from 1 and never reused for the
 * lifetime of the correlator. Each request races its response against a timer on a
 * shared scheduler; whichever removes the table entry first completes the future and
 * the other becomes a no-op.</p>
 */
public class RpcCorrelator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RpcCorrelator.class);

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public RpcCorrelator() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "gateway-rpc-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Writes one request frame to the transport.
     */
    @FunctionalInterface
    public interface FrameWriter {
        void write(RequestFrame frame);
    }

    /**
     * Allocates the next request id.
     */
    public String nextId() {
        return Long.toString(nextId.getAndIncrement());
    }

    /**
     * Builds, registers and transmits a request. The returned future completes with the
     * matching response, or exceptionally with {@link RequestTimeoutException}, the
     * writer's failure, or whatever {@link #cancelAll(Supplier)} supplies.
     */
    public CompletableFuture<ResponseFrame> send(String method, JsonNode params, Duration timeout, FrameWriter writer) {
        String id = nextId();
        PendingRequest request = register(id, method, timeout);
        try {
            writer.write(new RequestFrame(id, method, params));
        } catch (GatewayException e) {
            fail(id, e);
        }
        return request.getFuture();
    }

    /**
     * Registers a pending request and arms its timeout.
     *
     * @throws IllegalStateException if the id is already pending
     */
    public PendingRequest register(String id, String method, Duration timeout) {
        PendingRequest request = new PendingRequest(id, method, Instant.now().plus(timeout));
        if (pending.putIfAbsent(id, request) != null) {
            throw new IllegalStateException("Request id already pending: " + id);
        }
        request.getFuture().whenComplete((response, error) -> request.cancelTimer());
        try {
            request.setTimer(scheduler.schedule(() -> expire(id), timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            pending.remove(id, request);
            request.getFuture().completeExceptionally(new GatewayException("Correlator is closed", e));
        }
        logger.debug("Registered request {} ({})", id, method);
        return request;
    }

    /**
     * Completes the pending request matching the response id.
     *
     * @return false when no request with that id is pending (late or duplicate response)
     */
    public boolean resolve(ResponseFrame response) {
        PendingRequest request = response.getId() != null ? pending.remove(response.getId()) : null;
        if (request == null) {
            logger.debug("Dropping response for unknown request id {}", response.getId());
            return false;
        }
        return request.getFuture().complete(response);
    }

    /**
     * Fails one pending request.
     */
    public boolean fail(String id, GatewayException error) {
        PendingRequest request = pending.remove(id);
        return request != null && request.getFuture().completeExceptionally(error);
    }

    /**
     * Fails every pending request and empties the table.
     *
     * @return number of requests failed
     */
    public int cancelAll(Supplier<? extends GatewayException> reason) {
        List<PendingRequest> drained = new ArrayList<>();
        for (String id : new ArrayList<>(pending.keySet())) {
            PendingRequest request = pending.remove(id);
            if (request != null) {
                drained.add(request);
            }
        }
        for (PendingRequest request : drained) {
            request.getFuture().completeExceptionally(reason.get());
        }
        if (!drained.isEmpty()) {
            logger.debug("Cancelled {} pending request(s)", drained.size());
        }
        return drained.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(String id) {
        return pending.containsKey(id);
    }

    private void expire(String id) {
        PendingRequest request = pending.remove(id);
        if (request != null) {
            logger.debug("Request {} ({}) timed out", id, request.getMethod());
            request.getFuture().completeExceptionally(new RequestTimeoutException(request.getMethod()));
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        cancelAll(() -> new GatewayException("Correlator is closed"));
    }
}
