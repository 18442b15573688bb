package io.ballot.raft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Delivers requests to one peer, one at a time. At most one request waits
 * behind the one in flight; a newer request replaces it. Responses and
 * failures are fed back to the core as events until the stream is cancelled.
 */
final class ReplicationStream {
    private static final Logger log = LoggerFactory.getLogger(ReplicationStream.class);

    private final String peer;
    private final RaftTransport transport;
    private final Duration rpcTimeout;
    private final Consumer<RaftEvent> events;
    private final ExecutorService executor;
    private final AtomicReference<RaftMessage.Request> next = new AtomicReference<>();
    private volatile boolean cancelled;

    ReplicationStream(String nodeId, String peer, RaftTransport transport,
                      Duration rpcTimeout, Consumer<RaftEvent> events) {
        this.peer = peer;
        this.transport = transport;
        this.rpcTimeout = rpcTimeout;
        this.events = events;
        this.executor = Executors.newSingleThreadExecutor(
            RaftNode.daemonThreads("ballot-replicate-" + nodeId + "-" + peer));
    }

    void send(RaftMessage.Request request) {
        if (cancelled) {
            return;
        }
        var replaced = next.getAndSet(request);
        if (replaced != null) {
            log.trace("Request to {} superseded before delivery: {}", peer, replaced.getClass().getSimpleName());
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            next.set(null);
            log.debug("Stream to {} closed, dropping {}", peer, request.getClass().getSimpleName());
        }
    }

    private void drain() {
        var request = next.getAndSet(null);
        if (request != null) {
            deliver(request);
        }
    }

    private void deliver(RaftMessage.Request request) {
        if (cancelled) {
            return;
        }

        CompletableFuture<RaftMessage.Response> future = null;
        try {
            future = transport.send(peer, request);
            var response = future.get(rpcTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!cancelled) {
                events.accept(new RaftEvent.Receive(peer, response));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            if (future != null) {
                future.cancel(true);
            }
            log.debug("{} to {} failed: {}", request.getClass().getSimpleName(), peer, e.toString());
            if (!cancelled) {
                events.accept(new RaftEvent.Unreachable(peer, request));
            }
        }
    }

    String peer() {
        return peer;
    }

    void cancel() {
        cancelled = true;
        next.set(null);
        executor.shutdownNow();
    }
}
