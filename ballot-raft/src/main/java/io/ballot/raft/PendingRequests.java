package io.ballot.raft;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client requests waiting on the log. Futures are registered from caller
 * threads; everything keyed by log index is touched only by the pipeline.
 */
final class PendingRequests<R> {

    record Tracked<T>(long requestId, CompletableFuture<T> future) {}

    record Query(long requestId, byte[] query) {}

    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicInteger outstanding = new AtomicInteger();
    private final int limit;

    private final Map<Long, CompletableFuture<WriteResult<R>>> writes = new ConcurrentHashMap<>();
    private final Map<Long, CompletableFuture<R>> reads = new ConcurrentHashMap<>();
    private final Map<Long, CompletableFuture<Membership>> changes = new ConcurrentHashMap<>();
    private final Map<Long, byte[]> queries = new ConcurrentHashMap<>();
    private final Map<Long, LogId> acceptedIds = new ConcurrentHashMap<>();

    private final NavigableMap<Long, Long> byIndex = new TreeMap<>();
    private final NavigableMap<Long, List<Long>> readsByIndex = new TreeMap<>();
    private long awaitingFinalConfig;

    PendingRequests(int limit) {
        this.limit = limit;
    }

    Tracked<WriteResult<R>> trackWrite() {
        return register(writes);
    }

    Tracked<R> trackRead(byte[] query) {
        Tracked<R> tracked = register(reads);
        queries.put(tracked.requestId(), query);
        return tracked;
    }

    Tracked<Membership> trackChange() {
        return register(changes);
    }

    private <T> Tracked<T> register(Map<Long, CompletableFuture<T>> kind) {
        reserve();
        long id = nextId.getAndIncrement();
        var future = new CompletableFuture<T>();
        kind.put(id, future);
        future.whenComplete((result, error) -> {
            kind.remove(id, future);
            queries.remove(id);
            acceptedIds.remove(id);
            outstanding.decrementAndGet();
        });
        return new Tracked<>(id, future);
    }

    private void reserve() {
        int current;
        do {
            current = outstanding.get();
            if (current >= limit) {
                throw new RaftException.TooManyRequests(limit);
            }
        } while (!outstanding.compareAndSet(current, current + 1));
    }

    void accepted(long requestId, LogId logId) {
        if (!writes.containsKey(requestId) && !changes.containsKey(requestId)) {
            return;
        }
        acceptedIds.put(requestId, logId);
        byIndex.put(logId.index(), requestId);
    }

    void readReady(long requestId, long readIndex) {
        if (reads.containsKey(requestId)) {
            readsByIndex.computeIfAbsent(readIndex, i -> new ArrayList<>()).add(requestId);
        }
    }

    /**
     * Resolves whatever was waiting on {@code entry}. {@code result} is the
     * state machine's output for data entries and null otherwise.
     */
    void applied(LogEntry entry, R result) {
        Long requestId = byIndex.remove(entry.index());
        if (requestId != null) {
            var logId = acceptedIds.get(requestId);
            if (logId == null || logId.term() != entry.term()) {
                fail(requestId, new RaftException.LeadershipLost(null));
            } else if (entry instanceof LogEntry.Data) {
                completeWrite(requestId, new WriteResult<>(entry.id(), result));
            } else if (entry instanceof LogEntry.Config c) {
                if (c.membership().isJoint()) {
                    awaitingFinalConfig = requestId;
                } else {
                    completeChange(requestId, c.membership());
                }
            }
            return;
        }

        if (entry instanceof LogEntry.Config c && !c.membership().isJoint() && awaitingFinalConfig != 0) {
            completeChange(awaitingFinalConfig, c.membership());
            awaitingFinalConfig = 0;
        }
    }

    /**
     * Removes and returns the reads whose read index is at or below
     * {@code lastApplied}.
     */
    List<Query> readsUpTo(long lastApplied) {
        var ready = readsByIndex.headMap(lastApplied, true);
        if (ready.isEmpty()) {
            return List.of();
        }
        var result = new ArrayList<Query>();
        for (var ids : ready.values()) {
            for (long id : ids) {
                byte[] query = queries.get(id);
                if (query != null) {
                    result.add(new Query(id, query));
                }
            }
        }
        ready.clear();
        return result;
    }

    void completeRead(long requestId, R value) {
        complete(reads, requestId, value);
    }

    private void completeWrite(long requestId, WriteResult<R> value) {
        complete(writes, requestId, value);
    }

    private void completeChange(long requestId, Membership value) {
        complete(changes, requestId, value);
    }

    private static <T> void complete(Map<Long, CompletableFuture<T>> kind, long requestId, T value) {
        var future = kind.get(requestId);
        if (future != null) {
            future.complete(value);
        }
    }

    void fail(long requestId, Throwable error) {
        failIn(writes, requestId, error);
        failIn(reads, requestId, error);
        failIn(changes, requestId, error);
    }

    private static void failIn(Map<Long, ? extends CompletableFuture<?>> kind, long requestId, Throwable error) {
        var future = kind.get(requestId);
        if (future != null) {
            future.completeExceptionally(error);
        }
    }

    void timeout(long requestId) {
        var logId = acceptedIds.get(requestId);
        fail(requestId, new RaftException.CommitTimeout(logId != null ? logId.index() : 0));
    }

    /**
     * Fails everything in flight. Called from the pipeline on leadership loss
     * and from any thread once the node stops.
     */
    void failAll(RaftException error) {
        for (var id : List.copyOf(writes.keySet())) {
            failIn(writes, id, error);
        }
        for (var id : List.copyOf(reads.keySet())) {
            failIn(reads, id, error);
        }
        for (var id : List.copyOf(changes.keySet())) {
            failIn(changes, id, error);
        }
    }

    /** Drops pipeline-side bookkeeping once the futures it points at are gone. */
    void clearIndexes() {
        byIndex.clear();
        readsByIndex.clear();
        awaitingFinalConfig = 0;
    }

    int size() {
        return outstanding.get();
    }
}
