package io.ballot.raft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Decides when to compact the log, and stores snapshots off the apply path.
 * The state is captured by the caller's thread so it matches the applied
 * index exactly; persisting and purging happen on the coordinator's thread.
 */
final class SnapshotCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCoordinator.class);

    private final RaftStorage storage;
    private final RaftConfig config;
    private final Consumer<RaftEvent> events;
    private final Consumer<Throwable> onFailure;
    private final ExecutorService executor;
    private final AtomicBoolean building = new AtomicBoolean();
    private volatile long snapshotIndex;

    SnapshotCoordinator(String nodeId, RaftStorage storage, RaftConfig config,
                        Consumer<RaftEvent> events, Consumer<Throwable> onFailure) {
        this.storage = storage;
        this.config = config;
        this.events = events;
        this.onFailure = onFailure;
        this.executor = Executors.newSingleThreadExecutor(RaftNode.daemonThreads("ballot-snapshot-" + nodeId));
        this.snapshotIndex = storage.snapshot().map(Snapshot::index).orElse(0L);
    }

    private boolean shouldSnapshot(long lastApplied) {
        if (building.get() || lastApplied <= snapshotIndex) {
            return false;
        }
        return lastApplied - snapshotIndex >= config.snapshotThresholdEntries()
            || storage.log().sizeInBytes() >= config.snapshotThresholdBytes();
    }

    /**
     * Starts a snapshot at {@code applied} when a threshold is crossed.
     * Returns whether a build was started.
     */
    boolean maybeSnapshot(LogId applied, Membership membership, Supplier<byte[]> state) {
        if (!shouldSnapshot(applied.index()) || !building.compareAndSet(false, true)) {
            return false;
        }

        var snapshot = new Snapshot(new SnapshotMeta(applied, membership), state.get());
        try {
            executor.execute(() -> save(snapshot));
        } catch (RejectedExecutionException e) {
            building.set(false);
            return false;
        }
        return true;
    }

    private void save(Snapshot snapshot) {
        try {
            storage.saveSnapshot(snapshot);
            storage.sync();
            snapshotIndex = Math.max(snapshotIndex, snapshot.index());
            log.info("Stored snapshot at {} ({} bytes), log purged through {}",
                snapshot.meta().lastIncluded(), snapshot.data().length, snapshot.index());
            events.accept(new RaftEvent.SnapshotBuilt(snapshot.meta()));
        } catch (StorageException e) {
            log.error("Failed to store snapshot at {}", snapshot.meta().lastIncluded(), e);
            onFailure.accept(e);
        } finally {
            building.set(false);
        }
    }

    /** A snapshot received from the leader replaced the local state. */
    void installed(long index) {
        snapshotIndex = Math.max(snapshotIndex, index);
    }

    void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
