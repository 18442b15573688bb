package io.ballot.raft;

import java.util.Objects;

/**
 * Protocol tuning. All durations are in ticks of the node's tick interval.
 */
public record RaftConfig(
    int electionTimeoutMin,
    int electionTimeoutMax,
    int heartbeatInterval,
    int maxEntriesPerAppend,
    int maxBackoffTicks,
    long snapshotThresholdEntries,
    long snapshotThresholdBytes,
    int snapshotChunkSize,
    ReadPolicy readPolicy,
    int leaseTicks
) {
    public RaftConfig {
        if (electionTimeoutMin <= 0) {
            throw new IllegalArgumentException("electionTimeoutMin must be positive");
        }
        if (electionTimeoutMax <= electionTimeoutMin) {
            throw new IllegalArgumentException("electionTimeoutMax must be greater than electionTimeoutMin");
        }
        if (heartbeatInterval <= 0) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (heartbeatInterval >= electionTimeoutMin) {
            throw new IllegalArgumentException("heartbeatInterval must be less than electionTimeoutMin");
        }
        if (maxEntriesPerAppend <= 0) {
            throw new IllegalArgumentException("maxEntriesPerAppend must be positive");
        }
        if (maxBackoffTicks < heartbeatInterval) {
            throw new IllegalArgumentException("maxBackoffTicks must be at least heartbeatInterval");
        }
        if (snapshotThresholdEntries <= 0) {
            throw new IllegalArgumentException("snapshotThresholdEntries must be positive");
        }
        if (snapshotThresholdBytes <= 0) {
            throw new IllegalArgumentException("snapshotThresholdBytes must be positive");
        }
        if (snapshotChunkSize <= 0) {
            throw new IllegalArgumentException("snapshotChunkSize must be positive");
        }
        Objects.requireNonNull(readPolicy, "readPolicy must not be null");
        if (leaseTicks <= 0) {
            throw new IllegalArgumentException("leaseTicks must be positive");
        }
        if (leaseTicks >= electionTimeoutMin) {
            throw new IllegalArgumentException("leaseTicks must be less than electionTimeoutMin");
        }
    }

    public static RaftConfig defaults() {
        return new RaftConfig(10, 20, 3, 100, 10, 10_000, 64L * 1024 * 1024, 64 * 1024,
            ReadPolicy.COMMIT_CONFIRMED, 8);
    }

    public RaftConfig withSnapshotThreshold(long entries, long bytes) {
        return new RaftConfig(electionTimeoutMin, electionTimeoutMax, heartbeatInterval, maxEntriesPerAppend,
            maxBackoffTicks, entries, bytes, snapshotChunkSize, readPolicy, leaseTicks);
    }

    public RaftConfig withSnapshotChunkSize(int chunkSize) {
        return new RaftConfig(electionTimeoutMin, electionTimeoutMax, heartbeatInterval, maxEntriesPerAppend,
            maxBackoffTicks, snapshotThresholdEntries, snapshotThresholdBytes, chunkSize, readPolicy, leaseTicks);
    }

    public RaftConfig withReadPolicy(ReadPolicy policy, int leaseTicks) {
        return new RaftConfig(electionTimeoutMin, electionTimeoutMax, heartbeatInterval, maxEntriesPerAppend,
            maxBackoffTicks, snapshotThresholdEntries, snapshotThresholdBytes, snapshotChunkSize, policy, leaseTicks);
    }

    public RaftConfig withMaxEntriesPerAppend(int maxEntries) {
        return new RaftConfig(electionTimeoutMin, electionTimeoutMax, heartbeatInterval, maxEntries,
            maxBackoffTicks, snapshotThresholdEntries, snapshotThresholdBytes, snapshotChunkSize, readPolicy, leaseTicks);
    }
}
