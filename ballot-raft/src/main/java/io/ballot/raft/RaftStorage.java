package io.ballot.raft;

import java.util.Optional;

/**
 * Durable state the consensus core depends on. Every mutating method must be
 * durable once {@link #sync()} returns; failures are reported as
 * {@link StorageException}. Implementations must be safe for concurrent use.
 */
public interface RaftStorage extends AutoCloseable {

    InitialState initialState();

    RaftLog log();

    void saveHardState(HardState hardState);

    Optional<Snapshot> snapshot();

    /**
     * Stores a locally built snapshot and purges the log up to and including
     * its last included index, as one atomic step. A snapshot that is not
     * newer than the stored one is ignored.
     */
    void saveSnapshot(Snapshot snapshot);

    /**
     * Stores a snapshot received from the leader and discards the whole log,
     * as one atomic step. The next appended entry follows the snapshot.
     */
    void installSnapshot(Snapshot snapshot);

    void sync();

    @Override
    void close();

    record InitialState(HardState hardState, Membership membership) {}
}
