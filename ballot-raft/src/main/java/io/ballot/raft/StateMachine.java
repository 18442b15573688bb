package io.ballot.raft;

/**
 * The replicated application. Entries are applied in log order, exactly
 * once per node lifetime; {@link #restore} replaces the whole state.
 *
 * @param <R> the result type of commands and queries
 */
public interface StateMachine<R> {

    R apply(LogId id, byte[] command);

    R read(byte[] query);

    byte[] snapshot();

    void restore(SnapshotMeta meta, byte[] snapshot);
}
