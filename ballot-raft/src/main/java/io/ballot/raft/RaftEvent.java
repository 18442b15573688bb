package io.ballot.raft;

public sealed interface RaftEvent {
    record Tick() implements RaftEvent {}
    record Propose(long requestId, byte[] data) implements RaftEvent {}
    record ChangeConfig(long requestId, ConfigChange change) implements RaftEvent {}
    record ReadIndex(long requestId) implements RaftEvent {}
    record Receive(String from, RaftMessage message) implements RaftEvent {}

    /** Delivery of {@code request} to {@code peer} failed or timed out. */
    record Unreachable(String peer, RaftMessage.Request request) implements RaftEvent {}

    /** Storage durably holds the log up to {@code lastLogId}. */
    record Persisted(LogId lastLogId) implements RaftEvent {}

    /** The state machine has applied every entry up to {@code index}. */
    record Applied(long index) implements RaftEvent {}

    /** A local snapshot was stored and the log purged through its last index. */
    record SnapshotBuilt(SnapshotMeta meta) implements RaftEvent {}
}
