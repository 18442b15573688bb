package io.ballot.raft;

import java.util.List;

/**
 * The work produced by one {@link Raft#step}: persist first, then send,
 * then apply.
 */
public record Ready(
    Persist persist,
    List<Outbound> messages,
    Apply apply,
    List<Accepted> accepted,
    List<Rejected> rejected
) {
    public static final Ready EMPTY = new Ready(Persist.EMPTY, List.of(), Apply.EMPTY, List.of(), List.of());

    public boolean hasWork() {
        return persist.hasWork() || !messages.isEmpty() || apply.hasWork()
            || !accepted.isEmpty() || !rejected.isEmpty();
    }

    public record Persist(
        HardState hardState,
        List<LogEntry> entries,
        Snapshot incomingSnapshot,
        boolean mustSync
    ) {
        public static final Persist EMPTY = new Persist(null, List.of(), null, false);

        public boolean hasWork() {
            return hardState != null || !entries.isEmpty() || incomingSnapshot != null;
        }

        public LogId lastLogId() {
            if (!entries.isEmpty()) {
                return entries.get(entries.size() - 1).id();
            }
            return incomingSnapshot != null ? incomingSnapshot.meta().lastIncluded() : null;
        }
    }

    public record Apply(
        List<LogEntry> entries,
        List<ReadState> readStates,
        List<MembershipChange> membershipChanges
    ) {
        public static final Apply EMPTY = new Apply(List.of(), List.of(), List.of());

        public boolean hasWork() {
            return !entries.isEmpty() || !readStates.isEmpty() || !membershipChanges.isEmpty();
        }
    }

    public record Outbound(String to, RaftMessage message) {}

    /** A linearizable read may be served once {@code index} is applied. */
    public record ReadState(long requestId, long index) {}

    public record MembershipChange(long index, Membership previous, Membership current) {}

    /** A client request was appended to the log at {@code logId}. */
    public record Accepted(long requestId, LogId logId) {}

    public record Rejected(long requestId, RaftException reason) {}
}
