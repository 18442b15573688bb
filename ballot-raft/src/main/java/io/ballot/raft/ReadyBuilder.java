package io.ballot.raft;

import java.util.ArrayList;
import java.util.List;

final class ReadyBuilder {
    private HardState hardState;
    private final List<LogEntry> entries = new ArrayList<>();
    private final List<Ready.Outbound> messages = new ArrayList<>();
    private final List<LogEntry> toApply = new ArrayList<>();
    private final List<Ready.ReadState> readStates = new ArrayList<>();
    private final List<Ready.MembershipChange> membershipChanges = new ArrayList<>();
    private final List<Ready.Accepted> accepted = new ArrayList<>();
    private final List<Ready.Rejected> rejected = new ArrayList<>();
    private Snapshot incomingSnapshot;

    void setHardState(HardState hardState) {
        this.hardState = hardState;
    }

    void persist(LogEntry entry) {
        if (!entries.isEmpty() && entries.get(entries.size() - 1).index() >= entry.index()) {
            entries.removeIf(e -> e.index() >= entry.index());
        }
        entries.add(entry);
    }

    void send(String to, RaftMessage message) {
        messages.add(new Ready.Outbound(to, message));
    }

    void apply(LogEntry entry) {
        toApply.add(entry);
    }

    void addReadState(long requestId, long index) {
        readStates.add(new Ready.ReadState(requestId, index));
    }

    void addMembershipChange(long index, Membership previous, Membership current) {
        membershipChanges.add(new Ready.MembershipChange(index, previous, current));
    }

    void accept(long requestId, LogId logId) {
        accepted.add(new Ready.Accepted(requestId, logId));
    }

    void reject(long requestId, RaftException reason) {
        rejected.add(new Ready.Rejected(requestId, reason));
    }

    void setIncomingSnapshot(Snapshot snapshot) {
        this.incomingSnapshot = snapshot;
        this.entries.clear();
    }

    Ready build() {
        boolean mustSync = hardState != null || !entries.isEmpty() || incomingSnapshot != null;

        var persist = new Ready.Persist(
            hardState,
            List.copyOf(entries),
            incomingSnapshot,
            mustSync
        );

        var apply = new Ready.Apply(
            List.copyOf(toApply),
            List.copyOf(readStates),
            List.copyOf(membershipChanges)
        );

        return new Ready(persist, List.copyOf(messages), apply, List.copyOf(accepted), List.copyOf(rejected));
    }
}
