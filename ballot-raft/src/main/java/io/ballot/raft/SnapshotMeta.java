package io.ballot.raft;

import java.util.Objects;

public record SnapshotMeta(LogId lastIncluded, Membership membership) {
    public SnapshotMeta {
        Objects.requireNonNull(lastIncluded, "lastIncluded must not be null");
        Objects.requireNonNull(membership, "membership must not be null");
    }

    public long index() {
        return lastIncluded.index();
    }

    public long term() {
        return lastIncluded.term();
    }
}
