package io.ballot.raft;

import java.util.Objects;

public record Snapshot(SnapshotMeta meta, byte[] data) {

    public Snapshot {
        Objects.requireNonNull(meta, "meta must not be null");
        Objects.requireNonNull(data, "data must not be null");
    }

    public long index() {
        return meta.index();
    }

    public long term() {
        return meta.term();
    }

    public Membership membership() {
        return meta.membership();
    }
}
