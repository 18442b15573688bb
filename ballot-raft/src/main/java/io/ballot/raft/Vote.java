package io.ballot.raft;

import java.util.Objects;

/**
 * A vote cast in {@code term}. A committed vote belongs to a node known to
 * have won that term.
 */
public record Vote(long term, String votedFor, boolean committed) {
    public Vote {
        if (term < 0) {
            throw new IllegalArgumentException("term must be non-negative: " + term);
        }
        Objects.requireNonNull(votedFor, "votedFor must not be null");
    }

    public static Vote of(long term, String votedFor) {
        return new Vote(term, votedFor, false);
    }

    public Vote commit() {
        return committed ? this : new Vote(term, votedFor, true);
    }

    public boolean isFor(String nodeId) {
        return votedFor.equals(nodeId);
    }
}
