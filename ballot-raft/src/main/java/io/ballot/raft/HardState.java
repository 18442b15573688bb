package io.ballot.raft;

public record HardState(long term, Vote vote, long commit) {
    public static final HardState INITIAL = new HardState(0, null, 0);

    public HardState {
        if (term < 0) {
            throw new IllegalArgumentException("term must be non-negative: " + term);
        }
        if (commit < 0) {
            throw new IllegalArgumentException("commit must be non-negative: " + commit);
        }
        if (vote != null && vote.term() != term) {
            throw new IllegalArgumentException(
                "vote term " + vote.term() + " does not match term " + term);
        }
    }

    public String votedFor() {
        return vote != null ? vote.votedFor() : null;
    }
}
