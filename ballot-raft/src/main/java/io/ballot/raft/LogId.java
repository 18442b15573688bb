package io.ballot.raft;

public record LogId(long term, long index) implements Comparable<LogId> {
    public static final LogId ZERO = new LogId(0, 0);

    public LogId {
        if (term < 0) {
            throw new IllegalArgumentException("term must be non-negative: " + term);
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
    }

    public static LogId of(long term, long index) {
        return index == 0 && term == 0 ? ZERO : new LogId(term, index);
    }

    /**
     * Log freshness order used by elections: the higher term wins, and for
     * equal terms the longer log wins.
     */
    @Override
    public int compareTo(LogId other) {
        int byTerm = Long.compare(term, other.term);
        return byTerm != 0 ? byTerm : Long.compare(index, other.index);
    }

    public boolean isAtLeast(LogId other) {
        return compareTo(other) >= 0;
    }

    @Override
    public String toString() {
        return "T" + term + "-I" + index;
    }
}
