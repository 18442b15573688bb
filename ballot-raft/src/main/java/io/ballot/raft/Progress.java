package io.ballot.raft;

/**
 * The leader's view of one follower's log. Discarded whenever leadership
 * changes or the follower leaves the membership.
 */
final class Progress {

    enum Mode {
        /** Looking for the last matching entry; one request in flight. */
        PROBE,
        /** Match known; batches stream one at a time. */
        REPLICATE,
        /** Log needed by the follower is compacted; sending a snapshot. */
        SNAPSHOT
    }

    private long matchIndex;
    private long nextIndex;
    private Mode mode = Mode.PROBE;
    private boolean inflight;
    private long lastContactTick;
    private long sentTick;
    private long lastSentTick;
    private long leaseTick;

    private int backoffTicks;
    private long pausedUntilTick;

    private SnapshotMeta snapshotMeta;
    private long snapshotOffset;

    Progress(long nextIndex, long tick) {
        this.nextIndex = nextIndex;
        this.lastContactTick = tick;
        this.leaseTick = Long.MIN_VALUE / 2;
    }

    long matchIndex() {
        return matchIndex;
    }

    long nextIndex() {
        return nextIndex;
    }

    Mode mode() {
        return mode;
    }

    boolean inflight() {
        return inflight;
    }

    long lastContactTick() {
        return lastContactTick;
    }

    /**
     * Send tick of the oldest request the follower has answered. A lease can
     * only be measured from when the leader asked, not from when it heard back.
     */
    long leaseTick() {
        return leaseTick;
    }

    SnapshotMeta snapshotMeta() {
        return snapshotMeta;
    }

    long snapshotOffset() {
        return snapshotOffset;
    }

    boolean isPaused(long tick) {
        return tick < pausedUntilTick;
    }

    /**
     * Whether a request sent less than {@code window} ticks ago is still
     * unanswered. Such a follower gets no heartbeat until the window passes.
     */
    boolean awaitingResponse(long tick, long window) {
        return inflight && tick - lastSentTick < window;
    }

    void markSent(long tick) {
        if (!inflight) {
            sentTick = tick;
        }
        lastSentTick = tick;
        inflight = true;
    }

    void heardFrom(long tick) {
        lastContactTick = tick;
        if (inflight) {
            leaseTick = Math.max(leaseTick, sentTick);
        }
        backoffTicks = 0;
        pausedUntilTick = 0;
    }

    /**
     * Records a successful append. Returns whether the match index moved.
     */
    boolean acknowledge(long index) {
        inflight = false;
        if (mode == Mode.SNAPSHOT) {
            return false;
        }
        mode = Mode.REPLICATE;
        if (index <= matchIndex) {
            nextIndex = Math.max(nextIndex, matchIndex + 1);
            return false;
        }
        matchIndex = index;
        nextIndex = index + 1;
        return true;
    }

    /**
     * Moves {@code nextIndex} back after a rejected append, never to or below
     * the known match.
     */
    void rewind(long next) {
        inflight = false;
        if (mode == Mode.SNAPSHOT) {
            return;
        }
        mode = Mode.PROBE;
        nextIndex = Math.max(matchIndex + 1, Math.min(next, nextIndex));
    }

    void startSnapshot(SnapshotMeta meta) {
        mode = Mode.SNAPSHOT;
        inflight = false;
        snapshotMeta = meta;
        snapshotOffset = 0;
    }

    void snapshotChunkAcknowledged(long nextOffset) {
        inflight = false;
        snapshotOffset = nextOffset;
    }

    void snapshotInstalled(long index) {
        inflight = false;
        mode = Mode.PROBE;
        snapshotMeta = null;
        snapshotOffset = 0;
        matchIndex = Math.max(matchIndex, index);
        nextIndex = matchIndex + 1;
    }

    /**
     * Pauses the follower after a failed delivery, doubling the pause up to
     * {@code maxBackoff}.
     */
    void backOff(long tick, int initialBackoff, int maxBackoff) {
        inflight = false;
        backoffTicks = backoffTicks == 0 ? initialBackoff : Math.min(backoffTicks * 2, maxBackoff);
        pausedUntilTick = tick + backoffTicks;
    }

    int backoffTicks() {
        return backoffTicks;
    }

    @Override
    public String toString() {
        return "Progress[match=" + matchIndex + ", next=" + nextIndex + ", mode=" + mode
            + ", inflight=" + inflight + "]";
    }
}
