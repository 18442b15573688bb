package io.ballot.raft;

import java.util.List;
import java.util.Objects;

public sealed interface RaftMessage {
    long term();

    sealed interface Request extends RaftMessage {}
    sealed interface Response extends RaftMessage {}

    record RequestVote(
        long term,
        String candidateId,
        LogId lastLogId,
        boolean preVote
    ) implements Request {
        public RequestVote {
            Objects.requireNonNull(candidateId, "candidateId must not be null");
            Objects.requireNonNull(lastLogId, "lastLogId must not be null");
        }
    }

    /** A granted pre-vote carries the term it was asked for, not the voter's. */
    record RequestVoteResponse(
        long term,
        boolean voteGranted,
        boolean preVote
    ) implements Response {}

    record AppendEntries(
        long term,
        String leaderId,
        LogId prevLogId,
        List<LogEntry> entries,
        long leaderCommit
    ) implements Request {
        public AppendEntries {
            Objects.requireNonNull(leaderId, "leaderId must not be null");
            Objects.requireNonNull(prevLogId, "prevLogId must not be null");
            entries = List.copyOf(entries);
        }

        public boolean isHeartbeat() {
            return entries.isEmpty();
        }
    }

    /**
     * Where a follower's log diverges from the leader's. A {@code term} of 0
     * means the follower's log ends before {@code index}.
     */
    record ConflictHint(long term, long index) {}

    record AppendEntriesResponse(
        long term,
        boolean success,
        long matchIndex,
        ConflictHint conflict
    ) implements Response {
        public static AppendEntriesResponse accepted(long term, long matchIndex) {
            return new AppendEntriesResponse(term, true, matchIndex, null);
        }

        public static AppendEntriesResponse rejected(long term, ConflictHint conflict) {
            return new AppendEntriesResponse(term, false, 0, conflict);
        }
    }

    record InstallSnapshot(
        long term,
        String leaderId,
        SnapshotMeta meta,
        long offset,
        byte[] data,
        boolean done
    ) implements Request {
        public InstallSnapshot {
            Objects.requireNonNull(leaderId, "leaderId must not be null");
            Objects.requireNonNull(meta, "meta must not be null");
            Objects.requireNonNull(data, "data must not be null");
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be non-negative");
            }
        }
    }

    /**
     * Acknowledges a snapshot chunk: {@code nextOffset} is the first byte the
     * follower still needs, and {@code done} reports a completed install.
     */
    record InstallSnapshotResponse(
        long term,
        long snapshotIndex,
        long nextOffset,
        boolean done
    ) implements Response {}
}
