package io.ballot.raft;

import java.util.Optional;

public sealed class RaftException extends RuntimeException
    permits RaftException.NotLeader,
            RaftException.Stopped,
            RaftException.LeadershipLost,
            RaftException.CommitTimeout,
            RaftException.TooManyRequests,
            RaftException.MembershipChangeInProgress,
            RaftException.InvalidMembershipChange,
            RaftException.StorageFailure,
            RaftException.LogCompacted {

    protected RaftException(String message) {
        super(message);
    }

    protected RaftException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class NotLeader extends RaftException {
        private final String leaderId;

        public NotLeader(String leaderId) {
            super(leaderId != null
                ? "Not leader; current leader is " + leaderId
                : "Not leader; leader unknown");
            this.leaderId = leaderId;
        }

        public Optional<String> leaderId() {
            return Optional.ofNullable(leaderId);
        }
    }

    public static final class Stopped extends RaftException {
        public Stopped() {
            super("Raft node has been stopped");
        }
    }

    /**
     * The node lost leadership before the request completed. The request may
     * still take effect under the new leader.
     */
    public static final class LeadershipLost extends RaftException {
        private final String leaderId;

        public LeadershipLost(String leaderId) {
            super(leaderId != null
                ? "Leadership lost; new leader is " + leaderId
                : "Leadership lost; leader unknown");
            this.leaderId = leaderId;
        }

        public Optional<String> leaderId() {
            return Optional.ofNullable(leaderId);
        }
    }

    public static final class CommitTimeout extends RaftException {
        private final long index;

        public CommitTimeout(long index) {
            super(index > 0
                ? "Entry " + index + " was not committed in time"
                : "Request was not committed in time");
            this.index = index;
        }

        public long index() {
            return index;
        }
    }

    public static final class TooManyRequests extends RaftException {
        private final int limit;

        public TooManyRequests(int limit) {
            super("Too many pending requests (limit " + limit + ")");
            this.limit = limit;
        }

        public int limit() {
            return limit;
        }
    }

    public static final class MembershipChangeInProgress extends RaftException {
        public MembershipChangeInProgress(Membership current) {
            super("A membership change is already in progress: " + current);
        }
    }

    public static final class InvalidMembershipChange extends RaftException {
        public InvalidMembershipChange(ConfigChange change, String reason) {
            super("Invalid membership change " + change + ": " + reason);
        }
    }

    public static final class StorageFailure extends RaftException {
        public StorageFailure(Throwable cause) {
            super("Storage failure; node stopped: " + cause.getMessage(), cause);
        }
    }

    public static final class LogCompacted extends RaftException {
        private final long requestedIndex;
        private final long firstAvailableIndex;

        public LogCompacted(long requestedIndex, long firstAvailableIndex) {
            super("Log entry at index " + requestedIndex +
                  " has been compacted (first available: " + firstAvailableIndex + ")");
            this.requestedIndex = requestedIndex;
            this.firstAvailableIndex = firstAvailableIndex;
        }

        public long requestedIndex() {
            return requestedIndex;
        }

        public long firstAvailableIndex() {
            return firstAvailableIndex;
        }
    }
}
