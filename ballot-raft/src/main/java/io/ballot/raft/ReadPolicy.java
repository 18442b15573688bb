package io.ballot.raft;

public enum ReadPolicy {
    /** Each read batch waits for a blank entry of the leader's term to commit. */
    COMMIT_CONFIRMED,
    /** Reads are served at the commit index while a quorum lease is held. */
    LEADER_LEASE
}
