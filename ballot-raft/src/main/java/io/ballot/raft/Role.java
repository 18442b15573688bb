package io.ballot.raft;

public enum Role {
    FOLLOWER,
    LEARNER,
    PRE_CANDIDATE,
    CANDIDATE,
    LEADER
}
