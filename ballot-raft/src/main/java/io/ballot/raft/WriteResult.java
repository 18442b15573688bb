package io.ballot.raft;

/**
 * Outcome of a committed write: where it landed in the log and what the
 * state machine returned for it.
 */
public record WriteResult<R>(LogId logId, R result) {}
