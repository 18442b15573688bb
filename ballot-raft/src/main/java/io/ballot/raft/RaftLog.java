package io.ballot.raft;

import java.util.List;
import java.util.Optional;

/**
 * The replicated log as stored by a {@link RaftStorage}. Indexes start at 1;
 * entries before {@link #firstIndex()} have been purged into a snapshot.
 * Implementations must be safe for concurrent use.
 */
public interface RaftLog {

    /**
     * Appends entries that directly follow {@link #lastIndex()}.
     */
    void append(List<LogEntry> entries);

    Optional<LogEntry> get(long index);

    /**
     * Entries in {@code [fromIndex, toIndex)}, clipped to the last index.
     *
     * @throws RaftException.LogCompacted if {@code fromIndex} was purged
     */
    List<LogEntry> getRange(long fromIndex, long toIndex);

    long firstIndex();

    long lastIndex();

    LogId lastLogId();

    /**
     * Removes every entry after {@code index}.
     */
    void truncateAfter(long index);

    /**
     * Purges every entry before {@code index}.
     */
    void deleteBefore(long index);

    long sizeInBytes();
}
