package io.ballot.raft;

import java.util.ArrayList;
import java.util.List;

/**
 * Entries appended by the core that storage has not confirmed yet. Every
 * index at or above {@link #offset()} is owned by this buffer: storage may
 * still hold stale entries there until the pending writes land.
 */
final class Unstable {
    private final List<LogEntry> entries = new ArrayList<>();
    private long offset;
    private SnapshotMeta snapshot;

    Unstable(long offset) {
        this.offset = offset;
    }

    /**
     * Appends an entry, truncating any conflicting suffix first. Returns
     * whether the log changed.
     */
    boolean append(LogEntry entry) {
        long idx = entry.index();

        if (idx < offset) {
            entries.clear();
            entries.add(entry);
            offset = idx;
            return true;
        }

        int arrayIdx = (int) (idx - offset);
        if (arrayIdx < entries.size()) {
            if (entries.get(arrayIdx).term() == entry.term()) {
                return false;
            }
            entries.subList(arrayIdx, entries.size()).clear();
            entries.add(entry);
            return true;
        }
        if (arrayIdx > entries.size()) {
            throw new IllegalStateException(
                "Gap in log: appending index " + idx + " after " + lastIndex());
        }
        entries.add(entry);
        return true;
    }

    void acceptSnapshot(SnapshotMeta meta) {
        this.snapshot = meta;
        this.entries.clear();
        this.offset = meta.index() + 1;
    }

    void stableTo(long index, long term) {
        if (entries.isEmpty() || index < offset) {
            return;
        }

        int arrayIdx = (int) (index - offset);
        if (arrayIdx >= entries.size()) {
            return;
        }

        if (entries.get(arrayIdx).term() == term) {
            entries.subList(0, arrayIdx + 1).clear();
            offset = index + 1;
        }
    }

    void snapshotStabilized(long index) {
        if (snapshot != null && snapshot.index() <= index) {
            snapshot = null;
        }
    }

    LogEntry get(long index) {
        if (index < offset || index >= offset + entries.size()) {
            return null;
        }
        return entries.get((int) (index - offset));
    }

    Long term(long index) {
        if (snapshot != null && index == snapshot.index()) {
            return snapshot.term();
        }
        LogEntry entry = get(index);
        return entry != null ? entry.term() : null;
    }

    List<LogEntry> slice(long from, long to) {
        if (from >= offset + entries.size() || to <= offset || from >= to) {
            return List.of();
        }

        int start = Math.max(0, (int) (from - offset));
        int end = Math.min(entries.size(), (int) (to - offset));
        return List.copyOf(entries.subList(start, end));
    }

    List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    SnapshotMeta snapshot() {
        return snapshot;
    }

    /**
     * The last index of the whole log: entries here, or the last stable index
     * when nothing is pending.
     */
    long lastIndex() {
        return offset + entries.size() - 1;
    }

    boolean hasEntries() {
        return !entries.isEmpty();
    }

    long offset() {
        return offset;
    }
}
