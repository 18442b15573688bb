package io.ballot.raft;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Volatile {@link RaftStorage} for tests, benchmarks and embedded use.
 */
public final class InMemoryStorage implements RaftStorage {
    private final Object lock = new Object();
    private final InMemoryLog log = new InMemoryLog();
    private HardState hardState = HardState.INITIAL;
    private Snapshot snapshot;
    private Membership membership;

    public InMemoryStorage() {
        this(null);
    }

    public InMemoryStorage(Membership initialMembership) {
        this.membership = initialMembership;
    }

    @Override
    public InitialState initialState() {
        synchronized (lock) {
            return new InitialState(hardState, latestMembership());
        }
    }

    @Override
    public RaftLog log() {
        return log;
    }

    @Override
    public void saveHardState(HardState hardState) {
        synchronized (lock) {
            this.hardState = hardState;
        }
    }

    public HardState hardState() {
        synchronized (lock) {
            return hardState;
        }
    }

    @Override
    public Optional<Snapshot> snapshot() {
        synchronized (lock) {
            return Optional.ofNullable(snapshot);
        }
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        synchronized (lock) {
            if (this.snapshot != null && this.snapshot.index() >= snapshot.index()) {
                return;
            }
            this.snapshot = snapshot;
            this.membership = snapshot.membership();
            log.purgeThrough(snapshot.index());
        }
    }

    @Override
    public void installSnapshot(Snapshot snapshot) {
        synchronized (lock) {
            this.snapshot = snapshot;
            this.membership = snapshot.membership();
            log.reset(snapshot.index() + 1);
        }
    }

    @Override
    public void sync() {
    }

    @Override
    public void close() {
    }

    private Membership latestMembership() {
        var latest = membership;
        for (LogEntry entry : log.entries) {
            if (entry instanceof LogEntry.Config config) {
                latest = config.membership();
            }
        }
        return latest;
    }

    private final class InMemoryLog implements RaftLog {
        private final List<LogEntry> entries = new ArrayList<>();
        private long offset = 1;
        private long bytes;

        @Override
        public void append(List<LogEntry> newEntries) {
            synchronized (lock) {
                for (LogEntry entry : newEntries) {
                    long expected = offset + entries.size();
                    if (entry.index() != expected) {
                        throw new StorageException(
                            "Non-contiguous append: expected index " + expected + ", got " + entry.index());
                    }
                    entries.add(entry);
                    bytes += entry.sizeInBytes();
                }
            }
        }

        @Override
        public Optional<LogEntry> get(long index) {
            synchronized (lock) {
                if (index < offset || index >= offset + entries.size()) {
                    return Optional.empty();
                }
                return Optional.of(entries.get((int) (index - offset)));
            }
        }

        @Override
        public List<LogEntry> getRange(long fromIndex, long toIndex) {
            synchronized (lock) {
                if (fromIndex < offset) {
                    throw new RaftException.LogCompacted(fromIndex, offset);
                }
                long end = Math.min(toIndex, offset + entries.size());
                if (fromIndex >= end) {
                    return List.of();
                }
                return List.copyOf(entries.subList((int) (fromIndex - offset), (int) (end - offset)));
            }
        }

        @Override
        public long firstIndex() {
            synchronized (lock) {
                return offset;
            }
        }

        @Override
        public long lastIndex() {
            synchronized (lock) {
                return offset + entries.size() - 1;
            }
        }

        @Override
        public LogId lastLogId() {
            synchronized (lock) {
                if (!entries.isEmpty()) {
                    return entries.get(entries.size() - 1).id();
                }
                return snapshot != null ? snapshot.meta().lastIncluded() : LogId.ZERO;
            }
        }

        @Override
        public void truncateAfter(long index) {
            synchronized (lock) {
                if (index < offset - 1) {
                    throw new StorageException(
                        "Cannot truncate after " + index + ": entries before " + offset + " are purged");
                }
                int keep = (int) (index - offset + 1);
                if (keep < entries.size()) {
                    var removed = entries.subList(keep, entries.size());
                    for (LogEntry entry : removed) {
                        bytes -= entry.sizeInBytes();
                    }
                    removed.clear();
                }
            }
        }

        @Override
        public void deleteBefore(long index) {
            synchronized (lock) {
                purgeThrough(index - 1);
            }
        }

        @Override
        public long sizeInBytes() {
            synchronized (lock) {
                return bytes;
            }
        }

        private void purgeThrough(long index) {
            if (index < offset) {
                return;
            }
            long last = offset + entries.size() - 1;
            if (index >= last) {
                reset(index + 1);
                return;
            }
            var purged = entries.subList(0, (int) (index - offset + 1));
            for (LogEntry entry : purged) {
                bytes -= entry.sizeInBytes();
            }
            purged.clear();
            offset = index + 1;
        }

        private void reset(long newOffset) {
            entries.clear();
            bytes = 0;
            offset = newOffset;
        }
    }
}
