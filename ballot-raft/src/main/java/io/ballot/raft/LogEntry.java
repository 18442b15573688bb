package io.ballot.raft;

public sealed interface LogEntry {
    long index();
    long term();

    default LogId id() {
        return new LogId(term(), index());
    }

    default int sizeInBytes() {
        return 16;
    }

    record Data(long index, long term, byte[] command) implements LogEntry {
        public Data {
            if (index < 1) {
                throw new IllegalArgumentException("index must be positive");
            }
            if (term < 0) {
                throw new IllegalArgumentException("term must be non-negative");
            }
            if (command == null) {
                throw new IllegalArgumentException("command must not be null");
            }
        }

        @Override
        public int sizeInBytes() {
            return 16 + command.length;
        }
    }

    record Blank(long index, long term) implements LogEntry {
        public Blank {
            if (index < 1) {
                throw new IllegalArgumentException("index must be positive");
            }
            if (term < 0) {
                throw new IllegalArgumentException("term must be non-negative");
            }
        }
    }

    record Config(long index, long term, Membership membership) implements LogEntry {
        public Config {
            if (index < 1) {
                throw new IllegalArgumentException("index must be positive");
            }
            if (term < 0) {
                throw new IllegalArgumentException("term must be non-negative");
            }
            if (membership == null) {
                throw new IllegalArgumentException("membership must not be null");
            }
        }
    }
}
