package io.ballot.raft;

import java.io.ByteArrayOutputStream;

/**
 * Reassembles a chunked snapshot on a follower. Nothing is installed until
 * the final chunk arrives with every preceding byte in place.
 */
final class SnapshotReceiver {

    record Outcome(long nextOffset, Snapshot completed) {
        boolean isDone() {
            return completed != null;
        }
    }

    private SnapshotMeta meta;
    private ByteArrayOutputStream buffer;

    Outcome receive(RaftMessage.InstallSnapshot chunk) {
        if (!chunk.meta().equals(meta)) {
            meta = null;
            buffer = null;
            if (chunk.offset() != 0) {
                return new Outcome(0, null);
            }
            meta = chunk.meta();
            buffer = new ByteArrayOutputStream();
        }

        long received = buffer.size();
        if (chunk.offset() > received) {
            return new Outcome(received, null);
        }

        long end = chunk.offset() + chunk.data().length;
        if (end > received) {
            int skip = (int) (received - chunk.offset());
            buffer.write(chunk.data(), skip, chunk.data().length - skip);
        }

        if (chunk.done() && end == buffer.size()) {
            var snapshot = new Snapshot(meta, buffer.toByteArray());
            reset();
            return new Outcome(snapshot.data().length, snapshot);
        }
        return new Outcome(buffer.size(), null);
    }

    boolean inProgress() {
        return meta != null;
    }

    void reset() {
        meta = null;
        buffer = null;
    }
}
