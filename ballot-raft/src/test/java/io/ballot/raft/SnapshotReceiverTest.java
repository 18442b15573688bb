package io.ballot.raft;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotReceiverTest {

    private static final SnapshotMeta META = new SnapshotMeta(LogId.of(2, 100), Membership.ofVoters("a", "b", "c"));

    private static RaftMessage.InstallSnapshot chunk(SnapshotMeta meta, long offset, String data, boolean done) {
        return new RaftMessage.InstallSnapshot(3, "a", meta, offset, data.getBytes(StandardCharsets.UTF_8), done);
    }

    @Test
    void assemblesChunksInOrder() {
        var receiver = new SnapshotReceiver();

        var first = receiver.receive(chunk(META, 0, "hello ", false));
        var last = receiver.receive(chunk(META, 6, "world", true));

        assertThat(first.isDone()).isFalse();
        assertThat(first.nextOffset()).isEqualTo(6);
        assertThat(last.isDone()).isTrue();
        assertThat(new String(last.completed().data(), StandardCharsets.UTF_8)).isEqualTo("hello world");
        assertThat(last.completed().meta()).isEqualTo(META);
        assertThat(receiver.inProgress()).isFalse();
    }

    @Test
    void retransmittedChunkIsIdempotent() {
        var receiver = new SnapshotReceiver();
        receiver.receive(chunk(META, 0, "abc", false));

        var again = receiver.receive(chunk(META, 0, "abc", false));
        var done = receiver.receive(chunk(META, 3, "def", true));

        assertThat(again.nextOffset()).isEqualTo(3);
        assertThat(new String(done.completed().data(), StandardCharsets.UTF_8)).isEqualTo("abcdef");
    }

    @Test
    void overlappingChunkAppendsOnlyTheTail() {
        var receiver = new SnapshotReceiver();
        receiver.receive(chunk(META, 0, "abcd", false));

        var outcome = receiver.receive(chunk(META, 2, "cdef", true));

        assertThat(new String(outcome.completed().data(), StandardCharsets.UTF_8)).isEqualTo("abcdef");
    }

    @Test
    void chunkBeyondReceivedLengthAsksForRewind() {
        var receiver = new SnapshotReceiver();
        receiver.receive(chunk(META, 0, "abc", false));

        var outcome = receiver.receive(chunk(META, 9, "xyz", true));

        assertThat(outcome.isDone()).isFalse();
        assertThat(outcome.nextOffset()).isEqualTo(3);
    }

    @Test
    void newSnapshotRestartsTheBuffer() {
        var receiver = new SnapshotReceiver();
        receiver.receive(chunk(META, 0, "old", false));
        var newer = new SnapshotMeta(LogId.of(3, 200), META.membership());

        var outcome = receiver.receive(chunk(newer, 0, "new", true));

        assertThat(outcome.completed().meta()).isEqualTo(newer);
        assertThat(new String(outcome.completed().data(), StandardCharsets.UTF_8)).isEqualTo("new");
    }

    @Test
    void midStreamChunkOfUnknownSnapshotRestartsFromZero() {
        var receiver = new SnapshotReceiver();

        var outcome = receiver.receive(chunk(META, 4, "late", false));

        assertThat(outcome.nextOffset()).isZero();
        assertThat(receiver.inProgress()).isFalse();
    }

    @Test
    void emptySnapshotCompletesInOneChunk() {
        var receiver = new SnapshotReceiver();

        var outcome = receiver.receive(chunk(META, 0, "", true));

        assertThat(outcome.isDone()).isTrue();
        assertThat(outcome.completed().data()).isEmpty();
    }
}
