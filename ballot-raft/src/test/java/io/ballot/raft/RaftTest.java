package io.ballot.raft;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RaftTest {

    private static final RaftConfig CONFIG = RaftConfig.defaults();
    private static final int DETERMINISTIC_JITTER = 0;
    private static final List<String> PEERS = List.of("b", "c");

    /**
     * One core plus its storage. Each step's {@link Ready} is persisted and
     * acknowledged at once, the way the runtime pipeline does it.
     */
    private static final class Member {
        final Raft raft;
        final InMemoryStorage storage;
        final List<Ready.Outbound> sent = new ArrayList<>();
        final List<Ready.ReadState> reads = new ArrayList<>();
        final Map<Long, RaftException> rejected = new HashMap<>();
        final Map<Long, LogId> accepted = new HashMap<>();

        Member(Raft raft, InMemoryStorage storage) {
            this.raft = raft;
            this.storage = storage;
        }

        Ready step(RaftEvent event) {
            var ready = raft.step(event);
            var persist = ready.persist();
            if (persist.incomingSnapshot() != null) {
                storage.installSnapshot(persist.incomingSnapshot());
            }
            if (!persist.entries().isEmpty()) {
                long first = persist.entries().get(0).index();
                if (first <= storage.log().lastIndex()) {
                    storage.log().truncateAfter(first - 1);
                }
                storage.log().append(persist.entries());
            }
            if (persist.hardState() != null) {
                storage.saveHardState(persist.hardState());
            }
            sent.addAll(ready.messages());
            reads.addAll(ready.apply().readStates());
            ready.rejected().forEach(r -> rejected.put(r.requestId(), r.reason()));
            ready.accepted().forEach(a -> accepted.put(a.requestId(), a.logId()));

            if (persist.lastLogId() != null) {
                step(new RaftEvent.Persisted(persist.lastLogId()));
            }
            if (!ready.apply().entries().isEmpty()) {
                var entries = ready.apply().entries();
                step(new RaftEvent.Applied(entries.get(entries.size() - 1).index()));
            }
            return ready;
        }

        Ready receive(String from, RaftMessage message) {
            return step(new RaftEvent.Receive(from, message));
        }

        Ready tick(int times) {
            Ready ready = Ready.EMPTY;
            for (int i = 0; i < times; i++) {
                ready = step(new RaftEvent.Tick());
            }
            return ready;
        }

        <T extends RaftMessage> List<T> sentOf(Class<T> type) {
            return sent.stream()
                .map(Ready.Outbound::message)
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
        }

        <T extends RaftMessage> List<T> sentTo(String peer, Class<T> type) {
            return sent.stream()
                .filter(o -> o.to().equals(peer))
                .map(Ready.Outbound::message)
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
        }
    }

    private Member member(String id, Membership membership, RaftConfig config) {
        var storage = new InMemoryStorage(membership);
        return new Member(new Raft(id, membership, config, storage, bound -> DETERMINISTIC_JITTER), storage);
    }

    private Member member(String id, String... voters) {
        return member(id, Membership.ofVoters(voters), CONFIG);
    }

    private Member memberWithLog(String id, List<LogEntry> entries, HardState hardState, String... voters) {
        var membership = Membership.ofVoters(voters);
        var storage = new InMemoryStorage(membership);
        storage.log().append(entries);
        storage.saveHardState(hardState);
        return new Member(new Raft(id, membership, CONFIG, storage, bound -> DETERMINISTIC_JITTER), storage);
    }

    private static LogEntry data(long index, long term) {
        return new LogEntry.Data(index, term, new byte[]{(byte) index});
    }

    private static List<LogEntry> entries(long term, long from, long to) {
        var result = new ArrayList<LogEntry>();
        for (long i = from; i <= to; i++) {
            result.add(data(i, term));
        }
        return result;
    }

    private Ready tickUntilTimeout(Member m) {
        return m.tick(CONFIG.electionTimeoutMin());
    }

    private void grantPreVotes(Member m, List<String> peers) {
        for (String peer : peers) {
            m.receive(peer, new RaftMessage.RequestVoteResponse(m.raft.term() + 1, true, true));
            if (m.raft.role() == Role.CANDIDATE || m.raft.isLeader()) {
                break;
            }
        }
    }

    private Ready grantVotes(Member m, List<String> peers) {
        Ready ready = Ready.EMPTY;
        for (String peer : peers) {
            ready = m.receive(peer, new RaftMessage.RequestVoteResponse(m.raft.term(), true, false));
            if (m.raft.isLeader()) {
                break;
            }
        }
        return ready;
    }

    private Ready becomeLeader(Member m, List<String> peers) {
        tickUntilTimeout(m);
        grantPreVotes(m, peers);
        return grantVotes(m, peers);
    }

    /** Elects {@code a} in a three-node cluster and commits its blank entry. */
    private Member establishedLeader() {
        var leader = member("a", "a", "b", "c");
        becomeLeader(leader, PEERS);
        leader.receive("b", RaftMessage.AppendEntriesResponse.accepted(1, 1));
        leader.sent.clear();
        return leader;
    }

    private RaftMessage.AppendEntries append(long term, String leader, LogId prev, List<LogEntry> entries, long commit) {
        return new RaftMessage.AppendEntries(term, leader, prev, entries, commit);
    }

    private Optional<RaftMessage.AppendEntriesResponse> lastAppendResponse(Member m) {
        var responses = m.sentOf(RaftMessage.AppendEntriesResponse.class);
        return responses.isEmpty() ? Optional.empty() : Optional.of(responses.get(responses.size() - 1));
    }

    @Nested
    class Election {
        @Test
        void followerStartsPreVoteAfterTimeout() {
            var m = member("a", "a", "b", "c");

            var ready = tickUntilTimeout(m);

            assertEquals(Role.PRE_CANDIDATE, m.raft.role());
            assertEquals(0, m.raft.term());
            var requests = m.sentOf(RaftMessage.RequestVote.class);
            assertEquals(2, requests.size());
            assertTrue(requests.stream().allMatch(r -> r.preVote() && r.term() == 1));
            assertNull(ready.persist().hardState());
        }

        @Test
        void noTimeoutBeforeElectionTimeoutMin() {
            var m = member("a", "a", "b", "c");

            m.tick(CONFIG.electionTimeoutMin() - 1);

            assertEquals(Role.FOLLOWER, m.raft.role());
            assertTrue(m.sent.isEmpty());
        }

        @Test
        void preVoteQuorumStartsRealElection() {
            var m = member("a", "a", "b", "c");
            tickUntilTimeout(m);

            var ready = m.receive("b", new RaftMessage.RequestVoteResponse(1, true, true));

            assertEquals(Role.CANDIDATE, m.raft.role());
            assertEquals(1, m.raft.term());
            assertEquals("a", ready.persist().hardState().votedFor());
            var votes = m.sentOf(RaftMessage.RequestVote.class).stream().filter(r -> !r.preVote()).toList();
            assertEquals(2, votes.size());
            assertTrue(votes.stream().allMatch(r -> r.term() == 1));
        }

        @Test
        void deniedPreVoteLeavesTermUntouched() {
            var m = member("a", "a", "b", "c");
            tickUntilTimeout(m);

            m.receive("b", new RaftMessage.RequestVoteResponse(0, false, true));
            m.receive("c", new RaftMessage.RequestVoteResponse(0, false, true));
            tickUntilTimeout(m);

            assertEquals(Role.PRE_CANDIDATE, m.raft.role());
            assertEquals(0, m.raft.term());
        }

        @Test
        void preVoteGrantForEarlierTermIsIgnored() {
            var m = member("a", "a", "b", "c");
            m.receive("b", append(3, "b", LogId.ZERO, List.of(), 0));
            tickUntilTimeout(m);
            assertEquals(Role.PRE_CANDIDATE, m.raft.role());

            m.receive("c", new RaftMessage.RequestVoteResponse(1, true, true));

            assertEquals(Role.PRE_CANDIDATE, m.raft.role());
            assertEquals(3, m.raft.term());

            m.receive("c", new RaftMessage.RequestVoteResponse(4, true, true));

            assertEquals(Role.CANDIDATE, m.raft.role());
            assertEquals(4, m.raft.term());
        }

        @Test
        void candidateWinsWithMajorityAndAppendsBlankEntry() {
            var m = member("a", "a", "b", "c");

            var ready = becomeLeader(m, PEERS);

            assertTrue(m.raft.isLeader());
            assertEquals(1, m.raft.term());
            assertEquals(List.of(new LogEntry.Blank(1, 1)), ready.persist().entries());
            assertTrue(m.raft.vote().orElseThrow().committed());
        }

        @Test
        void singleNodeElectsItselfWithoutMessages() {
            var m = member("a", "a");

            tickUntilTimeout(m);

            assertTrue(m.raft.isLeader());
            assertEquals(1, m.raft.term());
            assertEquals(1, m.raft.commitIndex());
            assertTrue(m.sent.isEmpty());
        }

        @Test
        void candidateStepsDownOnAppendFromLeaderOfSameTerm() {
            var m = member("a", "a", "b", "c");
            tickUntilTimeout(m);
            m.receive("b", new RaftMessage.RequestVoteResponse(1, true, true));

            m.receive("b", append(1, "b", LogId.ZERO, List.of(), 0));

            assertEquals(Role.FOLLOWER, m.raft.role());
            assertEquals(Optional.of("b"), m.raft.leaderId());
        }

        @Test
        void leaderStepsDownOnHigherTerm() {
            var m = member("a", "a", "b", "c");
            becomeLeader(m, PEERS);

            m.receive("c", append(5, "c", LogId.ZERO, List.of(), 0));

            assertEquals(Role.FOLLOWER, m.raft.role());
            assertEquals(5, m.raft.term());
            assertEquals(Optional.of("c"), m.raft.leaderId());
        }

        @Test
        void leaderWithoutQuorumContactStepsDown() {
            var m = member("a", "a", "b", "c");
            becomeLeader(m, PEERS);

            m.tick(CONFIG.electionTimeoutMin());

            assertEquals(Role.FOLLOWER, m.raft.role());
            assertEquals(1, m.raft.term());
        }

        @Test
        void learnerNeverCampaigns() {
            var membership = new Membership(Set.of("a", "b", "c"), Set.of("l"));
            var m = member("l", membership, CONFIG);

            m.tick(CONFIG.electionTimeoutMax() * 5);

            assertEquals(Role.LEARNER, m.raft.role());
            assertTrue(m.sent.isEmpty());
        }
    }

    @Nested
    class Voting {
        @Test
        void grantsVoteToUpToDateCandidateAndPersistsIt() {
            var m = member("b", "a", "b", "c");

            var ready = m.receive("a", new RaftMessage.RequestVote(1, "a", LogId.ZERO, false));

            var response = m.sentOf(RaftMessage.RequestVoteResponse.class).get(0);
            assertTrue(response.voteGranted());
            assertEquals(1, response.term());
            assertEquals("a", ready.persist().hardState().votedFor());
            assertEquals(1, ready.persist().hardState().term());
        }

        @Test
        void rejectsCandidateWithStaleLog() {
            var m = memberWithLog("b", entries(1, 1, 2), new HardState(1, null, 0), "a", "b", "c");

            m.receive("a", new RaftMessage.RequestVote(2, "a", LogId.of(1, 1), false));

            assertFalse(m.sentOf(RaftMessage.RequestVoteResponse.class).get(0).voteGranted());
            assertEquals(2, m.raft.term());
            assertTrue(m.raft.vote().isEmpty());
        }

        @Test
        void higherLastTermWinsOverLongerLog() {
            var m = memberWithLog("b", entries(1, 1, 5), new HardState(1, null, 0), "a", "b", "c");

            m.receive("a", new RaftMessage.RequestVote(3, "a", LogId.of(2, 2), false));

            assertTrue(m.sentOf(RaftMessage.RequestVoteResponse.class).get(0).voteGranted());
        }

        @Test
        void votesOncePerTerm() {
            var m = member("b", "a", "b", "c");

            m.receive("a", new RaftMessage.RequestVote(1, "a", LogId.ZERO, false));
            m.receive("c", new RaftMessage.RequestVote(1, "c", LogId.ZERO, false));
            m.receive("a", new RaftMessage.RequestVote(1, "a", LogId.ZERO, false));

            var responses = m.sentOf(RaftMessage.RequestVoteResponse.class);
            assertTrue(responses.get(0).voteGranted());
            assertFalse(responses.get(1).voteGranted());
            assertTrue(responses.get(2).voteGranted());
        }

        @Test
        void rejectsStaleTermCandidate() {
            var m = memberWithLog("b", List.of(), new HardState(4, null, 0), "a", "b", "c");

            m.receive("a", new RaftMessage.RequestVote(3, "a", LogId.ZERO, false));

            var response = m.sentOf(RaftMessage.RequestVoteResponse.class).get(0);
            assertFalse(response.voteGranted());
            assertEquals(4, response.term());
        }

        @Test
        void rejectsVoteWhileLeaderIsLiveWithoutAdoptingTerm() {
            var m = member("b", "a", "b", "c");
            m.receive("a", append(1, "a", LogId.ZERO, List.of(), 0));

            m.receive("c", new RaftMessage.RequestVote(2, "c", LogId.ZERO, false));

            var response = m.sentOf(RaftMessage.RequestVoteResponse.class).get(0);
            assertFalse(response.voteGranted());
            assertEquals(1, m.raft.term());
            assertEquals(Optional.of("a"), m.raft.leaderId());
        }

        @Test
        void grantsVoteOnceLeaderHasBeenSilentLongEnough() {
            var m = member("b", "a", "b", "c");
            m.receive("a", append(1, "a", LogId.ZERO, List.of(), 0));
            m.tick(CONFIG.electionTimeoutMin() - 1);

            m.receive("c", new RaftMessage.RequestVote(2, "c", LogId.ZERO, false));
            m.tick(1);
            m.receive("c", new RaftMessage.RequestVote(2, "c", LogId.ZERO, false));

            var responses = m.sentOf(RaftMessage.RequestVoteResponse.class);
            assertFalse(responses.get(0).voteGranted());
            assertTrue(responses.get(responses.size() - 1).voteGranted());
            assertEquals(2, m.raft.term());
        }

        @Test
        void grantsPreVoteWithoutChangingState() {
            var m = member("b", "a", "b", "c");

            var ready = m.receive("a", new RaftMessage.RequestVote(1, "a", LogId.ZERO, true));

            var response = m.sentOf(RaftMessage.RequestVoteResponse.class).get(0);
            assertTrue(response.voteGranted());
            assertTrue(response.preVote());
            assertEquals(1, response.term());
            assertEquals(0, m.raft.term());
            assertTrue(m.raft.vote().isEmpty());
            assertNull(ready.persist().hardState());
        }

        @Test
        void rejectsPreVoteWhileLeaderIsLive() {
            var m = member("b", "a", "b", "c");
            m.receive("a", append(1, "a", LogId.ZERO, List.of(), 0));

            m.receive("c", new RaftMessage.RequestVote(2, "c", LogId.ZERO, true));

            assertFalse(m.sentOf(RaftMessage.RequestVoteResponse.class).get(0).voteGranted());
            assertEquals(1, m.raft.term());
        }

        @Test
        void leaderRejectsVotesAndPreVotes() {
            var m = member("a", "a", "b", "c");
            becomeLeader(m, PEERS);
            m.sent.clear();

            m.receive("c", new RaftMessage.RequestVote(2, "c", LogId.of(1, 1), true));
            m.receive("c", new RaftMessage.RequestVote(2, "c", LogId.of(1, 1), false));

            assertTrue(m.sentOf(RaftMessage.RequestVoteResponse.class).stream().noneMatch(r -> r.voteGranted()));
            assertTrue(m.raft.isLeader());
            assertEquals(1, m.raft.term());
        }
    }

    @Nested
    class FollowerAppend {
        @Test
        void appendsEntriesAndAcknowledgesMatch() {
            var m = member("b", "a", "b", "c");

            var ready = m.receive("a", append(1, "a", LogId.ZERO, entries(1, 1, 2), 0));

            assertEquals(2, ready.persist().entries().size());
            var response = lastAppendResponse(m).orElseThrow();
            assertTrue(response.success());
            assertEquals(2, response.matchIndex());
            assertEquals(LogId.of(1, 2), m.raft.lastLogId());
        }

        @Test
        void shortLogRejectsWithLengthHint() {
            var m = member("b", "a", "b", "c");

            m.receive("a", append(1, "a", LogId.of(1, 5), entries(1, 6, 6), 0));

            var response = lastAppendResponse(m).orElseThrow();
            assertFalse(response.success());
            assertEquals(new RaftMessage.ConflictHint(0, 1), response.conflict());
        }

        @Test
        void conflictHintPointsAtFirstIndexOfConflictingTerm() {
            var log = new ArrayList<LogEntry>();
            log.add(data(1, 1));
            log.addAll(entries(2, 2, 4));
            var m = memberWithLog("b", log, new HardState(2, null, 0), "a", "b", "c");

            m.receive("a", append(3, "a", LogId.of(3, 4), List.of(), 0));

            var response = lastAppendResponse(m).orElseThrow();
            assertFalse(response.success());
            assertEquals(new RaftMessage.ConflictHint(2, 2), response.conflict());
        }

        @Test
        void truncatesConflictingSuffix() {
            var m = memberWithLog("b", entries(1, 1, 3), new HardState(1, null, 0), "a", "b", "c");

            var ready = m.receive("a", append(2, "a", LogId.of(1, 1), List.of(data(2, 2)), 0));

            assertEquals(List.of(data(2, 2).id()), ready.persist().entries().stream().map(LogEntry::id).toList());
            assertEquals(LogId.of(2, 2), m.raft.lastLogId());
            assertEquals(2, m.storage.log().lastIndex());
        }

        @Test
        void duplicateAppendIsIdempotent() {
            var m = member("b", "a", "b", "c");
            var request = append(1, "a", LogId.ZERO, entries(1, 1, 3), 1);
            m.receive("a", request);

            var second = m.receive("a", request);

            assertTrue(second.persist().entries().isEmpty());
            assertEquals(3, lastAppendResponse(m).orElseThrow().matchIndex());
            assertEquals(1, m.raft.commitIndex());
            assertEquals(3, m.raft.lastIndex());
        }

        @Test
        void staleAppendDoesNotTruncateNewerEntries() {
            var m = member("b", "a", "b", "c");
            m.receive("a", append(1, "a", LogId.ZERO, entries(1, 1, 3), 0));

            m.receive("a", append(1, "a", LogId.ZERO, entries(1, 1, 1), 0));

            assertEquals(3, m.raft.lastIndex());
        }

        @Test
        void commitIsBoundedByVerifiedIndex() {
            var m = member("b", "a", "b", "c");

            m.receive("a", append(1, "a", LogId.ZERO, entries(1, 1, 1), 5));

            assertEquals(1, m.raft.commitIndex());
        }

        @Test
        void commitNeverMovesBackwards() {
            var m = member("b", "a", "b", "c");
            m.receive("a", append(1, "a", LogId.ZERO, entries(1, 1, 3), 3));

            m.receive("a", append(1, "a", LogId.of(1, 3), List.of(), 1));

            assertEquals(3, m.raft.commitIndex());
        }

        @Test
        void committedEntriesAreHandedOutForApply() {
            var m = member("b", "a", "b", "c");

            var ready = m.receive("a", append(1, "a", LogId.ZERO, entries(1, 1, 2), 2));

            assertEquals(2, ready.apply().entries().size());
            assertEquals(2, m.raft.lastApplied());
        }

        @Test
        void staleTermAppendIsRejected() {
            var m = memberWithLog("b", List.of(), new HardState(3, null, 0), "a", "b", "c");

            m.receive("a", append(2, "a", LogId.ZERO, entries(2, 1, 1), 0));

            var response = lastAppendResponse(m).orElseThrow();
            assertFalse(response.success());
            assertEquals(3, response.term());
            assertEquals(0, m.raft.lastIndex());
            assertTrue(m.raft.leaderId().isEmpty());
        }

        @Test
        void acceptingLeaderCommitsVote() {
            var m = member("b", "a", "b", "c");

            var ready = m.receive("a", append(1, "a", LogId.ZERO, List.of(), 0));

            var vote = ready.persist().hardState().vote();
            assertEquals("a", vote.votedFor());
            assertTrue(vote.committed());
        }
    }

    @Nested
    class LeaderReplication {
        @Test
        void commitsOnlyCurrentTermEntries() {
            var log = List.of(data(1, 1), data(2, 2));
            var m = memberWithLog("a", log, new HardState(2, null, 1), "a", "b", "c");
            becomeLeader(m, PEERS);
            assertEquals(3, m.raft.term());

            m.receive("b", RaftMessage.AppendEntriesResponse.accepted(3, 2));
            assertEquals(1, m.raft.commitIndex());

            m.receive("b", RaftMessage.AppendEntriesResponse.accepted(3, 3));
            assertEquals(3, m.raft.commitIndex());
        }

        @Test
        void leaderCountsOnlyPersistedEntriesForItself() {
            var m = establishedLeader();
            var storage = m.storage;
            var raw = m.raft;

            var ready = raw.step(new RaftEvent.Propose(1, new byte[]{7}));
            raw.step(new RaftEvent.Receive("b", RaftMessage.AppendEntriesResponse.accepted(1, 2)));

            assertEquals(1, raw.commitIndex());

            storage.log().append(ready.persist().entries());
            raw.step(new RaftEvent.Persisted(LogId.of(1, 2)));
            assertEquals(2, raw.commitIndex());
        }

        @Test
        void conflictHintRewindsNextIndex() {
            var m = memberWithLog("a", entries(1, 1, 5), new HardState(1, null, 0), "a", "b", "c");
            becomeLeader(m, PEERS);
            m.sent.clear();

            m.receive("b", RaftMessage.AppendEntriesResponse.rejected(2, new RaftMessage.ConflictHint(0, 3)));

            var retry = m.sentTo("b", RaftMessage.AppendEntries.class).get(0);
            assertEquals(LogId.of(1, 2), retry.prevLogId());
            assertEquals(4, retry.entries().size());
            assertEquals(Progress.Mode.PROBE, m.raft.progress("b").mode());
        }

        @Test
        void conflictTermKnownToLeaderSkipsWholeTerm() {
            var log = new ArrayList<LogEntry>(entries(1, 1, 3));
            log.addAll(entries(3, 4, 6));
            var m = memberWithLog("a", log, new HardState(3, null, 0), "a", "b", "c");
            becomeLeader(m, PEERS);
            m.sent.clear();

            m.receive("b", RaftMessage.AppendEntriesResponse.rejected(4, new RaftMessage.ConflictHint(1, 2)));

            var retry = m.sentTo("b", RaftMessage.AppendEntries.class).get(0);
            assertEquals(LogId.of(1, 3), retry.prevLogId());
        }

        @Test
        void proposalIsAcceptedAndReplicated() {
            var m = establishedLeader();

            m.step(new RaftEvent.Propose(42, new byte[]{1, 2}));

            assertEquals(LogId.of(1, 2), m.accepted.get(42L));
            var append = m.sentTo("b", RaftMessage.AppendEntries.class).get(0);
            assertEquals(LogId.of(1, 1), append.prevLogId());
            assertEquals(1, append.entries().size());
        }

        @Test
        void followerProposalIsRejectedWithLeaderHint() {
            var m = member("b", "a", "b", "c");
            m.receive("a", append(1, "a", LogId.ZERO, List.of(), 0));

            m.step(new RaftEvent.Propose(7, new byte[]{1}));

            var error = assertInstanceOf(RaftException.NotLeader.class, m.rejected.get(7L));
            assertEquals(Optional.of("a"), error.leaderId());
        }

        @Test
        void onlyOneAppendInFlightPerFollower() {
            var m = establishedLeader();
            m.receive("c", RaftMessage.AppendEntriesResponse.accepted(1, 1));
            m.sent.clear();

            m.step(new RaftEvent.Propose(1, new byte[]{1}));
            m.step(new RaftEvent.Propose(2, new byte[]{2}));

            assertEquals(1, m.sentTo("c", RaftMessage.AppendEntries.class).size());
            assertTrue(m.raft.progress("c").inflight());
        }

        @Test
        void heartbeatSkipsFollowerStillAwaitingResponse() {
            var m = establishedLeader();

            m.tick(CONFIG.heartbeatInterval());

            assertTrue(m.sentTo("c", RaftMessage.AppendEntries.class).isEmpty());
            assertFalse(m.sentTo("b", RaftMessage.AppendEntries.class).isEmpty());
        }

        @Test
        void unansweredAppendIsRetransmittedOnce() {
            var m = establishedLeader();

            m.tick(CONFIG.heartbeatInterval() * 2);

            var retransmitted = m.sentTo("c", RaftMessage.AppendEntries.class);
            assertEquals(1, retransmitted.size());
            assertEquals(0, retransmitted.get(0).prevLogId().index());
            assertEquals(List.of(new LogEntry.Blank(1, 1)), retransmitted.get(0).entries());
        }

        @Test
        void unreachableFollowerBacksOff() {
            var m = establishedLeader();
            var request = append(1, "a", LogId.of(1, 1), List.of(), 1);

            m.step(new RaftEvent.Unreachable("c", request));
            assertEquals(CONFIG.heartbeatInterval(), m.raft.progress("c").backoffTicks());
            m.step(new RaftEvent.Unreachable("c", request));
            assertEquals(CONFIG.heartbeatInterval() * 2, m.raft.progress("c").backoffTicks());

            m.sent.clear();
            m.tick(CONFIG.heartbeatInterval());
            assertTrue(m.sentTo("c", RaftMessage.AppendEntries.class).isEmpty());
            assertFalse(m.sentTo("b", RaftMessage.AppendEntries.class).isEmpty());
        }

        @Test
        void unreachableFromOldTermIsIgnored() {
            var m = establishedLeader();

            m.step(new RaftEvent.Unreachable("c", append(0, "a", LogId.ZERO, List.of(), 0)));

            assertEquals(0, m.raft.progress("c").backoffTicks());
        }

        @Test
        void staleResponseIsIgnored() {
            var m = establishedLeader();

            m.receive("c", RaftMessage.AppendEntriesResponse.accepted(0, 40));

            assertEquals(0, m.raft.progress("c").matchIndex());
        }
    }

    @Nested
    class Reads {
        @Test
        void commitConfirmedReadWaitsForBarrier() {
            var m = establishedLeader();

            m.step(new RaftEvent.ReadIndex(5));

            assertTrue(m.reads.isEmpty());
            assertEquals(new LogEntry.Blank(2, 1), m.raft.entry(2));

            m.receive("b", RaftMessage.AppendEntriesResponse.accepted(1, 2));

            assertEquals(List.of(new Ready.ReadState(5, 2)), m.reads);
        }

        @Test
        void concurrentReadsShareOneBarrier() {
            var m = establishedLeader();

            m.step(new RaftEvent.ReadIndex(1));
            m.step(new RaftEvent.ReadIndex(2));
            m.receive("b", RaftMessage.AppendEntriesResponse.accepted(1, 2));

            assertEquals(2, m.raft.lastIndex());
            assertEquals(List.of(new Ready.ReadState(1, 2), new Ready.ReadState(2, 2)), m.reads);
        }

        @Test
        void leaseReadIsServedAtCommitIndex() {
            var config = CONFIG.withReadPolicy(ReadPolicy.LEADER_LEASE, 8);
            var m = member("a", Membership.ofVoters("a", "b", "c"), config);
            becomeLeader(m, PEERS);
            m.receive("b", RaftMessage.AppendEntriesResponse.accepted(1, 1));

            m.step(new RaftEvent.ReadIndex(9));

            assertEquals(List.of(new Ready.ReadState(9, 1)), m.reads);
            assertEquals(1, m.raft.lastIndex());
        }

        @Test
        void expiredLeaseFallsBackToBarrier() {
            var config = CONFIG.withReadPolicy(ReadPolicy.LEADER_LEASE, 4);
            var m = member("a", Membership.ofVoters("a", "b", "c"), config);
            becomeLeader(m, PEERS);
            m.receive("b", RaftMessage.AppendEntriesResponse.accepted(1, 1));
            m.tick(5);

            m.step(new RaftEvent.ReadIndex(9));

            assertTrue(m.reads.isEmpty());
            assertInstanceOf(LogEntry.Blank.class, m.raft.entry(2));
        }

        @Test
        void leaseNeedsEntryOfCurrentTermCommitted() {
            var config = CONFIG.withReadPolicy(ReadPolicy.LEADER_LEASE, 8);
            var m = member("a", Membership.ofVoters("a", "b", "c"), config);
            becomeLeader(m, PEERS);

            m.step(new RaftEvent.ReadIndex(9));

            assertTrue(m.reads.isEmpty());
        }

        @Test
        void followerRejectsRead() {
            var m = member("b", "a", "b", "c");

            m.step(new RaftEvent.ReadIndex(3));

            assertInstanceOf(RaftException.NotLeader.class, m.rejected.get(3L));
        }

        @Test
        void steppingDownDropsPendingReads() {
            var m = establishedLeader();
            m.step(new RaftEvent.ReadIndex(5));

            m.receive("c", append(2, "c", LogId.ZERO, List.of(), 0));
            m.receive("c", append(2, "c", LogId.of(1, 2), List.of(), 2));

            assertTrue(m.reads.isEmpty());
        }
    }

    @Nested
    class MembershipChanges {
        @Test
        void followerRejectsChange() {
            var m = member("b", "a", "b", "c");

            m.step(new RaftEvent.ChangeConfig(1, new ConfigChange.AddLearner("d")));

            assertInstanceOf(RaftException.NotLeader.class, m.rejected.get(1L));
        }

        @Test
        void changeWaitsForLeaderToCommitInItsTerm() {
            var m = member("a", "a", "b", "c");
            becomeLeader(m, PEERS);

            m.step(new RaftEvent.ChangeConfig(1, new ConfigChange.AddLearner("d")));

            assertInstanceOf(RaftException.InvalidMembershipChange.class, m.rejected.get(1L));
            assertEquals(1, m.raft.lastIndex());
        }

        @Test
        void learnerAdditionIsSingleEntryEffectiveOnAppend() {
            var m = establishedLeader();

            var ready = m.step(new RaftEvent.ChangeConfig(1, new ConfigChange.AddLearner("d")));

            var config = assertInstanceOf(LogEntry.Config.class, ready.persist().entries().get(0));
            assertFalse(config.membership().isJoint());
            assertTrue(m.raft.membership().isLearner("d"));
            assertNotNull(m.raft.progress("d"));
            assertFalse(m.sentTo("d", RaftMessage.AppendEntries.class).isEmpty());
        }

        @Test
        void secondChangeWhileFirstUncommittedIsRejected() {
            var m = establishedLeader();
            m.step(new RaftEvent.ChangeConfig(1, new ConfigChange.AddLearner("d")));

            m.step(new RaftEvent.ChangeConfig(2, new ConfigChange.AddLearner("e")));

            assertInstanceOf(RaftException.MembershipChangeInProgress.class, m.rejected.get(2L));
        }

        @Test
        void invalidChangeIsRejectedWithoutTouchingLog() {
            var m = establishedLeader();

            m.step(new RaftEvent.ChangeConfig(1, new ConfigChange.PromoteVoter("zz")));

            assertInstanceOf(RaftException.InvalidMembershipChange.class, m.rejected.get(1L));
            assertEquals(1, m.raft.lastIndex());
        }

        @Test
        void voterChangeGoesThroughJointThenFinal() {
            var m = establishedLeader();

            m.step(new RaftEvent.ChangeConfig(1, new ConfigChange.ChangeVoters(Set.of("a", "b", "c", "d"))));
            assertTrue(m.raft.membership().isJoint());

            m.receive("b", RaftMessage.AppendEntriesResponse.accepted(1, 2));
            assertEquals(1, m.raft.commitIndex());

            m.receive("d", RaftMessage.AppendEntriesResponse.accepted(1, 2));
            assertEquals(2, m.raft.commitIndex());
            assertTrue(m.raft.committedMembership().isJoint());

            var last = assertInstanceOf(LogEntry.Config.class, m.raft.entry(3));
            assertFalse(last.membership().isJoint());
            assertEquals(Set.of("a", "b", "c", "d"), last.membership().voters());
            assertEquals(last.membership(), m.raft.membership());
        }

        @Test
        void followerRevertsTruncatedConfig() {
            var m = member("b", "a", "b", "c");
            var joint = Membership.ofVoters("a", "b", "c").enterJoint(Membership.ofVoters("a", "b"));
            m.receive("a", append(1, "a", LogId.ZERO, List.of(data(1, 1), new LogEntry.Config(2, 1, joint)), 1));
            assertTrue(m.raft.membership().isJoint());

            m.receive("c", append(2, "c", LogId.of(1, 1), List.of(data(2, 2)), 1));

            assertFalse(m.raft.membership().isJoint());
            assertEquals(Membership.ofVoters("a", "b", "c"), m.raft.membership());
        }

        @Test
        void removedFollowerBecomesLearnerOnAppend() {
            var m = member("c", "a", "b", "c");
            var joint = Membership.ofVoters("a", "b", "c").enterJoint(Membership.ofVoters("a", "b"));

            m.receive("a", append(1, "a", LogId.ZERO, List.of(new LogEntry.Config(1, 1, joint)), 0));
            assertEquals(Role.FOLLOWER, m.raft.role());

            m.receive("a", append(1, "a", LogId.of(1, 1), List.of(new LogEntry.Config(2, 1, joint.leaveJoint())), 1));
            assertEquals(Role.LEARNER, m.raft.role());
        }
    }

    @Nested
    class Snapshots {
        @Test
        void lagBehindCompactedLogSwitchesToSnapshot() {
            var config = CONFIG.withSnapshotChunkSize(4);
            var storage = new InMemoryStorage(Membership.ofVoters("a", "b", "c"));
            storage.log().append(entries(1, 1, 10));
            storage.saveHardState(new HardState(1, null, 10));
            var meta = new SnapshotMeta(LogId.of(1, 8), Membership.ofVoters("a", "b", "c"));
            storage.saveSnapshot(new Snapshot(meta, "0123456789".getBytes()));
            var m = new Member(new Raft("a", null, config, storage, bound -> 0), storage);
            becomeLeader(m, PEERS);
            m.sent.clear();

            m.receive("b", RaftMessage.AppendEntriesResponse.rejected(2, new RaftMessage.ConflictHint(0, 3)));

            var chunk = m.sentTo("b", RaftMessage.InstallSnapshot.class).get(0);
            assertEquals(meta, chunk.meta());
            assertEquals(0, chunk.offset());
            assertEquals(4, chunk.data().length);
            assertFalse(chunk.done());
            assertEquals(Progress.Mode.SNAPSHOT, m.raft.progress("b").mode());

            m.receive("b", new RaftMessage.InstallSnapshotResponse(2, 8, 4, false));
            m.receive("b", new RaftMessage.InstallSnapshotResponse(2, 8, 8, false));
            var last = m.sentTo("b", RaftMessage.InstallSnapshot.class);
            assertTrue(last.get(last.size() - 1).done());

            m.receive("b", new RaftMessage.InstallSnapshotResponse(2, 8, 10, true));
            assertEquals(8, m.raft.progress("b").matchIndex());
            var resumed = m.sentTo("b", RaftMessage.AppendEntries.class);
            assertEquals(LogId.of(1, 8), resumed.get(resumed.size() - 1).prevLogId());
        }

        @Test
        void followerInstallsCompletedSnapshot() {
            var m = memberWithLog("b", entries(1, 1, 3), new HardState(1, null, 2), "a", "b", "c");
            var target = Membership.ofVoters("a", "b", "c").addLearner("d");
            var meta = new SnapshotMeta(LogId.of(2, 20), target);

            m.receive("a", new RaftMessage.InstallSnapshot(2, "a", meta, 0, new byte[]{1, 2}, false));
            assertEquals(2, m.raft.commitIndex());

            var ready = m.receive("a", new RaftMessage.InstallSnapshot(2, "a", meta, 2, new byte[]{3}, true));

            assertArrayEquals(new byte[]{1, 2, 3}, ready.persist().incomingSnapshot().data());
            assertEquals(20, m.raft.commitIndex());
            assertEquals(20, m.raft.lastApplied());
            assertEquals(LogId.of(2, 20), m.raft.lastLogId());
            assertEquals(target, m.raft.membership());
            var response = m.sentOf(RaftMessage.InstallSnapshotResponse.class);
            assertTrue(response.get(response.size() - 1).done());
        }

        @Test
        void snapshotAtOrBelowCommitIsAcknowledgedWithoutEffect() {
            var m = memberWithLog("b", entries(1, 1, 5), new HardState(1, null, 5), "a", "b", "c");
            var meta = new SnapshotMeta(LogId.of(1, 3), Membership.ofVoters("a", "b", "c"));

            var ready = m.receive("a", new RaftMessage.InstallSnapshot(1, "a", meta, 0, new byte[]{9}, true));

            assertNull(ready.persist().incomingSnapshot());
            assertEquals(5, m.raft.lastIndex());
            assertTrue(m.sentOf(RaftMessage.InstallSnapshotResponse.class).get(0).done());
        }

        @Test
        void appendAfterSnapshotContinuesFromIt() {
            var m = member("b", "a", "b", "c");
            var meta = new SnapshotMeta(LogId.of(1, 10), Membership.ofVoters("a", "b", "c"));
            m.receive("a", new RaftMessage.InstallSnapshot(1, "a", meta, 0, new byte[0], true));

            m.receive("a", append(1, "a", LogId.of(1, 10), entries(1, 11, 12), 12));

            assertEquals(12, m.raft.commitIndex());
            assertEquals(11, m.storage.log().firstIndex());
            assertEquals(12, m.storage.log().lastIndex());
        }
    }

    @Test
    void restartRecoversTermVoteAndCommit() {
        var storage = new InMemoryStorage(Membership.ofVoters("a", "b", "c"));
        storage.log().append(entries(2, 1, 4));
        storage.saveHardState(new HardState(3, Vote.of(3, "c"), 2));

        var raft = new Raft("a", null, CONFIG, storage, bound -> 0);

        assertEquals(3, raft.term());
        assertEquals(Optional.of(Vote.of(3, "c")), raft.vote());
        assertEquals(2, raft.commitIndex());
        assertEquals(LogId.of(2, 4), raft.lastLogId());
        var ready = raft.step(new RaftEvent.Tick());
        assertEquals(2, ready.apply().entries().size());
    }
}
