package io.ballot.raft;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.IntUnaryOperator;

/**
 * The consensus state machine. Not thread-safe: a single owner feeds it
 * events through {@link #step} and carries out the returned {@link Ready}.
 */
public final class Raft {

    private record PendingRead(long requestId, long index) {}

    private final String id;
    private final RaftConfig config;
    private final IntUnaryOperator random;
    private final RaftStorage storage;
    private final Unstable unstable;
    private final SnapshotReceiver snapshotReceiver = new SnapshotReceiver();

    private Membership committedMembership;
    private long committedConfigIndex;
    private final TreeMap<Long, Membership> pendingConfigs = new TreeMap<>();
    private Membership appliedMembership;

    private long term;
    private Vote vote;

    private Role role;
    private String leaderId;
    private long commitIndex;
    private long applyCursor;
    private long lastApplied;
    private SnapshotMeta snapshotMeta;

    private Map<String, Progress> progress = Map.of();
    private List<PendingRead> pendingReads = new ArrayList<>();
    private long readBarrierIndex;

    private Set<String> votesReceived;
    private Set<String> preVotesReceived;

    private long tickCount;
    private long electionTicks;
    private long heartbeatTicks;
    private long electionTimeout;
    private long leaderContactTicks;

    public Raft(String id, Membership membership, RaftConfig config,
                RaftStorage storage, IntUnaryOperator random) {
        this.id = id;
        this.config = config;
        this.random = random;
        this.storage = storage;

        var initial = storage.initialState();
        var hardState = initial.hardState() != null ? initial.hardState() : HardState.INITIAL;
        this.snapshotMeta = storage.snapshot().map(Snapshot::meta).orElse(null);
        long snapIndex = snapshotMeta != null ? snapshotMeta.index() : 0;

        this.term = hardState.term();
        this.vote = hardState.vote();
        this.commitIndex = Math.max(hardState.commit(), snapIndex);
        this.applyCursor = snapIndex;
        this.lastApplied = snapIndex;
        this.unstable = new Unstable(storage.log().lastIndex() + 1);

        var base = snapshotMeta != null ? snapshotMeta.membership() : membership;
        if (base == null) {
            base = initial.membership();
        }
        if (base == null) {
            throw new IllegalArgumentException("membership is required when storage holds none");
        }
        this.committedMembership = base;
        this.committedConfigIndex = snapIndex;
        this.appliedMembership = base;
        loadConfigEntries();

        this.role = followerRole();
        this.commitIndex = Math.min(commitIndex, lastIndex());
        resetElectionTimeout();
    }

    public Ready step(RaftEvent event) {
        var builder = new ReadyBuilder();

        if (event instanceof RaftEvent.Tick) {
            tick(builder);
        } else if (event instanceof RaftEvent.Propose p) {
            propose(p.requestId(), p.data(), builder);
        } else if (event instanceof RaftEvent.ChangeConfig c) {
            proposeConfigChange(c.requestId(), c.change(), builder);
        } else if (event instanceof RaftEvent.ReadIndex r) {
            readIndex(r.requestId(), builder);
        } else if (event instanceof RaftEvent.Receive r) {
            receive(r.from(), r.message(), builder);
        } else if (event instanceof RaftEvent.Unreachable u) {
            unreachable(u.peer(), u.request());
        } else if (event instanceof RaftEvent.Persisted p) {
            persisted(p.lastLogId(), builder);
        } else if (event instanceof RaftEvent.Applied a) {
            lastApplied = Math.max(lastApplied, a.index());
        } else if (event instanceof RaftEvent.SnapshotBuilt s) {
            snapshotBuilt(s.meta());
        }

        prepareEntriesToApply(builder);

        return builder.build();
    }

    public String id() {
        return id;
    }

    public boolean isLeader() {
        return role == Role.LEADER;
    }

    public Role role() {
        return role;
    }

    public Optional<String> leaderId() {
        return Optional.ofNullable(leaderId);
    }

    public long term() {
        return term;
    }

    public Optional<Vote> vote() {
        return Optional.ofNullable(vote);
    }

    public long commitIndex() {
        return commitIndex;
    }

    public long lastApplied() {
        return lastApplied;
    }

    /**
     * The active membership: the latest configuration in the log, committed
     * or not.
     */
    public Membership membership() {
        return pendingConfigs.isEmpty() ? committedMembership : pendingConfigs.lastEntry().getValue();
    }

    public Membership committedMembership() {
        return committedMembership;
    }

    public LogId lastLogId() {
        long last = lastIndex();
        return LogId.of(Math.max(0, termAt(last)), last);
    }

    public Optional<SnapshotMeta> snapshotMeta() {
        return Optional.ofNullable(snapshotMeta);
    }

    Progress progress(String peer) {
        return progress.get(peer);
    }

    long lastIndex() {
        return unstable.lastIndex();
    }

    long persistedIndex() {
        return unstable.offset() - 1;
    }

    /**
     * The term of the entry at {@code index}, or -1 when the log has no such
     * entry (past the end, or purged).
     */
    long termAt(long index) {
        if (index == 0) {
            return 0;
        }
        Long t = unstable.term(index);
        if (t != null) {
            return t;
        }
        if (index >= unstable.offset()) {
            return -1;
        }
        if (snapshotMeta != null && index == snapshotMeta.index()) {
            return snapshotMeta.term();
        }
        var entry = storage.log().get(index);
        if (entry.isPresent()) {
            return entry.get().term();
        }
        var stored = storage.snapshot();
        if (stored.isPresent() && stored.get().index() == index) {
            return stored.get().term();
        }
        return -1;
    }

    LogEntry entry(long index) {
        LogEntry entry = unstable.get(index);
        if (entry != null || index >= unstable.offset()) {
            return entry;
        }
        return storage.log().get(index).orElse(null);
    }

    private List<LogEntry> slice(long from, long to) {
        if (from >= to) {
            return List.of();
        }

        var result = new ArrayList<LogEntry>();
        long stableEnd = Math.min(to, unstable.offset());
        if (from < stableEnd) {
            try {
                var stable = storage.log().getRange(from, stableEnd);
                if (stable.size() != stableEnd - from) {
                    return null;
                }
                result.addAll(stable);
            } catch (RaftException.LogCompacted e) {
                return null;
            }
        }

        if (to > unstable.offset()) {
            result.addAll(unstable.slice(Math.max(from, unstable.offset()), to));
        }

        return result;
    }

    private void loadConfigEntries() {
        var log = storage.log();
        long from = Math.max(log.firstIndex(), committedConfigIndex + 1);
        long last = log.lastIndex();
        while (from <= last) {
            long to = Math.min(last + 1, from + 1024);
            for (LogEntry entry : log.getRange(from, to)) {
                if (entry instanceof LogEntry.Config c) {
                    if (entry.index() <= commitIndex) {
                        committedMembership = c.membership();
                        committedConfigIndex = entry.index();
                    } else {
                        pendingConfigs.put(entry.index(), c.membership());
                    }
                }
            }
            from = to;
        }
    }

    private long lastConfigIndex() {
        return pendingConfigs.isEmpty() ? committedConfigIndex : pendingConfigs.lastKey();
    }

    private Role followerRole() {
        return membership().isVoter(id) ? Role.FOLLOWER : Role.LEARNER;
    }

    private void appendEntry(LogEntry entry, ReadyBuilder builder) {
        var truncated = pendingConfigs.tailMap(entry.index(), true);
        boolean membershipChanged = !truncated.isEmpty();
        truncated.clear();

        unstable.append(entry);
        builder.persist(entry);

        if (entry instanceof LogEntry.Config c) {
            pendingConfigs.put(entry.index(), c.membership());
            membershipChanged = true;
        }
        if (entry.index() <= readBarrierIndex) {
            readBarrierIndex = 0;
        }
        if (membershipChanged) {
            onMembershipChanged();
        }
    }

    private void onMembershipChanged() {
        var current = membership();
        switch (role) {
            case LEADER -> syncProgress(current);
            case FOLLOWER, PRE_CANDIDATE, CANDIDATE -> {
                if (!current.isVoter(id)) {
                    role = Role.LEARNER;
                }
            }
            case LEARNER -> {
                if (current.isVoter(id)) {
                    role = Role.FOLLOWER;
                    resetElectionTimeout();
                }
            }
        }
    }

    private void syncProgress(Membership current) {
        for (String peer : current.members()) {
            if (!peer.equals(id) && !progress.containsKey(peer)) {
                progress.put(peer, new Progress(lastIndex() + 1, tickCount));
            }
        }
        progress.keySet().retainAll(current.members());
    }

    private void tick(ReadyBuilder builder) {
        tickCount++;
        leaderContactTicks++;
        if (role == Role.LEADER) {
            tickHeartbeat(builder);
        } else {
            tickElection(builder);
        }
    }

    private void tickHeartbeat(ReadyBuilder builder) {
        heartbeatTicks++;
        if (heartbeatTicks >= config.heartbeatInterval()) {
            heartbeatTicks = 0;
            long window = retransmitTicks();
            for (var entry : progress.entrySet()) {
                if (!entry.getValue().awaitingResponse(tickCount, window)) {
                    sendAppend(entry.getKey(), entry.getValue(), builder);
                }
            }
        }
        if (!hasRecentQuorumContact(electionTimeout)) {
            becomeFollower(term, null, builder);
        }
    }

    /** An unanswered request is re-sent after two heartbeats, and always before a follower's election timeout. */
    private long retransmitTicks() {
        return Math.min(2L * config.heartbeatInterval(), config.electionTimeoutMin() - 1L);
    }

    private boolean hasRecentQuorumContact(long window) {
        var contacted = new HashSet<String>();
        contacted.add(id);
        for (var entry : progress.entrySet()) {
            if (tickCount - entry.getValue().lastContactTick() < window) {
                contacted.add(entry.getKey());
            }
        }
        return membership().hasQuorum(contacted);
    }

    private void tickElection(ReadyBuilder builder) {
        if (role == Role.LEARNER || !membership().isVoter(id)) {
            return;
        }
        electionTicks++;
        if (electionTicks >= electionTimeout) {
            startPreVote(builder);
        }
    }

    private void propose(long requestId, byte[] data, ReadyBuilder builder) {
        if (role != Role.LEADER) {
            builder.reject(requestId, new RaftException.NotLeader(leaderId));
            return;
        }

        var entry = new LogEntry.Data(lastIndex() + 1, term, data);
        appendEntry(entry, builder);
        builder.accept(requestId, entry.id());
        broadcastAppend(builder);
    }

    private void proposeConfigChange(long requestId, ConfigChange change, ReadyBuilder builder) {
        if (role != Role.LEADER) {
            builder.reject(requestId, new RaftException.NotLeader(leaderId));
            return;
        }

        var current = membership();
        if (hasPendingConfigChange()) {
            builder.reject(requestId, new RaftException.MembershipChangeInProgress(current));
            return;
        }
        if (termAt(commitIndex) != term) {
            builder.reject(requestId, new RaftException.InvalidMembershipChange(
                change, "leader has not committed an entry in its term yet"));
            return;
        }

        Membership target;
        try {
            target = current.apply(change);
        } catch (IllegalArgumentException e) {
            builder.reject(requestId, new RaftException.InvalidMembershipChange(change, e.getMessage()));
            return;
        }

        var next = target.voters().equals(current.voters()) ? target : current.enterJoint(target);
        var entry = new LogEntry.Config(lastIndex() + 1, term, next);
        appendEntry(entry, builder);
        builder.accept(requestId, entry.id());
        broadcastAppend(builder);
    }

    private boolean hasPendingConfigChange() {
        return membership().isJoint() || lastConfigIndex() > commitIndex;
    }

    private void readIndex(long requestId, ReadyBuilder builder) {
        if (role != Role.LEADER) {
            builder.reject(requestId, new RaftException.NotLeader(leaderId));
            return;
        }

        if (config.readPolicy() == ReadPolicy.LEADER_LEASE && hasValidLease()) {
            builder.addReadState(requestId, commitIndex);
            return;
        }

        if (readBarrierIndex <= commitIndex) {
            var barrier = new LogEntry.Blank(lastIndex() + 1, term);
            appendEntry(barrier, builder);
            readBarrierIndex = barrier.index();
            broadcastAppend(builder);
        }
        pendingReads.add(new PendingRead(requestId, readBarrierIndex));
    }

    private boolean hasValidLease() {
        if (termAt(commitIndex) != term) {
            return false;
        }
        var acknowledged = new HashSet<String>();
        acknowledged.add(id);
        for (var entry : progress.entrySet()) {
            if (tickCount - entry.getValue().leaseTick() < config.leaseTicks()) {
                acknowledged.add(entry.getKey());
            }
        }
        return membership().hasQuorum(acknowledged);
    }

    private void receive(String from, RaftMessage msg, ReadyBuilder builder) {
        if (msg instanceof RaftMessage.RequestVote rv) {
            handleRequestVote(from, rv, builder);
            return;
        }
        if (msg instanceof RaftMessage.RequestVoteResponse rvr && rvr.preVote()) {
            handlePreVoteResponse(from, rvr, builder);
            return;
        }

        if (msg.term() > term) {
            String leader = null;
            if (msg instanceof RaftMessage.AppendEntries ae) {
                leader = ae.leaderId();
            } else if (msg instanceof RaftMessage.InstallSnapshot is) {
                leader = is.leaderId();
            }
            becomeFollower(msg.term(), leader, builder);
        }

        if (msg instanceof RaftMessage.RequestVoteResponse rvr) {
            handleRequestVoteResponse(from, rvr, builder);
        } else if (msg instanceof RaftMessage.AppendEntries ae) {
            handleAppendEntries(from, ae, builder);
        } else if (msg instanceof RaftMessage.AppendEntriesResponse aer) {
            handleAppendEntriesResponse(from, aer, builder);
        } else if (msg instanceof RaftMessage.InstallSnapshot is) {
            handleInstallSnapshot(from, is, builder);
        } else if (msg instanceof RaftMessage.InstallSnapshotResponse isr) {
            handleInstallSnapshotResponse(from, isr, builder);
        }
    }

    private void startPreVote(ReadyBuilder builder) {
        var membership = membership();
        if (membership.hasQuorum(Set.of(id))) {
            startElection(builder);
            return;
        }

        role = Role.PRE_CANDIDATE;
        leaderId = null;
        preVotesReceived = new HashSet<>();
        preVotesReceived.add(id);
        resetElectionTimeout();

        var request = new RaftMessage.RequestVote(term + 1, id, lastLogId(), true);
        for (String peer : membership.allVoters()) {
            if (!peer.equals(id)) {
                builder.send(peer, request);
            }
        }
    }

    private void startElection(ReadyBuilder builder) {
        term++;
        vote = Vote.of(term, id);
        role = Role.CANDIDATE;
        leaderId = null;
        votesReceived = new HashSet<>();
        votesReceived.add(id);
        resetElectionTimeout();

        persistHardState(builder);

        var membership = membership();
        if (membership.hasQuorum(votesReceived)) {
            becomeLeader(builder);
            return;
        }

        var request = new RaftMessage.RequestVote(term, id, lastLogId(), false);
        for (String peer : membership.allVoters()) {
            if (!peer.equals(id)) {
                builder.send(peer, request);
            }
        }
    }

    private void becomeLeader(ReadyBuilder builder) {
        role = Role.LEADER;
        leaderId = id;
        vote = vote.commit();
        heartbeatTicks = 0;
        persistHardState(builder);

        progress = new HashMap<>();
        pendingReads = new ArrayList<>();
        readBarrierIndex = 0;
        syncProgress(membership());

        var blank = new LogEntry.Blank(lastIndex() + 1, term);
        appendEntry(blank, builder);
        broadcastAppend(builder);
    }

    private void becomeFollower(long newTerm, String leader, ReadyBuilder builder) {
        boolean termChanged = newTerm > term;
        if (termChanged) {
            term = newTerm;
            vote = null;
            persistHardState(builder);
        }
        if (role == Role.LEADER || role == Role.CANDIDATE || role == Role.PRE_CANDIDATE || termChanged) {
            role = followerRole();
            progress = Map.of();
            pendingReads = new ArrayList<>();
            readBarrierIndex = 0;
            votesReceived = null;
            preVotesReceived = null;
        }
        leaderId = leader;
        resetElectionTimeout();
    }

    private void acceptLeader(String leader, ReadyBuilder builder) {
        leaderContactTicks = 0;
        if (vote == null || !vote.isFor(leader) || !vote.committed()) {
            vote = new Vote(term, leader, true);
            persistHardState(builder);
        }
    }

    private boolean leaderIsLive() {
        if (role == Role.LEADER) {
            return true;
        }
        return leaderId != null && leaderContactTicks < config.electionTimeoutMin();
    }

    private void handleRequestVote(String from, RaftMessage.RequestVote rv, ReadyBuilder builder) {
        boolean upToDate = rv.lastLogId().isAtLeast(lastLogId());

        if (rv.preVote()) {
            boolean granted = rv.term() >= term && upToDate && !leaderIsLive();
            builder.send(from, new RaftMessage.RequestVoteResponse(granted ? rv.term() : term, granted, true));
            return;
        }

        if (rv.term() < term || leaderIsLive()) {
            builder.send(from, new RaftMessage.RequestVoteResponse(term, false, false));
            return;
        }

        if (rv.term() > term) {
            becomeFollower(rv.term(), null, builder);
        }

        boolean granted = false;
        if ((vote == null || vote.isFor(from)) && upToDate) {
            granted = true;
            if (vote == null) {
                vote = Vote.of(term, from);
                persistHardState(builder);
            }
            electionTicks = 0;
        }

        builder.send(from, new RaftMessage.RequestVoteResponse(term, granted, false));
    }

    private void handlePreVoteResponse(String from, RaftMessage.RequestVoteResponse pvr, ReadyBuilder builder) {
        if (role != Role.PRE_CANDIDATE) {
            return;
        }

        if (pvr.voteGranted()) {
            if (pvr.term() != term + 1) {
                return;
            }
            preVotesReceived.add(from);
            if (membership().hasQuorum(preVotesReceived)) {
                startElection(builder);
            }
        } else if (pvr.term() > term) {
            becomeFollower(pvr.term(), null, builder);
        }
    }

    private void handleRequestVoteResponse(String from, RaftMessage.RequestVoteResponse rvr, ReadyBuilder builder) {
        if (role != Role.CANDIDATE || rvr.term() != term) {
            return;
        }

        if (rvr.voteGranted()) {
            votesReceived.add(from);
            if (membership().hasQuorum(votesReceived)) {
                becomeLeader(builder);
            }
        }
    }

    private void handleAppendEntries(String from, RaftMessage.AppendEntries ae, ReadyBuilder builder) {
        if (ae.term() < term) {
            builder.send(from, RaftMessage.AppendEntriesResponse.rejected(term, null));
            return;
        }

        becomeFollower(ae.term(), ae.leaderId(), builder);
        acceptLeader(ae.leaderId(), builder);

        var prev = ae.prevLogId();
        long matchIdx = prev.index();
        if (prev.index() < commitIndex) {
            matchIdx = commitIndex;
        } else if (termAt(prev.index()) != prev.term()) {
            builder.send(from, RaftMessage.AppendEntriesResponse.rejected(term, conflictHint(prev.index())));
            return;
        }

        for (LogEntry entry : ae.entries()) {
            if (entry.index() <= commitIndex) {
                continue;
            }
            if (termAt(entry.index()) != entry.term()) {
                appendEntry(entry, builder);
            }
            matchIdx = entry.index();
        }

        if (ae.leaderCommit() > commitIndex) {
            long newCommit = Math.min(ae.leaderCommit(), matchIdx);
            if (newCommit > commitIndex) {
                commitIndex = newCommit;
                persistHardState(builder);
                onCommitAdvanced(builder);
            }
        }

        builder.send(from, RaftMessage.AppendEntriesResponse.accepted(term, matchIdx));
    }

    private RaftMessage.ConflictHint conflictHint(long prevIndex) {
        long last = lastIndex();
        if (prevIndex > last) {
            return new RaftMessage.ConflictHint(0, last + 1);
        }
        long conflictTerm = termAt(prevIndex);
        if (conflictTerm < 0) {
            return new RaftMessage.ConflictHint(0, commitIndex + 1);
        }
        long first = prevIndex;
        while (first - 1 > commitIndex && termAt(first - 1) == conflictTerm) {
            first--;
        }
        return new RaftMessage.ConflictHint(conflictTerm, first);
    }

    private void handleAppendEntriesResponse(String from, RaftMessage.AppendEntriesResponse aer, ReadyBuilder builder) {
        if (role != Role.LEADER || aer.term() != term) {
            return;
        }
        var pr = progress.get(from);
        if (pr == null) {
            return;
        }
        pr.heardFrom(tickCount);

        if (aer.success()) {
            if (pr.acknowledge(aer.matchIndex())) {
                maybeCommit(builder);
            }
            if (pr.nextIndex() <= lastIndex()) {
                sendAppend(from, pr, builder);
            }
            return;
        }

        var hint = aer.conflict();
        if (hint == null) {
            return;
        }
        pr.rewind(nextIndexFor(hint, pr));
        sendAppend(from, pr, builder);
    }

    private long nextIndexFor(RaftMessage.ConflictHint hint, Progress pr) {
        if (hint.term() == 0) {
            return hint.index();
        }
        long idx = Math.min(lastIndex(), pr.nextIndex() - 1);
        long floor = pr.matchIndex();
        while (idx > floor) {
            long t = termAt(idx);
            if (t < 0 || t < hint.term()) {
                break;
            }
            if (t == hint.term()) {
                return idx + 1;
            }
            idx--;
        }
        return hint.index();
    }

    private void handleInstallSnapshot(String from, RaftMessage.InstallSnapshot is, ReadyBuilder builder) {
        var meta = is.meta();
        if (is.term() < term) {
            builder.send(from, new RaftMessage.InstallSnapshotResponse(term, meta.index(), 0, false));
            return;
        }

        becomeFollower(is.term(), is.leaderId(), builder);
        acceptLeader(is.leaderId(), builder);

        if (meta.index() <= commitIndex) {
            snapshotReceiver.reset();
            builder.send(from, new RaftMessage.InstallSnapshotResponse(
                term, meta.index(), is.offset() + is.data().length, true));
            return;
        }

        var outcome = snapshotReceiver.receive(is);
        if (!outcome.isDone()) {
            builder.send(from, new RaftMessage.InstallSnapshotResponse(
                term, meta.index(), outcome.nextOffset(), false));
            return;
        }

        var snapshot = outcome.completed();
        unstable.acceptSnapshot(meta);
        snapshotMeta = meta;
        pendingConfigs.clear();
        committedMembership = meta.membership();
        committedConfigIndex = meta.index();
        appliedMembership = meta.membership();
        commitIndex = meta.index();
        applyCursor = meta.index();
        lastApplied = meta.index();
        persistHardState(builder);
        builder.setIncomingSnapshot(snapshot);
        onMembershipChanged();

        builder.send(from, new RaftMessage.InstallSnapshotResponse(
            term, meta.index(), outcome.nextOffset(), true));
    }

    private void handleInstallSnapshotResponse(String from, RaftMessage.InstallSnapshotResponse isr,
                                               ReadyBuilder builder) {
        if (role != Role.LEADER || isr.term() != term) {
            return;
        }
        var pr = progress.get(from);
        if (pr == null) {
            return;
        }
        pr.heardFrom(tickCount);

        var meta = pr.snapshotMeta();
        if (pr.mode() != Progress.Mode.SNAPSHOT || meta == null || isr.snapshotIndex() != meta.index()) {
            return;
        }

        if (isr.done()) {
            pr.snapshotInstalled(meta.index());
            maybeCommit(builder);
        } else {
            pr.snapshotChunkAcknowledged(isr.nextOffset());
        }
        sendAppend(from, pr, builder);
    }

    private void unreachable(String peer, RaftMessage.Request request) {
        if (role != Role.LEADER || request.term() != term) {
            return;
        }
        var pr = progress.get(peer);
        if (pr != null) {
            pr.backOff(tickCount, config.heartbeatInterval(), config.maxBackoffTicks());
        }
    }

    private void persisted(LogId lastLogId, ReadyBuilder builder) {
        unstable.stableTo(lastLogId.index(), lastLogId.term());
        unstable.snapshotStabilized(lastLogId.index());
        if (role == Role.LEADER) {
            maybeCommit(builder);
        }
    }

    private void snapshotBuilt(SnapshotMeta meta) {
        if (snapshotMeta == null || meta.index() > snapshotMeta.index()) {
            snapshotMeta = meta;
        }
    }

    private void broadcastAppend(ReadyBuilder builder) {
        for (var entry : progress.entrySet()) {
            if (!entry.getValue().inflight()) {
                sendAppend(entry.getKey(), entry.getValue(), builder);
            }
        }
    }

    private void sendAppend(String peer, Progress pr, ReadyBuilder builder) {
        if (pr.isPaused(tickCount)) {
            return;
        }
        if (pr.mode() == Progress.Mode.SNAPSHOT) {
            sendSnapshotChunk(peer, pr, builder);
            return;
        }

        long next = pr.nextIndex();
        long prevIndex = next - 1;
        long prevTerm = termAt(prevIndex);
        List<LogEntry> entries = prevTerm < 0
            ? null
            : slice(next, Math.min(next + config.maxEntriesPerAppend(), lastIndex() + 1));

        if (entries == null) {
            var snapshot = storage.snapshot();
            if (snapshot.isEmpty()) {
                return;
            }
            pr.startSnapshot(snapshot.get().meta());
            sendSnapshotChunk(peer, pr, builder);
            return;
        }

        builder.send(peer, new RaftMessage.AppendEntries(
            term, id, LogId.of(prevTerm, prevIndex), entries, commitIndex
        ));
        pr.markSent(tickCount);
    }

    private void sendSnapshotChunk(String peer, Progress pr, ReadyBuilder builder) {
        var stored = storage.snapshot();
        if (stored.isEmpty()) {
            return;
        }
        var snapshot = stored.get();
        if (!snapshot.meta().equals(pr.snapshotMeta())) {
            pr.startSnapshot(snapshot.meta());
        }

        byte[] data = snapshot.data();
        int offset = (int) Math.min(pr.snapshotOffset(), data.length);
        int end = Math.min(data.length, offset + config.snapshotChunkSize());
        byte[] chunk = Arrays.copyOfRange(data, offset, end);

        builder.send(peer, new RaftMessage.InstallSnapshot(
            term, id, snapshot.meta(), offset, chunk, end == data.length
        ));
        pr.markSent(tickCount);
    }

    private void maybeCommit(ReadyBuilder builder) {
        if (role != Role.LEADER) {
            return;
        }
        var match = new HashMap<String, Long>();
        for (var entry : progress.entrySet()) {
            match.put(entry.getKey(), entry.getValue().matchIndex());
        }
        match.put(id, persistedIndex());

        long quorumIndex = membership().quorumIndex(match);
        if (quorumIndex > commitIndex && termAt(quorumIndex) == term) {
            commitIndex = quorumIndex;
            persistHardState(builder);
            onCommitAdvanced(builder);
        }
    }

    private void onCommitAdvanced(ReadyBuilder builder) {
        var committed = pendingConfigs.headMap(commitIndex, true);
        if (!committed.isEmpty()) {
            committedMembership = committed.lastEntry().getValue();
            committedConfigIndex = committed.lastKey();
            committed.clear();
        }

        if (role != Role.LEADER) {
            return;
        }

        Iterator<PendingRead> it = pendingReads.iterator();
        while (it.hasNext()) {
            var read = it.next();
            if (read.index() <= commitIndex) {
                builder.addReadState(read.requestId(), read.index());
                it.remove();
            }
        }

        var current = membership();
        if (lastConfigIndex() <= commitIndex) {
            if (current.isJoint()) {
                var entry = new LogEntry.Config(lastIndex() + 1, term, current.leaveJoint());
                appendEntry(entry, builder);
                broadcastAppend(builder);
            } else if (!current.isVoter(id)) {
                becomeFollower(term, null, builder);
            }
        }
    }

    private void prepareEntriesToApply(ReadyBuilder builder) {
        for (long i = applyCursor + 1; i <= commitIndex; i++) {
            var entry = entry(i);
            if (entry == null) {
                throw new IllegalStateException(
                    "Missing log entry at index " + i + " (firstIndex=" + storage.log().firstIndex() + ")");
            }
            builder.apply(entry);
            if (entry instanceof LogEntry.Config c) {
                builder.addMembershipChange(entry.index(), appliedMembership, c.membership());
                appliedMembership = c.membership();
            }
            applyCursor = i;
        }
    }

    private void resetElectionTimeout() {
        electionTicks = 0;
        int jitter = config.electionTimeoutMax() - config.electionTimeoutMin();
        electionTimeout = config.electionTimeoutMin() + (jitter > 0 ? random.applyAsInt(jitter) : 0);
    }

    private void persistHardState(ReadyBuilder builder) {
        builder.setHardState(new HardState(term, vote, commitIndex));
    }
}
