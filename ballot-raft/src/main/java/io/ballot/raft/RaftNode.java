package io.ballot.raft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.IntUnaryOperator;

/**
 * A running Raft member. One event loop thread owns the {@link Raft} core;
 * the work each step produces is carried out in order by a single pipeline
 * thread: persist, send, apply.
 *
 * @param <R> the state machine's result type
 */
public final class RaftNode<R> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RaftNode.class);

    private record Status(Role role, long term, String leaderId, long commitIndex, Membership membership) {
        boolean isLeader() {
            return role == Role.LEADER;
        }
    }

    private record RpcKey(String peerId, Class<? extends RaftMessage.Request> requestType) {}

    private final String nodeId;
    private final Raft raft;
    private final RaftTransport transport;
    private final RaftStorage storage;
    private final StateMachine<R> stateMachine;
    private final Duration rpcTimeout;
    private final Duration writeTimeout;

    private final BlockingQueue<RaftEvent> events = new LinkedBlockingQueue<>();
    private final Map<RpcKey, Deque<CompletableFuture<RaftMessage.Response>>> pendingRpcs = new ConcurrentHashMap<>();
    private final PendingRequests<R> requests;
    private final Map<String, ReplicationStream> streams = new ConcurrentHashMap<>();
    private final SnapshotCoordinator snapshots;

    private final ExecutorService pipeline;
    private final ScheduledExecutorService ticker;
    private final Thread eventLoop;

    private volatile boolean running = true;
    private volatile Throwable failure;
    private volatile Status status;

    // pipeline thread only
    private boolean leading;
    private LogId lastAppliedId;
    private Membership appliedMembership;

    private RaftNode(Builder<R> builder, Raft raft, LogId lastAppliedId, Membership appliedMembership) {
        this.nodeId = builder.nodeId;
        this.raft = raft;
        this.transport = builder.transport;
        this.storage = builder.storage;
        this.stateMachine = builder.stateMachine;
        this.rpcTimeout = builder.rpcTimeout;
        this.writeTimeout = builder.writeTimeout;
        this.requests = new PendingRequests<>(builder.maxPendingRequests);
        this.lastAppliedId = lastAppliedId;
        this.appliedMembership = appliedMembership;
        this.status = statusOf(raft);

        this.snapshots = new SnapshotCoordinator(nodeId, storage, builder.config, events::offer, this::fail);
        this.pipeline = Executors.newSingleThreadExecutor(daemonThreads("ballot-pipeline-" + nodeId));
        this.ticker = Executors.newSingleThreadScheduledExecutor(daemonThreads("ballot-ticker-" + nodeId));

        this.eventLoop = new Thread(this::runEventLoop, "ballot-event-loop-" + nodeId);
        this.eventLoop.setDaemon(true);
        this.eventLoop.start();

        long tickMillis = builder.tickInterval.toMillis();
        ticker.scheduleAtFixedRate(() -> events.offer(new RaftEvent.Tick()), tickMillis, tickMillis, TimeUnit.MILLISECONDS);

        transport.start(this::handleIncomingRpc);
        log.info("Node {} started at term {} with {}", nodeId, raft.term(), raft.membership());
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    /**
     * Replicates {@code command} and applies it. Completes once the entry is
     * applied on this node.
     */
    public CompletableFuture<WriteResult<R>> write(byte[] command) {
        var refused = refuse();
        if (refused != null) {
            return CompletableFuture.failedFuture(refused);
        }

        PendingRequests.Tracked<WriteResult<R>> tracked;
        try {
            tracked = requests.trackWrite();
        } catch (RaftException.TooManyRequests e) {
            return CompletableFuture.failedFuture(e);
        }
        scheduleTimeout(tracked.requestId());
        events.offer(new RaftEvent.Propose(tracked.requestId(), command));
        return tracked.future();
    }

    /**
     * Runs {@code query} against a state that reflects every write completed
     * before this call.
     */
    public CompletableFuture<R> read(byte[] query) {
        var refused = refuse();
        if (refused != null) {
            return CompletableFuture.failedFuture(refused);
        }

        PendingRequests.Tracked<R> tracked;
        try {
            tracked = requests.trackRead(query);
        } catch (RaftException.TooManyRequests e) {
            return CompletableFuture.failedFuture(e);
        }
        scheduleTimeout(tracked.requestId());
        events.offer(new RaftEvent.ReadIndex(tracked.requestId()));
        return tracked.future();
    }

    /**
     * Changes the membership. Voter changes go through a joint configuration;
     * the future completes with the final membership once it is applied.
     */
    public CompletableFuture<Membership> changeMembership(ConfigChange change) {
        var refused = refuse();
        if (refused != null) {
            return CompletableFuture.failedFuture(refused);
        }

        PendingRequests.Tracked<Membership> tracked;
        try {
            tracked = requests.trackChange();
        } catch (RaftException.TooManyRequests e) {
            return CompletableFuture.failedFuture(e);
        }
        scheduleTimeout(tracked.requestId());
        events.offer(new RaftEvent.ChangeConfig(tracked.requestId(), change));
        return tracked.future();
    }

    public String nodeId() {
        return nodeId;
    }

    public boolean isLeader() {
        return status.isLeader();
    }

    public Optional<String> leaderId() {
        return Optional.ofNullable(status.leaderId());
    }

    public long term() {
        return status.term();
    }

    public long commitIndex() {
        return status.commitIndex();
    }

    public Membership membership() {
        return status.membership();
    }

    public Role role() {
        return status.role();
    }

    /** The error that stopped this node, if any. */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    private RaftException refuse() {
        if (!running) {
            return stoppedError();
        }
        var current = status;
        if (!current.isLeader()) {
            return new RaftException.NotLeader(current.leaderId());
        }
        return null;
    }

    private RaftException stoppedError() {
        var cause = failure;
        return cause != null ? new RaftException.StorageFailure(cause) : new RaftException.Stopped();
    }

    private void scheduleTimeout(long requestId) {
        try {
            ticker.schedule(() -> requests.timeout(requestId), writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            requests.fail(requestId, stoppedError());
        }
    }

    private static Status statusOf(Raft raft) {
        return new Status(raft.role(), raft.term(), raft.leaderId().orElse(null), raft.commitIndex(), raft.membership());
    }

    private void runEventLoop() {
        while (running) {
            RaftEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                var ready = raft.step(event);
                var previous = status;
                var current = statusOf(raft);
                status = current;

                if (current.role() != previous.role() || current.term() != previous.term()) {
                    log.info("Node {} is {} at term {} (leader {})",
                        nodeId, current.role(), current.term(), current.leaderId());
                }
                if (ready.hasWork() || current.isLeader() != previous.isLeader()
                        || !current.membership().equals(previous.membership())) {
                    pipeline.execute(() -> processReady(ready, current));
                }
            } catch (RejectedExecutionException e) {
                break;
            } catch (RuntimeException e) {
                log.error("Node {} failed handling {}", nodeId, event.getClass().getSimpleName(), e);
                fail(e);
            }
        }
    }

    private CompletableFuture<RaftMessage.Response> handleIncomingRpc(String from, RaftMessage.Request request) {
        if (!running) {
            return CompletableFuture.failedFuture(stoppedError());
        }

        var responseFuture = new CompletableFuture<RaftMessage.Response>();
        var key = new RpcKey(from, request.getClass());
        pendingRpcs.computeIfAbsent(key, k -> new ConcurrentLinkedDeque<>())
            .addLast(responseFuture);

        events.offer(new RaftEvent.Receive(from, request));

        return responseFuture;
    }

    private void processReady(Ready ready, Status current) {
        if (!running) {
            return;
        }

        try {
            persist(ready.persist());

            for (var accepted : ready.accepted()) {
                requests.accepted(accepted.requestId(), accepted.logId());
            }
            for (var rejected : ready.rejected()) {
                requests.fail(rejected.requestId(), rejected.reason());
            }

            reconcileStreams(current);
            for (var outbound : ready.messages()) {
                if (outbound.message() instanceof RaftMessage.Request request) {
                    stream(outbound.to()).send(request);
                } else if (outbound.message() instanceof RaftMessage.Response response) {
                    completeRpc(outbound.to(), response);
                }
            }

            apply(ready.apply());

            if (leading && !current.isLeader()) {
                requests.failAll(new RaftException.LeadershipLost(current.leaderId()));
                requests.clearIndexes();
            }
            leading = current.isLeader();
        } catch (StorageException e) {
            log.error("Node {} storage failure", nodeId, e);
            fail(e);
        } catch (RuntimeException e) {
            log.error("Node {} pipeline failure", nodeId, e);
            fail(e);
        }
    }

    private void persist(Ready.Persist persist) {
        if (!persist.hasWork()) {
            return;
        }

        var snapshot = persist.incomingSnapshot();
        if (snapshot != null) {
            storage.installSnapshot(snapshot);
            stateMachine.restore(snapshot.meta(), snapshot.data());
            lastAppliedId = snapshot.meta().lastIncluded();
            appliedMembership = snapshot.membership();
            snapshots.installed(snapshot.index());
            log.info("Node {} installed snapshot at {}", nodeId, snapshot.meta().lastIncluded());
        }

        var entries = persist.entries();
        if (!entries.isEmpty()) {
            var raftLog = storage.log();
            long first = entries.get(0).index();
            if (first <= raftLog.lastIndex()) {
                log.debug("Node {} truncating log after {}", nodeId, first - 1);
                raftLog.truncateAfter(first - 1);
            }
            raftLog.append(entries);
        }

        if (persist.hardState() != null) {
            storage.saveHardState(persist.hardState());
        }
        if (persist.mustSync()) {
            storage.sync();
        }

        var persisted = persist.lastLogId();
        if (persisted != null) {
            events.offer(new RaftEvent.Persisted(persisted));
        }
    }

    private void apply(Ready.Apply apply) {
        for (var entry : apply.entries()) {
            R result = null;
            if (entry instanceof LogEntry.Data data) {
                result = stateMachine.apply(data.id(), data.command());
            }
            requests.applied(entry, result);
            lastAppliedId = entry.id();
        }

        for (var change : apply.membershipChanges()) {
            appliedMembership = change.current();
            log.info("Node {} applied membership {} at index {}", nodeId, change.current(), change.index());
        }

        for (var readState : apply.readStates()) {
            requests.readReady(readState.requestId(), readState.index());
        }
        for (var query : requests.readsUpTo(lastAppliedId.index())) {
            try {
                requests.completeRead(query.requestId(), stateMachine.read(query.query()));
            } catch (RuntimeException e) {
                requests.fail(query.requestId(), e);
            }
        }

        if (!apply.entries().isEmpty()) {
            events.offer(new RaftEvent.Applied(lastAppliedId.index()));
            snapshots.maybeSnapshot(lastAppliedId, appliedMembership, stateMachine::snapshot);
        }
    }

    private void reconcileStreams(Status current) {
        if (leading && !current.isLeader()) {
            cancelStreams();
            return;
        }
        var members = current.membership().members();
        streams.values().removeIf(stream -> {
            if (members.contains(stream.peer())) {
                return false;
            }
            log.debug("Node {} dropping stream to removed member {}", nodeId, stream.peer());
            stream.cancel();
            return true;
        });
    }

    private ReplicationStream stream(String peer) {
        return streams.computeIfAbsent(peer,
            p -> new ReplicationStream(nodeId, p, transport, rpcTimeout, events::offer));
    }

    private void cancelStreams() {
        streams.values().forEach(ReplicationStream::cancel);
        streams.clear();
    }

    private void completeRpc(String to, RaftMessage.Response response) {
        Class<? extends RaftMessage.Request> requestType;
        if (response instanceof RaftMessage.AppendEntriesResponse) {
            requestType = RaftMessage.AppendEntries.class;
        } else if (response instanceof RaftMessage.RequestVoteResponse) {
            requestType = RaftMessage.RequestVote.class;
        } else {
            requestType = RaftMessage.InstallSnapshot.class;
        }

        var queue = pendingRpcs.get(new RpcKey(to, requestType));
        if (queue != null) {
            var future = queue.pollFirst();
            if (future != null) {
                future.complete(response);
            }
        }
    }

    private void failPendingRpcs(RaftException error) {
        for (var queue : pendingRpcs.values()) {
            CompletableFuture<RaftMessage.Response> future;
            while ((future = queue.pollFirst()) != null) {
                future.completeExceptionally(error);
            }
        }
    }

    private synchronized void fail(Throwable cause) {
        if (failure != null || !running) {
            return;
        }
        failure = cause;
        running = false;
        log.error("Node {} stopped after fatal error", nodeId, cause);

        var error = new RaftException.StorageFailure(cause);
        eventLoop.interrupt();
        ticker.shutdownNow();
        pipeline.shutdown();
        cancelStreams();
        requests.failAll(error);
        failPendingRpcs(error);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (!running && failure == null && !eventLoop.isAlive()) {
                return;
            }
            running = false;
        }
        eventLoop.interrupt();
        ticker.shutdownNow();
        pipeline.shutdown();

        try {
            eventLoop.join(TimeUnit.SECONDS.toMillis(5));
            pipeline.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        cancelStreams();
        snapshots.close();
        var stopped = new RaftException.Stopped();
        requests.failAll(stopped);
        failPendingRpcs(stopped);
        transport.close();
        storage.close();
        log.info("Node {} closed", nodeId);
    }

    static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            var thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    public static final class Builder<R> {
        private String nodeId;
        private Membership membership;
        private RaftConfig config;
        private RaftTransport transport;
        private RaftStorage storage;
        private StateMachine<R> stateMachine;
        private Duration tickInterval = Duration.ofMillis(10);
        private Duration rpcTimeout = Duration.ofMillis(500);
        private Duration writeTimeout = Duration.ofSeconds(5);
        private int maxPendingRequests = 1024;
        private IntUnaryOperator random;

        private Builder() {}

        public Builder<R> nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        /** Bootstrap membership. A stored snapshot and configuration entries in the log take precedence. */
        public Builder<R> membership(Membership membership) {
            this.membership = membership;
            return this;
        }

        public Builder<R> config(RaftConfig config) {
            this.config = config;
            return this;
        }

        public Builder<R> transport(RaftTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder<R> storage(RaftStorage storage) {
            this.storage = storage;
            return this;
        }

        public Builder<R> stateMachine(StateMachine<R> stateMachine) {
            this.stateMachine = stateMachine;
            return this;
        }

        public Builder<R> tickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder<R> rpcTimeout(Duration rpcTimeout) {
            this.rpcTimeout = rpcTimeout;
            return this;
        }

        public Builder<R> writeTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder<R> maxPendingRequests(int maxPendingRequests) {
            this.maxPendingRequests = maxPendingRequests;
            return this;
        }

        public Builder<R> random(IntUnaryOperator random) {
            this.random = random;
            return this;
        }

        public RaftNode<R> build() {
            if (nodeId == null) throw new IllegalStateException("nodeId is required");
            if (transport == null) throw new IllegalStateException("transport is required");
            if (storage == null) throw new IllegalStateException("storage is required");
            if (stateMachine == null) throw new IllegalStateException("stateMachine is required");
            if (tickInterval.toMillis() <= 0) throw new IllegalStateException("tickInterval must be at least 1ms");
            if (maxPendingRequests <= 0) throw new IllegalStateException("maxPendingRequests must be positive");
            if (config == null) config = RaftConfig.defaults();
            if (random == null) random = bound -> ThreadLocalRandom.current().nextInt(bound);

            var initialState = storage.initialState();
            var effectiveMembership = membership != null ? membership : initialState.membership();
            var snapshot = storage.snapshot();
            if (effectiveMembership == null && snapshot.isEmpty()) {
                throw new IllegalStateException("membership is required (either from storage or builder)");
            }

            var raft = new Raft(nodeId, effectiveMembership, config, storage, random);

            var lastApplied = LogId.ZERO;
            var appliedMembership = effectiveMembership;
            if (snapshot.isPresent()) {
                var snap = snapshot.get();
                stateMachine.restore(snap.meta(), snap.data());
                lastApplied = snap.meta().lastIncluded();
                appliedMembership = snap.membership();
            }

            return new RaftNode<>(this, raft, lastApplied, appliedMembership);
        }
    }
}
