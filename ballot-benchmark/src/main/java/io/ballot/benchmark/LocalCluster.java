package io.ballot.benchmark;

import io.ballot.raft.InMemoryStorage;
import io.ballot.raft.LogEntry;
import io.ballot.raft.Membership;
import io.ballot.raft.Raft;
import io.ballot.raft.RaftConfig;
import io.ballot.raft.RaftEvent;
import io.ballot.raft.Ready;

import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Drives a set of {@link Raft} cores in one thread, delivering every
 * message synchronously until the cluster goes quiet.
 */
final class LocalCluster {
    private record Delivery(String from, Ready.Outbound outbound) {}

    private final Map<String, Raft> nodes = new LinkedHashMap<>();
    private final Map<String, InMemoryStorage> storages = new LinkedHashMap<>();
    private final Queue<Delivery> inflight = new ArrayDeque<>();
    private long applied;

    LocalCluster(int size, RaftConfig config) {
        var ids = new String[size];
        for (int i = 0; i < size; i++) {
            ids[i] = "node-" + i;
        }
        var membership = Membership.ofVoters(ids);
        for (int i = 0; i < size; i++) {
            var storage = new InMemoryStorage(membership);
            int jitter = i;
            storages.put(ids[i], storage);
            nodes.put(ids[i], new Raft(ids[i], membership, config, storage, bound -> jitter % bound));
        }
    }

    Raft elect() {
        for (int round = 0; round < 1_000; round++) {
            for (String id : nodes.keySet()) {
                step(id, new RaftEvent.Tick());
            }
            drain();
            for (Raft raft : nodes.values()) {
                if (raft.isLeader() && raft.commitIndex() >= raft.lastLogId().index()) {
                    return raft;
                }
            }
        }
        throw new IllegalStateException("no leader elected");
    }

    void step(String id, RaftEvent event) {
        var ready = nodes.get(id).step(event);
        var storage = storages.get(id);
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
        for (Ready.Outbound outbound : ready.messages()) {
            inflight.add(new Delivery(id, outbound));
        }
        if (persist.lastLogId() != null) {
            step(id, new RaftEvent.Persisted(persist.lastLogId()));
        }
        List<LogEntry> entries = ready.apply().entries();
        if (!entries.isEmpty()) {
            applied += entries.size();
            step(id, new RaftEvent.Applied(entries.get(entries.size() - 1).index()));
        }
    }

    void drain() {
        Delivery delivery;
        while ((delivery = inflight.poll()) != null) {
            step(delivery.outbound().to(), new RaftEvent.Receive(delivery.from(), delivery.outbound().message()));
        }
    }

    long applied() {
        return applied;
    }
}
