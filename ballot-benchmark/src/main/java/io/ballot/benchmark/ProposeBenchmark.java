package io.ballot.benchmark;

import io.ballot.raft.Raft;
import io.ballot.raft.RaftConfig;
import io.ballot.raft.RaftEvent;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class ProposeBenchmark {

    private static final int BATCH = 100;

    @Param({"1", "3", "5"})
    private int clusterSize;

    @Param({"100", "1024"})
    private int payloadSize;

    private LocalCluster cluster;
    private String leaderId;
    private byte[] payload;
    private long requestId;

    @Setup(Level.Iteration)
    public void setup() {
        var defaults = RaftConfig.defaults();
        var config = new RaftConfig(
            defaults.electionTimeoutMin(),
            defaults.electionTimeoutMax(),
            defaults.heartbeatInterval(),
            defaults.maxEntriesPerAppend(),
            defaults.maxBackoffTicks(),
            Long.MAX_VALUE,
            Long.MAX_VALUE,
            defaults.snapshotChunkSize(),
            defaults.readPolicy(),
            defaults.leaseTicks()
        );
        cluster = new LocalCluster(clusterSize, config);
        Raft leader = cluster.elect();
        leaderId = leader.id();
        payload = new byte[payloadSize];
        ThreadLocalRandom.current().nextBytes(payload);
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.SECONDS)
    @OperationsPerInvocation(BATCH)
    public long proposeAndCommit() {
        for (int i = 0; i < BATCH; i++) {
            cluster.step(leaderId, new RaftEvent.Propose(++requestId, payload));
        }
        cluster.drain();
        return cluster.applied();
    }
}
