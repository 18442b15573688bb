package io.ballot.benchmark;

import io.ballot.raft.Membership;
import org.openjdk.jmh.annotations.*;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
public class QuorumIndexBenchmark {

    @Param({"3", "5", "7"})
    private int voters;

    private Membership plain;
    private Membership joint;
    private Map<String, Long> matchIndex;

    @Setup(Level.Trial)
    public void setup() {
        Set<String> current = new HashSet<>();
        Set<String> target = new HashSet<>();
        matchIndex = new HashMap<>();
        for (int i = 0; i < voters; i++) {
            current.add("node-" + i);
            target.add("node-" + (i + voters / 2 + 1));
        }
        for (int i = 0; i < voters * 2; i++) {
            matchIndex.put("node-" + i, ThreadLocalRandom.current().nextLong(1_000_000));
        }
        plain = new Membership(current, Set.of());
        joint = plain.enterJoint(new Membership(target, Set.of()));
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long quorumIndexPlain() {
        return plain.quorumIndex(matchIndex);
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long quorumIndexJoint() {
        return joint.quorumIndex(matchIndex);
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public boolean hasQuorumJoint() {
        return joint.hasQuorum(matchIndex.keySet());
    }
}
