package io.ballot.raft;

import java.util.Set;

public sealed interface ConfigChange {

    record AddLearner(String nodeId) implements ConfigChange {
        public AddLearner {
            requireNodeId(nodeId);
        }
    }

    record PromoteVoter(String nodeId) implements ConfigChange {
        public PromoteVoter {
            requireNodeId(nodeId);
        }
    }

    record DemoteToLearner(String nodeId) implements ConfigChange {
        public DemoteToLearner {
            requireNodeId(nodeId);
        }
    }

    record RemoveNode(String nodeId) implements ConfigChange {
        public RemoveNode {
            requireNodeId(nodeId);
        }
    }

    /**
     * Replaces the whole voter set; nodes dropped from it leave the cluster.
     */
    record ChangeVoters(Set<String> voters) implements ConfigChange {
        public ChangeVoters {
            if (voters == null || voters.isEmpty()) {
                throw new IllegalArgumentException("voters must not be empty");
            }
            voters.forEach(ConfigChange::requireNodeId);
            voters = Set.copyOf(voters);
        }
    }

    private static void requireNodeId(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be null or blank");
        }
    }
}
