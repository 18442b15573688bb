package io.ballot.raft;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cluster membership: the voter set, the learner set and, while a voter
 * change is in progress, the outgoing voter set.
 *
 * <p>A membership with outgoing voters is <em>joint</em>: every quorum decision
 * then needs a majority of {@link #voters()} and, independently, a majority of
 * {@link #outgoingVoters()}. Learners never count towards a quorum.
 */
public record Membership(Set<String> voters, Set<String> learners, Set<String> outgoingVoters) {
    public Membership {
        if (voters == null || voters.isEmpty()) {
            throw new IllegalArgumentException("Must have at least one voter");
        }
        voters = Set.copyOf(voters);
        learners = learners == null ? Set.of() : Set.copyOf(learners);
        outgoingVoters = outgoingVoters == null ? Set.of() : Set.copyOf(outgoingVoters);
        if (!Collections.disjoint(voters, learners)) {
            throw new IllegalArgumentException("Node cannot be both voter and learner");
        }
    }

    public Membership(Set<String> voters, Set<String> learners) {
        this(voters, learners, Set.of());
    }

    public static Membership ofVoters(String... voters) {
        return new Membership(Set.of(voters), Set.of());
    }

    public boolean isJoint() {
        return !outgoingVoters.isEmpty();
    }

    public boolean isVoter(String id) {
        return voters.contains(id) || outgoingVoters.contains(id);
    }

    public boolean isLearner(String id) {
        return learners.contains(id) && !isVoter(id);
    }

    public boolean isMember(String id) {
        return isVoter(id) || learners.contains(id);
    }

    /**
     * Every node that must receive replication, in a stable order.
     */
    public Set<String> members() {
        var all = new TreeSet<>(voters);
        all.addAll(outgoingVoters);
        all.addAll(learners);
        return Collections.unmodifiableSet(all);
    }

    public Set<String> allVoters() {
        var all = new TreeSet<>(voters);
        all.addAll(outgoingVoters);
        return Collections.unmodifiableSet(all);
    }

    public boolean hasQuorum(Collection<String> granted) {
        if (!isMajority(voters, granted)) {
            return false;
        }
        return !isJoint() || isMajority(outgoingVoters, granted);
    }

    /**
     * The highest index acknowledged by a quorum, given each node's match
     * index. Nodes absent from the map count as index 0.
     */
    public long quorumIndex(Map<String, Long> matchIndex) {
        long index = majorityIndex(voters, matchIndex);
        if (isJoint()) {
            index = Math.min(index, majorityIndex(outgoingVoters, matchIndex));
        }
        return index;
    }

    public Membership enterJoint(Membership target) {
        if (isJoint()) {
            throw new IllegalStateException("Membership is already joint");
        }
        if (target.isJoint()) {
            throw new IllegalArgumentException("Target membership must not be joint");
        }
        return new Membership(target.voters(), target.learners(), voters);
    }

    public Membership leaveJoint() {
        if (!isJoint()) {
            throw new IllegalStateException("Membership is not joint");
        }
        return new Membership(voters, learners);
    }

    public boolean sameVoters(Membership other) {
        return voters.equals(other.voters) && outgoingVoters.equals(other.outgoingVoters);
    }

    public Membership apply(ConfigChange change) {
        if (isJoint()) {
            throw new IllegalStateException("Cannot change a joint membership");
        }
        if (change instanceof ConfigChange.AddLearner c) {
            return addLearner(c.nodeId());
        } else if (change instanceof ConfigChange.PromoteVoter c) {
            return promoteVoter(c.nodeId());
        } else if (change instanceof ConfigChange.DemoteToLearner c) {
            return demoteToLearner(c.nodeId());
        } else if (change instanceof ConfigChange.RemoveNode c) {
            return removeNode(c.nodeId());
        } else if (change instanceof ConfigChange.ChangeVoters c) {
            return changeVoters(c.voters());
        }
        throw new IllegalArgumentException("Unknown config change: " + change);
    }

    public Membership addLearner(String nodeId) {
        if (isMember(nodeId)) {
            throw new IllegalArgumentException("Node already a member: " + nodeId);
        }
        var newLearners = new HashSet<>(learners);
        newLearners.add(nodeId);
        return new Membership(voters, newLearners);
    }

    public Membership promoteVoter(String nodeId) {
        if (!learners.contains(nodeId)) {
            throw new IllegalArgumentException("Node must be a learner to promote: " + nodeId);
        }
        var newLearners = new HashSet<>(learners);
        newLearners.remove(nodeId);
        var newVoters = new HashSet<>(voters);
        newVoters.add(nodeId);
        return new Membership(newVoters, newLearners);
    }

    public Membership demoteToLearner(String nodeId) {
        if (!voters.contains(nodeId)) {
            throw new IllegalArgumentException("Node must be a voter to demote: " + nodeId);
        }
        if (voters.size() == 1) {
            throw new IllegalArgumentException("Cannot demote the last voter");
        }
        var newVoters = new HashSet<>(voters);
        newVoters.remove(nodeId);
        var newLearners = new HashSet<>(learners);
        newLearners.add(nodeId);
        return new Membership(newVoters, newLearners);
    }

    public Membership removeNode(String nodeId) {
        if (!isMember(nodeId)) {
            throw new IllegalArgumentException("Node not a member: " + nodeId);
        }
        if (voters.contains(nodeId) && voters.size() == 1) {
            throw new IllegalArgumentException("Cannot remove the last voter");
        }
        var newVoters = new HashSet<>(voters);
        newVoters.remove(nodeId);
        var newLearners = new HashSet<>(learners);
        newLearners.remove(nodeId);
        return new Membership(newVoters, newLearners);
    }

    public Membership changeVoters(Set<String> newVoters) {
        if (newVoters.isEmpty()) {
            throw new IllegalArgumentException("Must have at least one voter");
        }
        if (newVoters.equals(voters)) {
            throw new IllegalArgumentException("Voter set is unchanged: " + newVoters);
        }
        var newLearners = new HashSet<>(learners);
        newLearners.removeAll(newVoters);
        return new Membership(newVoters, newLearners);
    }

    private static boolean isMajority(Set<String> set, Collection<String> granted) {
        int count = 0;
        for (String id : set) {
            if (granted.contains(id)) {
                count++;
            }
        }
        return count >= set.size() / 2 + 1;
    }

    private static long majorityIndex(Set<String> set, Map<String, Long> matchIndex) {
        List<Long> matches = new ArrayList<>(set.size());
        for (String id : set) {
            matches.add(matchIndex.getOrDefault(id, 0L));
        }
        matches.sort(Collections.reverseOrder());
        return matches.get(set.size() / 2);
    }
}
