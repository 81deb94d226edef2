package io.podflow.topology.group.selection;

import io.podflow.topology.group.Replica;
import io.podflow.topology.group.selection.impl.LeastInFlightSelection;
import io.podflow.topology.group.selection.impl.RoundRobinSelection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SelectionPolicyTest {

    private static List<Replica> replicas(final int n) {
        final List<Replica> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(new Replica(i, null));
        return out;
    }

    @Test
    void roundRobinCyclesThroughCandidates() {
        final SelectionPolicy policy = new RoundRobinSelection();
        final List<Replica> candidates = replicas(3);

        final List<Integer> picks = new ArrayList<>();
        for (int i = 0; i < 6; i++) picks.add(policy.select(candidates));
        assertEquals(List.of(0, 1, 2, 0, 1, 2), picks);
    }

    @Test
    void roundRobinAdaptsToAShrinkingCandidateList() {
        final SelectionPolicy policy = new RoundRobinSelection();
        for (int i = 0; i < 10; i++) {
            final int pick = policy.select(replicas(1 + i % 3));
            assertTrue(pick >= 0 && pick < 1 + i % 3);
        }
    }

    @Test
    void leastInFlightPrefersTheIdleReplica() {
        final SelectionPolicy policy = new LeastInFlightSelection();
        final List<Replica> candidates = replicas(3);
        candidates.get(0).tryAcquire();
        candidates.get(0).tryAcquire();
        candidates.get(2).tryAcquire();

        for (int i = 0; i < 5; i++) {
            assertEquals(1, policy.select(candidates));
        }
    }

    @Test
    void leastInFlightRotatesBetweenEquallyLoadedReplicas() {
        final SelectionPolicy policy = new LeastInFlightSelection();
        final List<Replica> candidates = replicas(2);
        assertEquals(0, policy.select(candidates));
        assertEquals(1, policy.select(candidates));
    }
}
