package io.podflow.topology.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of the replicas eligible for selection. Every change produces a new
 * view with a higher version; readers never see a half-updated list.
 */
public record ReplicaView(long version, List<Integer> active) {

    public ReplicaView {
        active = List.copyOf(active);
    }

    public static ReplicaView allOf(final int replicas) {
        final List<Integer> all = new ArrayList<>(replicas);
        for (int i = 0; i < replicas; i++) all.add(i);
        return new ReplicaView(0L, all);
    }

    public boolean contains(final int replicaIndex) {
        return active.contains(replicaIndex);
    }

    public ReplicaView without(final int replicaIndex) {
        if (!contains(replicaIndex)) return this;
        final List<Integer> next = new ArrayList<>(active);
        next.remove(Integer.valueOf(replicaIndex));
        return new ReplicaView(version + 1, next);
    }

    public ReplicaView with(final int replicaIndex) {
        if (contains(replicaIndex)) return this;
        final List<Integer> next = new ArrayList<>(active);
        next.add(replicaIndex);
        Collections.sort(next);
        return new ReplicaView(version + 1, next);
    }
}
