package io.podflow.topology.group.selection.impl;

import io.podflow.topology.group.Replica;
import io.podflow.topology.group.selection.SelectionPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through the selectable replicas so every one of them receives a share of the
 * requests.
 */
public final class RoundRobinSelection implements SelectionPolicy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public int select(final List<Replica> candidates) {
        return Math.floorMod(counter.getAndIncrement(), candidates.size());
    }
}
