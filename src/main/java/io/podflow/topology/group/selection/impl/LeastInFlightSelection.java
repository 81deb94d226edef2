package io.podflow.topology.group.selection.impl;

import io.podflow.topology.group.Replica;
import io.podflow.topology.group.selection.SelectionPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prefers the replica with the fewest calls in flight; ties rotate so idle groups still
 * spread their load.
 */
public final class LeastInFlightSelection implements SelectionPolicy {

    private final AtomicInteger tieBreaker = new AtomicInteger(0);

    @Override
    public int select(final List<Replica> candidates) {
        final int n = candidates.size();
        final int offset = Math.floorMod(tieBreaker.getAndIncrement(), n);

        int best = offset;
        int bestLoad = Integer.MAX_VALUE;
        for (int i = 0; i < n; i++) {
            final int idx = (offset + i) % n;
            final int load = candidates.get(idx).inFlight();
            if (load < bestLoad) {
                bestLoad = load;
                best = idx;
            }
        }
        return best;
    }
}
