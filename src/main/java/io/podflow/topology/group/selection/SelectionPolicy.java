package io.podflow.topology.group.selection;

import io.podflow.topology.group.Replica;

import java.util.List;

/**
 * Picks the replica that serves a request. Implementations only ever see replicas that
 * are currently selectable.
 */
public interface SelectionPolicy {
    /**
     * @param candidates non-empty list of selectable replicas, in replica-index order
     * @return position in {@code candidates} of the chosen replica
     */
    int select(List<Replica> candidates);
}
