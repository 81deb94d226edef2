package io.podflow.topology.wiring;

import java.util.List;

/**
 * Ports of one replica. {@code shardHead}/{@code shardTail} are {@code null} for a
 * single-shard replica, whose only worker then carries the replica endpoint itself.
 */
public record ReplicaWiring(int replicaIndex,
                            Endpoint endpoint,
                            Endpoint shardHead,
                            Endpoint shardTail,
                            List<Endpoint> workers) {
    public ReplicaWiring {
        workers = List.copyOf(workers);
    }

    public boolean hasRoutingUnits() {
        return shardHead != null;
    }
}
