package io.podflow.topology.wiring;

import java.util.List;

/**
 * Ports of one pod. {@code head}/{@code tail} are {@code null} when the pod has a
 * single replica.
 */
public record PodWiring(String podName,
                        Endpoint endpoint,
                        Endpoint head,
                        Endpoint tail,
                        List<ReplicaWiring> replicas) {
    public PodWiring {
        replicas = List.copyOf(replicas);
    }

    public boolean hasRoutingUnits() {
        return head != null;
    }
}
