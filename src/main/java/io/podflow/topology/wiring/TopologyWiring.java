package io.podflow.topology.wiring;

import java.util.List;

/**
 * Complete port assignment of a pipeline. The gateway receives on the last link and
 * emits on the first one.
 */
public record TopologyWiring(Endpoint gateway, List<PodWiring> pods) {
    public TopologyWiring {
        pods = List.copyOf(pods);
    }
}
