package io.podflow.topology.wiring;

import io.podflow.config.impl.StageConfig;
import io.podflow.error.ConfigurationException;
import io.podflow.error.WiringException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns ports to every unit of a pipeline so that each unit's out-port is its
 * successor's in-port.
 * <p>
 * Allocation is deterministic. Explicit overrides are reserved first; then the
 * {@code n + 1} links gateway → pod0 → … → pod(n-1) → gateway receive a port each;
 * then, pod by pod, the replica head out-port and tail in-port (R &gt; 1), and for
 * each replica the shard head out-port and shard tail in-port (P &gt; 1).
 * </p>
 */
@Slf4j
public final class EndpointAllocator {
    private final int rangeStart;
    private final int rangeEnd;

    public EndpointAllocator(final int rangeStart, final int rangeEnd) {
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    public TopologyWiring allocate(final List<StageConfig> stages) {
        final int n = stages.size();
        final Integer[] links = linkOverrides(stages);
        final PortAllocator ports = new PortAllocator(rangeStart, rangeEnd);

        for (final Integer link : links) {
            if (link != null) ports.reserve(link);
        }
        for (int i = 0; i <= n; i++) {
            if (links[i] == null) links[i] = ports.allocate();
        }

        final List<PodWiring> pods = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            pods.add(wirePod(stages.get(i), new Endpoint(links[i], links[i + 1]), ports));
        }

        final TopologyWiring wiring = new TopologyWiring(new Endpoint(links[n], links[0]), pods);
        log.debug("Allocated wiring {}", wiring);
        return wiring;
    }

    /**
     * Link {@code i} is the port between unit {@code i-1} and unit {@code i} of
     * gateway, pod0, …, pod(n-1), gateway.
     */
    private static Integer[] linkOverrides(final List<StageConfig> stages) {
        final int n = stages.size();
        final Set<Integer> ins = new HashSet<>();
        final Set<Integer> outs = new HashSet<>();

        for (final StageConfig s : stages) {
            if (s.portIn() != null && !ins.add(s.portIn())) {
                throw new ConfigurationException("port_in " + s.portIn() + " is claimed by more than one pod");
            }
            if (s.portOut() != null && !outs.add(s.portOut())) {
                throw new ConfigurationException("port_out " + s.portOut() + " is claimed by more than one pod");
            }
            if (s.portIn() != null && s.portIn().equals(s.portOut())) {
                throw new ConfigurationException("pod " + s.name() + " uses port " + s.portIn() + " as both port_in and port_out");
            }
        }

        final Integer[] links = new Integer[n + 1];
        final Map<Integer, Integer> linkOfPort = new HashMap<>();
        for (int i = 0; i <= n; i++) {
            final Integer upstream = i > 0 ? stages.get(i - 1).portOut() : null;
            final Integer downstream = i < n ? stages.get(i).portIn() : null;
            if (upstream != null && downstream != null && !upstream.equals(downstream)) {
                throw new WiringException("pod " + stages.get(i - 1).name() + " port_out " + upstream
                        + " cannot feed pod " + stages.get(i).name() + " port_in " + downstream);
            }
            links[i] = upstream != null ? upstream : downstream;
            if (links[i] != null) {
                final Integer other = linkOfPort.putIfAbsent(links[i], i);
                if (other != null) {
                    throw new ConfigurationException("port " + links[i] + " is used by two different links ("
                            + other + " and " + i + ")");
                }
            }
        }
        return links;
    }

    private static PodWiring wirePod(final StageConfig stage, final Endpoint podEndpoint, final PortAllocator ports) {
        final Endpoint head;
        final Endpoint tail;
        final Endpoint replicaEndpoint;

        if (stage.replicas() > 1) {
            head = new Endpoint(podEndpoint.portIn(), ports.allocate());
            tail = new Endpoint(ports.allocate(), podEndpoint.portOut());
            replicaEndpoint = new Endpoint(head.portOut(), tail.portIn());
        } else {
            head = null;
            tail = null;
            replicaEndpoint = podEndpoint;
        }

        final List<ReplicaWiring> replicas = new ArrayList<>(stage.replicas());
        for (int r = 0; r < stage.replicas(); r++) {
            replicas.add(wireReplica(r, stage.shards(), replicaEndpoint, ports));
        }
        return new PodWiring(stage.name(), podEndpoint, head, tail, replicas);
    }

    private static ReplicaWiring wireReplica(final int replicaIndex,
                                             final int shards,
                                             final Endpoint replicaEndpoint,
                                             final PortAllocator ports) {
        if (shards == 1) {
            return new ReplicaWiring(replicaIndex, replicaEndpoint, null, null, List.of(replicaEndpoint));
        }

        final Endpoint shardHead = new Endpoint(replicaEndpoint.portIn(), ports.allocate());
        final Endpoint shardTail = new Endpoint(ports.allocate(), replicaEndpoint.portOut());
        final Endpoint worker = new Endpoint(shardHead.portOut(), shardTail.portIn());

        final List<Endpoint> workers = new ArrayList<>(shards);
        for (int s = 0; s < shards; s++) {
            workers.add(worker);
        }
        return new ReplicaWiring(replicaIndex, replicaEndpoint, shardHead, shardTail, workers);
    }
}
