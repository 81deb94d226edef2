package io.podflow.topology.wiring;

import io.podflow.error.WiringException;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks over a finished {@link TopologyWiring}: adjacent units chain, and
 * every group's head and tail carry the group's advertised ports.
 */
@UtilityClass
public class WiringVerifier {

    public void verify(final TopologyWiring wiring) {
        final List<Endpoint> chain = new ArrayList<>();
        chain.add(wiring.gateway());
        for (final PodWiring p : wiring.pods()) {
            chain.add(p.endpoint());
        }
        chain.add(wiring.gateway());

        for (int i = 0; i + 1 < chain.size(); i++) {
            final Endpoint up = chain.get(i);
            final Endpoint down = chain.get(i + 1);
            if (up.portOut() != down.portIn()) {
                throw new WiringException("unit " + i + " emits on " + up.portOut()
                        + " but unit " + (i + 1) + " receives on " + down.portIn());
            }
        }

        for (final PodWiring p : wiring.pods()) {
            verifyPod(p);
        }
    }

    private void verifyPod(final PodWiring pod) {
        final Endpoint replicaEndpoint;
        if (pod.hasRoutingUnits()) {
            requireGroupEdges(pod.podName(), pod.endpoint(), pod.head(), pod.tail());
            replicaEndpoint = new Endpoint(pod.head().portOut(), pod.tail().portIn());
        } else {
            if (pod.replicas().size() != 1) {
                throw new WiringException(pod.podName() + " has " + pod.replicas().size() + " replicas but no routing units");
            }
            replicaEndpoint = pod.endpoint();
        }

        for (final ReplicaWiring r : pod.replicas()) {
            final String name = pod.podName() + "/replica-" + r.replicaIndex();
            if (!r.endpoint().equals(replicaEndpoint)) {
                throw new WiringException(name + " is wired " + r.endpoint() + ", expected " + replicaEndpoint);
            }

            final Endpoint workerEndpoint;
            if (r.hasRoutingUnits()) {
                requireGroupEdges(name, r.endpoint(), r.shardHead(), r.shardTail());
                workerEndpoint = new Endpoint(r.shardHead().portOut(), r.shardTail().portIn());
            } else {
                if (r.workers().size() != 1) {
                    throw new WiringException(name + " has " + r.workers().size() + " shards but no routing units");
                }
                workerEndpoint = r.endpoint();
            }

            for (int s = 0; s < r.workers().size(); s++) {
                if (!r.workers().get(s).equals(workerEndpoint)) {
                    throw new WiringException(name + "/shard-" + s + " is wired " + r.workers().get(s)
                            + ", expected " + workerEndpoint);
                }
            }
        }
    }

    private void requireGroupEdges(final String name, final Endpoint group, final Endpoint head, final Endpoint tail) {
        if (head == null || tail == null) {
            throw new WiringException(name + " has only one of head and tail");
        }
        if (head.portIn() != group.portIn() || tail.portOut() != group.portOut()) {
            throw new WiringException(name + " head/tail " + head + " / " + tail + " do not carry group ports " + group);
        }
        if (head.portOut() == tail.portIn() || head.portOut() == group.portIn() || tail.portIn() == group.portOut()) {
            throw new WiringException(name + " reuses a port inside its routing units");
        }
    }
}
