package io.podflow.topology;

import io.podflow.config.impl.PipelineConfig;
import io.podflow.config.impl.StageConfig;
import io.podflow.error.ConfigurationException;
import io.podflow.snapshot.merge.MatchMerger;
import io.podflow.topology.group.Replica;
import io.podflow.topology.group.ReplicaGroup;
import io.podflow.topology.group.ShardGroup;
import io.podflow.topology.group.ShardGroupFactory;
import io.podflow.topology.group.selection.SelectionPolicy;
import io.podflow.topology.group.selection.impl.RoundRobinSelection;
import io.podflow.topology.pod.Gateway;
import io.podflow.topology.pod.Pod;
import io.podflow.topology.routing.RoutingRole;
import io.podflow.topology.routing.RoutingUnit;
import io.podflow.topology.update.RollingUpdateOrchestrator;
import io.podflow.topology.wiring.EndpointAllocator;
import io.podflow.topology.wiring.PodWiring;
import io.podflow.topology.wiring.ReplicaWiring;
import io.podflow.topology.wiring.TopologyWiring;
import io.podflow.topology.wiring.WiringVerifier;
import io.podflow.topology.worker.Worker;
import io.podflow.unit.ProcessingUnitFactory;
import io.podflow.unit.UnitContext;
import io.podflow.unit.registry.ProcessingUnitRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Turns a {@link PipelineConfig} into an unstarted {@link Topology}. Every stage is
 * validated before a single port is allocated.
 */
@Slf4j
public final class TopologyBuilder {
    private final ProcessingUnitRegistry registry;
    private final Supplier<SelectionPolicy> selectionPolicy;

    public TopologyBuilder(final ProcessingUnitRegistry registry) {
        this(registry, RoundRobinSelection::new);
    }

    /**
     * @param selectionPolicy one policy instance is created per replica group
     */
    public TopologyBuilder(final ProcessingUnitRegistry registry, final Supplier<SelectionPolicy> selectionPolicy) {
        this.registry = registry;
        this.selectionPolicy = selectionPolicy;
    }

    public Topology build(final PipelineConfig config) {
        validate(config.getStages());

        final TopologyWiring wiring = new EndpointAllocator(config.getPortRangeStart(), config.getPortRangeEnd())
                .allocate(config.getStages());
        WiringVerifier.verify(wiring);

        final MatchMerger merger = new MatchMerger(config.getMergePolicy());
        final List<Pod> pods = new ArrayList<>(config.getStages().size());
        for (int i = 0; i < config.getStages().size(); i++) {
            pods.add(buildPod(config, config.getStages().get(i), wiring.pods().get(i), merger));
        }

        final RollingUpdateOrchestrator orchestrator = new RollingUpdateOrchestrator(
                config.getDrainTimeoutMillis(), config.getReadinessTimeoutMillis(), config.getCallTimeoutMillis());

        final Topology topology = new Topology(config, wiring, new Gateway(wiring.gateway()), pods, orchestrator);
        log.info("Built topology of {} pods and {} units", pods.size(), topology.numUnits());
        return topology;
    }

    private void validate(final List<StageConfig> stages) {
        final Set<String> names = new HashSet<>();
        for (final StageConfig s : stages) {
            if (s.name() == null || s.name().isBlank()) {
                throw new ConfigurationException("every stage needs a name");
            }
            if (Gateway.NAME.equals(s.name())) {
                throw new ConfigurationException("stage name '" + Gateway.NAME + "' is reserved");
            }
            if (!names.add(s.name())) {
                throw new ConfigurationException("duplicate stage name " + s.name());
            }
            if (s.replicas() < 1) {
                throw new ConfigurationException(s.name() + ": replicas must be >= 1, got " + s.replicas());
            }
            if (s.shards() < 1) {
                throw new ConfigurationException(s.name() + ": shards must be >= 1, got " + s.shards());
            }
            if (!registry.contains(s.effectiveUses())) {
                throw new ConfigurationException(s.name() + ": unknown unit '" + s.effectiveUses()
                        + "', registered units are " + registry.listUnits());
            }
        }
    }

    private Pod buildPod(final PipelineConfig config,
                         final StageConfig stage,
                         final PodWiring wiring,
                         final MatchMerger merger) {
        final ProcessingUnitFactory factory = registry.factory(stage.effectiveUses());
        final ShardGroupFactory shardGroups = replicaIndex ->
                buildShardGroup(config, stage, wiring.replicas().get(replicaIndex), factory, merger);

        final List<Replica> replicas = new ArrayList<>(stage.replicas());
        for (int r = 0; r < stage.replicas(); r++) {
            replicas.add(new Replica(r, shardGroups.create(r)));
        }

        RoutingUnit head = null;
        RoutingUnit tail = null;
        if (wiring.hasRoutingUnits()) {
            final List<ReplicaWiring> members = wiring.replicas();
            head = new RoutingUnit(stage.name() + "/head", RoutingRole.HEAD, wiring.head(),
                    members.stream().map(ReplicaWiring::endpoint).toList());
            tail = new RoutingUnit(stage.name() + "/tail", RoutingRole.TAIL, wiring.tail(),
                    members.stream().map(ReplicaWiring::endpoint).toList());
        }

        final ReplicaGroup group = new ReplicaGroup(stage.name(), wiring.endpoint(), replicas, head, tail,
                selectionPolicy.get(), config.getCallTimeoutMillis());
        return new Pod(stage, wiring.endpoint(), group, shardGroups);
    }

    private static ShardGroup buildShardGroup(final PipelineConfig config,
                                              final StageConfig stage,
                                              final ReplicaWiring wiring,
                                              final ProcessingUnitFactory factory,
                                              final MatchMerger merger) {
        final int r = wiring.replicaIndex();
        final List<Worker> workers = new ArrayList<>(stage.shards());
        for (int s = 0; s < stage.shards(); s++) {
            final UnitContext ctx = new UnitContext(stage.name(), r, s, stage.shards(),
                    UnitContext.workspaceFor(config.getWorkspace(), stage.name(), r, s), stage.params());
            workers.add(new Worker(ctx, wiring.workers().get(s), factory));
        }

        RoutingUnit head = null;
        RoutingUnit tail = null;
        if (wiring.hasRoutingUnits()) {
            final String prefix = stage.name() + "/replica-" + r;
            head = new RoutingUnit(prefix + "/head", RoutingRole.HEAD, wiring.shardHead(), wiring.workers());
            tail = new RoutingUnit(prefix + "/tail", RoutingRole.TAIL, wiring.shardTail(), wiring.workers());
        }
        return new ShardGroup(stage.name(), r, wiring.endpoint(), workers, head, tail, merger, config.getCallTimeoutMillis());
    }
}
