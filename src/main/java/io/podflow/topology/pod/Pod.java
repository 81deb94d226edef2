package io.podflow.topology.pod;

import io.podflow.config.impl.StageConfig;
import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.error.PodflowException;
import io.podflow.error.ShardTimeoutException;
import io.podflow.topology.group.Replica;
import io.podflow.topology.group.ReplicaGroup;
import io.podflow.topology.group.ShardGroup;
import io.podflow.topology.group.ShardGroupFactory;
import io.podflow.topology.wiring.Endpoint;
import io.podflow.topology.worker.Worker;
import io.podflow.unit.ScanRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Externally addressable stage. However many replicas and shards sit inside, a pod has
 * one endpoint, and that endpoint does not change while replicas are replaced.
 */
@Slf4j
@Getter
public final class Pod {
    private final String name;
    private final StageConfig stage;
    private final Endpoint endpoint;
    private final ReplicaGroup replicaGroup;
    private final ShardGroupFactory shardGroupFactory;

    public Pod(final StageConfig stage,
               final Endpoint endpoint,
               final ReplicaGroup replicaGroup,
               final ShardGroupFactory shardGroupFactory) {
        this.name = stage.name();
        this.stage = stage;
        this.endpoint = endpoint;
        this.replicaGroup = replicaGroup;
        this.shardGroupFactory = shardGroupFactory;
    }

    /**
     * Endpoint of the unit that receives on the pod's in-port: the replica head, else the
     * shard head of the only replica, else the only worker.
     */
    public Endpoint headEndpoint() {
        if (replicaGroup.getHead() != null) return replicaGroup.getHead().getEndpoint();
        final ShardGroup shards = replicaGroup.replica(0).shards();
        return shards.getHead() != null ? shards.getHead().getEndpoint() : shards.getWorkers().get(0).getEndpoint();
    }

    /**
     * Endpoint of the unit that emits on the pod's out-port.
     */
    public Endpoint tailEndpoint() {
        if (replicaGroup.getTail() != null) return replicaGroup.getTail().getEndpoint();
        final ShardGroup shards = replicaGroup.replica(0).shards();
        return shards.getTail() != null ? shards.getTail().getEndpoint() : shards.getWorkers().get(0).getEndpoint();
    }

    public int numUnits() {
        return replicaGroup.unitCount();
    }

    public CompletableFuture<Void> start() {
        return replicaGroup.start();
    }

    public void stop(final long timeoutMillis) {
        replicaGroup.stop(timeoutMillis);
    }

    public CompletableFuture<Response> handle(final Request request) {
        return replicaGroup.handle(request);
    }

    /**
     * Fresh, unstarted shard group for a replica, built from the stage config.
     */
    public ShardGroup newShardGroup(final int replicaIndex) {
        return shardGroupFactory.create(replicaIndex);
    }

    /**
     * Scans every shard of one selectable replica and returns the records in shard order,
     * first occurrence of an id winning. The scan holds an admission on the replica, so a
     * rolling update waits for it for up to the drain timeout. A scan still running when
     * that timeout expires may see its replica stopped underneath it.
     *
     * @param timeoutMillis total budget; {@code <= 0} waits indefinitely
     */
    public List<ScanRecord> fullScan(final ExecutorService executor, final long timeoutMillis) {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);

        for (final int idx : replicaGroup.currentView().active()) {
            final Replica replica = replicaGroup.replica(idx);
            if (!replica.tryAcquire()) continue;
            try {
                return scanReplica(replica, executor, timeoutMillis, deadline);
            } finally {
                replica.release();
            }
        }
        throw new ShardTimeoutException(name, -1, -1, "no replica available for a full scan");
    }

    private List<ScanRecord> scanReplica(final Replica replica,
                                         final ExecutorService executor,
                                         final long timeoutMillis,
                                         final long deadline) {
        final Map<String, ScanRecord> seen = new LinkedHashMap<>();
        final List<Worker> workers = replica.shards().getWorkers();

        for (final Worker worker : workers) {
            final int shard = worker.getContext().shardIndex();
            final Future<List<ScanRecord>> scan = executor.submit(worker::fullScan);
            final List<ScanRecord> records;
            try {
                if (timeoutMillis > 0) {
                    records = scan.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } else {
                    records = scan.get();
                }
            } catch (final TimeoutException e) {
                scan.cancel(true);
                throw new ShardTimeoutException(name, replica.getIndex(), shard,
                        "full scan did not finish within " + timeoutMillis + " ms", e);
            } catch (final ExecutionException e) {
                if (e.getCause() instanceof RuntimeException re) throw re;
                throw new PodflowException("full scan of " + worker.name() + " failed", e.getCause());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PodflowException("interrupted while scanning " + worker.name(), e);
            }

            for (final ScanRecord r : records) {
                seen.putIfAbsent(r.id(), r);
            }
        }

        log.info("Scanned {} records from {}/replica-{} across {} shards", seen.size(), name, replica.getIndex(), workers.size());
        return new ArrayList<>(seen.values());
    }
}
