package io.podflow.topology.update;

import io.podflow.error.RollingUpdateException;
import io.podflow.topology.group.Replica;
import io.podflow.topology.group.ReplicaGroup;
import io.podflow.topology.group.ShardGroup;
import io.podflow.topology.pod.Pod;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replaces the replicas of a running pod one at a time while the remaining replicas
 * keep serving. Updates of one pod are serialized; different pods update independently.
 */
@Slf4j
public final class RollingUpdateOrchestrator {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, UpdateState> states = new ConcurrentHashMap<>();
    @Getter
    private final long drainTimeoutMillis;
    @Getter
    private final long readinessTimeoutMillis;
    private final long stopTimeoutMillis;

    public RollingUpdateOrchestrator(final long drainTimeoutMillis,
                                     final long readinessTimeoutMillis,
                                     final long stopTimeoutMillis) {
        this.drainTimeoutMillis = drainTimeoutMillis;
        this.readinessTimeoutMillis = readinessTimeoutMillis;
        this.stopTimeoutMillis = stopTimeoutMillis;
    }

    public UpdateState state(final String podName) {
        return states.getOrDefault(podName, UpdateState.IDLE);
    }

    /**
     * Blocks until every replica of the pod has been replaced.
     *
     * @throws RollingUpdateException if a fresh replica is not ready within the readiness
     *                                timeout; that replica stays out of rotation
     */
    public void rollingUpdate(final Pod pod) {
        final ReentrantLock lock = locks.computeIfAbsent(pod.getName(), k -> new ReentrantLock());
        lock.lock();
        try {
            final ReplicaGroup group = pod.getReplicaGroup();
            log.info("Rolling update of {} over {} replicas", pod.getName(), group.size());
            for (int i = 0; i < group.size(); i++) {
                cycle(pod, group, i);
            }
            log.info("Rolling update of {} finished", pod.getName());
        } finally {
            states.put(pod.getName(), UpdateState.IDLE);
            lock.unlock();
        }
    }

    private void cycle(final Pod pod, final ReplicaGroup group, final int index) {
        final String podName = pod.getName();
        final Replica replica = group.replica(index);

        transition(podName, UpdatePhase.DRAINING, index);
        group.exclude(index);
        replica.stopAccepting();
        if (!replica.awaitDrained(drainTimeoutMillis)) {
            log.warn("{}/replica-{} still had {} calls in flight after {} ms, restarting anyway",
                    podName, index, replica.inFlight(), drainTimeoutMillis);
        }

        transition(podName, UpdatePhase.RESTARTING, index);
        final ShardGroup fresh = pod.newShardGroup(index);
        replica.swap(fresh).stop(stopTimeoutMillis);

        transition(podName, UpdatePhase.WARMING, index);
        try {
            fresh.start().get(readinessTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            fresh.stop(stopTimeoutMillis);
            throw new RollingUpdateException(podName, index,
                    "not ready within " + readinessTimeoutMillis + " ms", e);
        } catch (final ExecutionException | CompletionException e) {
            fresh.stop(stopTimeoutMillis);
            throw new RollingUpdateException(podName, index, "start failed: " + e.getCause(), e.getCause());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            fresh.stop(stopTimeoutMillis);
            throw new RollingUpdateException(podName, index, "interrupted while warming", e);
        }

        replica.resumeAccepting();
        group.include(index);
        log.info("{}/replica-{} replaced", podName, index);
    }

    private void transition(final String podName, final UpdatePhase phase, final int index) {
        states.put(podName, new UpdateState(phase, index));
        log.debug("{}: {} replica {}", podName, phase, index);
    }
}
