package io.podflow.core.model;

/**
 * A member that failed during a broadcast write. Writes are not rolled back;
 * the failure is reported on the response instead.
 *
 * @param replicaIndex {@code -1} when the failure is not tied to a replica
 * @param shardIndex   {@code -1} when the failure is not tied to a shard
 */
public record UnitFailure(String podName, int replicaIndex, int shardIndex, String message) {
}
