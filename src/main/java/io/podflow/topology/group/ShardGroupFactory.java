package io.podflow.topology.group;

/**
 * Builds the shard group of one replica from the stage config, with the replica's
 * wired endpoints. Used at build time and again for every restart.
 */
@FunctionalInterface
public interface ShardGroupFactory {
    ShardGroup create(int replicaIndex);
}
