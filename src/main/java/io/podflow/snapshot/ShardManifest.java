package io.podflow.snapshot;

import io.podflow.error.PartitionMismatchException;

import java.util.List;

/**
 * How a snapshot's logical keyspace was divided, and which generation directory holds
 * the artifacts. Written last for a dump generation and never rewritten for it.
 */
public record ShardManifest(long generation, int shardCount, int totalRecords, List<ShardRange> ranges) {

    public ShardManifest(final long generation, final int shardCount, final int totalRecords, final List<ShardRange> ranges) {
        if (generation < 1) {
            throw new IllegalArgumentException("generation must be >= 1, was " + generation);
        }
        if (ranges == null || ranges.size() != shardCount) {
            throw new IllegalArgumentException("manifest must list exactly " + shardCount + " ranges");
        }
        this.generation = generation;
        this.shardCount = shardCount;
        this.totalRecords = totalRecords;
        this.ranges = List.copyOf(ranges);
    }

    public static ShardManifest of(final long generation, final int totalRecords, final int shardCount) {
        return new ShardManifest(generation, shardCount, totalRecords, ShardPartitioner.ranges(totalRecords, shardCount));
    }

    public ShardRange range(final int shardIndex) {
        if (shardIndex < 0 || shardIndex >= shardCount) {
            throw new PartitionMismatchException("shard " + shardIndex + " requested but manifest has shardCount=" + shardCount);
        }
        return ranges.get(shardIndex);
    }
}
