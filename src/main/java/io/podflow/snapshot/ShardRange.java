package io.podflow.snapshot;

/**
 * Contiguous, half-open slice {@code [start, end)} of the logical record order owned by one shard.
 */
public record ShardRange(int shardIndex, int start, int end) {
    public ShardRange {
        if (shardIndex < 0) throw new IllegalArgumentException("shardIndex must be >= 0");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    public int size() {
        return end - start;
    }
}
