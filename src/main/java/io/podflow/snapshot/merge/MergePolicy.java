package io.podflow.snapshot.merge;

/**
 * How far a merged, globally ranked match list may grow.
 */
public enum MergePolicy {
    /** Keep at most the caller's top-k; shorter when the union of shard answers is shorter. */
    TRUNCATE_TO_TOP_K,
    /** Keep every match every shard returned. */
    UNION
}
