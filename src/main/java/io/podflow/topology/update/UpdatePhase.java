package io.podflow.topology.update;

/**
 * Phase of a pod's rolling update. Every phase but {@link #IDLE} refers to one replica.
 */
public enum UpdatePhase {
    IDLE,
    /** Out of selection; waiting for in-flight calls to finish. */
    DRAINING,
    /** Old workers torn down, fresh ones being built. */
    RESTARTING,
    /** Fresh workers starting; back in selection once they are ready. */
    WARMING
}
