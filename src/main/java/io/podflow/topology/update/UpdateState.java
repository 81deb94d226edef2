package io.podflow.topology.update;

/**
 * @param replicaIndex {@code -1} while {@link UpdatePhase#IDLE}
 */
public record UpdateState(UpdatePhase phase, int replicaIndex) {
    public static final UpdateState IDLE = new UpdateState(UpdatePhase.IDLE, -1);
}
