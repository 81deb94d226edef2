package io.podflow.error;

import lombok.Getter;

/**
 * A replica did not come back within its readiness timeout. The pod keeps serving
 * from its remaining replicas; the failed one stays out of rotation.
 */
@Getter
public class RollingUpdateException extends PodflowException {
    private final String podName;
    private final int replicaIndex;

    public RollingUpdateException(final String podName, final int replicaIndex, final String message, final Throwable cause) {
        super("rolling update of " + podName + "/replica-" + replicaIndex + " failed: " + message, cause);
        this.podName = podName;
        this.replicaIndex = replicaIndex;
    }
}
