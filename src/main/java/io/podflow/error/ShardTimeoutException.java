package io.podflow.error;

import lombok.Getter;

/**
 * A shard or replica did not answer within the call deadline.
 * Index fields are {@code -1} when the failing unit is not a single replica or shard.
 */
@Getter
public class ShardTimeoutException extends PodflowException {
    private final String podName;
    private final int replicaIndex;
    private final int shardIndex;

    public ShardTimeoutException(final String podName, final int replicaIndex, final int shardIndex, final String message) {
        this(podName, replicaIndex, shardIndex, message, null);
    }

    public ShardTimeoutException(final String podName,
                                 final int replicaIndex,
                                 final int shardIndex,
                                 final String message,
                                 final Throwable cause) {
        super(podName + "[replica=" + replicaIndex + ", shard=" + shardIndex + "]: " + message, cause);
        this.podName = podName;
        this.replicaIndex = replicaIndex;
        this.shardIndex = shardIndex;
    }
}
