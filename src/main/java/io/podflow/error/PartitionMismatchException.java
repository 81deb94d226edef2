package io.podflow.error;

/**
 * A snapshot import asked for a shard the manifest does not describe, or an artifact
 * disagrees with the manifest it was written with.
 */
public class PartitionMismatchException extends PodflowException {

    public PartitionMismatchException(final String message) {
        super(message);
    }
}
