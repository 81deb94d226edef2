package io.podflow.error;

/**
 * The endpoint allocator could not produce a wiring in which every unit's out-port
 * equals its successor's in-port.
 */
public class WiringException extends PodflowException {

    public WiringException(final String message) {
        super(message);
    }
}
