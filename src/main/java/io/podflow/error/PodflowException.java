package io.podflow.error;

/**
 * Root of the failures raised by topology construction and operation.
 */
public class PodflowException extends RuntimeException {

    public PodflowException(final String message) {
        super(message);
    }

    public PodflowException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
