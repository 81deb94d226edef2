package io.podflow.error;

/**
 * Invalid pipeline configuration: bad replica/shard counts, duplicate stage names,
 * unknown processing units or colliding port overrides. Always raised before any
 * port is allocated or unit started.
 */
public class ConfigurationException extends PodflowException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
