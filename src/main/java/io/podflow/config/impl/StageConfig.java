package io.podflow.config.impl;

import java.util.Map;

/**
 * One pipeline stage as declared by the user. Validation happens in the topology
 * builder so that every problem surfaces as a configuration failure before any port
 * is handed out.
 *
 * @param uses    registry name of the processing unit, {@code null} for pass-through
 * @param portIn  explicit in-port, or {@code null} to allocate from the range
 * @param portOut explicit out-port, or {@code null} to allocate from the range
 * @param params  opaque parameters handed to the processing unit factory
 */
public record StageConfig(String name,
                          int replicas,
                          int shards,
                          String uses,
                          Integer portIn,
                          Integer portOut,
                          Map<String, Object> params) {

    public static final String PASS_THROUGH = "_pass";

    public StageConfig {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static StageConfig of(final String name, final int replicas, final int shards) {
        return new StageConfig(name, replicas, shards, null, null, null, null);
    }

    public StageConfig withUses(final String newUses) {
        return new StageConfig(name, replicas, shards, newUses, portIn, portOut, params);
    }

    public StageConfig withPorts(final Integer newPortIn, final Integer newPortOut) {
        return new StageConfig(name, replicas, shards, uses, newPortIn, newPortOut, params);
    }

    public StageConfig withParams(final Map<String, Object> newParams) {
        return new StageConfig(name, replicas, shards, uses, portIn, portOut, newParams);
    }

    public String effectiveUses() {
        return uses == null || uses.isBlank() ? PASS_THROUGH : uses;
    }
}
