package io.podflow.unit;

import java.nio.file.Path;
import java.util.Map;

/**
 * Where a unit sits in the topology.
 *
 * @param workspace {@code <workspaceRoot>/<pod>-<replica>-<shard>}, or {@code null} when
 *                  the pipeline has no workspace root
 * @param params    the stage's opaque parameters
 */
public record UnitContext(String podName,
                          int replicaIndex,
                          int shardIndex,
                          int shardCount,
                          Path workspace,
                          Map<String, Object> params) {

    public UnitContext {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static Path workspaceFor(final Path root, final String podName, final int replicaIndex, final int shardIndex) {
        return root == null ? null : root.resolve(podName + "-" + replicaIndex + "-" + shardIndex);
    }

    public String param(final String key) {
        final Object v = params.get(key);
        return v == null ? null : v.toString();
    }
}
