package io.podflow.config.impl;

import io.podflow.snapshot.merge.MergePolicy;
import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable pipeline description plus the runtime knobs every operation needs.
 * Built programmatically or loaded from a YAML file such as:
 * <pre>
 * portRangeStart: 50000
 * callTimeoutMillis: 5000
 * workspace: /var/lib/podflow
 * stages:
 *   - name: indexer
 *     replicas: 2
 *     shards: 3
 *     uses: _index
 *     with:
 *       dumpPath: /var/lib/podflow/dump
 * </pre>
 */
@Getter
@ToString
public final class PipelineConfig {
    public static final int DEFAULT_PORT_RANGE_START = 50_000;
    public static final int DEFAULT_PORT_RANGE_END = 60_000;

    private final List<StageConfig> stages;
    private final int portRangeStart;
    private final int portRangeEnd;
    private final long callTimeoutMillis;
    private final long readinessTimeoutMillis;
    private final long drainTimeoutMillis;
    private final MergePolicy mergePolicy;
    private final int defaultTopK;
    private final Path workspace;

    private PipelineConfig(final Builder b) {
        this.stages = List.copyOf(b.stages);
        this.portRangeStart = b.portRangeStart;
        this.portRangeEnd = b.portRangeEnd;
        this.callTimeoutMillis = b.callTimeoutMillis;
        this.readinessTimeoutMillis = b.readinessTimeoutMillis;
        this.drainTimeoutMillis = b.drainTimeoutMillis;
        this.mergePolicy = b.mergePolicy;
        this.defaultTopK = b.defaultTopK;
        this.workspace = b.workspace;
    }

    public static Builder builder() {
        return new Builder();
    }

    @SuppressWarnings("unchecked")
    public static PipelineConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            final Builder b = builder();

            b.portRangeStart((Integer) m.getOrDefault("portRangeStart", DEFAULT_PORT_RANGE_START));
            b.portRangeEnd((Integer) m.getOrDefault("portRangeEnd", DEFAULT_PORT_RANGE_END));
            b.callTimeoutMillis(((Number) m.getOrDefault("callTimeoutMillis", 5_000)).longValue());
            b.readinessTimeoutMillis(((Number) m.getOrDefault("readinessTimeoutMillis", 10_000)).longValue());
            b.drainTimeoutMillis(((Number) m.getOrDefault("drainTimeoutMillis", 5_000)).longValue());
            b.mergePolicy(MergePolicy.valueOf(((String) m.getOrDefault("mergePolicy", "TRUNCATE_TO_TOP_K")).toUpperCase()));
            b.defaultTopK((Integer) m.getOrDefault("defaultTopK", 10));
            if (m.get("workspace") != null) {
                b.workspace(Paths.get((String) m.get("workspace")));
            }

            final List<Map<String, Object>> stageList = (List<Map<String, Object>>) m.get("stages");
            if (stageList != null) {
                for (final Map<String, Object> s : stageList) {
                    b.stage(new StageConfig(
                            (String) s.get("name"),
                            (Integer) s.getOrDefault("replicas", 1),
                            (Integer) s.getOrDefault("shards", 1),
                            (String) s.get("uses"),
                            (Integer) s.get("portIn"),
                            (Integer) s.get("portOut"),
                            (Map<String, Object>) s.get("with")));
                }
            }
            return b.build();
        }
    }

    public static final class Builder {
        private final List<StageConfig> stages = new ArrayList<>();
        private int portRangeStart = DEFAULT_PORT_RANGE_START;
        private int portRangeEnd = DEFAULT_PORT_RANGE_END;
        private long callTimeoutMillis = 5_000;
        private long readinessTimeoutMillis = 10_000;
        private long drainTimeoutMillis = 5_000;
        private MergePolicy mergePolicy = MergePolicy.TRUNCATE_TO_TOP_K;
        private int defaultTopK = 10;
        private Path workspace;

        public Builder stage(final StageConfig stage) {
            stages.add(stage);
            return this;
        }

        public Builder portRangeStart(final int port) {
            this.portRangeStart = port;
            return this;
        }

        public Builder portRangeEnd(final int port) {
            this.portRangeEnd = port;
            return this;
        }

        public Builder callTimeoutMillis(final long millis) {
            this.callTimeoutMillis = millis;
            return this;
        }

        public Builder readinessTimeoutMillis(final long millis) {
            this.readinessTimeoutMillis = millis;
            return this;
        }

        public Builder drainTimeoutMillis(final long millis) {
            this.drainTimeoutMillis = millis;
            return this;
        }

        public Builder mergePolicy(final MergePolicy policy) {
            this.mergePolicy = policy;
            return this;
        }

        public Builder defaultTopK(final int topK) {
            this.defaultTopK = topK;
            return this;
        }

        public Builder workspace(final Path dir) {
            this.workspace = dir;
            return this;
        }

        public PipelineConfig build() {
            if (portRangeStart <= 0 || portRangeEnd > 65_536 || portRangeStart >= portRangeEnd) {
                throw new IllegalArgumentException("invalid port range [" + portRangeStart + ", " + portRangeEnd + ")");
            }
            if (callTimeoutMillis <= 0) throw new IllegalArgumentException("callTimeoutMillis must be > 0");
            if (readinessTimeoutMillis <= 0) throw new IllegalArgumentException("readinessTimeoutMillis must be > 0");
            if (drainTimeoutMillis <= 0) throw new IllegalArgumentException("drainTimeoutMillis must be > 0");
            if (mergePolicy == null) throw new IllegalArgumentException("mergePolicy must not be null");
            return new PipelineConfig(this);
        }
    }
}
