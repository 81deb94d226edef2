package io.podflow.config.type;

import io.podflow.config.impl.PipelineConfig;
import io.podflow.config.impl.StageConfig;

import java.io.IOException;
import java.util.List;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads a pipeline from a YAML file by delegating to {@link PipelineConfig#load(String)}.
     *
     * @param path the path to the pipeline YAML file
     * @return a populated {@link PipelineConfig}
     * @throws IOException if the file cannot be read
     */
    public static PipelineConfig load(final String path) throws IOException {
        return PipelineConfig.load(path);
    }

    /**
     * Loads only the stage list of a pipeline file, in declaration order.
     */
    public static List<StageConfig> loadStages(final String path) throws IOException {
        return PipelineConfig.load(path).getStages();
    }
}
