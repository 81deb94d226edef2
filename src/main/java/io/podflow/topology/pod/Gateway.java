package io.podflow.topology.pod;

import io.podflow.topology.wiring.Endpoint;
import lombok.Getter;
import lombok.ToString;

/**
 * Pseudo-pod at both ends of the pipeline: emits on the first link, receives on the last.
 */
@Getter
@ToString
public final class Gateway {
    public static final String NAME = "gateway";

    private final Endpoint endpoint;

    public Gateway(final Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    public int unitCount() {
        return 1;
    }
}
