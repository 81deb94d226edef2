package io.podflow.core.model;

import java.util.Objects;

/**
 * A scored hit. Higher scores rank first.
 */
public record Match(Document document, double score) {
    public Match {
        Objects.requireNonNull(document, "document");
    }

    public String id() {
        return document.id();
    }
}
