package io.podflow.snapshot;

public record VectorEntry(String id, float[] vector) {
}
