package io.podflow.unit;

import com.google.protobuf.Struct;

import java.util.Objects;

/**
 * One record as returned by a full scan: the vector and the metadata travel separately
 * so snapshots can store them in separate artifacts.
 */
public record ScanRecord(String id, float[] vector, Struct metadata) {
    public ScanRecord {
        Objects.requireNonNull(id, "id");
        vector = vector == null ? new float[0] : vector;
        metadata = metadata == null ? Struct.getDefaultInstance() : metadata;
    }
}
