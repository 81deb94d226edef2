package io.podflow.snapshot;

import com.google.protobuf.Struct;

/**
 * Document metadata without the embedding.
 */
public record MetadataEntry(String id, Struct metadata) {
}
