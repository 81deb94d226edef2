package io.podflow.core.model;

import com.google.protobuf.Struct;

import java.util.List;
import java.util.Objects;

/**
 * A record travelling through the pipeline. The embedding is the heavy payload;
 * everything else a unit wants to keep rides in {@code metadata}.
 *
 * @param matches ranked matches attached by search units, empty otherwise
 */
public record Document(String id, float[] embedding, Struct metadata, List<Match> matches) {

    public Document(final String id,
                    final float[] embedding,
                    final Struct metadata,
                    final List<Match> matches) {
        this.id = Objects.requireNonNull(id, "id");
        this.embedding = embedding;
        this.metadata = metadata == null ? Struct.getDefaultInstance() : metadata;
        this.matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public static Document of(final String id, final float[] embedding) {
        return new Document(id, embedding, null, null);
    }

    public static Document of(final String id, final float[] embedding, final Struct metadata) {
        return new Document(id, embedding, metadata, null);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public Document withMatches(final List<Match> newMatches) {
        return new Document(id, embedding, metadata, newMatches);
    }

    public Document withMetadata(final Struct newMetadata) {
        return new Document(id, embedding, newMetadata, matches);
    }
}
