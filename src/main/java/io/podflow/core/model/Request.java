package io.podflow.core.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record Request(String requestId, RequestType type, List<Document> docs, int topK) {

    public Request {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(type, "type");
        docs = docs == null ? List.of() : List.copyOf(docs);
    }

    public static Request index(final List<Document> docs) {
        return new Request(UUID.randomUUID().toString(), RequestType.INDEX, docs, 0);
    }

    public static Request search(final List<Document> docs, final int topK) {
        return new Request(UUID.randomUUID().toString(), RequestType.SEARCH, docs, topK);
    }

    public Request withDocs(final List<Document> newDocs) {
        return new Request(requestId, type, newDocs, topK);
    }

    public boolean isRetrySafe() {
        return type == RequestType.SEARCH;
    }
}
