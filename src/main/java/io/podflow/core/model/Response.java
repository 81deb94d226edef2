package io.podflow.core.model;

import java.util.List;

public record Response(String requestId, RequestType type, List<Document> docs, List<UnitFailure> failures) {

    public Response {
        docs = docs == null ? List.of() : List.copyOf(docs);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static Response of(final Request request, final List<Document> docs) {
        return new Response(request.requestId(), request.type(), docs, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
