package io.podflow.unit.builtin;

import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.unit.ProcessingUnit;

/** Forwards documents unchanged. */
public final class PassThroughUnit implements ProcessingUnit {

    @Override
    public Response process(final Request request) {
        return Response.of(request, request.docs());
    }
}
