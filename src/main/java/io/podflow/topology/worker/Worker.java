package io.podflow.topology.worker;

import io.netty.channel.EventLoop;
import io.podflow.core.concurrent.EventLoops;
import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.topology.wiring.Endpoint;
import io.podflow.unit.ProcessingUnit;
import io.podflow.unit.ProcessingUnitFactory;
import io.podflow.unit.ScanRecord;
import io.podflow.unit.UnitContext;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Leaf unit bound to one (replica, shard) pair. Owns one processing unit, created and
 * driven on the worker's own event loop.
 */
@Slf4j
@Getter
public final class Worker {
    private final UnitContext context;
    private final Endpoint endpoint;
    private final ProcessingUnitFactory factory;
    private volatile EventLoop loop;
    private volatile ProcessingUnit unit;

    public Worker(final UnitContext context, final Endpoint endpoint, final ProcessingUnitFactory factory) {
        this.context = context;
        this.endpoint = endpoint;
        this.factory = factory;
    }

    public String name() {
        return context.podName() + "/replica-" + context.replicaIndex() + "/shard-" + context.shardIndex();
    }

    /**
     * Creates and opens the unit. The returned future completes when the worker is ready.
     */
    public CompletableFuture<Void> start() {
        loop = EventLoops.newLoop(name());
        return EventLoops.submit(loop, () -> {
            final ProcessingUnit u = factory.create(context);
            u.open();
            unit = u;
            log.debug("Worker {} ready on {}", name(), endpoint);
            return null;
        });
    }

    public boolean isReady() {
        return unit != null;
    }

    public CompletableFuture<Response> handle(final Request request) {
        final EventLoop l = loop;
        if (l == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("worker " + name() + " is not running"));
        }
        return EventLoops.submit(l, () -> {
            final ProcessingUnit u = unit;
            if (u == null) {
                throw new IllegalStateException("worker " + name() + " is not ready");
            }
            return u.process(request);
        });
    }

    /**
     * Full scan of the unit's records, run on the caller's thread so the event loop keeps
     * serving requests.
     */
    public List<ScanRecord> fullScan() {
        final ProcessingUnit u = unit;
        if (u == null) {
            throw new IllegalStateException("worker " + name() + " is not ready");
        }
        return u.fullScan();
    }

    public void stop(final long timeoutMillis) {
        final EventLoop l = loop;
        if (l == null) return;

        final CompletableFuture<Void> closed = EventLoops.submit(l, () -> {
            final ProcessingUnit u = unit;
            unit = null;
            if (u != null) u.close();
            return null;
        });
        closed.whenComplete((v, err) -> {
            if (err != null) log.warn("Closing unit of {} failed: {}", name(), err.toString());
        });

        loop = null;
        EventLoops.shutdown(l, timeoutMillis);
    }
}
