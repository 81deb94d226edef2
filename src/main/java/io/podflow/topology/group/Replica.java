package io.podflow.topology.group;

import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.topology.wiring.Endpoint;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

/**
 * One full copy of a stage. Admission is increment-then-check: a caller first counts
 * itself in flight, then checks {@code accepting}. A drainer clears {@code accepting}
 * first and then waits for the count, so it can never miss an admitted call.
 */
public final class Replica {
    @Getter
    private final int index;
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean accepting = true;
    private volatile ShardGroup shards;

    public Replica(final int index, final ShardGroup shards) {
        this.index = index;
        this.shards = shards;
    }

    public ShardGroup shards() {
        return shards;
    }

    public Endpoint endpoint() {
        return shards.getEndpoint();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * @return {@code true} if the caller may route one call here and must later
     * {@link #release()} it
     */
    public boolean tryAcquire() {
        inFlight.incrementAndGet();
        if (!accepting) {
            inFlight.decrementAndGet();
            return false;
        }
        return true;
    }

    public void release() {
        inFlight.decrementAndGet();
    }

    /**
     * Routes an admitted call; the admission is released when the call really finishes.
     */
    public CompletableFuture<Response> call(final Request request) {
        final CompletableFuture<Response> f;
        try {
            f = shards.handle(request);
        } catch (final RuntimeException e) {
            release();
            return CompletableFuture.failedFuture(e);
        }
        f.whenComplete((r, err) -> release());
        return f;
    }

    public void stopAccepting() {
        accepting = false;
    }

    public void resumeAccepting() {
        accepting = true;
    }

    /**
     * Waits until every admitted call has finished.
     *
     * @return {@code false} if calls were still in flight when the timeout expired
     */
    public boolean awaitDrained(final long timeoutMillis) {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) return false;
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
        }
        return true;
    }

    /**
     * Installs a freshly built shard group and returns the previous one.
     */
    public ShardGroup swap(final ShardGroup fresh) {
        final ShardGroup old = shards;
        shards = fresh;
        return old;
    }
}
