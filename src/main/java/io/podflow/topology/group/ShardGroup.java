package io.podflow.topology.group;

import io.podflow.core.model.Request;
import io.podflow.core.model.RequestType;
import io.podflow.core.model.Response;
import io.podflow.core.model.UnitFailure;
import io.podflow.error.ShardTimeoutException;
import io.podflow.snapshot.merge.MatchMerger;
import io.podflow.topology.routing.RoutingUnit;
import io.podflow.topology.wiring.Endpoint;
import io.podflow.topology.worker.Worker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The P workers of one replica. Every request reaches every shard: writes because
 * ownership of persisted data is only decided when a snapshot is cut, reads because
 * each shard answers for its own data. With more than one shard the head fans out and
 * the tail merges.
 */
@Slf4j
@Getter
public final class ShardGroup {
    private final String podName;
    private final int replicaIndex;
    private final Endpoint endpoint;
    private final List<Worker> workers;
    private final RoutingUnit head;
    private final RoutingUnit tail;
    private final MatchMerger merger;
    private final long callTimeoutMillis;

    public ShardGroup(final String podName,
                      final int replicaIndex,
                      final Endpoint endpoint,
                      final List<Worker> workers,
                      final RoutingUnit head,
                      final RoutingUnit tail,
                      final MatchMerger merger,
                      final long callTimeoutMillis) {
        if (workers.isEmpty()) throw new IllegalArgumentException("shard group needs at least one worker");
        if ((workers.size() > 1) != (head != null && tail != null)) {
            throw new IllegalArgumentException("head and tail are required exactly when there is more than one shard");
        }
        this.podName = podName;
        this.replicaIndex = replicaIndex;
        this.endpoint = endpoint;
        this.workers = List.copyOf(workers);
        this.head = head;
        this.tail = tail;
        this.merger = merger;
        this.callTimeoutMillis = callTimeoutMillis;
    }

    public int shardCount() {
        return workers.size();
    }

    public int unitCount() {
        return workers.size() + (head != null ? 2 : 0);
    }

    /**
     * Starts routing units and workers; completes when every worker is ready.
     */
    public CompletableFuture<Void> start() {
        final List<CompletableFuture<Void>> ready = new ArrayList<>();
        if (head != null) ready.add(head.start());
        if (tail != null) ready.add(tail.start());
        for (final Worker w : workers) {
            ready.add(w.start());
        }
        return CompletableFuture.allOf(ready.toArray(new CompletableFuture[0]));
    }

    public void stop(final long timeoutMillis) {
        for (final Worker w : workers) {
            w.stop(timeoutMillis);
        }
        if (head != null) head.stop(timeoutMillis);
        if (tail != null) tail.stop(timeoutMillis);
    }

    public boolean isReady() {
        for (final Worker w : workers) {
            if (!w.isReady()) return false;
        }
        return true;
    }

    public CompletableFuture<Response> handle(final Request request) {
        if (head == null) {
            return callShard(workers.get(0), request);
        }

        return head.submit(() -> fanOut(request))
                .thenCompose(ShardGroup::settle)
                .thenApplyAsync(outcomes -> collect(request, outcomes), tail.executor());
    }

    private List<CompletableFuture<Response>> fanOut(final Request request) {
        final List<CompletableFuture<Response>> calls = new ArrayList<>(workers.size());
        for (final Worker w : workers) {
            calls.add(callShard(w, request));
        }
        return calls;
    }

    private CompletableFuture<Response> callShard(final Worker worker, final Request request) {
        final int shard = worker.getContext().shardIndex();
        return worker.handle(request)
                .orTimeout(callTimeoutMillis, TimeUnit.MILLISECONDS)
                .exceptionally(err -> {
                    final Throwable cause = unwrap(err);
                    final String msg = cause instanceof TimeoutException
                            ? "no answer within " + callTimeoutMillis + " ms"
                            : cause.toString();
                    throw new ShardTimeoutException(podName, replicaIndex, shard, msg, cause);
                });
    }

    private Response collect(final Request request, final List<Outcome> outcomes) {
        if (request.type() == RequestType.SEARCH) {
            final List<Response> answers = new ArrayList<>(outcomes.size());
            for (final Outcome o : outcomes) {
                if (o.error() != null) {
                    // an answer without every shard would silently drop matches
                    throw asCompletion(o.error());
                }
                answers.add(o.response());
            }
            return merger.merge(request, answers);
        }

        Response first = null;
        final List<UnitFailure> failures = new ArrayList<>();
        for (int s = 0; s < outcomes.size(); s++) {
            final Outcome o = outcomes.get(s);
            if (o.error() != null) {
                log.warn("Write {} failed on {}/replica-{}/shard-{}: {}",
                        request.requestId(), podName, replicaIndex, s, o.error().getMessage());
                failures.add(new UnitFailure(podName, replicaIndex, s, o.error().getMessage()));
            } else {
                if (first == null) first = o.response();
                failures.addAll(o.response().failures());
            }
        }
        if (first == null) {
            throw new CompletionException(new ShardTimeoutException(podName, replicaIndex, -1,
                    "write failed on all " + outcomes.size() + " shards"));
        }
        return new Response(request.requestId(), request.type(), first.docs(), failures);
    }

    private static CompletableFuture<List<Outcome>> settle(final List<CompletableFuture<Response>> calls) {
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                .handle((ignored, err) -> {
                    final List<Outcome> out = new ArrayList<>(calls.size());
                    for (final CompletableFuture<Response> c : calls) {
                        try {
                            out.add(new Outcome(c.join(), null));
                        } catch (final CompletionException | CancellationException e) {
                            out.add(new Outcome(null, unwrap(e)));
                        }
                    }
                    return out;
                });
    }

    static Throwable unwrap(final Throwable err) {
        Throwable t = err;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static CompletionException asCompletion(final Throwable t) {
        return t instanceof CompletionException ce ? ce : new CompletionException(t);
    }

    private record Outcome(Response response, Throwable error) {
    }
}
