package io.podflow.topology.group;

import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.core.model.UnitFailure;
import io.podflow.error.ShardTimeoutException;
import io.podflow.topology.group.selection.SelectionPolicy;
import io.podflow.topology.routing.RoutingUnit;
import io.podflow.topology.wiring.Endpoint;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The R replicas of a pod.
 * <p>
 * Reads go to exactly one replica chosen by the {@link SelectionPolicy} from the current
 * {@link ReplicaView}. A replica that fails or times out is skipped for the rest of that
 * call and the read is retried on another one; when nothing is selectable the head polls
 * the view again until the call deadline, so a rolling update shows up as latency and
 * not as a rejection. Writes go to every selectable replica and are not retried.
 * </p>
 */
@Slf4j
@Getter
public final class ReplicaGroup {
    static final long POLL_MILLIS = 2;
    private static final Executor POLLER = CompletableFuture.delayedExecutor(POLL_MILLIS, TimeUnit.MILLISECONDS);

    private final String podName;
    private final Endpoint endpoint;
    private final List<Replica> replicas;
    private final RoutingUnit head;
    private final RoutingUnit tail;
    private final SelectionPolicy selectionPolicy;
    private final long callTimeoutMillis;
    private final AtomicReference<ReplicaView> view;

    public ReplicaGroup(final String podName,
                        final Endpoint endpoint,
                        final List<Replica> replicas,
                        final RoutingUnit head,
                        final RoutingUnit tail,
                        final SelectionPolicy selectionPolicy,
                        final long callTimeoutMillis) {
        if (replicas.isEmpty()) throw new IllegalArgumentException("replica group needs at least one replica");
        if ((replicas.size() > 1) != (head != null && tail != null)) {
            throw new IllegalArgumentException("head and tail are required exactly when there is more than one replica");
        }
        this.podName = podName;
        this.endpoint = endpoint;
        this.replicas = List.copyOf(replicas);
        this.head = head;
        this.tail = tail;
        this.selectionPolicy = selectionPolicy;
        this.callTimeoutMillis = callTimeoutMillis;
        this.view = new AtomicReference<>(ReplicaView.allOf(replicas.size()));
    }

    public Replica replica(final int index) {
        return replicas.get(index);
    }

    public int size() {
        return replicas.size();
    }

    public int unitCount() {
        int units = head != null ? 2 : 0;
        for (final Replica r : replicas) {
            units += r.shards().unitCount();
        }
        return units;
    }

    public ReplicaView currentView() {
        return view.get();
    }

    public ReplicaView exclude(final int replicaIndex) {
        final ReplicaView v = view.updateAndGet(cur -> cur.without(replicaIndex));
        log.debug("{}: replica {} excluded, view v{} = {}", podName, replicaIndex, v.version(), v.active());
        return v;
    }

    public ReplicaView include(final int replicaIndex) {
        final ReplicaView v = view.updateAndGet(cur -> cur.with(replicaIndex));
        log.debug("{}: replica {} included, view v{} = {}", podName, replicaIndex, v.version(), v.active());
        return v;
    }

    public CompletableFuture<Void> start() {
        final List<CompletableFuture<Void>> ready = new ArrayList<>();
        if (head != null) ready.add(head.start());
        if (tail != null) ready.add(tail.start());
        for (final Replica r : replicas) {
            ready.add(r.shards().start());
        }
        return CompletableFuture.allOf(ready.toArray(new CompletableFuture[0]));
    }

    public void stop(final long timeoutMillis) {
        for (final Replica r : replicas) {
            r.stopAccepting();
            r.shards().stop(timeoutMillis);
        }
        if (head != null) head.stop(timeoutMillis);
        if (tail != null) tail.stop(timeoutMillis);
    }

    public CompletableFuture<Response> handle(final Request request) {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(callTimeoutMillis);
        final CompletableFuture<Response> result = new CompletableFuture<>();
        if (request.isRetrySafe()) {
            select(request, ConcurrentHashMap.newKeySet(), deadline, null, result);
        } else {
            broadcast(request, deadline, result);
        }
        return tail == null || !tail.isRunning() ? result : result.thenApplyAsync(r -> r, tail.executor());
    }

    private void select(final Request request,
                        final Set<Integer> attempted,
                        final long deadline,
                        final Throwable lastError,
                        final CompletableFuture<Response> result) {
        final List<Replica> candidates = new ArrayList<>();
        for (final int idx : view.get().active()) {
            if (!attempted.contains(idx)) candidates.add(replicas.get(idx));
        }

        Replica chosen = null;
        while (!candidates.isEmpty()) {
            final Replica r = candidates.get(selectionPolicy.select(candidates));
            if (r.tryAcquire()) {
                chosen = r;
                break;
            }
            candidates.remove(r);
        }

        final long remainingNs = deadline - System.nanoTime();
        if (chosen == null) {
            if (remainingNs <= 0) {
                result.completeExceptionally(new ShardTimeoutException(podName, -1, -1,
                        "no replica answered within " + callTimeoutMillis + " ms", lastError));
                return;
            }
            // everything selectable has failed this call or is being replaced: poll again
            if (attempted.size() >= replicas.size()) attempted.clear();
            retryLater(() -> select(request, attempted, deadline, lastError, result));
            return;
        }

        final Replica replica = chosen;
        replica.call(request)
                .thenApply(r -> r)
                .orTimeout(Math.max(1, remainingNs), TimeUnit.NANOSECONDS)
                .whenComplete((response, err) -> {
                    if (err == null) {
                        result.complete(response);
                        return;
                    }
                    final Throwable cause = ShardGroup.unwrap(err);
                    log.debug("{}: replica {} failed request {}: {}", podName, replica.getIndex(),
                            request.requestId(), cause.toString());
                    attempted.add(replica.getIndex());
                    select(request, attempted, deadline, cause, result);
                });
    }

    private void broadcast(final Request request, final long deadline, final CompletableFuture<Response> result) {
        final List<Replica> targets = new ArrayList<>();
        final List<CompletableFuture<Response>> calls = new ArrayList<>();
        for (final int idx : view.get().active()) {
            final Replica r = replicas.get(idx);
            if (r.tryAcquire()) {
                targets.add(r);
                calls.add(r.call(request));
            }
        }

        if (calls.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                result.completeExceptionally(new ShardTimeoutException(podName, -1, -1,
                        "no replica accepted the write within " + callTimeoutMillis + " ms"));
            } else {
                retryLater(() -> broadcast(request, deadline, result));
            }
            return;
        }

        CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).whenComplete((ignored, e) -> {
            Response first = null;
            final List<UnitFailure> failures = new ArrayList<>();
            for (int i = 0; i < calls.size(); i++) {
                final int replicaIndex = targets.get(i).getIndex();
                try {
                    final Response r = calls.get(i).join();
                    if (first == null) first = r;
                    failures.addAll(r.failures());
                } catch (final CompletionException | CancellationException ce) {
                    final Throwable cause = ShardGroup.unwrap(ce);
                    log.warn("Write {} failed on {}/replica-{}: {}", request.requestId(), podName, replicaIndex, cause.getMessage());
                    failures.add(new UnitFailure(podName, replicaIndex, -1, cause.getMessage()));
                }
            }
            if (first == null) {
                result.completeExceptionally(new ShardTimeoutException(podName, -1, -1,
                        "write failed on every replica: " + failures));
            } else {
                result.complete(new Response(request.requestId(), request.type(), first.docs(), failures));
            }
        });
    }

    private void retryLater(final Runnable task) {
        if (head != null && head.isRunning()) {
            try {
                head.schedule(task, POLL_MILLIS);
                return;
            } catch (final RejectedExecutionException | IllegalStateException e) {
                log.debug("{}: head stopped, polling off-loop", podName);
            }
        }
        POLLER.execute(task);
    }
}
