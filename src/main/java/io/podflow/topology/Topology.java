package io.podflow.topology;

import io.netty.util.concurrent.DefaultThreadFactory;
import io.podflow.config.impl.PipelineConfig;
import io.podflow.core.model.Document;
import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.core.model.UnitFailure;
import io.podflow.error.WiringException;
import io.podflow.snapshot.ShardManifest;
import io.podflow.snapshot.SnapshotWriter;
import io.podflow.topology.pod.Gateway;
import io.podflow.topology.pod.Pod;
import io.podflow.topology.update.RollingUpdateOrchestrator;
import io.podflow.topology.update.UpdateState;
import io.podflow.topology.wiring.TopologyWiring;
import io.podflow.unit.ScanRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A built pipeline: the gateway, the pods in order, and the port fabric between them.
 * Requests leave the gateway on its out-port and are handed from pod to pod by port
 * until they arrive back on the gateway's in-port.
 */
@Slf4j
public final class Topology implements AutoCloseable {
    @Getter
    private final PipelineConfig config;
    @Getter
    private final TopologyWiring wiring;
    @Getter
    private final Gateway gateway;
    private final Map<String, Pod> pods;
    private final Map<Integer, Pod> inbound;
    private final RollingUpdateOrchestrator orchestrator;
    private final ExecutorService dumpExecutor;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    Topology(final PipelineConfig config,
             final TopologyWiring wiring,
             final Gateway gateway,
             final List<Pod> pods,
             final RollingUpdateOrchestrator orchestrator) {
        this.config = config;
        this.wiring = wiring;
        this.gateway = gateway;
        this.orchestrator = orchestrator;

        final Map<String, Pod> byName = new LinkedHashMap<>();
        final Map<Integer, Pod> byPort = new HashMap<>();
        for (final Pod p : pods) {
            byName.put(p.getName(), p);
            if (byPort.put(p.getEndpoint().portIn(), p) != null) {
                throw new WiringException("two pods receive on port " + p.getEndpoint().portIn());
            }
        }
        this.pods = Collections.unmodifiableMap(byName);
        this.inbound = Map.copyOf(byPort);
        this.dumpExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("podflow-dump", true));
    }

    /**
     * Starts every unit and waits until all of them are ready.
     *
     * @throws IllegalStateException if a unit fails or is not ready within the readiness
     *                               timeout; whatever was started is stopped again
     */
    public void start() {
        if (closed.get()) throw new IllegalStateException("topology is closed");
        if (!started.compareAndSet(false, true)) return;

        final List<CompletableFuture<Void>> ready = new ArrayList<>(pods.size());
        for (final Pod p : pods.values()) {
            ready.add(p.start());
        }

        try {
            CompletableFuture.allOf(ready.toArray(new CompletableFuture[0]))
                    .get(config.getReadinessTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            close();
            throw new IllegalStateException("topology not ready within " + config.getReadinessTimeoutMillis() + " ms", e);
        } catch (final ExecutionException e) {
            close();
            throw new IllegalStateException("topology failed to start: " + e.getCause(), e.getCause());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new IllegalStateException("interrupted while starting topology", e);
        }
        log.info("Topology started: {} pods, {} units, gateway {}", pods.size(), numUnits(), gateway.getEndpoint());
    }

    public Response index(final List<Document> docs) {
        return await(send(Request.index(docs)));
    }

    public Response search(final List<Document> docs) {
        return search(docs, config.getDefaultTopK());
    }

    public Response search(final List<Document> docs, final int topK) {
        return await(send(Request.search(docs, topK)));
    }

    /**
     * Sends a request through the whole pipeline. Failures reported by pods along the
     * way are accumulated on the final response.
     */
    public CompletableFuture<Response> send(final Request request) {
        if (!started.get() || closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("topology is not running"));
        }
        return forward(gateway.getEndpoint().portOut(), request, new ArrayList<>());
    }

    private CompletableFuture<Response> forward(final int port, final Request request, final List<UnitFailure> failures) {
        if (port == gateway.getEndpoint().portIn()) {
            return CompletableFuture.completedFuture(
                    new Response(request.requestId(), request.type(), request.docs(), failures));
        }

        final Pod pod = inbound.get(port);
        if (pod == null) {
            return CompletableFuture.failedFuture(new WiringException("nothing receives on port " + port));
        }
        return pod.handle(request).thenCompose(response -> {
            failures.addAll(response.failures());
            return forward(pod.getEndpoint().portOut(), request.withDocs(response.docs()), failures);
        });
    }

    /**
     * Full-scans one ready replica of a pod and writes it as a snapshot of
     * {@code shardCount} shards.
     *
     * @param timeout bound on the scan; zero or negative waits indefinitely
     */
    public ShardManifest dump(final String podName, final Path path, final int shardCount, final Duration timeout) {
        if (shardCount < 1) throw new IllegalArgumentException("shardCount must be >= 1, got " + shardCount);

        final Pod pod = pod(podName);
        final List<ScanRecord> records = pod.fullScan(dumpExecutor, timeout.toMillis());
        try {
            final ShardManifest manifest = SnapshotWriter.write(path, records, shardCount);
            log.info("Dumped {} records of {} into {} shards at {}", records.size(), podName, shardCount, path);
            return manifest;
        } catch (final IOException e) {
            throw new UncheckedIOException("dump of " + podName + " to " + path + " failed", e);
        }
    }

    /**
     * Replaces every replica of the pod in turn; blocks until done.
     */
    public void rollingUpdate(final String podName) {
        orchestrator.rollingUpdate(pod(podName));
    }

    public UpdateState updateState(final String podName) {
        return orchestrator.state(pod(podName).getName());
    }

    public Pod pod(final String name) {
        final Pod p = pods.get(name);
        if (p == null) throw new IllegalArgumentException("no pod named " + name);
        return p;
    }

    public Collection<Pod> pods() {
        return pods.values();
    }

    public int numUnits() {
        int units = gateway.unitCount();
        for (final Pod p : pods.values()) {
            units += p.numUnits();
        }
        return units;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        final List<Pod> reversed = new ArrayList<>(pods.values());
        Collections.reverse(reversed);
        for (final Pod p : reversed) {
            try {
                p.stop(config.getCallTimeoutMillis());
            } catch (final RuntimeException e) {
                log.warn("Stopping pod {} failed: {}", p.getName(), e.toString());
            }
        }
        dumpExecutor.shutdownNow();
        log.info("Topology closed");
    }

    private static Response await(final CompletableFuture<Response> f) {
        try {
            return f.join();
        } catch (final CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }
}
