package io.podflow.topology.update;

import io.podflow.config.impl.PipelineConfig;
import io.podflow.config.impl.StageConfig;
import io.podflow.core.model.Document;
import io.podflow.core.model.Match;
import io.podflow.core.model.Response;
import io.podflow.error.RollingUpdateException;
import io.podflow.snapshot.ShardManifest;
import io.podflow.snapshot.SnapshotWriter;
import io.podflow.topology.TestUnits;
import io.podflow.topology.Topology;
import io.podflow.topology.TopologyBuilder;
import io.podflow.topology.group.ReplicaGroup;
import io.podflow.topology.wiring.Endpoint;
import io.podflow.unit.ProcessingUnitFactory;
import io.podflow.unit.ScanRecord;
import io.podflow.unit.builtin.InMemoryIndexer;
import io.podflow.unit.registry.ProcessingUnitRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class RollingUpdateOrchestratorTest {

    private static final List<Document> QUERY = List.of(Document.of("q", new float[]{1f, 0f}));

    @TempDir
    Path tmp;

    private Path writeDump(final int records, final int shards) throws IOException {
        final List<ScanRecord> in = new ArrayList<>();
        for (int i = 0; i < records; i++) {
            in.add(new ScanRecord("e" + i, new float[]{i, 1f}, null));
        }
        final Path dir = tmp.resolve("dump");
        SnapshotWriter.write(dir, in, shards);
        return dir;
    }

    private static List<String> ids(final Response r) {
        return r.docs().get(0).matches().stream().map(Match::id).toList();
    }

    @Test
    void searchesKeepSucceedingWhileEveryReplicaIsReplaced() throws Exception {
        final Path dump = writeDump(10, 2);
        final PipelineConfig cfg = PipelineConfig.builder()
                .workspace(tmp.resolve("ws"))
                .stage(StageConfig.of("search", 2, 2)
                        .withUses(ProcessingUnitRegistry.INDEXER)
                        .withParams(Map.of(InMemoryIndexer.DUMP_PATH, dump.toString())))
                .build();

        final ExecutorService clients = Executors.newFixedThreadPool(8);
        try (final Topology t = new TopologyBuilder(ProcessingUnitRegistry.defaults()).build(cfg)) {
            t.start();
            final Endpoint before = t.pod("search").getEndpoint();
            assertEquals(List.of("e9", "e8", "e7"), ids(t.search(QUERY, 3)));

            final List<Future<List<String>>> calls = new ArrayList<>();
            for (int i = 0; i < 600; i++) {
                calls.add(clients.submit(() -> ids(t.search(QUERY, 3))));
            }

            t.rollingUpdate("search");

            for (final Future<List<String>> f : calls) {
                assertEquals(List.of("e9", "e8", "e7"), f.get(30, TimeUnit.SECONDS));
            }

            final ReplicaGroup group = t.pod("search").getReplicaGroup();
            assertEquals(List.of(0, 1), group.currentView().active());
            assertEquals(UpdatePhase.IDLE, t.updateState("search").phase());
            assertEquals(before, t.pod("search").getEndpoint());
            assertTrue(group.replica(0).isAccepting());
            assertTrue(group.replica(0).shards().isReady());
            assertTrue(group.replica(1).shards().isReady());
            assertEquals(List.of("e9", "e8", "e7"), ids(t.search(QUERY, 3)));
        } finally {
            clients.shutdownNow();
        }
    }

    @Test
    void phasesAreObservableWhileAReplicaWarms() throws Exception {
        final AtomicInteger created = new AtomicInteger();
        final CountDownLatch warm = new CountDownLatch(1);
        final ProcessingUnitFactory unit = ctx -> created.incrementAndGet() > 2
                ? new TestUnits.BlockingOpenUnit(warm)
                : new TestUnits.TaggingUnit(ctx);

        final PipelineConfig cfg = PipelineConfig.builder()
                .stage(StageConfig.of("p", 2, 1).withUses("test"))
                .build();

        try (final Topology t = new TopologyBuilder(ProcessingUnitRegistry.builder().unit("test", unit).build()).build(cfg)) {
            t.start();

            final Thread updater = new Thread(() -> t.rollingUpdate("p"));
            updater.start();

            final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (t.updateState("p").phase() != UpdatePhase.WARMING && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertEquals(new UpdateState(UpdatePhase.WARMING, 0), t.updateState("p"));
            assertEquals(List.of(1), t.pod("p").getReplicaGroup().currentView().active());
            assertEquals(1, TestUnits.replicaOf(t.search(QUERY, 1).docs().get(0)));

            warm.countDown();
            updater.join(10_000);
            assertFalse(updater.isAlive());
            assertEquals(UpdateState.IDLE, t.updateState("p"));
            assertEquals(List.of(0, 1), t.pod("p").getReplicaGroup().currentView().active());
        } finally {
            warm.countDown();
        }
    }

    @Test
    void replicaThatNeverBecomesReadyLeavesThePodDegraded() {
        final AtomicInteger created = new AtomicInteger();
        final CountDownLatch never = new CountDownLatch(1);
        final ProcessingUnitFactory unit = ctx -> created.incrementAndGet() > 2
                ? new TestUnits.BlockingOpenUnit(never)
                : new TestUnits.TaggingUnit(ctx);

        final PipelineConfig cfg = PipelineConfig.builder()
                .readinessTimeoutMillis(300)
                .callTimeoutMillis(500)
                .stage(StageConfig.of("p", 2, 1).withUses("test"))
                .build();

        try (final Topology t = new TopologyBuilder(ProcessingUnitRegistry.builder().unit("test", unit).build()).build(cfg)) {
            t.start();

            final RollingUpdateException e = assertThrows(RollingUpdateException.class, () -> t.rollingUpdate("p"));
            assertEquals("p", e.getPodName());
            assertEquals(0, e.getReplicaIndex());

            final ReplicaGroup group = t.pod("p").getReplicaGroup();
            assertEquals(List.of(1), group.currentView().active());
            assertEquals(UpdateState.IDLE, t.updateState("p"));
            for (int i = 0; i < 5; i++) {
                assertEquals(1, TestUnits.replicaOf(t.search(QUERY, 1).docs().get(0)));
            }
        } finally {
            never.countDown();
        }
    }

    @Test
    void drainWaitsForAFullScanInProgress() throws Exception {
        final CountDownLatch scanning = new CountDownLatch(1);
        final AtomicBoolean scanFinished = new AtomicBoolean();
        final ProcessingUnitFactory unit = ctx -> new TestUnits.SlowScanUnit(300) {
            @Override
            public List<ScanRecord> fullScan() {
                scanning.countDown();
                final List<ScanRecord> out = super.fullScan();
                scanFinished.set(true);
                return out;
            }
        };
        final PipelineConfig cfg = PipelineConfig.builder()
                .drainTimeoutMillis(5_000)
                .stage(StageConfig.of("scanned", 1, 1).withUses("scan"))
                .build();

        final ExecutorService dumper = Executors.newSingleThreadExecutor();
        try (final Topology t = new TopologyBuilder(ProcessingUnitRegistry.builder().unit("scan", unit).build())
                .build(cfg)) {
            t.start();
            final Future<ShardManifest> dump = dumper.submit(
                    () -> t.dump("scanned", tmp.resolve("dump"), 1, Duration.ofSeconds(10)));
            assertTrue(scanning.await(5, TimeUnit.SECONDS));

            t.rollingUpdate("scanned");

            assertTrue(scanFinished.get());
            assertEquals(0, dump.get(5, TimeUnit.SECONDS).totalRecords());
        } finally {
            dumper.shutdownNow();
        }
    }

    @Test
    void podsUpdateIndependently() throws Exception {
        final PipelineConfig cfg = PipelineConfig.builder()
                .stage(StageConfig.of("a", 2, 1))
                .stage(StageConfig.of("b", 3, 2))
                .build();

        try (final Topology t = new TopologyBuilder(ProcessingUnitRegistry.defaults()).build(cfg)) {
            t.start();
            final Thread other = new Thread(() -> t.rollingUpdate("b"));
            other.start();
            t.rollingUpdate("a");
            other.join(10_000);

            assertFalse(other.isAlive());
            assertEquals(List.of(0, 1, 2), t.pod("b").getReplicaGroup().currentView().active());
            assertEquals("x", t.search(List.of(Document.of("x", new float[]{1f})), 1).docs().get(0).id());
        }
    }

    @Test
    void unknownPodCannotBeUpdated() {
        try (final Topology t = new TopologyBuilder(ProcessingUnitRegistry.defaults())
                .build(PipelineConfig.builder().stage(StageConfig.of("a", 1, 1)).build())) {
            assertThrows(IllegalArgumentException.class, () -> t.rollingUpdate("zzz"));
            assertThrows(IllegalArgumentException.class, () -> t.dump("zzz", tmp, 1, Duration.ofSeconds(1)));
        }
    }
}
