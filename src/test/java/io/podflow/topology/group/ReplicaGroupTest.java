package io.podflow.topology.group;

import io.podflow.config.impl.PipelineConfig;
import io.podflow.config.impl.StageConfig;
import io.podflow.core.model.Document;
import io.podflow.core.model.Response;
import io.podflow.error.ShardTimeoutException;
import io.podflow.topology.TestUnits;
import io.podflow.topology.Topology;
import io.podflow.topology.TopologyBuilder;
import io.podflow.topology.worker.Worker;
import io.podflow.unit.ProcessingUnitFactory;
import io.podflow.unit.registry.ProcessingUnitRegistry;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ReplicaGroupTest {

    private static Topology start(final ProcessingUnitFactory unit, final StageConfig stage, final long callTimeoutMillis) {
        final ProcessingUnitRegistry registry = ProcessingUnitRegistry.builder().unit("test", unit).build();
        final PipelineConfig cfg = PipelineConfig.builder()
                .callTimeoutMillis(callTimeoutMillis)
                .stage(stage.withUses(stage.uses() == null ? "test" : stage.uses()))
                .build();
        final Topology t = new TopologyBuilder(registry).build(cfg);
        t.start();
        return t;
    }

    private static List<Document> query(final int i) {
        return List.of(Document.of("q" + i, new float[]{1f, 0f}));
    }

    @Test
    void twentySearchesReachEveryReplica() {
        try (final Topology t = start(TestUnits.TaggingUnit::new, StageConfig.of("tagger", 3, 1), 5_000)) {
            final Set<Integer> hit = new HashSet<>();
            for (int i = 0; i < 20; i++) {
                final Response r = t.search(query(i), 5);
                hit.add(TestUnits.replicaOf(r.docs().get(0)));
            }
            assertEquals(Set.of(0, 1, 2), hit);
        }
    }

    @Test
    void failingReplicaIsSkippedAndTheSearchRetried() {
        final ProcessingUnitFactory unit = ctx -> ctx.replicaIndex() == 0
                ? new TestUnits.FailingUnit()
                : new TestUnits.TaggingUnit(ctx);

        try (final Topology t = start(unit, StageConfig.of("flaky", 3, 1), 5_000)) {
            for (int i = 0; i < 12; i++) {
                final Response r = t.search(query(i), 5);
                assertNotEquals(0, TestUnits.replicaOf(r.docs().get(0)));
                assertFalse(r.hasFailures());
            }
        }
    }

    @Test
    void shardFailureFailsTheWholeReplicaAnswer() {
        final ProcessingUnitFactory unit = ctx -> ctx.replicaIndex() == 0 && ctx.shardIndex() == 1
                ? new TestUnits.FailingUnit()
                : new TestUnits.TaggingUnit(ctx);

        try (final Topology t = start(unit, StageConfig.of("sharded", 2, 2), 5_000)) {
            for (int i = 0; i < 8; i++) {
                assertEquals(1, TestUnits.replicaOf(t.search(query(i), 5).docs().get(0)));
            }
        }
    }

    @Test
    void searchWithoutAnyHealthyReplicaTimesOut() {
        try (final Topology t = start(ctx -> new TestUnits.FailingUnit(), StageConfig.of("dead", 2, 1), 300)) {
            final ShardTimeoutException e = assertThrows(ShardTimeoutException.class, () -> t.search(query(0), 5));
            assertEquals("dead", e.getPodName());
        }
    }

    @Test
    void writesReachEveryReplicaAndEveryShard() {
        final StageConfig stage = StageConfig.of("idx", 3, 2).withUses(ProcessingUnitRegistry.INDEXER);
        try (final Topology t = start(TestUnits.TaggingUnit::new, stage, 5_000)) {
            final Response r = t.index(List.of(
                    Document.of("a", new float[]{1f}),
                    Document.of("b", new float[]{2f})));
            assertFalse(r.hasFailures());

            final ReplicaGroup group = t.pod("idx").getReplicaGroup();
            for (int i = 0; i < 3; i++) {
                for (final Worker worker : group.replica(i).shards().getWorkers()) {
                    assertEquals(2, worker.fullScan().size(), worker.name());
                }
            }
        }
    }

    @Test
    void partialWriteFailureIsReportedOnTheResponse() {
        final ProcessingUnitFactory unit = ctx -> ctx.replicaIndex() == 1
                ? new TestUnits.FailingUnit()
                : new TestUnits.TaggingUnit(ctx);

        try (final Topology t = start(unit, StageConfig.of("half", 2, 1), 5_000)) {
            final Response r = t.index(query(0));

            assertTrue(r.hasFailures());
            assertEquals(1, r.failures().size());
            assertEquals("half", r.failures().get(0).podName());
            assertEquals(1, r.failures().get(0).replicaIndex());
            assertEquals(0, TestUnits.replicaOf(r.docs().get(0)));
        }
    }

    @Test
    void excludedReplicaIsNotSelected() {
        try (final Topology t = start(TestUnits.TaggingUnit::new, StageConfig.of("tagger", 2, 1), 5_000)) {
            final ReplicaGroup group = t.pod("tagger").getReplicaGroup();
            group.exclude(0);
            for (int i = 0; i < 6; i++) {
                assertEquals(1, TestUnits.replicaOf(t.search(query(i), 5).docs().get(0)));
            }
            group.include(0);
            assertEquals(List.of(0, 1), group.currentView().active());
        }
    }
}
