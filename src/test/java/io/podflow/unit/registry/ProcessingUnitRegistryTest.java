package io.podflow.unit.registry;

import io.podflow.config.impl.StageConfig;
import io.podflow.core.model.Document;
import io.podflow.core.model.Request;
import io.podflow.unit.ProcessingUnit;
import io.podflow.unit.UnitContext;
import io.podflow.unit.builtin.InMemoryIndexer;
import io.podflow.unit.builtin.PassThroughUnit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ProcessingUnitRegistryTest {

    private static final UnitContext CTX = new UnitContext("p", 0, 0, 1, null, null);

    @Test
    void builtInsAreAlwaysRegistered() throws Exception {
        final ProcessingUnitRegistry registry = ProcessingUnitRegistry.defaults();

        assertEquals(Set.of(StageConfig.PASS_THROUGH, ProcessingUnitRegistry.INDEXER), registry.listUnits());
        assertInstanceOf(PassThroughUnit.class, registry.factory(StageConfig.PASS_THROUGH).create(CTX));
        assertInstanceOf(InMemoryIndexer.class, registry.factory(ProcessingUnitRegistry.INDEXER).create(CTX));
        assertNull(registry.factory("missing"));
    }

    @Test
    void unitsCanBeAddedAtRuntime() throws Exception {
        final ProcessingUnitRegistry registry = ProcessingUnitRegistry.builder().build();
        assertFalse(registry.contains("echo"));

        registry.register("echo", ctx -> new PassThroughUnit());

        assertTrue(registry.contains("echo"));
        final ProcessingUnit unit = registry.factory("echo").create(CTX);
        final Request request = Request.index(List.of(Document.of("a", new float[]{1f})));
        assertEquals("a", unit.process(request).docs().get(0).id());
        assertThrows(UnsupportedOperationException.class, unit::fullScan);
        assertThrows(UnsupportedOperationException.class, () -> registry.listUnits().add("x"));
    }

    @Test
    void builderCanReplaceABuiltIn() throws Exception {
        final ProcessingUnitRegistry registry = ProcessingUnitRegistry.builder()
                .unit(ProcessingUnitRegistry.INDEXER, ctx -> new PassThroughUnit())
                .build();
        assertInstanceOf(PassThroughUnit.class, registry.factory(ProcessingUnitRegistry.INDEXER).create(CTX));
    }
}
