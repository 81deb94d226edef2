package io.podflow.unit.registry;

import io.podflow.config.impl.StageConfig;
import io.podflow.unit.ProcessingUnitFactory;
import io.podflow.unit.builtin.InMemoryIndexer;
import io.podflow.unit.builtin.PassThroughUnit;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps the {@code uses} names of stage configs to unit factories.
 * The built-ins {@code _pass} and {@code _index} are always present unless replaced.
 */
public final class ProcessingUnitRegistry {
    public static final String INDEXER = "_index";

    private final ConcurrentMap<String, ProcessingUnitFactory> units;

    private ProcessingUnitRegistry(final Map<String, ProcessingUnitFactory> units) {
        this.units = new ConcurrentHashMap<>(units);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProcessingUnitRegistry defaults() {
        return builder().build();
    }

    public boolean contains(final String name) {
        return units.containsKey(name);
    }

    public ProcessingUnitFactory factory(final String name) {
        return units.get(name);
    }

    public Set<String> listUnits() {
        return Collections.unmodifiableSet(units.keySet());
    }

    /**
     * Add or replace a unit.
     */
    public void register(final String name, final ProcessingUnitFactory factory) {
        units.put(name, factory);
    }

    public static final class Builder {
        private final Map<String, ProcessingUnitFactory> map = new HashMap<>();

        private Builder() {
            map.put(StageConfig.PASS_THROUGH, ctx -> new PassThroughUnit());
            map.put(INDEXER, InMemoryIndexer::new);
        }

        public Builder unit(final String name, final ProcessingUnitFactory factory) {
            map.put(name, factory);
            return this;
        }

        public ProcessingUnitRegistry build() {
            return new ProcessingUnitRegistry(map);
        }
    }
}
