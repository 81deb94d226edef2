package io.podflow.unit;

import io.podflow.core.model.Request;
import io.podflow.core.model.Response;

import java.util.List;

/**
 * The work a single worker performs. A unit instance is owned by exactly one worker and
 * {@link #open()}, {@link #process(Request)} and {@link #close()} are always invoked from
 * that worker's event loop. {@link #fullScan()} is invoked from a dump thread and must
 * tolerate running alongside {@code process}.
 */
public interface ProcessingUnit extends AutoCloseable {

    /**
     * Loads state and warms up. The worker reports ready once this returns.
     */
    default void open() throws Exception {
        // nothing to load
    }

    Response process(Request request) throws Exception;

    /**
     * Every record this unit holds, in insertion order. Only indexers support it.
     */
    default List<ScanRecord> fullScan() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support full scans");
    }

    @Override
    default void close() throws Exception {
        // no-op
    }
}
