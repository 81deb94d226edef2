package io.podflow.unit;

/**
 * Creates a fresh unit for a worker. Called once per worker start, including restarts
 * during a rolling update.
 */
@FunctionalInterface
public interface ProcessingUnitFactory {
    ProcessingUnit create(UnitContext context) throws Exception;
}
