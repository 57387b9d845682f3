package io.numstab.core.spi;

import io.numstab.core.error.FailureKind;

/**
 * Observability hooks for the stabilization pipeline. Adapters bridge these to
 * whatever reporting they have; the core carries no telemetry dependency.
 *
 * <p>
 * Exceptions thrown by a listener are caught and logged by {@code Stabilizer};
 * they never affect the result.
 */
public interface StabilizerListener {

    /** The canonical text was found in the cache. */
    default void onCacheHit(CacheEvent event) {}

    /** The canonical text was not cached; the solver is about to run. */
    default void onCacheMiss(CacheEvent event) {}

    /** The solver answered (successfully or with a fallback). */
    default void onSolverCompleted(SolverCompletedEvent event) {}

    /** A failure was absorbed somewhere in the pipeline. */
    default void onFailure(FailureEvent event) {}

    /** Event carrying the canonical text being looked up. */
    record CacheEvent(String canonicalText) {}

    /** Event emitted after a solver run. */
    record SolverCompletedEvent(String canonicalText, long durationMs, double errin, double errout, boolean fallback) {}

    /** Event emitted when a failure is absorbed. */
    record FailureEvent(String canonicalText, FailureKind kind, String detail) {}
}
