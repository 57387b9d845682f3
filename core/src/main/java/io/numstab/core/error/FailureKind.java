package io.numstab.core.error;

/**
 * Closed set of ways the stabilization pipeline can fail. Each kind has a fixed
 * recovery:
 *
 * <ul>
 * <li>{@link #PARSE_FAILURE}: canonical text cannot be turned back into an
 *     expression; the call passes its input through unchanged.
 * <li>{@link #SOLVER_PROTOCOL_FAILURE}: the solver is missing, failed, or
 *     replied in an unexpected shape; the invoker returns the fallback result.
 * <li>{@link #STORE_UNAVAILABLE}: the cache store cannot be opened or queried;
 *     the call proceeds without caching.
 * </ul>
 */
public enum FailureKind {
    PARSE_FAILURE,
    SOLVER_PROTOCOL_FAILURE,
    STORE_UNAVAILABLE
}
