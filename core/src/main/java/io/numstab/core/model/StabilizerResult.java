package io.numstab.core.model;

import java.util.Objects;

/**
 * A solver verdict: the input, the rewritten output, and the solver's error
 * estimates in bits of accuracy lost (lower is better).
 *
 * <p>
 * {@code T} is {@code String} (canonical text) while the result travels through
 * the solver and the cache, and {@link MathExpr} once translated back for the
 * host. {@code errout > errin} is a legitimate solver regression; {@code NaN}
 * in both fields means the solver gave no usable answer.
 *
 * <p>
 * Immutable.
 */
public record StabilizerResult<T>(T cmdin, T cmdout, double errin, double errout) {

    public StabilizerResult {
        Objects.requireNonNull(cmdin, "cmdin must not be null");
        Objects.requireNonNull(cmdout, "cmdout must not be null");
    }

    /** "No change, unknown error": output equals input, both error fields {@code NaN}. */
    public static <T> StabilizerResult<T> fallback(T cmdin) {
        return new StabilizerResult<>(cmdin, cmdin, Double.NaN, Double.NaN);
    }

    /** {@code true} when either error estimate is {@code NaN}. */
    public boolean isUnknown() {
        return Double.isNaN(errin) || Double.isNaN(errout);
    }

    /**
     * Bits of accuracy recovered ({@code errin - errout}); negative on
     * regression, NaN if unknown.
     */
    public double improvement() {
        return errin - errout;
    }

    /** Returns a copy carrying different input/output values and the same error estimates. */
    public <U> StabilizerResult<U> withExprs(U newCmdin, U newCmdout) {
        return new StabilizerResult<>(newCmdin, newCmdout, errin, errout);
    }
}
