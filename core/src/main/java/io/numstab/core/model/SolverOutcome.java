package io.numstab.core.model;

import io.numstab.core.error.FailureKind;
import java.util.Objects;

/**
 * What a solver invocation produced: always a usable {@link StabilizerResult},
 * plus, when the result is the fallback, the kind of failure and a detail
 * message.
 */
public final class SolverOutcome {

    private final StabilizerResult<String> result;
    private final FailureKind failure;
    private final String detail;

    private SolverOutcome(StabilizerResult<String> result, FailureKind failure, String detail) {
        this.result = result;
        this.failure = failure;
        this.detail = detail;
    }

    public static SolverOutcome success(StabilizerResult<String> result) {
        Objects.requireNonNull(result, "result must not be null");
        return new SolverOutcome(result, null, null);
    }

    /** The fallback for {@code canonicalText}: unchanged output, {@code NaN} error estimates. */
    public static SolverOutcome fallback(String canonicalText, FailureKind failure, String detail) {
        Objects.requireNonNull(failure, "failure must not be null for a fallback");
        return new SolverOutcome(StabilizerResult.fallback(canonicalText), failure, detail);
    }

    public StabilizerResult<String> result() {
        return result;
    }

    /** The failure kind, or {@code null} on success. */
    public FailureKind failure() {
        return failure;
    }

    /** Failure detail, or {@code null} on success. */
    public String detail() {
        return detail;
    }

    public boolean isFallback() {
        return failure != null;
    }

    @Override
    public String toString() {
        return isFallback()
                ? "SolverOutcome[FALLBACK, " + failure + ": " + detail + "]"
                : "SolverOutcome[SUCCESS, errin=" + result.errin() + ", errout=" + result.errout() + "]";
    }
}
