package io.numstab.core.error;

/**
 * Abstract base for all numstab exceptions. Never thrown directly; use the
 * concrete subclass for the matching {@link FailureKind}. None of these escape
 * {@code Stabilizer.stabilize()}.
 */
public abstract class StabilizerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    protected StabilizerException(String message, FailureKind kind) {
        super(message);
        this.kind = kind;
    }

    protected StabilizerException(String message, Throwable cause, FailureKind kind) {
        super(message, cause);
        this.kind = kind;
    }

    /** The failure kind, which decides how the pipeline recovers. */
    public FailureKind kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
