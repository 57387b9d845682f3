package io.numstab.core.error;

/**
 * Thrown when the external solver cannot be run or its reply does not have the
 * expected shape. Converted into a fallback result by the invoker.
 */
public final class SolverProtocolException extends StabilizerException {

    private static final long serialVersionUID = 1L;

    public SolverProtocolException(String message) {
        super(message, FailureKind.SOLVER_PROTOCOL_FAILURE);
    }

    public SolverProtocolException(String message, Throwable cause) {
        super(message, cause, FailureKind.SOLVER_PROTOCOL_FAILURE);
    }
}
