package io.numstab.core.error;

/** Thrown when the result store cannot be created, opened or queried. */
public final class StoreUnavailableException extends StabilizerException {

    private static final long serialVersionUID = 1L;

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause, FailureKind.STORE_UNAVAILABLE);
    }
}
