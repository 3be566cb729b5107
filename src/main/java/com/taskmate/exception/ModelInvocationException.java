package com.taskmate.exception;

import lombok.Getter;

/**
 * The language model could not be reached or returned something unusable.
 *
 * <p>{@code mutatedBeforeFailure} records whether an earlier round of the same turn already
 * changed the task store, so the caller can still resynchronise connected clients.</p>
 */
@Getter
public class ModelInvocationException extends RuntimeException {

    private final boolean mutatedBeforeFailure;

    public ModelInvocationException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private ModelInvocationException(String message, Throwable cause, boolean mutatedBeforeFailure) {
        super(message, cause);
        this.mutatedBeforeFailure = mutatedBeforeFailure;
    }

    public static ModelInvocationException duringTurn(Throwable error, boolean mutatedBeforeFailure) {
        if (error instanceof ModelInvocationException mie) {
            return new ModelInvocationException(mie.getMessage(), mie.getCause(), mutatedBeforeFailure);
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ModelInvocationException("The assistant is unavailable right now: " + detail, error, mutatedBeforeFailure);
    }
}
