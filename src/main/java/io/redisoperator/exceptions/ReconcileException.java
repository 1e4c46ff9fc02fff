package io.redisoperator.exceptions;

import io.redisoperator.enums.ErrorClass;

/**
 * Base of every failure a reconcile pass can end with. The error class decides
 * the retry policy and the phase written to status.
 */
public abstract class ReconcileException extends Exception {

    protected ReconcileException(String message) {
        super(message);
    }

    protected ReconcileException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorClass getErrorClass();

    /**
     * Machine-readable reason used for the status condition.
     */
    public abstract String getReason();
}
