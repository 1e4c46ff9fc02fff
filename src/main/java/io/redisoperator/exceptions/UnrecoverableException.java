package io.redisoperator.exceptions;

import io.redisoperator.enums.ErrorClass;

/**
 * The platform refused the request outright, e.g. missing RBAC or a rejected manifest.
 */
public class UnrecoverableException extends ReconcileException {

    public UnrecoverableException(String message) {
        super(message);
    }

    public UnrecoverableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.UNRECOVERABLE;
    }

    @Override
    public String getReason() {
        return "Unrecoverable";
    }
}
