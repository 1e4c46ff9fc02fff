package io.redisoperator.exceptions;

import io.redisoperator.enums.ErrorClass;

/**
 * The object's spec field cannot be synthesized. Not retried until its generation changes.
 */
public class InvalidSpecException extends ReconcileException {

    public InvalidSpecException(String message) {
        super(message);
    }

    public InvalidSpecException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.INVALID_SPEC;
    }

    @Override
    public String getReason() {
        return "InvalidSpec";
    }
}
