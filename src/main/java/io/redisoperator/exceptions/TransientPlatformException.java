package io.redisoperator.exceptions;

import io.redisoperator.enums.ErrorClass;

/**
 * The platform API failed in a way that may succeed on retry.
 */
public class TransientPlatformException extends ReconcileException {

    public TransientPlatformException(String message) {
        super(message);
    }

    public TransientPlatformException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.TRANSIENT;
    }

    @Override
    public String getReason() {
        return "TransientPlatformError";
    }
}
