package io.redisoperator.exceptions;

import io.redisoperator.enums.ErrorClass;

/**
 * A write carried a stale resource version, or a create raced another create.
 * Handled inside the apply engine; reaching the driver means it escaped a retry loop.
 */
public class VersionConflictException extends ReconcileException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.TRANSIENT;
    }

    @Override
    public String getReason() {
        return "VersionConflict";
    }
}
