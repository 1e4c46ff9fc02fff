package io.redisoperator.exceptions;

import io.redisoperator.enums.ErrorClass;
import lombok.Getter;

/**
 * A referenced object is absent or not yet Ready.
 */
@Getter
public class PendingDependencyException extends ReconcileException {

    private final String dependency;

    public PendingDependencyException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.PENDING_DEPENDENCY;
    }

    @Override
    public String getReason() {
        return "DependencyNotReady";
    }
}
