package io.redisoperator.exceptions;

import io.redisoperator.enums.ErrorClass;
import lombok.Getter;

/**
 * Every optimistic-concurrency attempt on one object hit a version conflict.
 */
@Getter
public class ConflictExhaustedException extends ReconcileException {

    private final String resource;
    private final int attempts;

    public ConflictExhaustedException(String resource, int attempts, Throwable lastConflict) {
        super("Gave up writing " + resource + " after " + attempts + " conflicting attempts", lastConflict);
        this.resource = resource;
        this.attempts = attempts;
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.CONFLICT_EXHAUSTED;
    }

    @Override
    public String getReason() {
        return "ConflictRetriesExhausted";
    }
}
