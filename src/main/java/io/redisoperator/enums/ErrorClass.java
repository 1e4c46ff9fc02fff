package io.redisoperator.enums;

/**
 * Failure classes of a reconcile pass. Each class maps to one retry policy in the driver.
 */
public enum ErrorClass {
    /** Spec rejected; not retried until the generation changes. */
    INVALID_SPEC(false),
    /** A referenced object is absent or not ready; retried with a short backoff cap. */
    PENDING_DEPENDENCY(true),
    /** Optimistic-concurrency retries ran out on one child. */
    CONFLICT_EXHAUSTED(true),
    /** API unreachable, throttled or the pass deadline expired. */
    TRANSIENT(true),
    /** The platform refused the operator's credentials or a manifest outright. */
    UNRECOVERABLE(false);

    private final boolean retryable;

    ErrorClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
