package io.redisoperator.reconcile;

import lombok.Value;

import java.time.Duration;

/**
 * What the driver does with a key after a pass.
 */
@Value
public class ReconcileResult {

    public enum Action {
        /** Converged; revisit after the resync interval. */
        DONE,
        /** Failed with a retryable error; revisit after the backoff delay. */
        REQUEUE,
        /** Nothing to do until the object changes. */
        STOP
    }

    Action action;
    Duration delay;

    public static ReconcileResult done(Duration resync) {
        return new ReconcileResult(Action.DONE, resync);
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(Action.REQUEUE, delay);
    }

    public static ReconcileResult stop() {
        return new ReconcileResult(Action.STOP, Duration.ZERO);
    }
}
