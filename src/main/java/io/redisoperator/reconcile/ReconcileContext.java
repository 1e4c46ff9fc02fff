package io.redisoperator.reconcile;

import io.redisoperator.exceptions.DeadlineExceededException;
import io.redisoperator.models.ObjectKey;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-pass state: the object being reconciled and the pass deadline.
 * Long-running steps call {@link #checkDeadline} between platform round trips.
 */
@Getter
public class ReconcileContext {

    private final ObjectKey key;
    private final Clock clock;
    private final Instant deadline;

    public ReconcileContext(ObjectKey key, Clock clock, Duration timeout) {
        this.key = key;
        this.clock = clock;
        this.deadline = clock.instant().plus(timeout);
    }

    public void checkDeadline(String step) throws DeadlineExceededException {
        if (!clock.instant().isBefore(deadline)) {
            throw new DeadlineExceededException("Reconcile deadline " + deadline + " passed before " + step);
        }
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
