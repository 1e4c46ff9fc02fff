package io.redisoperator.status;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.redisoperator.config.Constants.CONDITION_FALSE;
import static io.redisoperator.config.Constants.CONDITION_TRUE;
import static io.redisoperator.config.Constants.REASON_RESOLVED;

/**
 * Append-only condition log, most recent last. A condition is appended only when its
 * status, reason or message differs from the latest condition of the same type.
 */
public class ConditionHistory {

    private final List<Condition> conditions;
    private final Clock clock;
    private final long generation;

    public ConditionHistory(List<Condition> existing, Clock clock, long generation) {
        this.conditions = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        this.clock = clock;
        this.generation = generation;
    }

    /**
     * @return true when a new condition was appended
     */
    public boolean record(String type, boolean status, String reason, String message) {
        String statusValue = status ? CONDITION_TRUE : CONDITION_FALSE;
        Optional<Condition> latest = latest(type);
        if (latest.isPresent()
                && Objects.equals(latest.get().getStatus(), statusValue)
                && Objects.equals(latest.get().getReason(), reason)
                && Objects.equals(latest.get().getMessage(), message)) {
            return false;
        }
        conditions.add(new ConditionBuilder()
                .withType(type)
                .withStatus(statusValue)
                .withReason(reason)
                .withMessage(message)
                .withObservedGeneration(generation)
                .withLastTransitionTime(clock.instant().toString())
                .build());
        return true;
    }

    /**
     * Appends a False condition when the latest one of {@code type} is True.
     */
    public void resolve(String type) {
        if (isTrue(type)) {
            record(type, false, REASON_RESOLVED, type + " no longer applies");
        }
    }

    public boolean isTrue(String type) {
        return latest(type).map(c -> CONDITION_TRUE.equals(c.getStatus())).orElse(false);
    }

    public Optional<Condition> latest(String type) {
        for (int i = conditions.size() - 1; i >= 0; i--) {
            if (type.equals(conditions.get(i).getType())) {
                return Optional.of(conditions.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * The history with the oldest entries dropped beyond {@code max}.
     */
    public List<Condition> capped(int max) {
        if (conditions.size() <= max) {
            return new ArrayList<>(conditions);
        }
        return new ArrayList<>(conditions.subList(conditions.size() - max, conditions.size()));
    }
}
