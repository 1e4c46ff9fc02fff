package io.redisoperator.status;

import io.redisoperator.apply.AppliedResult;
import io.redisoperator.enums.Role;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.topology.TopologyPlan;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything a reconcile pass produced, as far as it got. {@code error} is set when the pass failed.
 */
@Value
@Builder
public class PassOutcome {
    @Builder.Default
    Map<Role, Integer> desiredReplicas = Map.of();
    TopologyPlan plan;
    ChildResourceSet desired;
    AppliedResult applied;
    ReconcileException error;

    public boolean isFailed() {
        return error != null;
    }
}
