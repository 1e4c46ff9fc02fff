package io.redisoperator.topology;

import io.redisoperator.enums.Role;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.TopologyResource;

import java.util.Map;

/**
 * Per-kind capability set used by the reconcile driver.
 */
public interface TopologyHandler<R extends TopologyResource> {

    TopologyKind getKind();

    Class<R> getResourceType();

    /**
     * Rejects specs that cannot be synthesized.
     */
    void validate(R resource) throws InvalidSpecException;

    /**
     * Resolves kind-specific inputs (slot assignment, monitored master). May read the platform.
     */
    default TopologyPlan plan(R resource) throws ReconcileException {
        return TopologyPlan.empty();
    }

    /**
     * Pure function of the resource and its plan.
     */
    ChildResourceSet synthesize(R resource, TopologyPlan plan) throws InvalidSpecException;

    /**
     * Replica count per role; assumes {@link #validate} passed.
     */
    Map<Role, Integer> desiredReplicas(R resource);
}
