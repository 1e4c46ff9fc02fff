package io.redisoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.models.status.TopologyStatus;

/**
 * Common view of the four topology custom resources.
 */
public interface TopologyResource extends HasMetadata {

    TopologyKind topologyKind();

    TopologyStatus getStatus();

    void setStatus(TopologyStatus status);

    default ObjectKey key() {
        return ObjectKey.of(topologyKind(), getMetadata().getNamespace(), getMetadata().getName());
    }

    default long generation() {
        Long generation = getMetadata().getGeneration();
        return generation == null ? 0L : generation;
    }

    @JsonIgnore
    default boolean isBeingDeleted() {
        return getMetadata().getDeletionTimestamp() != null;
    }
}
