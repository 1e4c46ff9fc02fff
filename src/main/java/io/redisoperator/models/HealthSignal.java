package io.redisoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.redisoperator.enums.TopologyKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Out-of-band health of one topology object as reported by the metrics collector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSignal {
    private static final String CLUSTER_STATE_OK = "ok";

    private TopologyKind kind;
    private String namespace;
    private String name;
    /** All Redis/Sentinel processes answered the last probe. */
    private boolean up;
    private Integer instancesDown;
    /** {@code cluster_state} from CLUSTER INFO, cluster topologies only. */
    private String clusterState;
    private Integer knownMasters;
    private Instant observedAt;

    @JsonIgnore
    public ObjectKey key() {
        return ObjectKey.of(kind, namespace, name);
    }

    @JsonIgnore
    public boolean isClusterStateOk() {
        return clusterState == null || CLUSTER_STATE_OK.equalsIgnoreCase(clusterState);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return up && isClusterStateOk();
    }
}
