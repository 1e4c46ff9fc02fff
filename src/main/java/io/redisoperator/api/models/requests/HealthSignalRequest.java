package io.redisoperator.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.models.HealthSignal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health report pushed by the metrics collector for one topology object.
 *
 * Example usage:
 * <pre>
 * {
 *   "kind": "cluster",
 *   "namespace": "cache",
 *   "name": "sessions",
 *   "up": true,
 *   "instances_down": 0,
 *   "cluster_state": "ok",
 *   "known_masters": 3
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthSignalRequest {
    private String kind;
    private String namespace;
    private String name;
    private Boolean up;
    private Integer instancesDown;
    private String clusterState;
    private Integer knownMasters;

    /**
     * @throws IllegalArgumentException when a required field is missing or the kind is unknown
     */
    public HealthSignal toSignal() {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (up == null) {
            throw new IllegalArgumentException("up is required");
        }
        if (instancesDown != null && instancesDown < 0) {
            throw new IllegalArgumentException("instances_down must not be negative");
        }
        return HealthSignal.builder()
            .kind(TopologyKind.fromString(kind))
            .namespace(namespace.trim())
            .name(name.trim())
            .up(up)
            .instancesDown(instancesDown)
            .clusterState(clusterState)
            .knownMasters(knownMasters)
            .build();
    }
}
