package io.redisoperator.models.specs;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sentinel group monitoring exactly one master: either an embedded group ({@code redis})
 * or an existing RedisMasterReplica ({@code masterReplicaRef}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RedisSentinelSpec {
    private String image;
    private Integer replicas;
    private ResourceRequirements resources;
    private SentinelConfig config;
    private EmbeddedRedisSpec redis;
    private MasterReplicaRef masterReplicaRef;
}
