package io.redisoperator.enums;

import io.redisoperator.models.RedisCluster;
import io.redisoperator.models.RedisInstance;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.models.TopologyResource;
import lombok.Getter;

/**
 * The Redis deployment shapes the operator reconciles.
 */
@Getter
public enum TopologyKind {
    INSTANCE("RedisInstance", "instance", RedisInstance.class),
    MASTER_REPLICA("RedisMasterReplica", "masterreplica", RedisMasterReplica.class),
    SENTINEL("RedisSentinel", "sentinel", RedisSentinel.class),
    CLUSTER("RedisCluster", "cluster", RedisCluster.class);

    private final String resourceKind;
    private final String labelValue;
    private final Class<? extends TopologyResource> resourceType;

    TopologyKind(String resourceKind, String labelValue, Class<? extends TopologyResource> resourceType) {
        this.resourceKind = resourceKind;
        this.labelValue = labelValue;
        this.resourceType = resourceType;
    }

    /**
     * Accepts the resource kind ("RedisCluster"), the label value ("cluster") or the enum name, ignoring case.
     */
    public static TopologyKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Topology kind must not be empty");
        }
        String trimmed = value.trim();
        for (TopologyKind kind : values()) {
            if (kind.resourceKind.equalsIgnoreCase(trimmed)
                    || kind.labelValue.equalsIgnoreCase(trimmed)
                    || kind.name().equalsIgnoreCase(trimmed)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown topology kind: " + value);
    }
}
