package io.redisoperator;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.redisoperator.models.RedisCluster;
import io.redisoperator.models.RedisInstance;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.models.specs.EmbeddedRedisSpec;
import io.redisoperator.models.specs.MasterReplicaRef;
import io.redisoperator.models.specs.RedisClusterSpec;
import io.redisoperator.models.specs.RedisInstanceSpec;
import io.redisoperator.models.specs.RedisMasterReplicaSpec;
import io.redisoperator.models.specs.RedisSentinelSpec;
import io.redisoperator.models.specs.RoleSpec;

/**
 * Topology objects used across tests.
 */
public final class TopologyFixtures {

    public static final String NAMESPACE = "cache";
    public static final String IMAGE = "redis:7.2";

    private TopologyFixtures() {
    }

    public static ObjectMeta meta(String name, String uid) {
        return new ObjectMetaBuilder()
                .withName(name)
                .withNamespace(NAMESPACE)
                .withUid(uid)
                .withGeneration(1L)
                .build();
    }

    public static RedisInstance instance(String name) {
        RedisInstance instance = new RedisInstance();
        instance.setMetadata(meta(name, "uid-" + name));
        instance.setSpec(RedisInstanceSpec.builder().image(IMAGE).build());
        return instance;
    }

    public static RedisMasterReplica masterReplica(String name, int replicas) {
        RedisMasterReplica masterReplica = new RedisMasterReplica();
        masterReplica.setMetadata(meta(name, "uid-" + name));
        masterReplica.setSpec(RedisMasterReplicaSpec.builder()
                .image(IMAGE)
                .replica(RoleSpec.builder().replicas(replicas).build())
                .build());
        return masterReplica;
    }

    public static RedisSentinel sentinelWithRef(String name, String target) {
        RedisSentinel sentinel = new RedisSentinel();
        sentinel.setMetadata(meta(name, "uid-" + name));
        sentinel.setSpec(RedisSentinelSpec.builder()
                .image(IMAGE)
                .replicas(3)
                .masterReplicaRef(MasterReplicaRef.builder().name(target).build())
                .build());
        return sentinel;
    }

    public static RedisSentinel sentinelEmbedded(String name) {
        RedisSentinel sentinel = new RedisSentinel();
        sentinel.setMetadata(meta(name, "uid-" + name));
        sentinel.setSpec(RedisSentinelSpec.builder()
                .image(IMAGE)
                .replicas(3)
                .redis(EmbeddedRedisSpec.builder()
                        .replica(RoleSpec.builder().replicas(2).build())
                        .build())
                .build());
        return sentinel;
    }

    public static RedisCluster cluster(String name, int masters, int replicasPerMaster) {
        RedisCluster cluster = new RedisCluster();
        cluster.setMetadata(meta(name, "uid-" + name));
        cluster.setSpec(RedisClusterSpec.builder()
                .image(IMAGE)
                .masters(masters)
                .replicasPerMaster(replicasPerMaster)
                .build());
        return cluster;
    }
}
