package io.redisoperator.topology;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.redisoperator.TopologyFixtures;
import io.redisoperator.enums.Role;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.models.specs.MasterReplicaRef;
import io.redisoperator.models.specs.SentinelConfig;
import io.redisoperator.platform.InMemoryPlatformClient;
import io.redisoperator.sentinel.SentinelConfigRenderer;
import io.redisoperator.sentinel.SentinelTopologyBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.redisoperator.config.Constants.ANNOTATION_CONFIG_HASH;
import static io.redisoperator.config.Constants.SENTINEL_CONFIG_FILE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentinelHandlerTest {

    private SentinelHandler handler;

    @BeforeEach
    void setUp() {
        ManifestFactory manifests = new ManifestFactory();
        ReplicationGroupSynthesizer groups = new ReplicationGroupSynthesizer(manifests, new RedisConfigRenderer());
        handler = new SentinelHandler(manifests, groups,
                new SentinelTopologyBuilder(new InMemoryPlatformClient(), groups), new SentinelConfigRenderer());
    }

    @Test
    void testSynthesize_EmbeddedGroup() throws Exception {
        // Given
        RedisSentinel sentinel = TopologyFixtures.sentinelEmbedded("watch");
        handler.validate(sentinel);

        // When
        ChildResourceSet children = handler.synthesize(sentinel, handler.plan(sentinel));

        // Then
        assertThat(children.size()).isEqualTo(9);
        assertThat(children.find(StatefulSet.class, "watch-redis-master")).isPresent();
        assertThat(children.find(StatefulSet.class, "watch-redis-replica").orElseThrow().getSpec().getReplicas())
                .isEqualTo(2);
        StatefulSet sentinels = children.find(StatefulSet.class, "watch-sentinel").orElseThrow();
        assertThat(sentinels.getSpec().getReplicas()).isEqualTo(3);
        assertThat(sentinels.getSpec().getTemplate().getMetadata().getAnnotations())
                .doesNotContainKey(ANNOTATION_CONFIG_HASH);
        assertThat(children.find(ConfigMap.class, "watch-sentinel-config").orElseThrow()
                .getData().get(SENTINEL_CONFIG_FILE))
                .contains("sentinel monitor mymaster watch-redis-master-service.cache.svc.cluster.local 6379 2\n");
    }

    @Test
    void testDesiredReplicas_Embedded() {
        RedisSentinel sentinel = TopologyFixtures.sentinelEmbedded("watch");

        assertThat(handler.desiredReplicas(sentinel))
                .containsEntry(Role.MASTER, 1)
                .containsEntry(Role.REPLICA, 2)
                .containsEntry(Role.SENTINEL, 3);
    }

    @Test
    void testDesiredReplicas_ReferenceOnlyCountsSentinels() {
        RedisSentinel sentinel = TopologyFixtures.sentinelWithRef("watch", "sessions");

        assertThat(handler.desiredReplicas(sentinel)).containsOnlyKeys(Role.SENTINEL);
    }

    @Test
    void testValidate_RequiresExactlyOneTarget() {
        RedisSentinel both = TopologyFixtures.sentinelEmbedded("watch");
        both.getSpec().setMasterReplicaRef(MasterReplicaRef.builder().name("sessions").build());
        RedisSentinel neither = TopologyFixtures.sentinelEmbedded("watch");
        neither.getSpec().setRedis(null);

        assertThatThrownBy(() -> handler.validate(both))
                .isInstanceOf(InvalidSpecException.class)
                .hasMessageContaining("exactly one");
        assertThatThrownBy(() -> handler.validate(neither))
                .isInstanceOf(InvalidSpecException.class)
                .hasMessageContaining("exactly one");
    }

    @Test
    void testValidate_QuorumAboveReplicas() {
        RedisSentinel sentinel = TopologyFixtures.sentinelWithRef("watch", "sessions");
        sentinel.getSpec().setConfig(SentinelConfig.builder().quorum(4).build());

        assertThatThrownBy(() -> handler.validate(sentinel))
                .isInstanceOf(InvalidSpecException.class)
                .hasMessageContaining("quorum");
    }

    @Test
    void testValidate_BlankReferenceName() {
        RedisSentinel sentinel = TopologyFixtures.sentinelWithRef("watch", " ");

        assertThatThrownBy(() -> handler.validate(sentinel))
                .isInstanceOf(InvalidSpecException.class)
                .hasMessageContaining("masterReplicaRef.name");
    }
}
