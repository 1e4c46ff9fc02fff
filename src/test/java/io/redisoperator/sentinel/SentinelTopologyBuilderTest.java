package io.redisoperator.sentinel;

import io.redisoperator.TopologyFixtures;
import io.redisoperator.enums.ErrorClass;
import io.redisoperator.enums.Phase;
import io.redisoperator.exceptions.PendingDependencyException;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.models.SentinelMonitor;
import io.redisoperator.models.SentinelMonitorSet;
import io.redisoperator.models.specs.SentinelConfig;
import io.redisoperator.models.status.TopologyStatus;
import io.redisoperator.platform.InMemoryPlatformClient;
import io.redisoperator.topology.ManifestFactory;
import io.redisoperator.topology.RedisConfigRenderer;
import io.redisoperator.topology.ReplicationGroupSynthesizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentinelTopologyBuilderTest {

    private InMemoryPlatformClient platform;
    private SentinelTopologyBuilder builder;

    @BeforeEach
    void setUp() {
        platform = new InMemoryPlatformClient();
        builder = new SentinelTopologyBuilder(platform,
                new ReplicationGroupSynthesizer(new ManifestFactory(), new RedisConfigRenderer()));
    }

    @Test
    void testBuild_ReferenceDoesNotExist() {
        // Given
        RedisSentinel sentinel = TopologyFixtures.sentinelWithRef("watch", "sessions");

        // When / Then
        assertThatThrownBy(() -> builder.build(sentinel))
                .isInstanceOf(PendingDependencyException.class)
                .hasMessageContaining("RedisMasterReplica cache/sessions does not exist")
                .satisfies(e -> assertThat(((PendingDependencyException) e).getErrorClass())
                        .isEqualTo(ErrorClass.PENDING_DEPENDENCY));
    }

    @Test
    void testBuild_ReferenceNotReady() {
        // Given
        RedisMasterReplica target = TopologyFixtures.masterReplica("sessions", 1);
        TopologyStatus status = TopologyStatus.pending();
        status.setPhase(Phase.CREATING);
        target.setStatus(status);
        platform.seed(target);

        // When / Then
        assertThatThrownBy(() -> builder.build(TopologyFixtures.sentinelWithRef("watch", "sessions")))
                .isInstanceOf(PendingDependencyException.class)
                .hasMessageContaining("is Creating");
    }

    @Test
    void testBuild_ReadyReferenceWithoutAddress() {
        seedReadyTarget(null);

        assertThatThrownBy(() -> builder.build(TopologyFixtures.sentinelWithRef("watch", "sessions")))
                .isInstanceOf(PendingDependencyException.class)
                .hasMessageContaining("master address");
    }

    @Test
    void testBuild_ReadyReference() throws Exception {
        // Given
        seedReadyTarget("sessions-master-service.cache.svc.cluster.local:6380");
        RedisSentinel sentinel = TopologyFixtures.sentinelWithRef("watch", "sessions");

        // When
        SentinelMonitorSet monitors = builder.build(sentinel);

        // Then
        SentinelMonitor monitor = monitors.primary();
        assertThat(monitors.getReplicas()).isEqualTo(3);
        assertThat(monitor.getMasterName()).isEqualTo("mymaster");
        assertThat(monitor.getHost()).isEqualTo("sessions-master-service.cache.svc.cluster.local");
        assertThat(monitor.getPort()).isEqualTo(6380);
        assertThat(monitor.getQuorum()).isEqualTo(2);
        assertThat(monitor.getDownAfterMs()).isEqualTo(30000);
    }

    @Test
    void testBuild_Embedded() throws Exception {
        // Given
        RedisSentinel sentinel = TopologyFixtures.sentinelEmbedded("watch");
        sentinel.getSpec().setConfig(SentinelConfig.builder().quorum(3).downAfterMs(5000).build());

        // When
        SentinelMonitor monitor = builder.build(sentinel).primary();

        // Then
        assertThat(monitor.getHost()).isEqualTo("watch-redis-master-service.cache.svc.cluster.local");
        assertThat(monitor.getPort()).isEqualTo(6379);
        assertThat(monitor.getQuorum()).isEqualTo(3);
        assertThat(monitor.getDownAfterMs()).isEqualTo(5000);
    }

    @Test
    void testQuorum_DefaultsToMajority() {
        RedisSentinel sentinel = TopologyFixtures.sentinelEmbedded("watch");

        sentinel.getSpec().setReplicas(4);
        assertThat(SentinelTopologyBuilder.quorum(sentinel.getSpec())).isEqualTo(3);
        sentinel.getSpec().setReplicas(5);
        assertThat(SentinelTopologyBuilder.quorum(sentinel.getSpec())).isEqualTo(3);
        sentinel.getSpec().setReplicas(null);
        assertThat(SentinelTopologyBuilder.quorum(sentinel.getSpec())).isEqualTo(2);
    }

    private void seedReadyTarget(String masterAddress) {
        RedisMasterReplica target = TopologyFixtures.masterReplica("sessions", 1);
        TopologyStatus status = TopologyStatus.pending();
        status.setPhase(Phase.READY);
        if (masterAddress != null) {
            status.getServices().put("master", masterAddress);
        }
        target.setStatus(status);
        platform.seed(target);
    }
}
