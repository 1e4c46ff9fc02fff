package io.redisoperator.apply;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.redisoperator.TopologyFixtures;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.topology.ManifestFactory;
import io.redisoperator.topology.MasterReplicaHandler;
import io.redisoperator.topology.RedisConfigRenderer;
import io.redisoperator.topology.ReplicationGroupSynthesizer;
import io.redisoperator.topology.TopologyPlan;
import io.redisoperator.util.Manifests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static io.redisoperator.config.Constants.REDIS_CONFIG_FILE;
import static org.assertj.core.api.Assertions.assertThat;

class ManifestMergerTest {

    private final ManifestMerger merger = new ManifestMerger();
    private ChildResourceSet desired;

    @BeforeEach
    void setUp() throws Exception {
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 2);
        MasterReplicaHandler handler = new MasterReplicaHandler(
                new ReplicationGroupSynthesizer(new ManifestFactory(), new RedisConfigRenderer()));
        desired = handler.synthesize(group, TopologyPlan.empty());
    }

    @Test
    void testMerge_IdenticalIsUnchanged() {
        StatefulSet wanted = statefulSet();

        assertThat(merger.merge(Manifests.copy(wanted), wanted)).isEmpty();
    }

    @Test
    void testMerge_ReplicaDrift() {
        // Given
        StatefulSet wanted = statefulSet();
        StatefulSet live = Manifests.copy(wanted);
        live.getSpec().setReplicas(5);

        // When
        Optional<StatefulSet> merged = merger.merge(live, wanted);

        // Then
        assertThat(merged).isPresent();
        assertThat(merged.get().getSpec().getReplicas()).isEqualTo(2);
    }

    @Test
    void testMerge_ForeignMetadataIsKept() {
        // Given
        ConfigMap wanted = desired.find(ConfigMap.class, "sessions-replica-config").orElseThrow();
        ConfigMap live = Manifests.copy(wanted);
        live.getMetadata().getLabels().put("team", "payments");
        live.getMetadata().setAnnotations(new HashMap<>());
        live.getMetadata().getAnnotations().put("backup", "nightly");

        // When / Then
        assertThat(merger.merge(live, wanted)).isEmpty();
    }

    @Test
    void testMerge_ConfigDataDrift() {
        // Given
        ConfigMap wanted = desired.find(ConfigMap.class, "sessions-replica-config").orElseThrow();
        ConfigMap live = Manifests.copy(wanted);
        live.getData().put(REDIS_CONFIG_FILE, "port 1\n");
        live.getMetadata().getLabels().put("team", "payments");

        // When
        ConfigMap merged = merger.merge(live, wanted).orElseThrow();

        // Then
        assertThat(merged.getData()).isEqualTo(wanted.getData());
        assertThat(merged.getMetadata().getLabels()).containsEntry("team", "payments");
    }

    @Test
    void testMerge_ServiceKeepsAllocatedNodePort() {
        // Given
        Service wanted = desired.find(Service.class, "sessions-master-service").orElseThrow();
        Service live = Manifests.copy(wanted);
        ServicePort port = live.getSpec().getPorts().get(0);
        port.setNodePort(30001);
        port.setPort(7000);

        // When
        Service merged = merger.merge(live, wanted).orElseThrow();

        // Then
        assertThat(merged.getSpec().getPorts().get(0).getPort()).isEqualTo(6379);
        assertThat(merged.getSpec().getPorts().get(0).getNodePort()).isEqualTo(30001);
    }

    @Test
    void testMerge_ImageChangeReplacesTemplate() {
        // Given
        StatefulSet wanted = statefulSet();
        StatefulSet live = Manifests.copy(wanted);
        live.getSpec().getTemplate().getSpec().getContainers().get(0).setImage("redis:6.0");

        // When
        StatefulSet merged = merger.merge(live, wanted).orElseThrow();

        // Then
        assertThat(merged.getSpec().getTemplate().getSpec().getContainers().get(0).getImage())
                .isEqualTo(TopologyFixtures.IMAGE);
    }

    @Test
    void testMerge_TemplateCommandDriftReverted() {
        // Given
        StatefulSet wanted = statefulSet();
        StatefulSet live = Manifests.copy(wanted);
        live.getSpec().getTemplate().getSpec().getContainers().get(0).setCommand(List.of("sleep", "infinity"));

        // When
        Optional<StatefulSet> merged = merger.merge(live, wanted);

        // Then
        assertThat(merged).isPresent();
        assertThat(merged.get().getSpec().getTemplate().getSpec().getContainers().get(0).getCommand())
                .isEqualTo(wanted.getSpec().getTemplate().getSpec().getContainers().get(0).getCommand());
    }

    @Test
    void testMerge_AddedEnvIsDrift() {
        // Given
        StatefulSet wanted = statefulSet();
        StatefulSet live = Manifests.copy(wanted);
        live.getSpec().getTemplate().getSpec().getContainers().get(0)
                .setEnv(List.of(new EnvVar("REDIS_ARGS", "--protected-mode no", null)));

        // When
        Optional<StatefulSet> merged = merger.merge(live, wanted);

        // Then
        assertThat(merged).isPresent();
        assertThat(merged.get().getSpec().getTemplate().getSpec().getContainers().get(0).getEnv()).isNullOrEmpty();
    }

    @Test
    void testMerge_ServerDefaultsAreNotDrift() {
        // Given
        StatefulSet wanted = statefulSet();
        StatefulSet live = Manifests.copy(wanted);
        live.getSpec().getTemplate().getSpec().setDnsPolicy("ClusterFirst");
        live.getSpec().getTemplate().getSpec().setSchedulerName("default-scheduler");
        live.getSpec().getTemplate().getSpec().getContainers().get(0).setTerminationMessagePath("/dev/termination-log");

        // When / Then
        assertThat(merger.merge(live, wanted)).isEmpty();
    }

    private StatefulSet statefulSet() {
        return desired.find(StatefulSet.class, "sessions-replica").orElseThrow();
    }
}
