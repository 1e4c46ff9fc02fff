package io.redisoperator.status;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.redisoperator.TopologyFixtures;
import io.redisoperator.allocation.SlotAllocator;
import io.redisoperator.apply.AppliedResult;
import io.redisoperator.apply.ConflictSafeApplier;
import io.redisoperator.apply.ManifestMerger;
import io.redisoperator.apply.StorageChangeAnalyzer;
import io.redisoperator.enums.Phase;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.ConflictExhaustedException;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.exceptions.PendingDependencyException;
import io.redisoperator.exceptions.TransientPlatformException;
import io.redisoperator.exceptions.OwnershipConflictException;
import io.redisoperator.exceptions.UnrecoverableException;
import io.redisoperator.exceptions.VersionConflictException;
import io.redisoperator.metrics.MetricsProvider;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.HealthSignal;
import io.redisoperator.models.RedisCluster;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.models.status.TopologyStatus;
import io.redisoperator.platform.InMemoryPlatformClient;
import io.redisoperator.reconcile.ReconcileContext;
import io.redisoperator.topology.ClusterHandler;
import io.redisoperator.topology.ManifestFactory;
import io.redisoperator.topology.MasterReplicaHandler;
import io.redisoperator.topology.RedisConfigRenderer;
import io.redisoperator.topology.ReplicationGroupSynthesizer;
import io.redisoperator.topology.TopologyHandler;
import io.redisoperator.topology.TopologyPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static io.redisoperator.config.Constants.*;
import static org.assertj.core.api.Assertions.assertThat;

class StatusAggregatorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private InMemoryPlatformClient platform;
    private ConflictSafeApplier applier;
    private StatusAggregator aggregator;
    private MasterReplicaHandler masterReplicaHandler;
    private ClusterHandler clusterHandler;

    @BeforeEach
    void setUp() {
        platform = new InMemoryPlatformClient();
        applier = new ConflictSafeApplier(platform, new ManifestMerger(), new StorageChangeAnalyzer(),
                new MetricsProvider(new SimpleMeterRegistry(), "test"), 5);
        aggregator = new StatusAggregator(clock, 20);
        ManifestFactory manifests = new ManifestFactory();
        RedisConfigRenderer renderer = new RedisConfigRenderer();
        masterReplicaHandler = new MasterReplicaHandler(new ReplicationGroupSynthesizer(manifests, renderer));
        clusterHandler = new ClusterHandler(manifests, renderer, new SlotAllocator());
    }

    @Test
    void testAggregate_CreatingWhileReplicasComeUp() throws Exception {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 2);
        PassOutcome outcome = pass(masterReplicaHandler, group, Map.of("sessions-master", 1, "sessions-replica", 1));

        // When
        TopologyStatus status = aggregator.aggregate(group, outcome, Optional.empty());

        // Then
        assertThat(status.getPhase()).isEqualTo(Phase.CREATING);
        assertThat(status.getObservedGeneration()).isEqualTo(1L);
        assertThat(status.getRoles().get("master").getReady()).isEqualTo(1);
        assertThat(status.getRoles().get("replica").getDesired()).isEqualTo(2);
        assertThat(status.getRoles().get("replica").getReady()).isEqualTo(1);
        assertThat(status.latestCondition(CONDITION_READY).orElseThrow().getMessage())
                .isEqualTo("master 1/1, replica 1/2 ready");
    }

    @Test
    void testAggregate_ReadyPublishesServiceAddresses() throws Exception {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 2);
        PassOutcome outcome = pass(masterReplicaHandler, group, Map.of("sessions-master", 1, "sessions-replica", 2));

        // When
        TopologyStatus status = aggregator.aggregate(group, outcome, Optional.empty());

        // Then
        assertThat(status.getPhase()).isEqualTo(Phase.READY);
        assertThat(status.getServices())
                .containsEntry("master", "sessions-master-service.cache.svc.cluster.local:6379")
                .containsEntry("replica", "sessions-replica-service.cache.svc.cluster.local:6379");
        assertThat(status.latestCondition(CONDITION_READY).orElseThrow().getStatus()).isEqualTo(CONDITION_TRUE);
    }

    @Test
    void testAggregate_ReadyToDegradedOnLostReplica() throws Exception {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 2);
        group.setStatus(status(Phase.READY));
        PassOutcome outcome = pass(masterReplicaHandler, group, Map.of("sessions-master", 1, "sessions-replica", 1));

        // When
        TopologyStatus status = aggregator.aggregate(group, outcome, Optional.empty());

        // Then
        assertThat(status.getPhase()).isEqualTo(Phase.DEGRADED);
    }

    @Test
    void testAggregate_UnhealthySignalDegrades() throws Exception {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);
        PassOutcome outcome = pass(masterReplicaHandler, group, Map.of("sessions-master", 1, "sessions-replica", 1));
        HealthSignal signal = HealthSignal.builder()
                .kind(TopologyKind.MASTER_REPLICA).namespace(TopologyFixtures.NAMESPACE).name("sessions")
                .up(false).instancesDown(1).build();

        // When
        TopologyStatus status = aggregator.aggregate(group, outcome, Optional.of(signal));

        // Then
        assertThat(status.getPhase()).isEqualTo(Phase.DEGRADED);
        assertThat(status.latestCondition(CONDITION_READY).orElseThrow().getMessage())
                .isEqualTo("Health signal reports 1 instances down");
    }

    @Test
    void testAggregate_InvalidSpec() {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);
        PassOutcome outcome = PassOutcome.builder().error(new InvalidSpecException("spec.image must be set")).build();

        // When
        TopologyStatus status = aggregator.aggregate(group, outcome, Optional.empty());

        // Then
        assertThat(status.getPhase()).isEqualTo(Phase.INVALID);
        assertThat(status.latestCondition(CONDITION_INVALID_SPEC).orElseThrow().getMessage())
                .isEqualTo("spec.image must be set");
        assertThat(status.latestCondition(CONDITION_READY).orElseThrow().getStatus()).isEqualTo(CONDITION_FALSE);
    }

    @Test
    void testAggregate_PendingDependency() {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);
        PassOutcome outcome = PassOutcome.builder()
                .error(new PendingDependencyException("RedisMasterReplica cache/x", "RedisMasterReplica cache/x does not exist"))
                .build();

        // When
        TopologyStatus pending = aggregator.aggregate(group, outcome, Optional.empty());
        group.setStatus(status(Phase.READY));
        TopologyStatus degraded = aggregator.aggregate(group, outcome, Optional.empty());

        // Then
        assertThat(pending.getPhase()).isEqualTo(Phase.PENDING);
        assertThat(pending.latestCondition(CONDITION_PENDING_DEPENDENCY).orElseThrow().getReason())
                .isEqualTo("DependencyNotReady");
        assertThat(degraded.getPhase()).isEqualTo(Phase.DEGRADED);
    }

    @Test
    void testAggregate_ConflictExhaustion() {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);
        PassOutcome outcome = PassOutcome.builder()
                .error(new ConflictExhaustedException("ConfigMap/x", 5, new VersionConflictException("modified")))
                .build();

        // When
        TopologyStatus fresh = aggregator.aggregate(group, outcome, Optional.empty());
        group.setStatus(status(Phase.READY));
        TopologyStatus serving = aggregator.aggregate(group, outcome, Optional.empty());

        // Then
        assertThat(fresh.getPhase()).isEqualTo(Phase.FAILED);
        assertThat(serving.getPhase()).isEqualTo(Phase.DEGRADED);
        assertThat(serving.latestCondition(CONDITION_CONFLICT_EXHAUSTED)).isPresent();
    }

    @Test
    void testAggregate_UnrecoverableFails() {
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);
        group.setStatus(status(Phase.READY));
        PassOutcome outcome = PassOutcome.builder().error(new UnrecoverableException("forbidden")).build();

        TopologyStatus status = aggregator.aggregate(group, outcome, Optional.empty());

        assertThat(status.getPhase()).isEqualTo(Phase.FAILED);
        assertThat(status.latestCondition(CONDITION_PLATFORM_ERROR)).isPresent();
    }

    @Test
    void testAggregate_OwnershipConflictFails() {
        RedisCluster cluster = TopologyFixtures.cluster("sessions", 3, 1);
        PassOutcome outcome = PassOutcome.builder()
                .error(new OwnershipConflictException("StatefulSet/sessions-master is owned by MasterReplica sessions"))
                .build();

        TopologyStatus status = aggregator.aggregate(cluster, outcome, Optional.empty());

        assertThat(status.getPhase()).isEqualTo(Phase.FAILED);
        assertThat(status.latestCondition(CONDITION_PLATFORM_ERROR)).hasValueSatisfying(
                condition -> assertThat(condition.getReason()).isEqualTo("OwnershipConflict"));
    }

    @Test
    void testAggregate_TransientKeepsPhase() {
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);
        group.setStatus(status(Phase.READY));
        PassOutcome outcome = PassOutcome.builder().error(new TransientPlatformException("timeout")).build();

        assertThat(aggregator.aggregate(group, outcome, Optional.empty()).getPhase()).isEqualTo(Phase.READY);
    }

    @Test
    void testAggregate_FixedSpecReentersPending() throws Exception {
        // Given
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);
        group.setStatus(aggregator.aggregate(group,
                PassOutcome.builder().error(new InvalidSpecException("bad")).build(), Optional.empty()));
        assertThat(group.getStatus().getPhase()).isEqualTo(Phase.INVALID);
        group.getMetadata().setGeneration(2L);
        PassOutcome outcome = pass(masterReplicaHandler, group, Map.of("sessions-master", 1, "sessions-replica", 1));

        // When
        TopologyStatus accepted = aggregator.aggregate(group, outcome, Optional.empty());
        group.setStatus(accepted);
        TopologyStatus next = aggregator.aggregate(group, outcome, Optional.empty());

        // Then
        assertThat(accepted.getPhase()).isEqualTo(Phase.PENDING);
        assertThat(accepted.getObservedGeneration()).isEqualTo(2L);
        assertThat(accepted.latestCondition(CONDITION_INVALID_SPEC).orElseThrow().getStatus())
                .isEqualTo(CONDITION_FALSE);
        assertThat(accepted.latestCondition(CONDITION_READY).orElseThrow().getReason()).isEqualTo("SpecAccepted");
        assertThat(next.getPhase()).isEqualTo(Phase.READY);
    }

    @Test
    void testAggregate_ClusterScaleOutWaitsForMigration() throws Exception {
        // Given
        RedisCluster cluster = TopologyFixtures.cluster("shards", 3, 0);
        PassOutcome first = pass(clusterHandler, cluster, Map.of("shards-master", 3, "shards-replica", 0));
        cluster.setStatus(aggregator.aggregate(cluster, first, Optional.empty()));
        assertThat(cluster.getStatus().getPhase()).isEqualTo(Phase.READY);

        cluster.getSpec().setMasters(4);
        PassOutcome scaled = pass(clusterHandler, cluster, Map.of("shards-master", 4, "shards-replica", 0));

        // When
        TopologyStatus migrating = aggregator.aggregate(cluster, scaled, Optional.empty());
        cluster.setStatus(migrating);
        PassOutcome resync = pass(clusterHandler, cluster, Map.of("shards-master", 4, "shards-replica", 0));
        HealthSignal converged = HealthSignal.builder()
                .kind(TopologyKind.CLUSTER).namespace(TopologyFixtures.NAMESPACE).name("shards")
                .up(true).clusterState("ok").knownMasters(4).build();
        TopologyStatus done = aggregator.aggregate(cluster, resync, Optional.of(converged));

        // Then
        assertThat(migrating.getPhase()).isEqualTo(Phase.DEGRADED);
        assertThat(migrating.getPendingSlotMigrations()).isNotEmpty();
        assertThat(migrating.getSlotAssignment()).hasSize(4);
        assertThat(migrating.latestCondition(CONDITION_SLOT_MIGRATION_PENDING).orElseThrow().getStatus())
                .isEqualTo(CONDITION_TRUE);
        assertThat(done.getPhase()).isEqualTo(Phase.READY);
        assertThat(done.getPendingSlotMigrations()).isNull();
        assertThat(done.latestCondition(CONDITION_SLOT_MIGRATION_PENDING).orElseThrow().getStatus())
                .isEqualTo(CONDITION_FALSE);
    }

    @Test
    void testAggregate_ConditionHistoryIsCapped() {
        // Given
        StatusAggregator small = new StatusAggregator(clock, 3);
        RedisMasterReplica group = TopologyFixtures.masterReplica("sessions", 1);

        // When
        for (int i = 0; i < 5; i++) {
            PassOutcome outcome = PassOutcome.builder().error(new TransientPlatformException("timeout " + i)).build();
            group.setStatus(small.aggregate(group, outcome, Optional.empty()));
        }

        // Then
        assertThat(group.getStatus().getConditions()).hasSize(3);
        assertThat(group.getStatus().getConditions().get(2).getMessage()).isEqualTo("timeout 4");
    }

    /**
     * Applies the synthesized children, marks the given workloads ready and returns the resulting outcome.
     */
    private <R extends TopologyResource> PassOutcome pass(TopologyHandler<R> handler, R resource,
                                                        Map<String, Integer> readyReplicas) throws Exception {
        TopologyPlan plan = handler.plan(resource);
        ChildResourceSet desired = handler.synthesize(resource, plan);
        ReconcileContext context = new ReconcileContext(resource.key(), clock, Duration.ofMinutes(1));
        applier.apply(desired, observed(resource), context);
        for (Map.Entry<String, Integer> entry : readyReplicas.entrySet()) {
            platform.modify(StatefulSet.class, TopologyFixtures.NAMESPACE, entry.getKey(), sts -> {
                StatefulSetStatus status = new StatefulSetStatus();
                status.setReadyReplicas(entry.getValue());
                sts.setStatus(status);
                return sts;
            });
        }
        AppliedResult applied = applier.apply(desired, observed(resource), context);
        return PassOutcome.builder()
                .desiredReplicas(handler.desiredReplicas(resource))
                .plan(plan)
                .desired(desired)
                .applied(applied)
                .build();
    }

    private ChildResourceSet observed(TopologyResource owner) {
        ChildResourceSet observed = new ChildResourceSet();
        for (Class<? extends HasMetadata> type : ChildResourceSet.CHILD_TYPES) {
            observed.addAll(platform.list(type, TopologyFixtures.NAMESPACE,
                    Map.of(LABEL_OWNER_UID, owner.getMetadata().getUid())));
        }
        return observed;
    }

    private static TopologyStatus status(Phase phase) {
        TopologyStatus status = TopologyStatus.pending();
        status.setPhase(phase);
        return status;
    }
}
