package io.redisoperator.status;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.redisoperator.apply.AppliedResult;
import io.redisoperator.apply.StorageChange;
import io.redisoperator.enums.Phase;
import io.redisoperator.enums.Role;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.HealthSignal;
import io.redisoperator.models.SentinelMonitor;
import io.redisoperator.models.SentinelMonitorSet;
import io.redisoperator.models.SlotMove;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.models.status.MonitoredMaster;
import io.redisoperator.models.status.RoleReplicaStatus;
import io.redisoperator.models.status.TopologyStatus;
import io.redisoperator.topology.ManifestFactory;
import io.redisoperator.topology.TopologyPlan;
import io.redisoperator.util.Manifests;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static io.redisoperator.config.Constants.*;

/**
 * Computes a topology object's status from the outcome of a pass and the latest health signal.
 * <p>
 * Phases: Pending, then Creating while replicas come up, then Ready. Ready and Degraded
 * alternate on health flaps, missing replicas or pending slot migrations. Invalid and
 * Failed come from the pass error class; a transient error keeps the previous phase.
 */
@Slf4j
public class StatusAggregator {

    private static final List<String> ERROR_CONDITIONS = List.of(
            CONDITION_INVALID_SPEC, CONDITION_PENDING_DEPENDENCY, CONDITION_CONFLICT_EXHAUSTED, CONDITION_PLATFORM_ERROR);

    private final Clock clock;
    private final int maxConditions;

    public StatusAggregator(Clock clock, int maxConditions) {
        this.clock = clock;
        this.maxConditions = maxConditions;
    }

    public TopologyStatus aggregate(TopologyResource resource, PassOutcome outcome, Optional<HealthSignal> health) {
        TopologyStatus previous = resource.getStatus() != null ? resource.getStatus() : TopologyStatus.pending();
        Phase previousPhase = previous.getPhase() != null ? previous.getPhase() : Phase.PENDING;
        TopologyStatus next = Manifests.copy(previous);
        ConditionHistory history = new ConditionHistory(next.getConditions(), clock, resource.generation());

        next.setObservedGeneration(resource.generation());
        Phase phase = outcome.isFailed()
                ? failurePhase(outcome.getError(), previousPhase, history)
                : successPhase(resource, outcome, health, previousPhase, next, history);
        next.setPhase(phase);
        next.setConditions(history.capped(maxConditions));
        if (phase != previousPhase) {
            log.info("[{}] Phase {} -> {}", resource.key(), previousPhase.getDisplayName(), phase.getDisplayName());
        }
        return next;
    }

    private Phase failurePhase(ReconcileException error, Phase previousPhase, ConditionHistory history) {
        String reason = error.getReason();
        String message = error.getMessage();
        switch (error.getErrorClass()) {
            case INVALID_SPEC:
                history.record(CONDITION_INVALID_SPEC, true, reason, message);
                history.record(CONDITION_READY, false, reason, "Spec was rejected");
                return Phase.INVALID;
            case PENDING_DEPENDENCY:
                history.resolve(CONDITION_INVALID_SPEC);
                history.record(CONDITION_PENDING_DEPENDENCY, true, reason, message);
                return previousPhase.isServing() ? Phase.DEGRADED : Phase.PENDING;
            case CONFLICT_EXHAUSTED:
                history.resolve(CONDITION_INVALID_SPEC);
                history.record(CONDITION_CONFLICT_EXHAUSTED, true, reason, message);
                return previousPhase.isServing() ? Phase.DEGRADED : Phase.FAILED;
            case UNRECOVERABLE:
                history.record(CONDITION_PLATFORM_ERROR, true, reason, message);
                history.record(CONDITION_READY, false, reason, "Platform refused a request");
                return Phase.FAILED;
            case TRANSIENT:
            default:
                history.resolve(CONDITION_INVALID_SPEC);
                history.record(CONDITION_PLATFORM_ERROR, true, reason, message);
                return previousPhase == Phase.INVALID ? Phase.PENDING : previousPhase;
        }
    }

    private Phase successPhase(TopologyResource resource, PassOutcome outcome, Optional<HealthSignal> health,
                               Phase previousPhase, TopologyStatus next, ConditionHistory history) {
        ERROR_CONDITIONS.forEach(history::resolve);
        AppliedResult applied = outcome.getApplied();
        ChildResourceSet observed = applied != null ? applied.getObserved() : new ChildResourceSet();

        Map<String, RoleReplicaStatus> roles = new TreeMap<>();
        boolean allReady = true;
        for (Map.Entry<Role, Integer> entry : outcome.getDesiredReplicas().entrySet()) {
            int ready = readyReplicas(observed, entry.getKey());
            roles.put(entry.getKey().getValue(), new RoleReplicaStatus(entry.getValue(), ready));
            allReady &= ready >= entry.getValue();
        }
        next.setRoles(roles);
        if (outcome.getDesired() != null) {
            next.setServices(serviceAddresses(outcome.getDesired()));
        }

        TopologyPlan plan = outcome.getPlan();
        if (plan != null && plan.getSlotAssignment() != null) {
            updateSlotMigrations(plan, health, next, history);
        }
        if (plan != null && plan.getSentinelMonitors() != null) {
            updateSentinelState(plan.getSentinelMonitors(), outcome, next, history);
        }
        if (applied != null) {
            updateStorageConditions(applied, history);
        }

        Optional<HealthSignal> signal = health.filter(h -> !h.isHealthy());
        if (previousPhase == Phase.INVALID) {
            // leaving Invalid restarts the lifecycle
            history.record(CONDITION_READY, false, "SpecAccepted",
                    "Spec accepted at generation " + resource.generation() + ", " + describeRoles(roles));
            return Phase.PENDING;
        }
        if (!allReady) {
            history.record(CONDITION_READY, false, "ReplicasNotReady", describeRoles(roles));
            return previousPhase.isServing() ? Phase.DEGRADED : Phase.CREATING;
        }
        if (signal.isPresent()) {
            history.record(CONDITION_READY, false, "Unhealthy", describeHealth(signal.get()));
            return Phase.DEGRADED;
        }
        if (next.getPendingSlotMigrations() != null) {
            history.record(CONDITION_READY, false, "SlotMigrationPending",
                    "Slot ranges changed owner and are waiting for migration");
            return Phase.DEGRADED;
        }
        history.record(CONDITION_READY, true, "AllReplicasReady", describeRoles(roles));
        return Phase.READY;
    }

    private void updateSlotMigrations(TopologyPlan plan, Optional<HealthSignal> health, TopologyStatus next,
                                      ConditionHistory history) {
        next.setSlotAssignment(new ArrayList<>(plan.getSlotAssignment().getRanges()));
        List<SlotMove> pending = plan.getSlotMoves().isEmpty()
                ? next.getPendingSlotMigrations()
                : new ArrayList<>(plan.getSlotMoves());
        int masters = plan.getSlotAssignment().getMasters();
        boolean converged = health.isPresent()
                && health.get().isClusterStateOk()
                && Objects.equals(health.get().getKnownMasters(), masters);
        if (pending != null && !pending.isEmpty() && !converged) {
            next.setPendingSlotMigrations(pending);
            int slots = pending.stream().mapToInt(SlotMove::size).sum();
            history.record(CONDITION_SLOT_MIGRATION_PENDING, true, "SlotsReassigned",
                    pending.size() + " slot ranges (" + slots + " slots) changed owner for " + masters + " masters");
        } else {
            next.setPendingSlotMigrations(null);
            history.resolve(CONDITION_SLOT_MIGRATION_PENDING);
        }
    }

    private void updateSentinelState(SentinelMonitorSet monitors, PassOutcome outcome, TopologyStatus next,
                                     ConditionHistory history) {
        SentinelMonitor primary = monitors.primary();
        next.setMonitoredMaster(new MonitoredMaster(primary.getMasterName(), primary.getHost(), primary.getPort(),
                primary.getQuorum()));

        if (monitors.getReplicas() % 2 == 0) {
            history.record(CONDITION_QUORUM_TIE_RISK, true, "EvenReplicaCount", monitors.getReplicas()
                    + " sentinels can split evenly during a partition; an odd count avoids tied votes");
        } else {
            history.resolve(CONDITION_QUORUM_TIE_RISK);
        }

        AppliedResult applied = outcome.getApplied();
        if (applied == null || outcome.getDesired() == null) {
            return;
        }
        Optional<ConfigMap> config = withRole(outcome.getDesired().ofType(ConfigMap.class), Role.SENTINEL);
        Optional<StatefulSet> workload = withRole(applied.getObserved().ofType(StatefulSet.class), Role.SENTINEL);
        String revision = workload.map(StatefulSet::getStatus).map(s -> s.getCurrentRevision()).orElse(null);
        boolean configUpdated = config.isPresent() && applied.getUpdated()
                .contains(ChildResourceSet.keyOf(ConfigMap.class, config.get().getMetadata().getName()));
        if (configUpdated) {
            next.setConfigPendingRestartRevision(revision != null ? revision : "");
            history.record(CONDITION_CONFIG_PENDING_RESTART, true, "SentinelConfigChanged",
                    "Sentinel config changed; running sentinels keep the old config until their pods restart");
        } else if (next.getConfigPendingRestartRevision() != null && revision != null
                && !revision.equals(next.getConfigPendingRestartRevision())) {
            next.setConfigPendingRestartRevision(null);
            history.resolve(CONDITION_CONFIG_PENDING_RESTART);
        }
    }

    private void updateStorageConditions(AppliedResult applied, ConditionHistory history) {
        List<StorageChange> rejected = applied.getStorageChanges().values().stream()
                .filter(StorageChange::isRejected)
                .collect(Collectors.toList());
        List<StorageChange> expanding = applied.getStorageChanges().values().stream()
                .filter(c -> c.getType() == StorageChange.Type.EXPANSION)
                .collect(Collectors.toList());
        if (rejected.isEmpty()) {
            history.resolve(CONDITION_STORAGE_SHRINK_REJECTED);
        } else {
            history.record(CONDITION_STORAGE_SHRINK_REJECTED, true, "StorageChangeRejected", join(rejected));
        }
        if (expanding.isEmpty()) {
            history.resolve(CONDITION_STORAGE_EXPANDING);
        } else {
            history.record(CONDITION_STORAGE_EXPANDING, true, "ClaimsExpanding", join(expanding));
        }
    }

    private static int readyReplicas(ChildResourceSet observed, Role role) {
        int ready = 0;
        for (StatefulSet workload : observed.ofType(StatefulSet.class)) {
            if (hasRole(workload, role) && workload.getStatus() != null && workload.getStatus().getReadyReplicas() != null) {
                ready += workload.getStatus().getReadyReplicas();
            }
        }
        return ready;
    }

    private static Map<String, String> serviceAddresses(ChildResourceSet desired) {
        Map<String, String> services = new TreeMap<>();
        for (Service service : desired.ofType(Service.class)) {
            String role = service.getMetadata().getLabels().get(LABEL_ROLE);
            List<ServicePort> ports = service.getSpec().getPorts();
            if (role == null || ports == null || ports.isEmpty()) {
                continue;
            }
            services.put(role, ManifestFactory.serviceHost(service.getMetadata().getName(),
                    service.getMetadata().getNamespace()) + ":" + ports.get(0).getPort());
        }
        return services;
    }

    private static <T extends HasMetadata> Optional<T> withRole(List<T> resources, Role role) {
        return resources.stream().filter(r -> hasRole(r, role)).findFirst();
    }

    private static boolean hasRole(HasMetadata resource, Role role) {
        Map<String, String> labels = resource.getMetadata().getLabels();
        return labels != null && role.getValue().equals(labels.get(LABEL_ROLE));
    }

    private static String describeRoles(Map<String, RoleReplicaStatus> roles) {
        return roles.entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue().getReady() + "/" + e.getValue().getDesired())
                .collect(Collectors.joining(", ", "", " ready"));
    }

    private static String describeHealth(HealthSignal signal) {
        StringBuilder sb = new StringBuilder("Health signal reports");
        if (!signal.isUp()) {
            sb.append(' ').append(signal.getInstancesDown() != null ? signal.getInstancesDown() : "some")
                    .append(" instances down");
        }
        if (!signal.isClusterStateOk()) {
            sb.append(signal.isUp() ? " " : ", ").append("cluster_state ").append(signal.getClusterState());
        }
        return sb.toString();
    }

    private static String join(List<StorageChange> changes) {
        return changes.stream().map(StorageChange::getMessage).collect(Collectors.joining("; "));
    }
}
