package io.redisoperator.sentinel;

import io.redisoperator.enums.Phase;
import io.redisoperator.enums.Role;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.exceptions.PendingDependencyException;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.models.SentinelMonitor;
import io.redisoperator.models.SentinelMonitorSet;
import io.redisoperator.models.specs.MasterReplicaRef;
import io.redisoperator.models.specs.RedisSentinelSpec;
import io.redisoperator.models.specs.SentinelConfig;
import io.redisoperator.models.status.TopologyStatus;
import io.redisoperator.platform.PlatformClient;
import io.redisoperator.topology.ReplicationGroupSynthesizer;
import io.redisoperator.topology.ResourceNames;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

import static io.redisoperator.config.Constants.*;

/**
 * Resolves the master a sentinel group monitors and the quorum settings it runs with.
 * <p>
 * A {@code masterReplicaRef} target is read from the referenced object's status: the
 * object must exist and be Ready, and its {@code services.master} address is used.
 * An embedded target uses the sentinel's own master service.
 */
@Slf4j
public class SentinelTopologyBuilder {

    private final PlatformClient platform;
    private final ReplicationGroupSynthesizer groups;

    public SentinelTopologyBuilder(PlatformClient platform, ReplicationGroupSynthesizer groups) {
        this.platform = platform;
        this.groups = groups;
    }

    public static int replicas(RedisSentinelSpec spec) {
        return spec.getReplicas() == null ? DEFAULT_SENTINEL_REPLICAS : spec.getReplicas();
    }

    /**
     * Configured quorum, or a strict majority of the sentinel replicas.
     */
    public static int quorum(RedisSentinelSpec spec) {
        SentinelConfig config = spec.getConfig();
        if (config != null && config.getQuorum() != null) {
            return config.getQuorum();
        }
        return replicas(spec) / 2 + 1;
    }

    public SentinelMonitorSet build(RedisSentinel sentinel) throws ReconcileException {
        RedisSentinelSpec spec = sentinel.getSpec();
        if (spec == null) {
            throw new InvalidSpecException("spec must be set");
        }
        SentinelConfig config = spec.getConfig() != null ? spec.getConfig() : new SentinelConfig();
        SentinelMonitor.SentinelMonitorBuilder monitor = SentinelMonitor.builder()
                .quorum(quorum(spec))
                .downAfterMs(orDefault(config.getDownAfterMs(), DEFAULT_SENTINEL_DOWN_AFTER_MS))
                .failoverTimeoutMs(orDefault(config.getFailoverTimeoutMs(), DEFAULT_SENTINEL_FAILOVER_TIMEOUT_MS))
                .parallelSyncs(orDefault(config.getParallelSyncs(), DEFAULT_SENTINEL_PARALLEL_SYNCS));

        if (spec.getMasterReplicaRef() != null) {
            resolveReference(sentinel, spec.getMasterReplicaRef(), monitor);
        } else if (spec.getRedis() != null) {
            String prefix = ResourceNames.embeddedRedisPrefix(sentinel.getMetadata().getName());
            monitor.masterName(nameOrDefault(spec.getRedis().getMasterName()))
                    .host(groups.masterHost(sentinel, prefix))
                    .port(REDIS_PORT);
        } else {
            throw new InvalidSpecException("exactly one of spec.redis and spec.masterReplicaRef must be set");
        }
        return new SentinelMonitorSet(replicas(spec), List.of(monitor.build()), config.getAdditionalConfig());
    }

    private void resolveReference(RedisSentinel sentinel, MasterReplicaRef ref,
                                  SentinelMonitor.SentinelMonitorBuilder monitor) throws ReconcileException {
        String namespace = sentinel.getMetadata().getNamespace();
        String dependency = "RedisMasterReplica " + namespace + "/" + ref.getName();
        Optional<RedisMasterReplica> target = platform.get(RedisMasterReplica.class, namespace, ref.getName());
        if (target.isEmpty()) {
            throw new PendingDependencyException(dependency, dependency + " does not exist");
        }
        TopologyStatus status = target.get().getStatus();
        Phase phase = status != null ? status.getPhase() : null;
        if (phase != Phase.READY) {
            throw new PendingDependencyException(dependency, dependency + " is "
                    + (phase == null ? Phase.PENDING.getDisplayName() : phase.getDisplayName()) + ", waiting for Ready");
        }
        String address = status.getServices() != null ? status.getServices().get(Role.MASTER.getValue()) : null;
        if (address == null || address.isBlank()) {
            throw new PendingDependencyException(dependency, dependency + " has not published a master address");
        }
        int separator = address.lastIndexOf(':');
        String host = separator > 0 ? address.substring(0, separator) : address;
        int port = REDIS_PORT;
        if (separator > 0) {
            try {
                port = Integer.parseInt(address.substring(separator + 1));
            } catch (NumberFormatException e) {
                throw new PendingDependencyException(dependency,
                        dependency + " published an unusable master address '" + address + "'");
            }
        }
        log.debug("[{}] monitoring {} at {}:{}", sentinel.key(), dependency, host, port);
        monitor.masterName(nameOrDefault(ref.getMasterName())).host(host).port(port);
    }

    private static String nameOrDefault(String masterName) {
        return masterName == null || masterName.isBlank() ? DEFAULT_MASTER_NAME : masterName;
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
