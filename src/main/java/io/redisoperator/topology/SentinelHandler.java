package io.redisoperator.topology;

import io.redisoperator.enums.Role;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.models.SentinelMonitorSet;
import io.redisoperator.models.specs.EmbeddedRedisSpec;
import io.redisoperator.models.specs.RedisSentinelSpec;
import io.redisoperator.models.specs.SentinelConfig;
import io.redisoperator.sentinel.SentinelConfigRenderer;
import io.redisoperator.sentinel.SentinelTopologyBuilder;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static io.redisoperator.config.Constants.*;

/**
 * Sentinel group {@code <name>-sentinel} plus, for an embedded target, a master/replica
 * group under {@code <name>-redis}.
 * <p>
 * Sentinels rewrite their config file at runtime, so the pod copies the rendered
 * sentinel.conf onto its data volume at startup and the workload carries no config hash.
 */
public class SentinelHandler implements TopologyHandler<RedisSentinel> {

    private static final String SENTINEL_STARTUP = "cp " + CONFIG_MOUNT_PATH + "/" + SENTINEL_CONFIG_FILE + " "
            + DATA_MOUNT_PATH + "/" + SENTINEL_CONFIG_FILE
            + " && exec redis-sentinel " + DATA_MOUNT_PATH + "/" + SENTINEL_CONFIG_FILE;

    private final ManifestFactory manifests;
    private final ReplicationGroupSynthesizer groups;
    private final SentinelTopologyBuilder topologyBuilder;
    private final SentinelConfigRenderer configRenderer;

    public SentinelHandler(ManifestFactory manifests, ReplicationGroupSynthesizer groups,
                           SentinelTopologyBuilder topologyBuilder, SentinelConfigRenderer configRenderer) {
        this.manifests = manifests;
        this.groups = groups;
        this.topologyBuilder = topologyBuilder;
        this.configRenderer = configRenderer;
    }

    public static String workloadName(String sentinelName) {
        return ResourceNames.workload(sentinelName, SUFFIX_SENTINEL);
    }

    @Override
    public TopologyKind getKind() {
        return TopologyKind.SENTINEL;
    }

    @Override
    public Class<RedisSentinel> getResourceType() {
        return RedisSentinel.class;
    }

    @Override
    public void validate(RedisSentinel resource) throws InvalidSpecException {
        RedisSentinelSpec spec = SpecValidation.requireSpec(resource.getSpec());
        SpecValidation.requireImage(spec.getImage());

        boolean embedded = spec.getRedis() != null;
        boolean referenced = spec.getMasterReplicaRef() != null;
        if (embedded == referenced) {
            throw new InvalidSpecException("exactly one of spec.redis and spec.masterReplicaRef must be set");
        }
        if (referenced && (spec.getMasterReplicaRef().getName() == null
                || spec.getMasterReplicaRef().getName().isBlank())) {
            throw new InvalidSpecException("spec.masterReplicaRef.name must be set");
        }

        int replicas = SpecValidation.positive("spec.replicas", spec.getReplicas(), DEFAULT_SENTINEL_REPLICAS);
        SentinelConfig config = spec.getConfig();
        if (config != null) {
            int quorum = SpecValidation.positive("spec.config.quorum", config.getQuorum(), 1);
            if (quorum > replicas) {
                throw new InvalidSpecException("spec.config.quorum (" + quorum
                        + ") must not exceed spec.replicas (" + replicas + ")");
            }
            SpecValidation.positive("spec.config.downAfterMs", config.getDownAfterMs(), DEFAULT_SENTINEL_DOWN_AFTER_MS);
            SpecValidation.positive("spec.config.failoverTimeoutMs", config.getFailoverTimeoutMs(),
                    DEFAULT_SENTINEL_FAILOVER_TIMEOUT_MS);
            SpecValidation.positive("spec.config.parallelSyncs", config.getParallelSyncs(),
                    DEFAULT_SENTINEL_PARALLEL_SYNCS);
            SpecValidation.validateDirectives("spec.config.additionalConfig", config.getAdditionalConfig());
        }
        if (embedded) {
            EmbeddedRedisSpec redis = spec.getRedis();
            groups.validate("spec.redis", redis.getMaster(), redis.getReplica(), redis.getConfig());
        }
    }

    @Override
    public TopologyPlan plan(RedisSentinel resource) throws ReconcileException {
        return TopologyPlan.builder().sentinelMonitors(topologyBuilder.build(resource)).build();
    }

    @Override
    public ChildResourceSet synthesize(RedisSentinel resource, TopologyPlan plan) throws InvalidSpecException {
        RedisSentinelSpec spec = SpecValidation.requireSpec(resource.getSpec());
        SentinelMonitorSet monitors = plan.getSentinelMonitors();
        if (monitors == null) {
            throw new IllegalStateException("Sentinel synthesis requires a resolved monitor set");
        }
        String name = resource.getMetadata().getName();
        ChildResourceSet children = new ChildResourceSet();

        EmbeddedRedisSpec redis = spec.getRedis();
        if (redis != null) {
            groups.synthesize(children, resource, ResourceNames.embeddedRedisPrefix(name), spec.getImage(),
                    redis.getMaster(), redis.getReplica(), redis.getConfig());
        }

        String workload = workloadName(name);
        String configMapName = ResourceNames.configMap(workload);
        String serviceName = ResourceNames.service(workload);
        children.add(manifests.configMap(resource, configMapName, Role.SENTINEL,
                Map.of(SENTINEL_CONFIG_FILE, configRenderer.render(monitors))));
        children.add(manifests.service(resource, serviceName, Role.SENTINEL,
                List.of(manifests.servicePort(SENTINEL_PORT_NAME, SENTINEL_PORT)), false));
        children.add(manifests.statefulSet(resource, WorkloadTemplate.builder()
                .name(workload)
                .role(Role.SENTINEL)
                .replicas(monitors.getReplicas())
                .image(spec.getImage())
                .containerName(CONTAINER_SENTINEL)
                .command(List.of("sh", "-c", SENTINEL_STARTUP))
                .ports(List.of(manifests.containerPort(SENTINEL_PORT_NAME, SENTINEL_PORT)))
                .probePort(SENTINEL_PORT)
                .resources(spec.getResources())
                .configMapName(configMapName)
                .serviceName(serviceName)
                .build()));
        return children;
    }

    @Override
    public Map<Role, Integer> desiredReplicas(RedisSentinel resource) {
        RedisSentinelSpec spec = resource.getSpec();
        Map<Role, Integer> replicas = new EnumMap<>(Role.class);
        if (spec.getRedis() != null) {
            replicas.put(Role.MASTER, 1);
            replicas.put(Role.REPLICA, groups.replicaCount(spec.getRedis().getReplica()));
        }
        replicas.put(Role.SENTINEL, SentinelTopologyBuilder.replicas(spec));
        return replicas;
    }
}
