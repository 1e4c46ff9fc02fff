package io.redisoperator.topology;

import io.redisoperator.allocation.SlotAllocator;
import io.redisoperator.enums.Role;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.RedisCluster;
import io.redisoperator.models.SlotAssignment;
import io.redisoperator.models.SlotMove;
import io.redisoperator.models.specs.ClusterConfig;
import io.redisoperator.models.specs.RedisClusterSpec;
import io.redisoperator.util.Manifests;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static io.redisoperator.config.Constants.*;

/**
 * Sharded cluster: {@code <name>-master} sized by {@code masters} and {@code <name>-replica}
 * sized by {@code masters * replicasPerMaster}, each with a headless service and a config map.
 * The master config map also carries the slot assignment.
 */
public class ClusterHandler implements TopologyHandler<RedisCluster> {

    public static final int DEFAULT_REPLICAS_PER_MASTER = 1;
    private static final String PARALLEL = "Parallel";

    private final ManifestFactory manifests;
    private final RedisConfigRenderer renderer;
    private final SlotAllocator slotAllocator;

    public ClusterHandler(ManifestFactory manifests, RedisConfigRenderer renderer, SlotAllocator slotAllocator) {
        this.manifests = manifests;
        this.renderer = renderer;
        this.slotAllocator = slotAllocator;
    }

    @Override
    public TopologyKind getKind() {
        return TopologyKind.CLUSTER;
    }

    @Override
    public Class<RedisCluster> getResourceType() {
        return RedisCluster.class;
    }

    @Override
    public void validate(RedisCluster resource) throws InvalidSpecException {
        RedisClusterSpec spec = SpecValidation.requireSpec(resource.getSpec());
        SpecValidation.requireImage(spec.getImage());
        if (spec.getMasters() == null) {
            throw new InvalidSpecException("spec.masters must be set");
        }
        int masters = SpecValidation.positive("spec.masters", spec.getMasters(), 1);
        if (masters > CLUSTER_SLOTS) {
            throw new InvalidSpecException("spec.masters must not exceed " + CLUSTER_SLOTS + ", got " + masters);
        }
        int perMaster = SpecValidation.nonNegative("spec.replicasPerMaster", spec.getReplicasPerMaster(),
                DEFAULT_REPLICAS_PER_MASTER);
        if ((long) masters * perMaster > Integer.MAX_VALUE) {
            throw new InvalidSpecException("spec.masters * spec.replicasPerMaster must not exceed "
                    + Integer.MAX_VALUE + ", got " + masters + " * " + perMaster);
        }
        SpecValidation.validateStorage("spec.storage", spec.getStorage());
        ClusterConfig config = spec.getConfig();
        if (config != null) {
            SpecValidation.positive("spec.config.clusterNodeTimeoutMs", config.getClusterNodeTimeoutMs(),
                    DEFAULT_CLUSTER_NODE_TIMEOUT_MS);
            SpecValidation.nonNegative("spec.config.clusterMigrationBarrier", config.getClusterMigrationBarrier(),
                    DEFAULT_CLUSTER_MIGRATION_BARRIER);
            SpecValidation.validateDirectives("spec.config.additionalConfig", config.getAdditionalConfig());
        }
    }

    @Override
    public TopologyPlan plan(RedisCluster resource) {
        SlotAssignment assignment = slotAllocator.allocate(resource.getSpec().getMasters());
        SlotAssignment previous = resource.getStatus() == null
                ? null
                : slotAllocator.fromStored(resource.getStatus().getSlotAssignment());
        List<SlotMove> moves = slotAllocator.diff(previous, assignment);
        return TopologyPlan.builder().slotAssignment(assignment).slotMoves(moves).build();
    }

    @Override
    public ChildResourceSet synthesize(RedisCluster resource, TopologyPlan plan) throws InvalidSpecException {
        RedisClusterSpec spec = SpecValidation.requireSpec(resource.getSpec());
        SlotAssignment assignment = plan.getSlotAssignment() != null
                ? plan.getSlotAssignment()
                : slotAllocator.allocate(spec.getMasters());
        String redisConf = renderer.render(renderer.merge(
                RedisConfigRenderer.BASE_DEFAULTS, additionalConfig(spec), clusterDirectives(spec)));

        ChildResourceSet children = new ChildResourceSet();
        Map<String, String> masterData = new TreeMap<>();
        masterData.put(REDIS_CONFIG_FILE, redisConf);
        masterData.put(SLOT_ASSIGNMENT_FILE, assignment.render());
        addRole(children, resource, spec, SUFFIX_MASTER, Role.MASTER, spec.getMasters(), masterData, redisConf);
        addRole(children, resource, spec, SUFFIX_REPLICA, Role.REPLICA, replicaReplicas(spec),
                Map.of(REDIS_CONFIG_FILE, redisConf), redisConf);
        return children;
    }

    @Override
    public Map<Role, Integer> desiredReplicas(RedisCluster resource) {
        Map<Role, Integer> replicas = new EnumMap<>(Role.class);
        replicas.put(Role.MASTER, resource.getSpec().getMasters());
        replicas.put(Role.REPLICA, replicaReplicas(resource.getSpec()));
        return replicas;
    }

    private static int replicaReplicas(RedisClusterSpec spec) {
        int perMaster = spec.getReplicasPerMaster() == null ? DEFAULT_REPLICAS_PER_MASTER : spec.getReplicasPerMaster();
        return Math.multiplyExact(spec.getMasters(), perMaster);
    }

    private static Map<String, String> additionalConfig(RedisClusterSpec spec) {
        return spec.getConfig() == null ? null : spec.getConfig().getAdditionalConfig();
    }

    private static Map<String, String> clusterDirectives(RedisClusterSpec spec) {
        ClusterConfig config = spec.getConfig() != null ? spec.getConfig() : new ClusterConfig();
        Map<String, String> directives = new LinkedHashMap<>();
        directives.put("cluster-enabled", "yes");
        directives.put("cluster-config-file", "nodes.conf");
        directives.put("cluster-node-timeout", String.valueOf(config.getClusterNodeTimeoutMs() != null
                ? config.getClusterNodeTimeoutMs() : DEFAULT_CLUSTER_NODE_TIMEOUT_MS));
        boolean fullCoverage = config.getClusterRequireFullCoverage() != null
                ? config.getClusterRequireFullCoverage() : DEFAULT_CLUSTER_REQUIRE_FULL_COVERAGE;
        directives.put("cluster-require-full-coverage", fullCoverage ? "yes" : "no");
        directives.put("cluster-migration-barrier", String.valueOf(config.getClusterMigrationBarrier() != null
                ? config.getClusterMigrationBarrier() : DEFAULT_CLUSTER_MIGRATION_BARRIER));
        return directives;
    }

    private void addRole(ChildResourceSet children, RedisCluster resource, RedisClusterSpec spec, String suffix,
                         Role role, int replicas, Map<String, String> data, String redisConf) {
        String workload = ResourceNames.workload(resource.getMetadata().getName(), suffix);
        String configMapName = ResourceNames.configMap(workload);
        String serviceName = ResourceNames.service(workload);

        children.add(manifests.configMap(resource, configMapName, role, data));
        children.add(manifests.service(resource, serviceName, role, List.of(
                manifests.servicePort(REDIS_PORT_NAME, REDIS_PORT),
                manifests.servicePort(CLUSTER_BUS_PORT_NAME, CLUSTER_BUS_PORT)), true));
        children.add(manifests.statefulSet(resource, WorkloadTemplate.builder()
                .name(workload)
                .role(role)
                .replicas(replicas)
                .image(spec.getImage())
                .containerName(CONTAINER_REDIS)
                .command(List.of("redis-server", CONFIG_MOUNT_PATH + "/" + REDIS_CONFIG_FILE))
                .ports(List.of(
                        manifests.containerPort(REDIS_PORT_NAME, REDIS_PORT),
                        manifests.containerPort(CLUSTER_BUS_PORT_NAME, CLUSTER_BUS_PORT)))
                .probePort(REDIS_PORT)
                .resources(spec.getResources())
                .storage(spec.getStorage())
                .configMapName(configMapName)
                .serviceName(serviceName)
                .configHash(Manifests.hash(redisConf))
                .podManagementPolicy(PARALLEL)
                .nodeSelector(spec.getNodeSelector())
                .tolerations(spec.getTolerations())
                .affinity(spec.getAffinity())
                .build()));
    }
}
