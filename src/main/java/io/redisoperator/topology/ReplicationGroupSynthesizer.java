package io.redisoperator.topology;

import io.redisoperator.enums.Role;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.models.specs.RoleSpec;
import io.redisoperator.util.Manifests;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static io.redisoperator.config.Constants.*;

/**
 * Children of a master/replica group: one workload, service and config map per role.
 * Used by RedisMasterReplica and by sentinels with an embedded group.
 */
public class ReplicationGroupSynthesizer {

    public static final int DEFAULT_REPLICAS = 1;

    private final ManifestFactory manifests;
    private final RedisConfigRenderer renderer;

    public ReplicationGroupSynthesizer(ManifestFactory manifests, RedisConfigRenderer renderer) {
        this.manifests = manifests;
        this.renderer = renderer;
    }

    public void validate(String field, RoleSpec master, RoleSpec replica, Map<String, String> sharedConfig)
            throws InvalidSpecException {
        SpecValidation.validateDirectives(field + ".config", sharedConfig);
        if (master != null) {
            SpecValidation.validateStorage(field + ".master.storage", master.getStorage());
            SpecValidation.validateDirectives(field + ".master.config", master.getConfig());
        }
        if (replica != null) {
            SpecValidation.nonNegative(field + ".replica.replicas", replica.getReplicas(), DEFAULT_REPLICAS);
            SpecValidation.validateStorage(field + ".replica.storage", replica.getStorage());
            SpecValidation.validateDirectives(field + ".replica.config", replica.getConfig());
        }
    }

    public int replicaCount(RoleSpec replica) {
        return replica == null || replica.getReplicas() == null ? DEFAULT_REPLICAS : replica.getReplicas();
    }

    /**
     * DNS name of the group's master service.
     */
    public String masterHost(TopologyResource owner, String prefix) {
        String workload = ResourceNames.workload(prefix, SUFFIX_MASTER);
        return ManifestFactory.serviceHost(ResourceNames.service(workload), owner.getMetadata().getNamespace());
    }

    public void synthesize(ChildResourceSet children, TopologyResource owner, String prefix, String image,
                           RoleSpec master, RoleSpec replica, Map<String, String> sharedConfig) {
        RoleSpec masterSpec = master != null ? master : new RoleSpec();
        RoleSpec replicaSpec = replica != null ? replica : new RoleSpec();

        Map<String, String> masterConfig = renderer.merge(
                RedisConfigRenderer.BASE_DEFAULTS, sharedConfig, masterSpec.getConfig());
        addRole(children, owner, prefix, SUFFIX_MASTER, Role.MASTER, image, 1, masterSpec, masterConfig);

        Map<String, String> enforced = new TreeMap<>();
        enforced.put("replicaof", masterHost(owner, prefix) + " " + REDIS_PORT);
        enforced.put("replica-read-only", "yes");
        Map<String, String> replicaConfig = renderer.merge(
                RedisConfigRenderer.BASE_DEFAULTS, sharedConfig, replicaSpec.getConfig(), enforced);
        addRole(children, owner, prefix, SUFFIX_REPLICA, Role.REPLICA, image, replicaCount(replica),
                replicaSpec, replicaConfig);
    }

    private void addRole(ChildResourceSet children, TopologyResource owner, String prefix, String suffix, Role role,
                         String image, int replicas, RoleSpec spec, Map<String, String> directives) {
        String workload = ResourceNames.workload(prefix, suffix);
        String configMapName = ResourceNames.configMap(workload);
        String serviceName = ResourceNames.service(workload);
        String redisConf = renderer.render(directives);

        children.add(manifests.configMap(owner, configMapName, role, Map.of(REDIS_CONFIG_FILE, redisConf)));
        children.add(manifests.service(owner, serviceName, role,
                List.of(manifests.servicePort(REDIS_PORT_NAME, REDIS_PORT)), false));
        children.add(manifests.statefulSet(owner, WorkloadTemplate.builder()
                .name(workload)
                .role(role)
                .replicas(replicas)
                .image(image)
                .containerName(CONTAINER_REDIS)
                .command(List.of("redis-server", CONFIG_MOUNT_PATH + "/" + REDIS_CONFIG_FILE))
                .ports(List.of(manifests.containerPort(REDIS_PORT_NAME, REDIS_PORT)))
                .probePort(REDIS_PORT)
                .resources(spec.getResources())
                .storage(spec.getStorage())
                .configMapName(configMapName)
                .serviceName(serviceName)
                .configHash(Manifests.hash(redisConf))
                .build()));
    }
}
