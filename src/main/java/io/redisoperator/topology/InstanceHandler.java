package io.redisoperator.topology;

import io.redisoperator.enums.Role;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.RedisInstance;
import io.redisoperator.models.specs.RedisInstanceSpec;
import io.redisoperator.util.Manifests;

import java.util.List;
import java.util.Map;

import static io.redisoperator.config.Constants.*;

/**
 * Single Redis server: StatefulSet {@code <name>} with one replica, its service and config map.
 */
public class InstanceHandler implements TopologyHandler<RedisInstance> {

    private final ManifestFactory manifests;
    private final RedisConfigRenderer renderer;

    public InstanceHandler(ManifestFactory manifests, RedisConfigRenderer renderer) {
        this.manifests = manifests;
        this.renderer = renderer;
    }

    @Override
    public TopologyKind getKind() {
        return TopologyKind.INSTANCE;
    }

    @Override
    public Class<RedisInstance> getResourceType() {
        return RedisInstance.class;
    }

    @Override
    public void validate(RedisInstance resource) throws InvalidSpecException {
        RedisInstanceSpec spec = SpecValidation.requireSpec(resource.getSpec());
        SpecValidation.requireImage(spec.getImage());
        SpecValidation.validateStorage("spec.storage", spec.getStorage());
        SpecValidation.validateDirectives("spec.config", spec.getConfig());
    }

    @Override
    public ChildResourceSet synthesize(RedisInstance resource, TopologyPlan plan) throws InvalidSpecException {
        RedisInstanceSpec spec = SpecValidation.requireSpec(resource.getSpec());
        String name = resource.getMetadata().getName();
        String configMapName = ResourceNames.configMap(name);
        String serviceName = ResourceNames.service(name);
        String redisConf = renderer.render(renderer.merge(RedisConfigRenderer.BASE_DEFAULTS, spec.getConfig()));

        ChildResourceSet children = new ChildResourceSet();
        children.add(manifests.configMap(resource, configMapName, Role.STANDALONE, Map.of(REDIS_CONFIG_FILE, redisConf)));
        children.add(manifests.service(resource, serviceName, Role.STANDALONE,
                List.of(manifests.servicePort(REDIS_PORT_NAME, REDIS_PORT)), false));
        children.add(manifests.statefulSet(resource, WorkloadTemplate.builder()
                .name(name)
                .role(Role.STANDALONE)
                .replicas(1)
                .image(spec.getImage())
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
        return children;
    }

    @Override
    public Map<Role, Integer> desiredReplicas(RedisInstance resource) {
        return Map.of(Role.STANDALONE, 1);
    }
}
