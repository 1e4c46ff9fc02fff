package io.redisoperator.topology;

import io.redisoperator.enums.Role;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.specs.RedisMasterReplicaSpec;

import java.util.EnumMap;
import java.util.Map;

public class MasterReplicaHandler implements TopologyHandler<RedisMasterReplica> {

    private final ReplicationGroupSynthesizer groups;

    public MasterReplicaHandler(ReplicationGroupSynthesizer groups) {
        this.groups = groups;
    }

    @Override
    public TopologyKind getKind() {
        return TopologyKind.MASTER_REPLICA;
    }

    @Override
    public Class<RedisMasterReplica> getResourceType() {
        return RedisMasterReplica.class;
    }

    @Override
    public void validate(RedisMasterReplica resource) throws InvalidSpecException {
        RedisMasterReplicaSpec spec = SpecValidation.requireSpec(resource.getSpec());
        SpecValidation.requireImage(spec.getImage());
        groups.validate("spec", spec.getMaster(), spec.getReplica(), spec.getConfig());
    }

    @Override
    public ChildResourceSet synthesize(RedisMasterReplica resource, TopologyPlan plan) throws InvalidSpecException {
        RedisMasterReplicaSpec spec = SpecValidation.requireSpec(resource.getSpec());
        ChildResourceSet children = new ChildResourceSet();
        groups.synthesize(children, resource, resource.getMetadata().getName(), spec.getImage(),
                spec.getMaster(), spec.getReplica(), spec.getConfig());
        return children;
    }

    @Override
    public Map<Role, Integer> desiredReplicas(RedisMasterReplica resource) {
        Map<Role, Integer> replicas = new EnumMap<>(Role.class);
        replicas.put(Role.MASTER, 1);
        replicas.put(Role.REPLICA, groups.replicaCount(resource.getSpec().getReplica()));
        return replicas;
    }
}
