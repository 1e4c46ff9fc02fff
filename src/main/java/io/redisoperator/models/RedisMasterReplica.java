package io.redisoperator.models;

import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;
import io.redisoperator.config.Constants;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.models.specs.RedisMasterReplicaSpec;
import io.redisoperator.models.status.TopologyStatus;

@Group(Constants.API_GROUP)
@Version(Constants.API_VERSION)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class RedisMasterReplica extends CustomResource<RedisMasterReplicaSpec, TopologyStatus> implements Namespaced, TopologyResource {

    @Override
    public TopologyKind topologyKind() {
        return TopologyKind.MASTER_REPLICA;
    }

    @Override
    public TopologyStatus getStatus() {
        return super.getStatus();
    }

    @Override
    public void setStatus(TopologyStatus status) {
        super.setStatus(status);
    }
}
