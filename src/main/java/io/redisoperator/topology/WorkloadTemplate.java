package io.redisoperator.topology;

import io.fabric8.kubernetes.api.model.Affinity;
import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.Toleration;
import io.redisoperator.enums.Role;
import io.redisoperator.models.specs.StorageSpec;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Inputs of one StatefulSet rendered by {@link ManifestFactory}.
 */
@Value
@Builder
public class WorkloadTemplate {
    String name;
    Role role;
    int replicas;
    String image;
    String containerName;
    List<String> command;
    List<ContainerPort> ports;
    int probePort;
    ResourceRequirements resources;
    StorageSpec storage;
    String configMapName;
    String serviceName;
    /** Hash of the rendered config; null for workloads that read their config only at startup. */
    String configHash;
    @Builder.Default
    String podManagementPolicy = "OrderedReady";
    Map<String, String> nodeSelector;
    List<Toleration> tolerations;
    Affinity affinity;
}
