package io.redisoperator.topology;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.ContainerPortBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServicePortBuilder;
import io.fabric8.kubernetes.api.model.ServiceSpecBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSetSpec;
import io.fabric8.kubernetes.api.model.apps.StatefulSetSpecBuilder;
import io.redisoperator.enums.Role;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.models.specs.StorageSpec;
import io.redisoperator.util.Manifests;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static io.redisoperator.config.Constants.*;

/**
 * Builds the child manifests of a topology object. Labels and annotations are kept in
 * sorted maps and nothing time-dependent is emitted, so equal inputs give equal manifests.
 */
public class ManifestFactory {

    private static final String PROTOCOL_TCP = "TCP";
    private static final String PULL_IF_NOT_PRESENT = "IfNotPresent";

    public Map<String, String> selectorLabels(TopologyResource owner, Role role) {
        Map<String, String> labels = new TreeMap<>();
        labels.put(LABEL_KIND, owner.topologyKind().getLabelValue());
        labels.put(LABEL_INSTANCE, owner.getMetadata().getName());
        labels.put(LABEL_ROLE, role.getValue());
        return labels;
    }

    public Map<String, String> labels(TopologyResource owner, Role role) {
        Map<String, String> labels = selectorLabels(owner, role);
        labels.put(LABEL_MANAGED_BY, MANAGED_BY_VALUE);
        labels.put(LABEL_APP_NAME, APP_NAME_VALUE);
        String uid = owner.getMetadata().getUid();
        if (uid != null) {
            labels.put(LABEL_OWNER_UID, uid);
        }
        return labels;
    }

    public OwnerReference ownerReference(TopologyResource owner) {
        return new OwnerReferenceBuilder()
                .withApiVersion(owner.getApiVersion())
                .withKind(owner.getKind())
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    public ObjectMeta metadata(TopologyResource owner, String name, Role role) {
        ObjectMetaBuilder builder = new ObjectMetaBuilder()
                .withName(name)
                .withNamespace(owner.getMetadata().getNamespace())
                .withLabels(labels(owner, role));
        if (owner.getMetadata().getUid() != null) {
            builder.withOwnerReferences(ownerReference(owner));
        }
        return builder.build();
    }

    public ConfigMap configMap(TopologyResource owner, String name, Role role, Map<String, String> data) {
        return new ConfigMapBuilder()
                .withMetadata(metadata(owner, name, role))
                .withData(new TreeMap<>(data))
                .build();
    }

    public Service service(TopologyResource owner, String name, Role role, List<ServicePort> ports, boolean headless) {
        ServiceSpecBuilder spec = new ServiceSpecBuilder()
                .withSelector(selectorLabels(owner, role))
                .withPorts(ports);
        if (headless) {
            spec.withClusterIP("None").withPublishNotReadyAddresses(true);
        }
        return new ServiceBuilder()
                .withMetadata(metadata(owner, name, role))
                .withSpec(spec.build())
                .build();
    }

    public StatefulSet statefulSet(TopologyResource owner, WorkloadTemplate template) {
        Map<String, String> selector = selectorLabels(owner, template.getRole());
        Map<String, String> podAnnotations = new TreeMap<>();
        if (template.getConfigHash() != null) {
            podAnnotations.put(ANNOTATION_CONFIG_HASH, template.getConfigHash());
        }

        List<Volume> volumes = new ArrayList<>();
        volumes.add(new VolumeBuilder()
                .withName(VOLUME_CONFIG)
                .withNewConfigMap().withName(template.getConfigMapName()).endConfigMap()
                .build());
        List<PersistentVolumeClaim> claims = new ArrayList<>();
        if (hasPersistentStorage(template.getStorage())) {
            claims.add(volumeClaimTemplate(selector, template.getStorage()));
        } else {
            volumes.add(new VolumeBuilder().withName(VOLUME_DATA).withNewEmptyDir().endEmptyDir().build());
        }

        PodSpec podSpec = new PodSpecBuilder()
                .withContainers(container(template))
                .withVolumes(volumes)
                .withNodeSelector(template.getNodeSelector() == null ? null : new TreeMap<>(template.getNodeSelector()))
                .withTolerations(template.getTolerations())
                .withAffinity(template.getAffinity())
                .build();

        StatefulSetSpec spec = new StatefulSetSpecBuilder()
                .withReplicas(template.getReplicas())
                .withServiceName(template.getServiceName())
                .withPodManagementPolicy(template.getPodManagementPolicy())
                .withNewSelector().withMatchLabels(selector).endSelector()
                .withNewUpdateStrategy().withType("RollingUpdate").endUpdateStrategy()
                .withNewTemplate()
                    .withNewMetadata()
                        .withLabels(labels(owner, template.getRole()))
                        .withAnnotations(podAnnotations)
                    .endMetadata()
                    .withSpec(podSpec)
                .endTemplate()
                .withVolumeClaimTemplates(claims)
                .build();

        ObjectMeta metadata = metadata(owner, template.getName(), template.getRole());
        Map<String, String> annotations = new TreeMap<>();
        annotations.put(ANNOTATION_SPEC_HASH, Manifests.hash(spec));
        metadata.setAnnotations(annotations);
        return new StatefulSetBuilder().withMetadata(metadata).withSpec(spec).build();
    }

    public ContainerPort containerPort(String name, int port) {
        return new ContainerPortBuilder().withName(name).withContainerPort(port).withProtocol(PROTOCOL_TCP).build();
    }

    public ServicePort servicePort(String name, int port) {
        return new ServicePortBuilder()
                .withName(name)
                .withPort(port)
                .withTargetPort(new IntOrString(port))
                .withProtocol(PROTOCOL_TCP)
                .build();
    }

    /**
     * In-cluster DNS name of a service.
     */
    public static String serviceHost(String serviceName, String namespace) {
        return serviceName + "." + namespace + "." + CLUSTER_DOMAIN_SUFFIX;
    }

    public static boolean isOwnedBy(HasMetadata child, String ownerUid) {
        Map<String, String> labels = child.getMetadata().getLabels();
        return ownerUid != null && labels != null && ownerUid.equals(labels.get(LABEL_OWNER_UID));
    }

    private static boolean hasPersistentStorage(StorageSpec storage) {
        return storage != null && storage.getSize() != null && !storage.getSize().isBlank();
    }

    private Container container(WorkloadTemplate template) {
        List<VolumeMount> mounts = List.of(
                new VolumeMountBuilder().withName(VOLUME_CONFIG).withMountPath(CONFIG_MOUNT_PATH).withReadOnly(true).build(),
                new VolumeMountBuilder().withName(VOLUME_DATA).withMountPath(DATA_MOUNT_PATH).build());
        return new ContainerBuilder()
                .withName(template.getContainerName())
                .withImage(template.getImage())
                .withImagePullPolicy(PULL_IF_NOT_PRESENT)
                .withCommand(template.getCommand())
                .withPorts(template.getPorts())
                .withResources(template.getResources())
                .withVolumeMounts(mounts)
                .withReadinessProbe(tcpProbe(template.getProbePort(), 5, 3))
                .withLivenessProbe(tcpProbe(template.getProbePort(), 30, 10))
                .build();
    }

    private PersistentVolumeClaim volumeClaimTemplate(Map<String, String> selector, StorageSpec storage) {
        String storageClass = storage.getStorageClassName() != null && !storage.getStorageClassName().isBlank()
                ? storage.getStorageClassName()
                : DEFAULT_STORAGE_CLASS;
        return new PersistentVolumeClaimBuilder()
                .withNewMetadata().withName(VOLUME_DATA).withLabels(selector).endMetadata()
                .withNewSpec()
                    .withAccessModes(ACCESS_MODE_RWO)
                    .withStorageClassName(storageClass)
                    .withNewResources().addToRequests(STORAGE_RESOURCE, new Quantity(storage.getSize())).endResources()
                .endSpec()
                .build();
    }

    private static Probe tcpProbe(int port, int initialDelaySeconds, int periodSeconds) {
        return new ProbeBuilder()
                .withNewTcpSocket().withPort(new IntOrString(port)).endTcpSocket()
                .withInitialDelaySeconds(initialDelaySeconds)
                .withPeriodSeconds(periodSeconds)
                .build();
    }
}
