package io.redisoperator.platform;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.redisoperator.exceptions.ReconcileException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PlatformClient} backed by the fabric8 Kubernetes client.
 * Updates use {@code update()}, which sends the object's resource version and fails with 409 when stale.
 */
@Slf4j
public class KubernetesPlatformClient implements PlatformClient {

    private final KubernetesClient client;

    public KubernetesPlatformClient(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public <T extends HasMetadata> Optional<T> get(Class<T> type, String namespace, String name)
            throws ReconcileException {
        try {
            return Optional.ofNullable(client.resources(type).inNamespace(namespace).withName(name).get());
        } catch (KubernetesClientException e) {
            throw PlatformErrors.translate("get", describe(type, namespace, name), e);
        }
    }

    @Override
    public <T extends HasMetadata> List<T> list(Class<T> type, String namespace, Map<String, String> labels)
            throws ReconcileException {
        try {
            if (isAllNamespaces(namespace)) {
                return client.resources(type).inAnyNamespace().withLabels(labels).list().getItems();
            }
            return client.resources(type).inNamespace(namespace).withLabels(labels).list().getItems();
        } catch (KubernetesClientException e) {
            throw PlatformErrors.translate("list", type.getSimpleName() + " in '" + namespace + "'", e);
        }
    }

    @Override
    public <T extends HasMetadata> T create(T resource) throws ReconcileException {
        try {
            T created = client.resource(resource).create();
            log.debug("Created {}", describe(resource));
            return created;
        } catch (KubernetesClientException e) {
            throw PlatformErrors.translate("create", describe(resource), e);
        }
    }

    @Override
    public <T extends HasMetadata> T update(T resource) throws ReconcileException {
        try {
            T updated = client.resource(resource).update();
            log.debug("Updated {} at resourceVersion {}", describe(resource),
                    resource.getMetadata().getResourceVersion());
            return updated;
        } catch (KubernetesClientException e) {
            throw PlatformErrors.translate("update", describe(resource), e);
        }
    }

    @Override
    public <T extends HasMetadata> T updateStatus(T resource) throws ReconcileException {
        try {
            return client.resource(resource).updateStatus();
        } catch (KubernetesClientException e) {
            throw PlatformErrors.translate("update status of", describe(resource), e);
        }
    }

    @Override
    public boolean delete(HasMetadata resource) throws ReconcileException {
        try {
            boolean deleted = !client.resource(resource).delete().isEmpty();
            log.debug("Deleted {}: {}", describe(resource), deleted);
            return deleted;
        } catch (KubernetesClientException e) {
            throw PlatformErrors.translate("delete", describe(resource), e);
        }
    }

    @Override
    public <T extends HasMetadata> AutoCloseable watch(Class<T> type, String namespace, Map<String, String> labels,
                                                       ResourceEventListener<T> listener) {
        ResourceEventHandler<T> handler = new ResourceEventHandler<>() {
            @Override
            public void onAdd(T obj) {
                listener.onUpsert(obj);
            }

            @Override
            public void onUpdate(T oldObj, T newObj) {
                listener.onUpsert(newObj);
            }

            @Override
            public void onDelete(T obj, boolean deletedFinalStateUnknown) {
                listener.onDelete(obj);
            }
        };
        SharedIndexInformer<T> informer = isAllNamespaces(namespace)
                ? client.resources(type).inAnyNamespace().withLabels(labels).inform(handler)
                : client.resources(type).inNamespace(namespace).withLabels(labels).inform(handler);
        log.info("Watching {} in {}", type.getSimpleName(),
                isAllNamespaces(namespace) ? "all namespaces" : "namespace '" + namespace + "'");
        return informer::stop;
    }

    private static boolean isAllNamespaces(String namespace) {
        return namespace == null || namespace.isEmpty();
    }

    private static String describe(HasMetadata resource) {
        return describe(resource.getClass(), resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    private static String describe(Class<?> type, String namespace, String name) {
        return type.getSimpleName() + " " + namespace + "/" + name;
    }
}
