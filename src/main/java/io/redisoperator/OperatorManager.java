package io.redisoperator;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.redisoperator.config.OperatorConfig;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.gc.OwnedResourceCollector;
import io.redisoperator.health.HealthSignalCache;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.ObjectKey;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.platform.PlatformClient;
import io.redisoperator.platform.ResourceEventListener;
import io.redisoperator.reconcile.ReconcileDriver;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static io.redisoperator.config.Constants.*;

/**
 * Wires watches to the per-kind reconcile drivers.
 * <p>
 * Topology objects are enqueued on every change. Child resources are routed back to their
 * owner through the kind and instance labels, so external edits to a child trigger a pass
 * that reverts them. A RedisMasterReplica change also enqueues the sentinels that reference it.
 */
@Slf4j
@Component
public class OperatorManager {

    private final Map<TopologyKind, ReconcileDriver<?>> drivers = new EnumMap<>(TopologyKind.class);
    private final PlatformClient platform;
    private final OwnedResourceCollector collector;
    private final HealthSignalCache healthCache;
    private final OperatorConfig config;
    private final List<AutoCloseable> watches = new ArrayList<>();

    public OperatorManager(List<ReconcileDriver<?>> drivers, PlatformClient platform,
                           OwnedResourceCollector collector, HealthSignalCache healthCache, OperatorConfig config) {
        for (ReconcileDriver<?> driver : drivers) {
            this.drivers.put(driver.getHandler().getKind(), driver);
        }
        this.platform = platform;
        this.collector = collector;
        this.healthCache = healthCache;
        this.config = config;
    }

    @PostConstruct
    public void start() {
        String namespace = config.getWatchNamespace();
        log.info("Starting operator for kinds {} in {}", drivers.keySet(),
                config.watchesAllNamespaces() ? "all namespaces" : "namespace " + namespace);

        sweepOrphans(namespace);
        drivers.values().forEach(ReconcileDriver::start);
        healthCache.addListener(this::enqueue);

        for (TopologyKind kind : drivers.keySet()) {
            watchTopology(kind, kind.getResourceType(), namespace);
        }
        for (Class<? extends HasMetadata> childType : ChildResourceSet.CHILD_TYPES) {
            watches.add(platform.watch(childType, namespace, Map.of(LABEL_MANAGED_BY, MANAGED_BY_VALUE),
                    new ChildEventListener<>()));
        }
        log.info("Operator started with {} watches", watches.size());
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping operator");
        for (AutoCloseable watch : watches) {
            try {
                watch.close();
            } catch (Exception e) {
                log.warn("Failed to close watch: {}", e.getMessage());
            }
        }
        watches.clear();
        drivers.values().forEach(ReconcileDriver::stop);
    }

    public void enqueue(ObjectKey key) {
        ReconcileDriver<?> driver = drivers.get(key.getKind());
        if (driver != null) {
            driver.enqueue(key);
        }
    }

    /**
     * Deletes the children of a deleted topology object and drops its queue state.
     */
    void onTopologyDeleted(TopologyResource resource) {
        ObjectKey key = resource.key();
        ReconcileDriver<?> driver = drivers.get(key.getKind());
        if (driver != null) {
            driver.forget(key);
        }
        try {
            int deleted = collector.collect(resource);
            log.info("[{}] Deleted with {} children", key, deleted);
        } catch (ReconcileException e) {
            // Children left behind are picked up by the next orphan sweep
            log.warn("[{}] Failed to collect children: {}", key, e.getMessage());
        }
    }

    /**
     * Enqueues every sentinel in the namespace that monitors {@code masterReplica}.
     */
    void enqueueReferencingSentinels(RedisMasterReplica masterReplica) {
        if (!drivers.containsKey(TopologyKind.SENTINEL)) {
            return;
        }
        String namespace = masterReplica.getMetadata().getNamespace();
        String name = masterReplica.getMetadata().getName();
        try {
            for (RedisSentinel sentinel : platform.list(RedisSentinel.class, namespace, Map.of())) {
                if (sentinel.getSpec() != null && sentinel.getSpec().getMasterReplicaRef() != null
                        && name.equals(sentinel.getSpec().getMasterReplicaRef().getName())) {
                    enqueue(sentinel.key());
                }
            }
        } catch (ReconcileException e) {
            log.warn("Failed to list sentinels referencing {}/{}: {}", namespace, name, e.getMessage());
        }
    }

    private void sweepOrphans(String namespace) {
        try {
            collector.sweepOrphans(namespace);
        } catch (ReconcileException e) {
            log.warn("Startup orphan sweep failed: {}", e.getMessage());
        }
    }

    private <T extends TopologyResource> void watchTopology(TopologyKind kind, Class<T> type, String namespace) {
        watches.add(platform.watch(type, namespace, Map.of(), new ResourceEventListener<T>() {
            @Override
            public void onUpsert(T resource) {
                enqueue(resource.key());
                if (kind == TopologyKind.MASTER_REPLICA) {
                    enqueueReferencingSentinels((RedisMasterReplica) resource);
                }
            }

            @Override
            public void onDelete(T resource) {
                onTopologyDeleted(resource);
                if (kind == TopologyKind.MASTER_REPLICA) {
                    enqueueReferencingSentinels((RedisMasterReplica) resource);
                }
            }
        }));
    }

    /**
     * Routes child events to the owning topology object.
     */
    private class ChildEventListener<T extends HasMetadata> implements ResourceEventListener<T> {

        @Override
        public void onUpsert(T child) {
            route(child);
        }

        @Override
        public void onDelete(T child) {
            route(child);
        }

        private void route(T child) {
            Map<String, String> labels = child.getMetadata().getLabels();
            if (labels == null || labels.get(LABEL_INSTANCE) == null) {
                return;
            }
            try {
                TopologyKind kind = TopologyKind.fromString(labels.get(LABEL_KIND));
                enqueue(ObjectKey.of(kind, child.getMetadata().getNamespace(), labels.get(LABEL_INSTANCE)));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring {} with unknown kind label", ChildResourceSet.keyOf(child));
            }
        }
    }
}
