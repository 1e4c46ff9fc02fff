package io.redisoperator.apply;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.redisoperator.exceptions.ConflictExhaustedException;
import io.redisoperator.exceptions.OwnershipConflictException;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.exceptions.VersionConflictException;
import io.redisoperator.metrics.MetricsProvider;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.models.status.TopologyStatus;
import io.redisoperator.platform.PlatformClient;
import io.redisoperator.reconcile.ReconcileContext;
import io.redisoperator.util.Manifests;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.redisoperator.config.Constants.LABEL_INSTANCE;
import static io.redisoperator.config.Constants.LABEL_KIND;
import static io.redisoperator.config.Constants.LABEL_OWNER_UID;
import static io.redisoperator.config.Constants.STORAGE_RESOURCE;
import static io.redisoperator.config.Constants.VOLUME_DATA;
import static io.redisoperator.metrics.MetricsConstants.*;

/**
 * Writes desired child state and topology status through optimistic concurrency.
 * <p>
 * Every write is computed from a freshly read object and sent with that object's
 * resource version. A version conflict re-reads the object, recomputes the change and
 * retries, up to the configured number of attempts per object; after that the pass
 * fails with {@link ConflictExhaustedException}. Objects already in the desired state
 * are not written.
 */
@Slf4j
public class ConflictSafeApplier {

    private final PlatformClient platform;
    private final ManifestMerger merger;
    private final StorageChangeAnalyzer storageAnalyzer;
    private final MetricsProvider metricsProvider;
    private final int maxAttempts;

    public ConflictSafeApplier(PlatformClient platform, ManifestMerger merger, StorageChangeAnalyzer storageAnalyzer,
                               MetricsProvider metricsProvider, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.platform = platform;
        this.merger = merger;
        this.storageAnalyzer = storageAnalyzer;
        this.metricsProvider = metricsProvider;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Creates missing children, patches drifted ones and deletes owned children that are no longer desired.
     */
    public AppliedResult apply(ChildResourceSet desired, ChildResourceSet actual, ReconcileContext context)
            throws ReconcileException {
        AppliedResult result = new AppliedResult();
        for (HasMetadata resource : desired.inApplyOrder()) {
            context.checkDeadline("applying " + ChildResourceSet.keyOf(resource));
            HasMetadata live = applyChild(resource, actual, result, context);
            if (resource instanceof StatefulSet) {
                handleStorage((StatefulSet) live, (StatefulSet) resource, result, context);
            }
        }
        for (HasMetadata stale : actual.getResources()) {
            if (desired.contains(stale)) {
                continue;
            }
            context.checkDeadline("deleting " + ChildResourceSet.keyOf(stale));
            if (platform.delete(stale)) {
                log.info("[{}] Deleted {} which is no longer desired", context.getKey(), ChildResourceSet.keyOf(stale));
                result.recordDeleted(stale);
                countWrite(stale, "delete");
            }
        }
        log.debug("[{}] Applied children: {}", context.getKey(), result);
        return result;
    }

    /**
     * Writes {@code status} to the status subresource unless the stored status already equals it.
     *
     * @return true when a write happened
     */
    public <R extends TopologyResource> boolean applyStatus(R resource, TopologyStatus status, ReconcileContext context)
            throws ReconcileException {
        @SuppressWarnings("unchecked")
        Class<R> type = (Class<R>) resource.getClass();
        Optional<R> written = updateWithRetry(type, resource, live -> {
            if (Objects.equals(live.getStatus(), status)) {
                return Optional.empty();
            }
            R copy = Manifests.copy(live);
            copy.setStatus(Manifests.copy(status));
            return Optional.of(copy);
        }, platform::updateStatus, context);
        written.ifPresent(r -> log.debug("[{}] Status written: phase {}", context.getKey(), status.getPhase()));
        return written.isPresent();
    }

    @SuppressWarnings("unchecked")
    private <T extends HasMetadata> T applyChild(T desired, ChildResourceSet actual, AppliedResult result,
                                                 ReconcileContext context) throws ReconcileException {
        Class<T> type = (Class<T>) desired.getClass();
        String namespace = desired.getMetadata().getNamespace();
        String name = desired.getMetadata().getName();
        String key = ChildResourceSet.keyOf(desired);
        T live = actual.find(type, name).orElse(null);
        VersionConflictException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (live == null) {
                    T created = platform.create(Manifests.copy(desired));
                    log.info("[{}] Created {}", context.getKey(), key);
                    result.recordCreated(created);
                    countWrite(desired, "create");
                    return created;
                }
                checkOwnership(live, desired, key);
                Optional<T> merged = merger.merge(live, desired);
                if (merged.isEmpty()) {
                    result.recordUnchanged(live);
                    return live;
                }
                T updated = platform.update(merged.get());
                log.info("[{}] Updated {}", context.getKey(), key);
                result.recordUpdated(updated);
                countWrite(desired, "update");
                return updated;
            } catch (VersionConflictException e) {
                lastConflict = e;
                countConflict(type);
                log.debug("[{}] Version conflict on {} (attempt {}/{}), re-reading", context.getKey(), key,
                        attempt, maxAttempts);
                context.checkDeadline("re-reading " + key);
                live = platform.get(type, namespace, name).orElse(null);
            }
        }
        throw new ConflictExhaustedException(key, maxAttempts, lastConflict);
    }

    /**
     * Refuses to write a child whose owner labels name another topology object. A child left
     * behind by an earlier object of the same kind and name is adopted.
     */
    private static void checkOwnership(HasMetadata live, HasMetadata desired, String key)
            throws OwnershipConflictException {
        Map<String, String> liveLabels = live.getMetadata().getLabels() != null
                ? live.getMetadata().getLabels() : Map.of();
        Map<String, String> wanted = desired.getMetadata().getLabels() != null
                ? desired.getMetadata().getLabels() : Map.of();
        String liveOwner = liveLabels.get(LABEL_OWNER_UID);
        if (liveOwner == null || liveOwner.equals(wanted.get(LABEL_OWNER_UID))) {
            return;
        }
        if (Objects.equals(liveLabels.get(LABEL_KIND), wanted.get(LABEL_KIND))
                && Objects.equals(liveLabels.get(LABEL_INSTANCE), wanted.get(LABEL_INSTANCE))) {
            return;
        }
        throw new OwnershipConflictException(key + " is owned by " + liveLabels.get(LABEL_KIND) + " "
                + liveLabels.get(LABEL_INSTANCE) + " (uid " + liveOwner + ")");
    }

    private void handleStorage(StatefulSet live, StatefulSet desired, AppliedResult result, ReconcileContext context)
            throws ReconcileException {
        StorageChange change = storageAnalyzer.analyze(live, desired);
        if (change.getType() == StorageChange.Type.NONE) {
            return;
        }
        result.recordStorageChange(change);
        if (change.isRejected()) {
            log.warn("[{}] {}", context.getKey(), change.getMessage());
            return;
        }
        PersistentVolumeClaim template = StorageChangeAnalyzer.dataClaimTemplate(desired);
        Quantity wanted = new Quantity(change.getDesiredSize());
        String claimPrefix = VOLUME_DATA + "-" + desired.getMetadata().getName() + "-";
        List<PersistentVolumeClaim> claims = platform.list(PersistentVolumeClaim.class,
                desired.getMetadata().getNamespace(), template.getMetadata().getLabels());
        for (PersistentVolumeClaim claim : claims) {
            if (!claim.getMetadata().getName().startsWith(claimPrefix)) {
                continue;
            }
            context.checkDeadline("expanding " + claim.getMetadata().getName());
            Optional<PersistentVolumeClaim> resized = updateWithRetry(PersistentVolumeClaim.class, claim, current -> {
                if (current.getSpec() == null || current.getSpec().getResources() == null
                        || !storageAnalyzer.isSmallerThan(current, wanted)) {
                    return Optional.empty();
                }
                PersistentVolumeClaim copy = Manifests.copy(current);
                Map<String, Quantity> requests = copy.getSpec().getResources().getRequests() == null
                        ? new LinkedHashMap<>()
                        : new LinkedHashMap<>(copy.getSpec().getResources().getRequests());
                requests.put(STORAGE_RESOURCE, wanted);
                copy.getSpec().getResources().setRequests(requests);
                return Optional.of(copy);
            }, platform::update, context);
            if (resized.isPresent()) {
                log.info("[{}] Expanded {} to {}", context.getKey(), claim.getMetadata().getName(), wanted);
                result.recordExpandedClaim(claim.getMetadata().getName());
                countWrite(claim, "expand");
            }
        }
    }

    private <T extends HasMetadata> Optional<T> updateWithRetry(Class<T> type, T current, Mutation<T> mutation,
                                                                Writer<T> writer, ReconcileContext context)
            throws ReconcileException {
        String namespace = current.getMetadata().getNamespace();
        String name = current.getMetadata().getName();
        T live = current;
        VersionConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (live == null) {
                return Optional.empty();
            }
            Optional<T> mutated = mutation.apply(live);
            if (mutated.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(writer.write(mutated.get()));
            } catch (VersionConflictException e) {
                lastConflict = e;
                countConflict(type);
                log.debug("[{}] Version conflict on {} {} (attempt {}/{}), re-reading", context.getKey(),
                        type.getSimpleName(), name, attempt, maxAttempts);
                context.checkDeadline("re-reading " + type.getSimpleName() + " " + name);
                live = platform.get(type, namespace, name).orElse(null);
            }
        }
        throw new ConflictExhaustedException(ChildResourceSet.keyOf(type, name), maxAttempts, lastConflict);
    }

    private void countConflict(Class<?> type) {
        metricsProvider.counter(CONFLICT_RETRY_METRIC_NAME, Map.of(RESOURCE_TYPE_TAG, type.getSimpleName())).increment();
    }

    private void countWrite(HasMetadata resource, String operation) {
        metricsProvider.counter(CHILD_WRITES_METRIC_NAME, Map.of(
                RESOURCE_TYPE_TAG, resource.getClass().getSimpleName(),
                OPERATION_TAG, operation)).increment();
    }

    @FunctionalInterface
    private interface Mutation<T> {
        Optional<T> apply(T live);
    }

    @FunctionalInterface
    private interface Writer<T> {
        T write(T resource) throws ReconcileException;
    }
}
