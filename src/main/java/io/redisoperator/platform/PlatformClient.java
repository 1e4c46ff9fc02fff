package io.redisoperator.platform;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.redisoperator.exceptions.ReconcileException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abstraction layer over the orchestration API.
 * Every write carries the resource version it was computed from; a stale version
 * fails with {@link io.redisoperator.exceptions.VersionConflictException}.
 * A null or empty namespace means all namespaces.
 */
public interface PlatformClient {

    // =================================================================
    // READS
    // =================================================================

    /**
     * Get one object by namespace and name
     */
    <T extends HasMetadata> Optional<T> get(Class<T> type, String namespace, String name) throws ReconcileException;

    /**
     * List objects whose labels contain every entry of {@code labels}
     */
    <T extends HasMetadata> List<T> list(Class<T> type, String namespace, Map<String, String> labels)
            throws ReconcileException;

    // =================================================================
    // WRITES
    // =================================================================

    /**
     * Create an object; an existing object of the same name is a version conflict
     */
    <T extends HasMetadata> T create(T resource) throws ReconcileException;

    /**
     * Replace an object, guarded by its metadata.resourceVersion
     */
    <T extends HasMetadata> T update(T resource) throws ReconcileException;

    /**
     * Replace the status subresource, guarded by metadata.resourceVersion
     */
    <T extends HasMetadata> T updateStatus(T resource) throws ReconcileException;

    /**
     * Delete an object
     *
     * @return false when the object was already gone
     */
    boolean delete(HasMetadata resource) throws ReconcileException;

    // =================================================================
    // WATCHES
    // =================================================================

    /**
     * Watch objects carrying {@code labels}; an empty map watches everything of the type.
     *
     * @return handle that stops the watch when closed
     */
    <T extends HasMetadata> AutoCloseable watch(Class<T> type, String namespace, Map<String, String> labels,
                                                ResourceEventListener<T> listener);
}
