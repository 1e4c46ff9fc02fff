package io.redisoperator.models;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of child resources of one topology object, keyed by kind and name.
 * Insertion order is the apply order: config maps first, then services, then workloads.
 */
public final class ChildResourceSet {

    /** Child types the operator creates, in apply order. */
    public static final List<Class<? extends HasMetadata>> CHILD_TYPES =
            List.of(ConfigMap.class, Service.class, StatefulSet.class);

    private final Map<String, HasMetadata> resources = new LinkedHashMap<>();

    public static String keyOf(HasMetadata resource) {
        return keyOf(resource.getClass(), resource.getMetadata().getName());
    }

    public static String keyOf(Class<?> type, String name) {
        return type.getSimpleName() + "/" + name;
    }

    /**
     * @throws IllegalArgumentException when a resource of the same kind and name is already present
     */
    public ChildResourceSet add(HasMetadata resource) {
        String key = keyOf(resource);
        if (resources.putIfAbsent(key, resource) != null) {
            throw new IllegalArgumentException("Duplicate child resource " + key);
        }
        return this;
    }

    public ChildResourceSet addAll(List<? extends HasMetadata> items) {
        items.forEach(this::add);
        return this;
    }

    public <T extends HasMetadata> Optional<T> find(Class<T> type, String name) {
        HasMetadata resource = resources.get(keyOf(type, name));
        return type.isInstance(resource) ? Optional.of(type.cast(resource)) : Optional.empty();
    }

    public boolean contains(HasMetadata resource) {
        return resources.containsKey(keyOf(resource));
    }

    public <T extends HasMetadata> List<T> ofType(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (HasMetadata resource : resources.values()) {
            if (type.isInstance(resource)) {
                matching.add(type.cast(resource));
            }
        }
        return matching;
    }

    /**
     * Resources sorted by {@link #CHILD_TYPES} order, stable within a type.
     */
    public List<HasMetadata> inApplyOrder() {
        List<HasMetadata> ordered = new ArrayList<>(resources.size());
        for (Class<? extends HasMetadata> type : CHILD_TYPES) {
            ordered.addAll(ofType(type));
        }
        for (HasMetadata resource : resources.values()) {
            if (!ordered.contains(resource)) {
                ordered.add(resource);
            }
        }
        return ordered;
    }

    public List<HasMetadata> getResources() {
        return Collections.unmodifiableList(new ArrayList<>(resources.values()));
    }

    public int size() {
        return resources.size();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    @Override
    public String toString() {
        return "ChildResourceSet" + resources.keySet();
    }
}
