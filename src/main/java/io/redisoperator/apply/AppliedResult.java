package io.redisoperator.apply;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.redisoperator.models.ChildResourceSet;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What one apply pass did to each child, plus the live objects it ended with.
 */
@Getter
public class AppliedResult {

    private final List<String> created = new ArrayList<>();
    private final List<String> updated = new ArrayList<>();
    private final List<String> unchanged = new ArrayList<>();
    private final List<String> deleted = new ArrayList<>();
    private final List<String> expandedClaims = new ArrayList<>();
    private final Map<String, StorageChange> storageChanges = new TreeMap<>();
    private final ChildResourceSet observed = new ChildResourceSet();

    void recordCreated(HasMetadata resource) {
        created.add(ChildResourceSet.keyOf(resource));
        observed.add(resource);
    }

    void recordUpdated(HasMetadata resource) {
        updated.add(ChildResourceSet.keyOf(resource));
        observed.add(resource);
    }

    void recordUnchanged(HasMetadata resource) {
        unchanged.add(ChildResourceSet.keyOf(resource));
        observed.add(resource);
    }

    void recordDeleted(HasMetadata resource) {
        deleted.add(ChildResourceSet.keyOf(resource));
    }

    void recordExpandedClaim(String claimName) {
        expandedClaims.add(claimName);
    }

    void recordStorageChange(StorageChange change) {
        storageChanges.put(change.getWorkload(), change);
    }

    /**
     * Number of create, update, delete and claim resize calls that succeeded.
     */
    public int writes() {
        return created.size() + updated.size() + deleted.size() + expandedClaims.size();
    }

    public boolean wasWritten(Class<? extends HasMetadata> type, String name) {
        String key = ChildResourceSet.keyOf(type, name);
        return created.contains(key) || updated.contains(key);
    }

    @Override
    public String toString() {
        return "created=" + created.size() + ", updated=" + updated.size() + ", unchanged=" + unchanged.size()
                + ", deleted=" + deleted.size() + ", expandedClaims=" + expandedClaims.size();
    }
}
