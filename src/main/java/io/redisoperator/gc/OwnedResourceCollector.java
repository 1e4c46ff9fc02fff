package io.redisoperator.gc;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.platform.PlatformClient;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.redisoperator.config.Constants.*;

/**
 * Deletes child resources whose owner is gone.
 * <p>
 * Children are matched through the owner-uid label rather than by name, so a parent
 * recreated under the same name never adopts the previous incarnation's children.
 * Persistent volume claims are left alone.
 */
@Slf4j
public class OwnedResourceCollector {

    private final PlatformClient platform;

    public OwnedResourceCollector(PlatformClient platform) {
        this.platform = platform;
    }

    /**
     * Deletes every child labelled with the parent's uid.
     *
     * @return number of children deleted
     */
    public int collect(TopologyResource parent) throws ReconcileException {
        String uid = parent.getMetadata().getUid();
        if (uid == null) {
            return 0;
        }
        int deleted = 0;
        for (Class<? extends HasMetadata> type : ChildResourceSet.CHILD_TYPES) {
            for (HasMetadata child : platform.list(type, parent.getMetadata().getNamespace(),
                    Map.of(LABEL_OWNER_UID, uid))) {
                if (platform.delete(child)) {
                    deleted++;
                    log.info("[{}] Collected {}", parent.key(), ChildResourceSet.keyOf(child));
                }
            }
        }
        return deleted;
    }

    /**
     * Deletes managed children whose labelled owner no longer exists or has a different uid.
     * An empty namespace sweeps every namespace.
     *
     * @return number of children deleted
     */
    public int sweepOrphans(String namespace) throws ReconcileException {
        Map<String, Optional<String>> ownerUids = new HashMap<>();
        int deleted = 0;
        for (Class<? extends HasMetadata> type : ChildResourceSet.CHILD_TYPES) {
            List<? extends HasMetadata> children = platform.list(type, namespace,
                    Map.of(LABEL_MANAGED_BY, MANAGED_BY_VALUE));
            for (HasMetadata child : children) {
                if (isOrphan(child, ownerUids) && platform.delete(child)) {
                    deleted++;
                    log.info("Swept orphaned {} in namespace {}", ChildResourceSet.keyOf(child),
                            child.getMetadata().getNamespace());
                }
            }
        }
        if (deleted > 0) {
            log.info("Orphan sweep deleted {} children", deleted);
        }
        return deleted;
    }

    private boolean isOrphan(HasMetadata child, Map<String, Optional<String>> ownerUids) throws ReconcileException {
        Map<String, String> labels = child.getMetadata().getLabels();
        String uid = labels.get(LABEL_OWNER_UID);
        String instance = labels.get(LABEL_INSTANCE);
        TopologyKind kind;
        try {
            kind = TopologyKind.fromString(labels.get(LABEL_KIND));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping {} with unknown kind label: {}", ChildResourceSet.keyOf(child), e.getMessage());
            return false;
        }
        if (uid == null || instance == null) {
            return false;
        }
        String namespace = child.getMetadata().getNamespace();
        String ownerKey = kind + "/" + namespace + "/" + instance;
        Optional<String> ownerUid = ownerUids.get(ownerKey);
        if (ownerUid == null) {
            Optional<? extends TopologyResource> owner = platform.get(kind.getResourceType(), namespace, instance);
            ownerUid = owner.map(o -> o.getMetadata().getUid());
            ownerUids.put(ownerKey, ownerUid);
        }
        return ownerUid.map(existing -> !existing.equals(uid)).orElse(true);
    }
}
