package io.redisoperator.apply;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;

import java.math.BigDecimal;
import java.util.Map;

import static io.redisoperator.config.Constants.STORAGE_RESOURCE;
import static io.redisoperator.config.Constants.VOLUME_DATA;

/**
 * Classifies data volume size changes. Volume claim templates are immutable, so only
 * expansion can be honoured, by resizing the workload's existing claims.
 */
public class StorageChangeAnalyzer {

    public StorageChange analyze(StatefulSet live, StatefulSet desired) {
        String workload = desired.getMetadata().getName();
        Quantity current = claimSize(live);
        Quantity wanted = claimSize(desired);
        if (current == null && wanted == null) {
            return StorageChange.none(workload);
        }
        if (current == null || wanted == null) {
            return new StorageChange(workload, StorageChange.Type.UNSUPPORTED, format(current), format(wanted),
                    "Switching " + workload + " between ephemeral and persistent storage requires recreating it");
        }
        int comparison = bytes(wanted).compareTo(bytes(current));
        if (comparison == 0) {
            return StorageChange.none(workload);
        }
        if (comparison > 0) {
            return new StorageChange(workload, StorageChange.Type.EXPANSION, format(current), format(wanted),
                    "Expanding data volumes of " + workload + " from " + format(current) + " to " + format(wanted));
        }
        return new StorageChange(workload, StorageChange.Type.SHRINK, format(current), format(wanted),
                "Data volumes of " + workload + " cannot shrink from " + format(current) + " to " + format(wanted));
    }

    /**
     * @return true when {@code claim} requests less than {@code size}
     */
    public boolean isSmallerThan(PersistentVolumeClaim claim, Quantity size) {
        Quantity requested = requested(claim);
        return requested == null || bytes(requested).compareTo(bytes(size)) < 0;
    }

    static Quantity requested(PersistentVolumeClaim claim) {
        if (claim.getSpec() == null || claim.getSpec().getResources() == null) {
            return null;
        }
        Map<String, Quantity> requests = claim.getSpec().getResources().getRequests();
        return requests == null ? null : requests.get(STORAGE_RESOURCE);
    }

    static PersistentVolumeClaim dataClaimTemplate(StatefulSet statefulSet) {
        if (statefulSet == null || statefulSet.getSpec() == null
                || statefulSet.getSpec().getVolumeClaimTemplates() == null) {
            return null;
        }
        for (PersistentVolumeClaim claim : statefulSet.getSpec().getVolumeClaimTemplates()) {
            if (claim.getMetadata() != null && VOLUME_DATA.equals(claim.getMetadata().getName())) {
                return claim;
            }
        }
        return null;
    }

    private static Quantity claimSize(StatefulSet statefulSet) {
        PersistentVolumeClaim claim = dataClaimTemplate(statefulSet);
        return claim == null ? null : requested(claim);
    }

    private static BigDecimal bytes(Quantity quantity) {
        return Quantity.getAmountInBytes(quantity);
    }

    private static String format(Quantity quantity) {
        return quantity == null ? null : quantity.toString();
    }
}
