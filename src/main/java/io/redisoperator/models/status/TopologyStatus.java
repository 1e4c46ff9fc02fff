package io.redisoperator.models.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.Condition;
import io.redisoperator.enums.Phase;
import io.redisoperator.models.SlotMove;
import io.redisoperator.models.SlotRange;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status subresource shared by all topology kinds. Written only by the status aggregator.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TopologyStatus {
    private Long observedGeneration;
    private Phase phase;
    private List<Condition> conditions = new ArrayList<>();
    /** Role name to desired/ready replica counts. */
    private Map<String, RoleReplicaStatus> roles = new TreeMap<>();
    /** Role name to "host:port" of the role's service. */
    private Map<String, String> services = new TreeMap<>();
    private List<SlotRange> slotAssignment;
    private List<SlotMove> pendingSlotMigrations;
    private MonitoredMaster monitoredMaster;
    private String configPendingRestartRevision;

    public static TopologyStatus pending() {
        TopologyStatus status = new TopologyStatus();
        status.setPhase(Phase.PENDING);
        return status;
    }

    /**
     * @return the most recent condition of {@code type}
     */
    public Optional<Condition> latestCondition(String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        for (int i = conditions.size() - 1; i >= 0; i--) {
            if (type.equals(conditions.get(i).getType())) {
                return Optional.of(conditions.get(i));
            }
        }
        return Optional.empty();
    }
}
