package io.redisoperator.topology;

import io.redisoperator.models.SentinelMonitorSet;
import io.redisoperator.models.SlotAssignment;
import io.redisoperator.models.SlotMove;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Kind-specific planning output fed to synthesis and status aggregation.
 */
@Value
@Builder
public class TopologyPlan {
    SlotAssignment slotAssignment;
    @Builder.Default
    List<SlotMove> slotMoves = List.of();
    SentinelMonitorSet sentinelMonitors;

    public static TopologyPlan empty() {
        return TopologyPlan.builder().build();
    }
}
