package io.redisoperator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.redisoperator.models.HealthSignal;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.models.status.TopologyStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored status of one topology object, with the health signal the operator currently holds for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TopologyStatusResponse {
    private String kind;
    private String namespace;
    private String name;
    private Long generation;
    private TopologyStatus status;
    private HealthSignal health;

    public static TopologyStatusResponse of(TopologyResource resource, HealthSignal health) {
        return TopologyStatusResponse.builder()
            .kind(resource.topologyKind().getResourceKind())
            .namespace(resource.getMetadata().getNamespace())
            .name(resource.getMetadata().getName())
            .generation(resource.generation())
            .status(resource.getStatus())
            .health(health)
            .build();
    }
}
