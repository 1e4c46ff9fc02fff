package io.redisoperator.models.specs;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A master/replica group created and owned by a sentinel object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmbeddedRedisSpec {
    private RoleSpec master;
    private RoleSpec replica;
    private Map<String, String> config;
    private String masterName;
}
