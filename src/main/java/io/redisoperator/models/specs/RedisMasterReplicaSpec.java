package io.redisoperator.models.specs;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One master workload plus a replica workload following it.
 * The shared {@code config} applies to both roles; role config wins on key clashes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RedisMasterReplicaSpec {
    private String image;
    private RoleSpec master;
    private RoleSpec replica;
    private Map<String, String> config;
}
