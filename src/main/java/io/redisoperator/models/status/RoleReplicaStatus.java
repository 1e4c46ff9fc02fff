package io.redisoperator.models.status;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoleReplicaStatus {
    private int desired;
    private int ready;
}
