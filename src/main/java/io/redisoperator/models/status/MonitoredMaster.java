package io.redisoperator.models.status;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The master a sentinel group is watching, as last rendered into its config.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredMaster {
    private String name;
    private String host;
    private int port;
    private int quorum;
}
