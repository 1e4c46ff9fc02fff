package io.redisoperator.sentinel;

import io.redisoperator.models.SentinelMonitor;
import io.redisoperator.models.SentinelMonitorSet;

import java.util.Map;

import static io.redisoperator.config.Constants.DATA_MOUNT_PATH;
import static io.redisoperator.config.Constants.SENTINEL_PORT;

/**
 * Renders sentinel.conf: global settings, then one block per monitored master, then extra directives sorted by key.
 */
public class SentinelConfigRenderer {

    public String render(SentinelMonitorSet monitors) {
        StringBuilder sb = new StringBuilder();
        sb.append("port ").append(SENTINEL_PORT).append('\n');
        sb.append("dir ").append(DATA_MOUNT_PATH).append('\n');
        sb.append("sentinel resolve-hostnames yes\n");
        sb.append("sentinel announce-hostnames yes\n");
        for (SentinelMonitor monitor : monitors.getMonitors()) {
            String name = monitor.getMasterName();
            sb.append("sentinel monitor ").append(name).append(' ').append(monitor.getHost()).append(' ')
                    .append(monitor.getPort()).append(' ').append(monitor.getQuorum()).append('\n');
            sb.append("sentinel down-after-milliseconds ").append(name).append(' ')
                    .append(monitor.getDownAfterMs()).append('\n');
            sb.append("sentinel failover-timeout ").append(name).append(' ')
                    .append(monitor.getFailoverTimeoutMs()).append('\n');
            sb.append("sentinel parallel-syncs ").append(name).append(' ')
                    .append(monitor.getParallelSyncs()).append('\n');
        }
        for (Map.Entry<String, String> entry : monitors.getAdditionalConfig().entrySet()) {
            sb.append(entry.getKey()).append(' ').append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }
}
