package io.redisoperator.models;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything rendered into a sentinel group's {@code sentinel.conf}.
 */
@Value
public class SentinelMonitorSet {
    int replicas;
    List<SentinelMonitor> monitors;
    Map<String, String> additionalConfig;

    public SentinelMonitorSet(int replicas, List<SentinelMonitor> monitors, Map<String, String> additionalConfig) {
        this.replicas = replicas;
        this.monitors = List.copyOf(monitors);
        this.additionalConfig = additionalConfig == null ? Map.of() : new TreeMap<>(additionalConfig);
    }

    public SentinelMonitor primary() {
        return monitors.get(0);
    }
}
