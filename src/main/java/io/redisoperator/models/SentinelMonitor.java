package io.redisoperator.models;

import lombok.Builder;
import lombok.Value;

/**
 * One {@code sentinel monitor} entry and its tuning directives.
 */
@Value
@Builder
public class SentinelMonitor {
    String masterName;
    String host;
    int port;
    int quorum;
    int downAfterMs;
    int failoverTimeoutMs;
    int parallelSyncs;
}
