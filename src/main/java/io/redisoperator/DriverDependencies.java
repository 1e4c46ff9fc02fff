package io.redisoperator;

import io.redisoperator.apply.ConflictSafeApplier;
import io.redisoperator.config.OperatorConfig;
import io.redisoperator.health.HealthSignalCache;
import io.redisoperator.metrics.MetricsProvider;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.platform.PlatformClient;
import io.redisoperator.reconcile.ReconcileDriver;
import io.redisoperator.status.StatusAggregator;
import io.redisoperator.topology.TopologyHandler;
import lombok.AllArgsConstructor;

import java.time.Clock;

/**
 * Components shared by every reconcile driver; only the handler differs per kind.
 */
@AllArgsConstructor
public class DriverDependencies {

    private final PlatformClient platform;
    private final ConflictSafeApplier applier;
    private final StatusAggregator aggregator;
    private final HealthSignalCache healthCache;
    private final MetricsProvider metricsProvider;
    private final Clock clock;
    private final OperatorConfig config;

    public <R extends TopologyResource> ReconcileDriver<R> driver(TopologyHandler<R> handler) {
        return new ReconcileDriver<>(handler, platform, applier, aggregator, healthCache, metricsProvider, clock,
                config);
    }
}
