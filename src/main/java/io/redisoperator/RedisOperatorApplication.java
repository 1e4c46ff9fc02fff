package io.redisoperator;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.redisoperator.allocation.SlotAllocator;
import io.redisoperator.apply.ConflictSafeApplier;
import io.redisoperator.apply.ManifestMerger;
import io.redisoperator.apply.StorageChangeAnalyzer;
import io.redisoperator.config.OperatorConfig;
import io.redisoperator.gc.OwnedResourceCollector;
import io.redisoperator.health.HealthSignalCache;
import io.redisoperator.metrics.MetricsProvider;
import io.redisoperator.models.RedisCluster;
import io.redisoperator.models.RedisInstance;
import io.redisoperator.models.RedisMasterReplica;
import io.redisoperator.models.RedisSentinel;
import io.redisoperator.platform.KubernetesPlatformClient;
import io.redisoperator.platform.PlatformClient;
import io.redisoperator.reconcile.ReconcileDriver;
import io.redisoperator.sentinel.SentinelConfigRenderer;
import io.redisoperator.sentinel.SentinelTopologyBuilder;
import io.redisoperator.status.StatusAggregator;
import io.redisoperator.topology.ClusterHandler;
import io.redisoperator.topology.InstanceHandler;
import io.redisoperator.topology.ManifestFactory;
import io.redisoperator.topology.MasterReplicaHandler;
import io.redisoperator.topology.RedisConfigRenderer;
import io.redisoperator.topology.ReplicationGroupSynthesizer;
import io.redisoperator.topology.SentinelHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;

/**
 * Main Spring Boot application class for the Redis topology operator.
 *
 * Reconciles RedisInstance, RedisMasterReplica, RedisSentinel and RedisCluster objects into
 * StatefulSets, Services and ConfigMaps, and serves the health-signal and status REST APIs.
 */
@Slf4j
@SpringBootApplication
public class RedisOperatorApplication {

    public static void main(String[] args) {
        log.info("Starting Redis topology operator");

        try {
            SpringApplication.run(RedisOperatorApplication.class, args);
            log.info("Redis topology operator started successfully");

        } catch (Exception e) {
            log.error("Failed to start Redis topology operator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public OperatorConfig operatorConfig() {
        OperatorConfig config = new OperatorConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Kubernetes client configured from the in-cluster service account or the local kubeconfig.
     */
    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        log.info("Initializing Kubernetes client");
        return new KubernetesClientBuilder().build();
    }

    @Bean
    public PlatformClient platformClient(KubernetesClient kubernetesClient) {
        return new KubernetesPlatformClient(kubernetesClient);
    }

    @Bean
    public ManifestFactory manifestFactory() {
        return new ManifestFactory();
    }

    @Bean
    public RedisConfigRenderer redisConfigRenderer() {
        return new RedisConfigRenderer();
    }

    @Bean
    public ReplicationGroupSynthesizer replicationGroupSynthesizer(ManifestFactory manifestFactory,
                                                                   RedisConfigRenderer redisConfigRenderer) {
        return new ReplicationGroupSynthesizer(manifestFactory, redisConfigRenderer);
    }

    @Bean
    public InstanceHandler instanceHandler(ManifestFactory manifestFactory, RedisConfigRenderer redisConfigRenderer) {
        return new InstanceHandler(manifestFactory, redisConfigRenderer);
    }

    @Bean
    public MasterReplicaHandler masterReplicaHandler(ReplicationGroupSynthesizer groups) {
        return new MasterReplicaHandler(groups);
    }

    @Bean
    public SentinelHandler sentinelHandler(ManifestFactory manifestFactory, ReplicationGroupSynthesizer groups,
                                           PlatformClient platformClient) {
        log.info("Initializing SentinelHandler");
        return new SentinelHandler(manifestFactory, groups, new SentinelTopologyBuilder(platformClient, groups),
                new SentinelConfigRenderer());
    }

    @Bean
    public ClusterHandler clusterHandler(ManifestFactory manifestFactory, RedisConfigRenderer redisConfigRenderer) {
        log.info("Initializing ClusterHandler");
        return new ClusterHandler(manifestFactory, redisConfigRenderer, new SlotAllocator());
    }

    @Bean
    public ConflictSafeApplier conflictSafeApplier(PlatformClient platformClient, MetricsProvider metricsProvider,
                                                   OperatorConfig config) {
        log.info("Initializing ConflictSafeApplier with {} attempts per object", config.getConflictRetryLimit());
        return new ConflictSafeApplier(platformClient, new ManifestMerger(), new StorageChangeAnalyzer(),
                metricsProvider, config.getConflictRetryLimit());
    }

    @Bean
    public StatusAggregator statusAggregator(Clock clock, OperatorConfig config) {
        return new StatusAggregator(clock, config.getMaxConditions());
    }

    @Bean
    public HealthSignalCache healthSignalCache(Clock clock, OperatorConfig config) {
        return new HealthSignalCache(clock, Duration.ofSeconds(config.getHealthSignalTtlSeconds()));
    }

    @Bean
    public OwnedResourceCollector ownedResourceCollector(PlatformClient platformClient) {
        return new OwnedResourceCollector(platformClient);
    }

    @Bean
    public ReconcileDriver<RedisInstance> instanceDriver(InstanceHandler handler, DriverDependencies deps) {
        return deps.driver(handler);
    }

    @Bean
    public ReconcileDriver<RedisMasterReplica> masterReplicaDriver(MasterReplicaHandler handler,
                                                                   DriverDependencies deps) {
        return deps.driver(handler);
    }

    @Bean
    public ReconcileDriver<RedisSentinel> sentinelDriver(SentinelHandler handler, DriverDependencies deps) {
        return deps.driver(handler);
    }

    @Bean
    public ReconcileDriver<RedisCluster> clusterDriver(ClusterHandler handler, DriverDependencies deps) {
        return deps.driver(handler);
    }

    @Bean
    public DriverDependencies driverDependencies(PlatformClient platformClient, ConflictSafeApplier applier,
                                                 StatusAggregator aggregator, HealthSignalCache healthCache,
                                                 MetricsProvider metricsProvider, Clock clock,
                                                 OperatorConfig config) {
        return new DriverDependencies(platformClient, applier, aggregator, healthCache, metricsProvider, clock,
                config);
    }
}
