package io.redisoperator.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_OPERATOR_ID = "redis-topology-operator";
    public static final String DEFAULT_WATCH_NAMESPACE = "";
    public static final long DEFAULT_RESYNC_INTERVAL_SECONDS = 30L;
    public static final int DEFAULT_WORKER_THREADS = 2;
    public static final long DEFAULT_RECONCILE_TIMEOUT_SECONDS = 60L;
    public static final int DEFAULT_CONFLICT_RETRY_LIMIT = 5;
    public static final long DEFAULT_BACKOFF_INITIAL_MILLIS = 1_000L;
    public static final long DEFAULT_BACKOFF_MAX_MILLIS = 300_000L;
    public static final long DEFAULT_DEPENDENCY_BACKOFF_MAX_MILLIS = 30_000L;
    public static final int DEFAULT_MAX_CONDITIONS = 20;
    public static final long DEFAULT_HEALTH_SIGNAL_TTL_SECONDS = 120L;

    // API group of the topology resources
    public static final String API_GROUP = "redis.github.com";
    public static final String API_VERSION = "v1";

    // Labels carried by every child resource
    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String LABEL_APP_NAME = "app.kubernetes.io/name";
    public static final String LABEL_KIND = "redis.github.com/kind";
    public static final String LABEL_INSTANCE = "redis.github.com/instance";
    public static final String LABEL_ROLE = "redis.github.com/role";
    public static final String LABEL_OWNER_UID = "redis.github.com/owner-uid";
    public static final String MANAGED_BY_VALUE = "redis-topology-operator";
    public static final String APP_NAME_VALUE = "redis";

    // Annotations
    public static final String ANNOTATION_CONFIG_HASH = "redis.github.com/config-hash";
    public static final String ANNOTATION_SPEC_HASH = "redis.github.com/spec-hash";

    // Ports
    public static final int REDIS_PORT = 6379;
    public static final int CLUSTER_BUS_PORT = 16379;
    public static final int SENTINEL_PORT = 26379;
    public static final String REDIS_PORT_NAME = "redis";
    public static final String CLUSTER_BUS_PORT_NAME = "cluster-bus";
    public static final String SENTINEL_PORT_NAME = "sentinel";

    // Cluster hash slots
    public static final int CLUSTER_SLOTS = 16384;

    // Sentinel defaults
    public static final int DEFAULT_SENTINEL_REPLICAS = 3;
    public static final int DEFAULT_SENTINEL_DOWN_AFTER_MS = 30_000;
    public static final int DEFAULT_SENTINEL_FAILOVER_TIMEOUT_MS = 180_000;
    public static final int DEFAULT_SENTINEL_PARALLEL_SYNCS = 1;
    public static final String DEFAULT_MASTER_NAME = "mymaster";

    // Cluster defaults
    public static final int DEFAULT_CLUSTER_NODE_TIMEOUT_MS = 15_000;
    public static final boolean DEFAULT_CLUSTER_REQUIRE_FULL_COVERAGE = true;
    public static final int DEFAULT_CLUSTER_MIGRATION_BARRIER = 1;

    // Storage
    public static final String DEFAULT_STORAGE_CLASS = "standard";
    public static final String STORAGE_RESOURCE = "storage";
    public static final String ACCESS_MODE_RWO = "ReadWriteOnce";

    // Container layout
    public static final String CONTAINER_REDIS = "redis";
    public static final String CONTAINER_SENTINEL = "sentinel";
    public static final String VOLUME_CONFIG = "config";
    public static final String VOLUME_DATA = "data";
    public static final String CONFIG_MOUNT_PATH = "/usr/local/etc/redis";
    public static final String DATA_MOUNT_PATH = "/data";
    public static final String REDIS_CONFIG_FILE = "redis.conf";
    public static final String SENTINEL_CONFIG_FILE = "sentinel.conf";
    public static final String SLOT_ASSIGNMENT_FILE = "slots.conf";
    public static final String CLUSTER_DOMAIN_SUFFIX = "svc.cluster.local";

    // Child resource name suffixes
    public static final String SUFFIX_MASTER = "master";
    public static final String SUFFIX_REPLICA = "replica";
    public static final String SUFFIX_SENTINEL = "sentinel";
    public static final String SUFFIX_SERVICE = "service";
    public static final String SUFFIX_CONFIG = "config";
    public static final String SUFFIX_EMBEDDED_REDIS = "redis";

    // Condition types
    public static final String CONDITION_READY = "Ready";
    public static final String CONDITION_INVALID_SPEC = "InvalidSpec";
    public static final String CONDITION_PENDING_DEPENDENCY = "PendingDependency";
    public static final String CONDITION_CONFLICT_EXHAUSTED = "ConflictExhausted";
    public static final String CONDITION_PLATFORM_ERROR = "PlatformError";
    public static final String CONDITION_SLOT_MIGRATION_PENDING = "SlotMigrationPending";
    public static final String CONDITION_CONFIG_PENDING_RESTART = "ConfigPendingRestart";
    public static final String CONDITION_STORAGE_SHRINK_REJECTED = "StorageShrinkRejected";
    public static final String CONDITION_STORAGE_EXPANDING = "StorageExpanding";
    public static final String CONDITION_QUORUM_TIE_RISK = "QuorumTieRisk";

    public static final String CONDITION_TRUE = "True";
    public static final String CONDITION_FALSE = "False";
    public static final String REASON_RESOLVED = "Resolved";
}
