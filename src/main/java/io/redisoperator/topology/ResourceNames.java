package io.redisoperator.topology;

import static io.redisoperator.config.Constants.SUFFIX_CONFIG;
import static io.redisoperator.config.Constants.SUFFIX_EMBEDDED_REDIS;
import static io.redisoperator.config.Constants.SUFFIX_SERVICE;

/**
 * Child resource naming: workload {@code <prefix>-<role>}, service {@code <workload>-service},
 * config map {@code <workload>-config}.
 */
public final class ResourceNames {

    private ResourceNames() {
        // Utility class
    }

    public static String workload(String prefix, String role) {
        return prefix + "-" + role;
    }

    public static String service(String workload) {
        return workload + "-" + SUFFIX_SERVICE;
    }

    public static String configMap(String workload) {
        return workload + "-" + SUFFIX_CONFIG;
    }

    /**
     * Prefix of the master/replica group embedded in a sentinel object.
     */
    public static String embeddedRedisPrefix(String sentinelName) {
        return sentinelName + "-" + SUFFIX_EMBEDDED_REDIS;
    }
}
