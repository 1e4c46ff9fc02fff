package io.redisoperator.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;

import static io.redisoperator.config.Constants.*;

/**
 * Configuration for the operator.
 * Loads configuration from application.yml with fallbacks to constants.
 * An external file named by {@code OPERATOR_CONFIG_FILE} takes precedence over the classpath copy.
 */
@Slf4j
@Getter
public class OperatorConfig {

    private final String watchNamespace;
    private final long resyncIntervalSeconds;
    private final int workerThreads;
    private final long reconcileTimeoutSeconds;
    private final int conflictRetryLimit;
    private final long backoffInitialMillis;
    private final long backoffMaxMillis;
    private final long dependencyBackoffMaxMillis;
    private final int maxConditions;
    private final long healthSignalTtlSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "OPERATOR_CONFIG_FILE";

    public OperatorConfig() {
        this(null);
        log.info("Loaded operator config - namespace: '{}', resync: {}s, workers: {}, timeout: {}s",
                watchNamespace, resyncIntervalSeconds, workerThreads, reconcileTimeoutSeconds);
    }

    /**
     * Builds the config from an already parsed model. A null model means "load from file or classpath".
     */
    public OperatorConfig(ConfigModel model) {
        ConfigModel config = model != null ? model : loadYamlConfig();
        Operator operator = config.getOperator() != null ? config.getOperator() : new Operator();
        Watch watch = operator.getWatch() != null ? operator.getWatch() : new Watch();
        Reconcile reconcile = operator.getReconcile() != null ? operator.getReconcile() : new Reconcile();
        Backoff backoff = operator.getBackoff() != null ? operator.getBackoff() : new Backoff();
        Status status = operator.getStatus() != null ? operator.getStatus() : new Status();
        Health health = operator.getHealth() != null ? operator.getHealth() : new Health();

        this.watchNamespace = watch.getNamespace() != null ? watch.getNamespace().trim() : DEFAULT_WATCH_NAMESPACE;
        this.resyncIntervalSeconds = positive("reconcile.resyncIntervalSeconds",
                reconcile.getResyncIntervalSeconds(), DEFAULT_RESYNC_INTERVAL_SECONDS);
        this.workerThreads = (int) positive("reconcile.workerThreads",
                reconcile.getWorkerThreads(), DEFAULT_WORKER_THREADS);
        this.reconcileTimeoutSeconds = positive("reconcile.timeoutSeconds",
                reconcile.getTimeoutSeconds(), DEFAULT_RECONCILE_TIMEOUT_SECONDS);
        this.conflictRetryLimit = (int) positive("reconcile.conflictRetryLimit",
                reconcile.getConflictRetryLimit(), DEFAULT_CONFLICT_RETRY_LIMIT);
        this.backoffInitialMillis = positive("backoff.initialMillis",
                backoff.getInitialMillis(), DEFAULT_BACKOFF_INITIAL_MILLIS);
        this.backoffMaxMillis = positive("backoff.maxMillis",
                backoff.getMaxMillis(), DEFAULT_BACKOFF_MAX_MILLIS);
        this.dependencyBackoffMaxMillis = positive("backoff.dependencyMaxMillis",
                backoff.getDependencyMaxMillis(), DEFAULT_DEPENDENCY_BACKOFF_MAX_MILLIS);
        this.maxConditions = (int) positive("status.maxConditions",
                status.getMaxConditions(), DEFAULT_MAX_CONDITIONS);
        this.healthSignalTtlSeconds = positive("health.signalTtlSeconds",
                health.getSignalTtlSeconds(), DEFAULT_HEALTH_SIGNAL_TTL_SECONDS);
    }

    public static OperatorConfig defaults() {
        return new OperatorConfig(new ConfigModel());
    }

    public Duration getResyncInterval() {
        return Duration.ofSeconds(resyncIntervalSeconds);
    }

    public Duration getReconcileTimeout() {
        return Duration.ofSeconds(reconcileTimeoutSeconds);
    }

    public boolean watchesAllNamespaces() {
        return watchNamespace.isEmpty();
    }

    /**
     * Parses a config document. Keys unknown to the model, such as the Spring web settings, are ignored.
     */
    public static ConfigModel parse(InputStream inputStream) {
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, options);
        // set explicitly, Yaml replaces a constructor's implicit PropertyUtils with the representer's
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        Yaml yaml = new Yaml(constructor);
        ConfigModel config = yaml.load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = parse(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (IOException e) {
            log.error("Error closing config input stream from {}: {}", loadedFrom, e.getMessage());
            return new ConfigModel();
        } catch (RuntimeException e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private static long positive(String key, Number value, long fallback) {
        if (value == null) {
            return fallback;
        }
        if (value.longValue() <= 0) {
            log.warn("Ignoring non-positive value {} for operator.{}, using default {}", value, key, fallback);
            return fallback;
        }
        return value.longValue();
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Operator operator;
    }

    @Data
    public static class Operator {
        private String id;
        private Watch watch;
        private Reconcile reconcile;
        private Backoff backoff;
        private Status status;
        private Health health;
    }

    @Data
    public static class Watch {
        private String namespace;
    }

    @Data
    public static class Reconcile {
        private Long resyncIntervalSeconds;
        private Integer workerThreads;
        private Long timeoutSeconds;
        private Integer conflictRetryLimit;
    }

    @Data
    public static class Backoff {
        private Long initialMillis;
        private Long maxMillis;
        private Long dependencyMaxMillis;
    }

    @Data
    public static class Status {
        private Integer maxConditions;
    }

    @Data
    public static class Health {
        private Long signalTtlSeconds;
    }
}
