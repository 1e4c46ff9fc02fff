package io.redisoperator.reconcile;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.redisoperator.apply.AppliedResult;
import io.redisoperator.apply.ConflictSafeApplier;
import io.redisoperator.config.OperatorConfig;
import io.redisoperator.enums.ErrorClass;
import io.redisoperator.enums.Phase;
import io.redisoperator.exceptions.DeadlineExceededException;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.health.HealthSignalCache;
import io.redisoperator.metrics.MetricsProvider;
import io.redisoperator.models.ChildResourceSet;
import io.redisoperator.models.ObjectKey;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.models.status.TopologyStatus;
import io.redisoperator.platform.PlatformClient;
import io.redisoperator.status.PassOutcome;
import io.redisoperator.status.StatusAggregator;
import io.redisoperator.topology.TopologyHandler;
import io.redisoperator.topology.TopologyPlan;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.redisoperator.config.Constants.LABEL_OWNER_UID;
import static io.redisoperator.metrics.MetricsConstants.*;

/**
 * Control loop for one topology kind.
 * <p>
 * Keys come from a coalescing {@link WorkQueue} and are processed by a fixed worker pool,
 * so different objects reconcile in parallel while passes for the same object never overlap.
 * A pass is validate, plan, synthesize, apply children, then write status. The error class
 * of a failed pass decides whether and when the key comes back.
 */
@Slf4j
public class ReconcileDriver<R extends TopologyResource> {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final TopologyHandler<R> handler;
    private final PlatformClient platform;
    private final ConflictSafeApplier applier;
    private final StatusAggregator aggregator;
    private final HealthSignalCache healthCache;
    private final MetricsProvider metricsProvider;
    private final Clock clock;
    private final OperatorConfig config;
    private final ExponentialBackoff<ObjectKey> backoff;
    private final WorkQueue<ObjectKey> queue;
    private ExecutorService workers;

    public ReconcileDriver(TopologyHandler<R> handler, PlatformClient platform, ConflictSafeApplier applier,
                           StatusAggregator aggregator, HealthSignalCache healthCache,
                           MetricsProvider metricsProvider, Clock clock, OperatorConfig config) {
        this.handler = handler;
        this.platform = platform;
        this.applier = applier;
        this.aggregator = aggregator;
        this.healthCache = healthCache;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        this.config = config;
        this.backoff = new ExponentialBackoff<>(config.getBackoffInitialMillis(), config.getBackoffMaxMillis());
        this.queue = new WorkQueue<>(handler.getKind().getLabelValue());
    }

    public TopologyHandler<R> getHandler() {
        return handler;
    }

    public synchronized void start() {
        if (workers != null) {
            return;
        }
        String kind = handler.getKind().getLabelValue();
        workers = Executors.newFixedThreadPool(config.getWorkerThreads(), r -> {
            Thread t = new Thread(r);
            t.setName("reconcile-" + kind + "-" + t.getId());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < config.getWorkerThreads(); i++) {
            workers.submit(this::workLoop);
        }
        log.info("Started {} reconcile workers for {}", config.getWorkerThreads(), handler.getKind().getResourceKind());
    }

    public synchronized void stop() {
        queue.shutdown();
        if (workers == null) {
            return;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Reconcile workers for {} did not stop in time", handler.getKind().getResourceKind());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers = null;
    }

    public void enqueue(ObjectKey key) {
        queue.add(key);
        updateQueueDepth();
    }

    public void enqueue(HasMetadata resource) {
        enqueue(ObjectKey.of(handler.getKind(), resource.getMetadata().getNamespace(),
                resource.getMetadata().getName()));
    }

    /**
     * Forgets per-key retry state of a deleted object.
     */
    public void forget(ObjectKey key) {
        backoff.forget(key);
        healthCache.evict(key);
    }

    public int getQueueDepth() {
        return queue.size();
    }

    /**
     * Runs one pass for {@code key}. Exposed for tests and callers that own their scheduling.
     */
    public ReconcileResult reconcile(ObjectKey key) {
        long startNanos = System.nanoTime();
        ReconcileContext context = new ReconcileContext(key, clock, config.getReconcileTimeout());
        ReconcileResult result;
        String outcomeTag;
        try {
            Optional<R> found = platform.get(handler.getResourceType(), key.getNamespace(), key.getName());
            if (found.isEmpty() || found.get().isBeingDeleted()) {
                log.debug("[{}] Object is gone or being deleted, nothing to reconcile", key);
                forget(key);
                return ReconcileResult.stop();
            }
            R resource = found.get();
            if (isInvalidAtCurrentGeneration(resource)) {
                log.debug("[{}] Generation {} was already rejected, waiting for a spec change", key,
                        resource.generation());
                return ReconcileResult.stop();
            }
            ReconcileException error = runPass(resource, context);
            result = schedule(key, error);
            outcomeTag = error == null ? RESULT_SUCCESS : error.getErrorClass().name().toLowerCase();
        } catch (ReconcileException e) {
            log.warn("[{}] Could not read object: {}", key, e.getMessage());
            result = schedule(key, e);
            outcomeTag = e.getErrorClass().name().toLowerCase();
        }
        Map<String, String> kindTag = Map.of(KIND_TAG, handler.getKind().getLabelValue());
        metricsProvider.timer(RECONCILE_DURATION_METRIC_NAME, kindTag)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        metricsProvider.counter(RECONCILE_TOTAL_METRIC_NAME, Map.of(
                KIND_TAG, handler.getKind().getLabelValue(), RESULT_TAG, outcomeTag)).increment();
        return result;
    }

    /**
     * @return the error the pass ended with, or null when it converged
     */
    private ReconcileException runPass(R resource, ReconcileContext context) {
        ObjectKey key = context.getKey();
        PassOutcome.PassOutcomeBuilder outcome = PassOutcome.builder();
        ReconcileException error = null;
        try {
            handler.validate(resource);
            outcome.desiredReplicas(handler.desiredReplicas(resource));
            context.checkDeadline("planning");
            TopologyPlan plan = handler.plan(resource);
            outcome.plan(plan);
            ChildResourceSet desired = handler.synthesize(resource, plan);
            outcome.desired(desired);
            context.checkDeadline("listing children");
            ChildResourceSet actual = listChildren(resource);
            AppliedResult applied = applier.apply(desired, actual, context);
            outcome.applied(applied);
            log.debug("[{}] Pass applied {}", key, applied);
        } catch (ReconcileException | RuntimeException e) {
            error = ErrorClassifier.classify(e);
            outcome.error(error);
            logFailure(key, error);
        }

        if (error instanceof DeadlineExceededException) {
            // The next pass recomputes status from whatever the partial apply left behind
            return error;
        }
        TopologyStatus status = aggregator.aggregate(resource, outcome.build(), healthCache.get(key));
        try {
            applier.applyStatus(resource, status, context);
        } catch (ReconcileException e) {
            log.warn("[{}] Failed to write status: {}", key, e.getMessage());
            if (error == null) {
                error = e;
            }
        }
        return error;
    }

    private ChildResourceSet listChildren(R resource) throws ReconcileException {
        ChildResourceSet actual = new ChildResourceSet();
        String uid = resource.getMetadata().getUid();
        if (uid == null) {
            return actual;
        }
        Map<String, String> ownerLabel = Map.of(LABEL_OWNER_UID, uid);
        for (Class<? extends HasMetadata> type : ChildResourceSet.CHILD_TYPES) {
            actual.addAll(platform.list(type, resource.getMetadata().getNamespace(), ownerLabel));
        }
        return actual;
    }

    private ReconcileResult schedule(ObjectKey key, ReconcileException error) {
        if (error == null) {
            backoff.forget(key);
            return ReconcileResult.done(config.getResyncInterval());
        }
        ErrorClass errorClass = error.getErrorClass();
        long cap = ErrorClassifier.backoffCapMillis(errorClass, config.getBackoffMaxMillis(),
                config.getDependencyBackoffMaxMillis());
        if (cap < 0) {
            backoff.forget(key);
            return ReconcileResult.stop();
        }
        return ReconcileResult.requeueAfter(backoff.next(key, cap));
    }

    private boolean isInvalidAtCurrentGeneration(R resource) {
        TopologyStatus status = resource.getStatus();
        return status != null
                && status.getPhase() == Phase.INVALID
                && status.getObservedGeneration() != null
                && status.getObservedGeneration() == resource.generation();
    }

    private void logFailure(ObjectKey key, ReconcileException error) {
        switch (error.getErrorClass()) {
            case INVALID_SPEC:
                log.warn("[{}] Spec rejected: {}", key, error.getMessage());
                break;
            case PENDING_DEPENDENCY:
                log.info("[{}] Waiting on dependency: {}", key, error.getMessage());
                break;
            case UNRECOVERABLE:
                log.error("[{}] Unrecoverable platform error: {}", key, error.getMessage(), error);
                break;
            default:
                log.warn("[{}] Pass failed ({}): {}", key, error.getReason(), error.getMessage());
        }
    }

    private void workLoop() {
        while (true) {
            ObjectKey key;
            try {
                key = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                return;
            }
            updateQueueDepth();
            try {
                ReconcileResult result = reconcile(key);
                if (result.getAction() != ReconcileResult.Action.STOP) {
                    log.debug("[{}] {} in {}", key, result.getAction(), result.getDelay());
                    queue.addAfter(key, result.getDelay());
                }
            } catch (RuntimeException e) {
                log.error("[{}] Unexpected error in reconcile pass: {}", key, e.getMessage(), e);
                queue.addAfter(key, backoff.next(key));
            } finally {
                queue.done(key);
            }
        }
    }

    private void updateQueueDepth() {
        metricsProvider.gauge(QUEUE_DEPTH_METRIC_NAME, Map.of(KIND_TAG, handler.getKind().getLabelValue()))
                .set(queue.size());
    }
}
