package io.redisoperator.metrics;

/**
 * Constants for metrics names and tags used by the operator.
 */
public class MetricsConstants {
    public final static String RECONCILE_TOTAL_METRIC_NAME = "redis_operator_reconcile_total";
    public final static String RECONCILE_DURATION_METRIC_NAME = "redis_operator_reconcile_duration";
    public final static String CONFLICT_RETRY_METRIC_NAME = "redis_operator_conflict_retries_total";
    public final static String CHILD_WRITES_METRIC_NAME = "redis_operator_child_writes_total";
    public final static String QUEUE_DEPTH_METRIC_NAME = "redis_operator_queue_depth";
    public final static String KIND_TAG = "kind";
    public final static String RESULT_TAG = "result";
    public final static String RESOURCE_TYPE_TAG = "resourceType";
    public final static String OPERATION_TAG = "operation";

    public final static String RESULT_SUCCESS = "success";

    private MetricsConstants() {}
}
