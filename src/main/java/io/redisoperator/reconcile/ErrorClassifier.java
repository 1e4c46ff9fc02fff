package io.redisoperator.reconcile;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.redisoperator.enums.ErrorClass;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.exceptions.TransientPlatformException;
import io.redisoperator.platform.PlatformErrors;

/**
 * Maps anything a pass can throw onto the reconcile error hierarchy, and an error class onto
 * the backoff cap the driver applies.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    public static ReconcileException classify(Throwable error) {
        if (error instanceof ReconcileException) {
            return (ReconcileException) error;
        }
        if (error instanceof KubernetesClientException) {
            return PlatformErrors.translate("request", "", (KubernetesClientException) error);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new TransientPlatformException("Unexpected error: " + message, error);
    }

    /**
     * @return the backoff cap in millis, or -1 when the class is not retried automatically
     */
    public static long backoffCapMillis(ErrorClass errorClass, long maxMillis, long dependencyMaxMillis) {
        if (!errorClass.isRetryable()) {
            return -1L;
        }
        return errorClass == ErrorClass.PENDING_DEPENDENCY ? dependencyMaxMillis : maxMillis;
    }
}
