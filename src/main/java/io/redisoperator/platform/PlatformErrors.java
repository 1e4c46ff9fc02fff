package io.redisoperator.platform;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.exceptions.TransientPlatformException;
import io.redisoperator.exceptions.UnrecoverableException;
import io.redisoperator.exceptions.VersionConflictException;

/**
 * Translates Kubernetes client failures into the reconcile error hierarchy by HTTP status.
 */
public final class PlatformErrors {

    public static final int HTTP_UNAUTHORIZED = 401;
    public static final int HTTP_FORBIDDEN = 403;
    public static final int HTTP_CONFLICT = 409;
    public static final int HTTP_UNPROCESSABLE = 422;

    private PlatformErrors() {
        // Utility class
    }

    public static ReconcileException translate(String operation, String target, KubernetesClientException e) {
        int code = e.getCode();
        String message = operation + " " + target + " failed (HTTP " + code + "): " + e.getMessage();
        switch (code) {
            case HTTP_CONFLICT:
                return new VersionConflictException(message, e);
            case HTTP_UNAUTHORIZED:
            case HTTP_FORBIDDEN:
            case HTTP_UNPROCESSABLE:
                return new UnrecoverableException(message, e);
            default:
                return new TransientPlatformException(message, e);
        }
    }
}
