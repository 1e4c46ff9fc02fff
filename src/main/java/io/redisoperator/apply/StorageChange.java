package io.redisoperator.apply;

import lombok.Value;

/**
 * Outcome of comparing a workload's live volume claim template with the desired one.
 */
@Value
public class StorageChange {

    public enum Type {
        NONE,
        EXPANSION,
        SHRINK,
        UNSUPPORTED
    }

    String workload;
    Type type;
    String currentSize;
    String desiredSize;
    String message;

    public static StorageChange none(String workload) {
        return new StorageChange(workload, Type.NONE, null, null, null);
    }

    public boolean isRejected() {
        return type == Type.SHRINK || type == Type.UNSUPPORTED;
    }
}
