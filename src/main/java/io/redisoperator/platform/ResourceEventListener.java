package io.redisoperator.platform;

/**
 * Callback for watched objects. Adds and updates are not distinguished.
 */
public interface ResourceEventListener<T> {

    void onUpsert(T resource);

    void onDelete(T resource);
}
