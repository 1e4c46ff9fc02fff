package io.redisoperator.health;

import io.redisoperator.models.HealthSignal;
import io.redisoperator.models.ObjectKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Latest out-of-band health signal per topology object.
 * <p>
 * Signals are stamped with the time they were received and ignored once older than the TTL,
 * so a collector that stops reporting does not pin an object to its last known state.
 * Listeners are told when a signal changes what the status aggregator would conclude.
 */
@Slf4j
public class HealthSignalCache {

    private final Map<ObjectKey, HealthSignal> signals = new ConcurrentHashMap<>();
    private final List<Consumer<ObjectKey>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final Duration ttl;

    public HealthSignalCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public void record(HealthSignal signal) {
        signal.setObservedAt(clock.instant());
        ObjectKey key = signal.key();
        HealthSignal previous = signals.put(key, signal);
        if (previous == null || isStale(previous) || changed(previous, signal)) {
            log.debug("[{}] Health signal changed: up={}, clusterState={}, knownMasters={}", key,
                    signal.isUp(), signal.getClusterState(), signal.getKnownMasters());
            listeners.forEach(listener -> listener.accept(key));
        }
    }

    /**
     * @return the signal for {@code key} unless it is missing or stale
     */
    public Optional<HealthSignal> get(ObjectKey key) {
        HealthSignal signal = signals.get(key);
        if (signal == null || isStale(signal)) {
            return Optional.empty();
        }
        return Optional.of(signal);
    }

    public void evict(ObjectKey key) {
        signals.remove(key);
    }

    /**
     * Fresh signals only, ordered by key.
     */
    public Map<String, HealthSignal> snapshot() {
        Map<String, HealthSignal> fresh = new TreeMap<>();
        signals.forEach((key, signal) -> {
            if (!isStale(signal)) {
                fresh.put(key.toString(), signal);
            }
        });
        return fresh;
    }

    public void addListener(Consumer<ObjectKey> listener) {
        listeners.add(listener);
    }

    private boolean isStale(HealthSignal signal) {
        return signal.getObservedAt() == null || signal.getObservedAt().plus(ttl).isBefore(clock.instant());
    }

    private static boolean changed(HealthSignal previous, HealthSignal next) {
        return previous.isUp() != next.isUp()
                || !Objects.equals(previous.getInstancesDown(), next.getInstancesDown())
                || !Objects.equals(previous.getClusterState(), next.getClusterState())
                || !Objects.equals(previous.getKnownMasters(), next.getKnownMasters());
    }
}
