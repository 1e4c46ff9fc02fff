package io.redisoperator.reconcile;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coalescing work queue.
 * <p>
 * A key is queued at most once: adds while it is waiting collapse into the pending entry.
 * A key taken by a worker is marked processing and is not handed to another worker; adds
 * while it is processing mark it dirty, and {@link #done} puts it back exactly once.
 * Delayed adds keep only the earliest due time per key.
 */
@Slf4j
public class WorkQueue<K> {

    private final Deque<K> queue = new ArrayDeque<>();
    private final Set<K> dirty = new HashSet<>();
    private final Set<K> processing = new HashSet<>();
    private final Map<K, Long> waitingUntil = new HashMap<>();
    private final ScheduledExecutorService delayer;
    private boolean shuttingDown = false;

    public WorkQueue(String name) {
        this.delayer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("workqueue-" + name + "-delay");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void add(K key) {
        if (shuttingDown || dirty.contains(key)) {
            return;
        }
        dirty.add(key);
        if (processing.contains(key)) {
            return;
        }
        queue.addLast(key);
        notifyAll();
    }

    public void addAfter(K key, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            add(key);
            return;
        }
        long due = System.nanoTime() + delay.toNanos();
        synchronized (this) {
            if (shuttingDown) {
                return;
            }
            Long existing = waitingUntil.get(key);
            if (existing != null && existing - due <= 0) {
                return;
            }
            waitingUntil.put(key, due);
        }
        delayer.schedule(() -> fire(key, due), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Blocks until a key is available.
     *
     * @return the next key, or null once the queue is shut down
     */
    public synchronized K take() throws InterruptedException {
        while (queue.isEmpty() && !shuttingDown) {
            wait();
        }
        return shuttingDown ? null : next();
    }

    /**
     * Like {@link #take} but gives up after {@code timeout}.
     *
     * @return the next key, or null on timeout or shutdown
     */
    public synchronized K poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (queue.isEmpty() && !shuttingDown) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return shuttingDown ? null : next();
    }

    /**
     * Marks {@code key} as processed; it is queued again if it was added meanwhile.
     */
    public synchronized void done(K key) {
        processing.remove(key);
        if (dirty.contains(key)) {
            queue.addLast(key);
            notifyAll();
        }
    }

    /**
     * Number of keys waiting to be taken, excluding delayed ones.
     */
    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isShuttingDown() {
        return shuttingDown;
    }

    public void shutdown() {
        synchronized (this) {
            shuttingDown = true;
            queue.clear();
            waitingUntil.clear();
            notifyAll();
        }
        delayer.shutdownNow();
    }

    private K next() {
        K key = queue.pollFirst();
        processing.add(key);
        dirty.remove(key);
        return key;
    }

    private void fire(K key, long due) {
        synchronized (this) {
            Long current = waitingUntil.get(key);
            if (current == null || current != due) {
                return;
            }
            waitingUntil.remove(key);
        }
        log.trace("Delayed key {} is due", key);
        add(key);
    }
}
