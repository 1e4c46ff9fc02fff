package io.redisoperator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider creates and caches the operator's counters, gauges and timers,
 * tagging each with the operator id.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String OPERATOR_TAG = "operator";

    private final MeterRegistry registry;
    private final String operatorId;
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${operator.id:redis-topology-operator}") String operatorId) {
        this.registry = registry;
        this.operatorId = operatorId;
        log.info("MetricsProvider initialized for the operator: {}", operatorId);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     * The same name and tags always return the same backing value.
     *
     * @param name the name of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance representing the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String[] tagArray = mapToTagArray(tags);
        return gauges.computeIfAbsent(name + String.join(",", tagArray), key -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(tagArray).register(registry);
            return value;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     *
     * @param name the name of the timer
     * @param tags a map of tag keys to tag values
     * @return the Timer instance
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including the operator id.
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = OPERATOR_TAG;
        tagArray[index] = operatorId;
        return tagArray;
    }
}
