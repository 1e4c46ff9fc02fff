package io.redisoperator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.redisoperator.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class MetricsProviderTest {

    @Mock
    private MeterRegistry mockRegistry;

    private static final String TEST_OPERATOR_ID = "test-operator-01";

    @Test
    void testConstructorInitializesWithRegistry() {
        MetricsProvider provider = new MetricsProvider(mockRegistry, TEST_OPERATOR_ID);
        assertThat(provider).isNotNull();
    }

    @Test
    void testCounterTagsOperatorId() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(registry, TEST_OPERATOR_ID);

        Counter counter = provider.counter(RECONCILE_TOTAL_METRIC_NAME, Map.of("kind", "cluster", "result", "success"));
        counter.increment();
        provider.counter(RECONCILE_TOTAL_METRIC_NAME, Map.of("kind", "cluster", "result", "success")).increment(2.0);

        assertThat(counter.getId().getName()).isEqualTo(RECONCILE_TOTAL_METRIC_NAME);
        assertThat(counter.getId().getTag("operator")).isEqualTo(TEST_OPERATOR_ID);
        assertThat(counter.getId().getTag("kind")).isEqualTo("cluster");
        assertThat(counter.count()).isEqualTo(3.0);
    }

    @Test
    void testGaugeReturnsSameBackingValue() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(registry, TEST_OPERATOR_ID);

        AtomicDouble first = provider.gauge(QUEUE_DEPTH_METRIC_NAME, Map.of("queue", "reconcile"));
        AtomicDouble second = provider.gauge(QUEUE_DEPTH_METRIC_NAME, Map.of("queue", "reconcile"));
        first.set(4);

        assertThat(second).isSameAs(first);
        Gauge gauge = registry.find(QUEUE_DEPTH_METRIC_NAME).gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(4.0);
        assertThat(gauge.getId().getTag("operator")).isEqualTo(TEST_OPERATOR_ID);
    }

    @Test
    void testTimerRecordsDuration() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(registry, TEST_OPERATOR_ID);

        Timer timer = provider.timer(RECONCILE_DURATION_METRIC_NAME, Map.of("kind", "sentinel"));
        timer.record(250, TimeUnit.MILLISECONDS);

        assertThat(timer.getId().getTag("operator")).isEqualTo(TEST_OPERATOR_ID);
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250);
    }
}
