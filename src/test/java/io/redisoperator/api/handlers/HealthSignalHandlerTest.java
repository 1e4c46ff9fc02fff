package io.redisoperator.api.handlers;

import io.redisoperator.api.models.requests.HealthSignalRequest;
import io.redisoperator.api.models.responses.ErrorResponse;
import io.redisoperator.api.models.responses.HealthSignalResponse;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.health.HealthSignalCache;
import io.redisoperator.models.HealthSignal;
import io.redisoperator.models.ObjectKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class HealthSignalHandlerTest {

    private HealthSignalCache healthCache;
    private HealthSignalHandler handler;

    @BeforeEach
    void setUp() {
        healthCache = new HealthSignalCache(Clock.systemUTC(), Duration.ofMinutes(2));
        handler = new HealthSignalHandler(healthCache);
    }

    @Test
    void testRecordSignal_Accepted() {
        // Given
        HealthSignalRequest request = HealthSignalRequest.builder()
            .kind("cluster")
            .namespace("cache")
            .name("shards")
            .up(true)
            .clusterState("ok")
            .knownMasters(3)
            .build();

        // When
        ResponseEntity<Object> response = handler.recordSignal(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        HealthSignalResponse body = (HealthSignalResponse) response.getBody();
        assertThat(body.isAcknowledged()).isTrue();
        assertThat(body.getTopology()).isEqualTo("RedisCluster cache/shards");
        HealthSignal stored = healthCache.get(ObjectKey.of(TopologyKind.CLUSTER, "cache", "shards")).orElseThrow();
        assertThat(stored.getKnownMasters()).isEqualTo(3);
        assertThat(stored.getObservedAt()).isNotNull();
    }

    @Test
    void testRecordSignal_MissingName() {
        // Given
        HealthSignalRequest request = HealthSignalRequest.builder()
            .kind("instance")
            .namespace("cache")
            .up(true)
            .build();

        // When
        ResponseEntity<Object> response = handler.recordSignal(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        ErrorResponse body = (ErrorResponse) response.getBody();
        assertThat(body.getReason()).isEqualTo("name is required");
        assertThat(healthCache.snapshot()).isEmpty();
    }

    @Test
    void testRecordSignal_UnknownKind() {
        // Given
        HealthSignalRequest request = HealthSignalRequest.builder()
            .kind("memcached")
            .namespace("cache")
            .name("shards")
            .up(false)
            .build();

        // When
        ResponseEntity<Object> response = handler.recordSignal(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).getReason()).contains("memcached");
    }

    @Test
    void testRecordSignal_NegativeInstancesDown() {
        // Given
        HealthSignalRequest request = HealthSignalRequest.builder()
            .kind("masterreplica")
            .namespace("cache")
            .name("sessions")
            .up(false)
            .instancesDown(-1)
            .build();

        // When
        ResponseEntity<Object> response = handler.recordSignal(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void testRecordSignal_CacheFailure() {
        // Given
        HealthSignalCache failingCache = mock(HealthSignalCache.class);
        doThrow(new IllegalStateException("listener failed")).when(failingCache).record(any());
        HealthSignalHandler failingHandler = new HealthSignalHandler(failingCache);
        HealthSignalRequest request = HealthSignalRequest.builder()
            .kind("instance")
            .namespace("cache")
            .name("single")
            .up(true)
            .build();

        // When
        ResponseEntity<Object> response = failingHandler.recordSignal(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(((ErrorResponse) response.getBody()).getError()).isEqualTo("internal_server_error");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListSignals_ReturnsSnapshot() {
        // Given
        handler.recordSignal(HealthSignalRequest.builder()
            .kind("RedisSentinel").namespace("cache").name("watch").up(true).build());

        // When
        ResponseEntity<Object> response = handler.listSignals();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, HealthSignal> body = (Map<String, HealthSignal>) response.getBody();
        assertThat(body).containsOnlyKeys("RedisSentinel cache/watch");
    }
}
