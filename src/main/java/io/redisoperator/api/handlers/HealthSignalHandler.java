package io.redisoperator.api.handlers;

import io.redisoperator.api.models.requests.HealthSignalRequest;
import io.redisoperator.api.models.responses.ErrorResponse;
import io.redisoperator.api.models.responses.HealthSignalResponse;
import io.redisoperator.health.HealthSignalCache;
import io.redisoperator.models.HealthSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for health signals pushed by the external metrics collector.
 *
 * Supported operations:
 * - POST /api/v1/health-signals - Record the latest health of one topology object
 * - GET /api/v1/health-signals - List the signals that are still fresh
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/health-signals")
public class HealthSignalHandler {

    private final HealthSignalCache healthCache;

    public HealthSignalHandler(HealthSignalCache healthCache) {
        this.healthCache = healthCache;
    }

    /**
     * Record a health signal.
     * POST /api/v1/health-signals
     */
    @PostMapping
    public ResponseEntity<Object> recordSignal(@RequestBody HealthSignalRequest request) {
        try {
            HealthSignal signal = request.toSignal();
            healthCache.record(signal);
            log.debug("Recorded health signal for {}", signal.key());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(HealthSignalResponse.accepted(signal.key().toString()));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected health signal: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error recording health signal: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * List fresh health signals.
     * GET /api/v1/health-signals
     */
    @GetMapping
    public ResponseEntity<Object> listSignals() {
        return ResponseEntity.ok(healthCache.snapshot());
    }
}
