package io.redisoperator.api.handlers;

import io.redisoperator.api.models.responses.ErrorResponse;
import io.redisoperator.api.models.responses.TopologyStatusResponse;
import io.redisoperator.enums.TopologyKind;
import io.redisoperator.exceptions.ReconcileException;
import io.redisoperator.health.HealthSignalCache;
import io.redisoperator.models.ObjectKey;
import io.redisoperator.models.TopologyResource;
import io.redisoperator.platform.PlatformClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST API handler for reading the status the operator wrote on topology objects.
 *
 * Supported operations:
 * - GET /api/v1/topologies/{kind}/{namespace} - Status of every object of a kind in a namespace
 * - GET /api/v1/topologies/{kind}/{namespace}/{name} - Status of one object
 *
 * {kind} accepts the resource kind (RedisCluster) or its short form (cluster).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/topologies")
public class TopologyStatusHandler {

    private final PlatformClient platform;
    private final HealthSignalCache healthCache;

    public TopologyStatusHandler(PlatformClient platform, HealthSignalCache healthCache) {
        this.platform = platform;
        this.healthCache = healthCache;
    }

    /**
     * Get the status of one topology object.
     * GET /api/v1/topologies/{kind}/{namespace}/{name}
     */
    @GetMapping("/{kind}/{namespace}/{name}")
    public ResponseEntity<Object> getTopology(
            @PathVariable String kind,
            @PathVariable String namespace,
            @PathVariable String name) {
        try {
            TopologyKind topologyKind = TopologyKind.fromString(kind);
            Optional<? extends TopologyResource> resource =
                    platform.get(topologyKind.getResourceType(), namespace, name);
            if (resource.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.notFound(topologyKind.getResourceKind() + " " + namespace + "/" + name));
            }
            return ResponseEntity.ok(toResponse(resource.get()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (ReconcileException e) {
            log.error("Error reading {} {}/{}: {}", kind, namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.unavailable(e.getMessage()));
        }
    }

    /**
     * List the status of every object of a kind in a namespace.
     * GET /api/v1/topologies/{kind}/{namespace}
     */
    @GetMapping("/{kind}/{namespace}")
    public ResponseEntity<Object> listTopologies(
            @PathVariable String kind,
            @PathVariable String namespace) {
        try {
            TopologyKind topologyKind = TopologyKind.fromString(kind);
            List<? extends TopologyResource> resources =
                    platform.list(topologyKind.getResourceType(), namespace, Map.of());
            return ResponseEntity.ok(resources.stream().map(this::toResponse).collect(Collectors.toList()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (ReconcileException e) {
            log.error("Error listing {} in {}: {}", kind, namespace, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.unavailable(e.getMessage()));
        }
    }

    private TopologyStatusResponse toResponse(TopologyResource resource) {
        ObjectKey key = resource.key();
        return TopologyStatusResponse.of(resource, healthCache.get(key).orElse(null));
    }
}
