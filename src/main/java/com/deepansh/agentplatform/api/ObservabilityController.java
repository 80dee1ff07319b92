package com.deepansh.agentplatform.api;

import com.deepansh.agentplatform.event.EventBridge;
import com.deepansh.agentplatform.event.EventBridgeStats;
import com.deepansh.agentplatform.registry.AgentRegistry;
import com.deepansh.agentplatform.registry.report.EventWiringReport;
import com.deepansh.agentplatform.registry.report.MonitoringReport;
import com.deepansh.agentplatform.registry.report.RegistryHealthReport;
import com.deepansh.agentplatform.resilience.CircuitBreakerStats;
import com.deepansh.agentplatform.resilience.DegradationManager;
import com.deepansh.agentplatform.resilience.DegradationStatus;
import com.deepansh.agentplatform.resilience.DependencyCircuitBreakers;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only operator views over the platform.
 *
 * GET /api/v1/platform/users         : per-user session health sweep
 * GET /api/v1/platform/health        : registry health (503 when CRITICAL)
 * GET /api/v1/platform/degradation   : degradation level and dependency flags
 * GET /api/v1/platform/wiring        : event emitter coverage and bridge stats
 * GET /api/v1/platform/breakers      : circuit breaker state per dependency
 */
@RestController
@RequestMapping("/api/v1/platform")
@RequiredArgsConstructor
public class ObservabilityController {

    private final AgentRegistry registry;
    private final DegradationManager degradationManager;
    private final DependencyCircuitBreakers breakers;
    private final EventBridge eventBridge;

    @GetMapping("/users")
    public ResponseEntity<MonitoringReport> getUsers() {
        return ResponseEntity.ok(registry.monitorAllUsers());
    }

    @GetMapping("/health")
    public ResponseEntity<RegistryHealthReport> getHealth() {
        RegistryHealthReport report = registry.getRegistryHealth();
        HttpStatus status = switch (report.getStatus()) {
            case CRITICAL -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/degradation")
    public ResponseEntity<Map<String, Object>> getDegradation() {
        DegradationStatus status = degradationManager.getDegradationStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("level", status.level());
        body.put("affectedDependencies", status.affectedDependencies());
        body.put("totalDependencies", status.totalDependencies());
        body.put("lastRecomputedAt", status.lastRecomputedAt().toString());
        body.put("dependencies", degradationManager.getServiceStatuses());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/wiring")
    public ResponseEntity<Map<String, Object>> getWiring() {
        EventWiringReport wiring = registry.diagnoseEventWiring();
        EventBridgeStats stats = eventBridge.getStats();
        return ResponseEntity.ok(Map.of("wiring", wiring, "bridge", stats));
    }

    @GetMapping("/breakers")
    public ResponseEntity<List<CircuitBreakerStats>> getBreakers() {
        return ResponseEntity.ok(breakers.getAllStats());
    }
}
