package com.deepansh.agentplatform.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of one dependency breaker, for the degradation manager and dashboards.
 */
public record CircuitBreakerStats(
        String dependency,
        BreakerState state,
        int consecutiveFailures,
        long totalCalls,
        long failedCalls,
        long rejectedCalls,
        Instant lastFailureAt,
        Instant lastTransitionAt,
        int failureThreshold,
        Duration openDuration,
        Duration callTimeout
) {}
