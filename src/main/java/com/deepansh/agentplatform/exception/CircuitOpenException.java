package com.deepansh.agentplatform.exception;

import java.time.Duration;

/**
 * Call rejected without being attempted because the dependency's circuit is open.
 * Callers should treat this as a retryable, degraded condition.
 */
public class CircuitOpenException extends AgentPlatformException {

    private final String dependency;

    public CircuitOpenException(String dependency, Duration openDuration) {
        super(String.format("Circuit for '%s' is open; calls are rejected for up to %dms",
                dependency, openDuration.toMillis()));
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
