package com.deepansh.agentplatform.resilience;

/**
 * System-wide degradation, ordered from best to worst.
 */
public enum DegradationLevel {
    NORMAL,
    PARTIAL,
    DEGRADED,
    MINIMAL;

    public boolean isWorseThan(DegradationLevel other) {
        return ordinal() > other.ordinal();
    }
}
