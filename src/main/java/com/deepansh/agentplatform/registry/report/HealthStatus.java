package com.deepansh.agentplatform.registry.report;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    NO_SESSION;

    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() && other != NO_SESSION ? other : this;
    }
}
