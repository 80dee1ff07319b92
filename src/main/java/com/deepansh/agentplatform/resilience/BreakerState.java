package com.deepansh.agentplatform.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /** Forced and disabled resilience4j states are reported by their effect on callers. */
    static BreakerState from(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return OPEN;
            case HALF_OPEN:
                return HALF_OPEN;
            default:
                return CLOSED;
        }
    }
}
