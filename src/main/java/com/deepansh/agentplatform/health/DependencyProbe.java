package com.deepansh.agentplatform.health;

/**
 * A cheap liveness check against one external dependency.
 *
 * {@link #probe()} returns normally when the dependency answered and throws
 * otherwise. Probes are always run through that dependency's circuit breaker,
 * so they never need their own timeout or retry handling.
 */
public interface DependencyProbe {

    /** Name used for the circuit breaker and the degradation flag. */
    String dependencyName();

    default boolean isEnabled() {
        return true;
    }

    void probe() throws Exception;
}
