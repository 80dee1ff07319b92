package com.deepansh.agentplatform.resilience;

import com.deepansh.agentplatform.config.PlatformProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * One {@link DependencyCircuitBreaker} per dependency name, created on first use
 * and wired into the {@link DegradationManager}: OPEN marks the dependency
 * unhealthy, CLOSED marks it healthy again. HALF_OPEN leaves the flag alone
 * until the trial call settles it.
 */
@Component
@Slf4j
public class DependencyCircuitBreakers {

    private final Map<String, DependencyCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final PlatformProperties properties;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final DegradationManager degradationManager;
    private final Executor callExecutor;

    public DependencyCircuitBreakers(PlatformProperties properties,
                                     CircuitBreakerRegistry circuitBreakerRegistry,
                                     DegradationManager degradationManager,
                                     @Qualifier("dependencyCallExecutor") Executor callExecutor) {
        this.properties = properties;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.degradationManager = degradationManager;
        this.callExecutor = callExecutor;
    }

    public DependencyCircuitBreaker forDependency(String dependency) {
        return breakers.computeIfAbsent(dependency, this::createBreaker);
    }

    /** Shorthand for {@code forDependency(name).execute(operation)}. */
    public <T> T execute(String dependency, Callable<T> operation) {
        return forDependency(dependency).execute(operation);
    }

    public <T> CallResult<T> call(String dependency, Callable<T> operation, Supplier<T> fallback) {
        return forDependency(dependency).call(operation, fallback);
    }

    public List<CircuitBreakerStats> getAllStats() {
        return breakers.values().stream()
                .map(DependencyCircuitBreaker::getStats)
                .sorted(Comparator.comparing(CircuitBreakerStats::dependency))
                .toList();
    }

    private DependencyCircuitBreaker createBreaker(String dependency) {
        PlatformProperties.Breaker settings = properties.getResilience().breakerFor(dependency);
        DependencyCircuitBreaker breaker = new DependencyCircuitBreaker(
                dependency, settings, circuitBreakerRegistry, callExecutor);
        degradationManager.registerDependency(dependency,
                properties.getResilience().getCriticalDependencies().contains(dependency));
        breaker.addListener(this::propagate);

        log.info("Circuit breaker created [dependency={}, failureThreshold={}, openDuration={}ms, callTimeout={}ms]",
                dependency, settings.getFailureThreshold(),
                settings.getOpenDuration().toMillis(), settings.getCallTimeout().toMillis());
        return breaker;
    }

    private void propagate(String dependency, BreakerState from, BreakerState to) {
        if (to == BreakerState.OPEN) {
            degradationManager.setServiceStatus(dependency, false);
        } else if (to == BreakerState.CLOSED) {
            degradationManager.setServiceStatus(dependency, true);
        }
    }
}
