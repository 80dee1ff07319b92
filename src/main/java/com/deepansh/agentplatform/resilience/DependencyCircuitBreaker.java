package com.deepansh.agentplatform.resilience;

import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.exception.CircuitOpenException;
import com.deepansh.agentplatform.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Failure detector for one external dependency (database, cache, model provider).
 *
 * Backed by a resilience4j circuit breaker configured for consecutive-failure
 * semantics: a count-based window of {@code failureThreshold} calls that trips
 * only at a 100% failure rate, so it opens exactly on the Nth failure in a row.
 * Half-open admits a single trial call. Every call also runs under a
 * resilience4j TimeLimiter; a timeout is recorded as a failure.
 *
 * State transitions are pushed to {@link BreakerStateListener}s, which is how
 * the {@link DegradationManager} learns about them. Failure and transition
 * timestamps are taken from the breaker's own events, so they share the clock
 * that times the open period.
 */
@Slf4j
public class DependencyCircuitBreaker {

    private final String dependency;
    private final PlatformProperties.Breaker settings;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final Executor callExecutor;
    private final List<BreakerStateListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicLong rejectedCalls = new AtomicLong();
    private volatile Instant lastFailureAt;
    private volatile Instant lastTransitionAt;

    public DependencyCircuitBreaker(String dependency,
                                    PlatformProperties.Breaker settings,
                                    CircuitBreakerRegistry registry,
                                    Executor callExecutor) {
        this.dependency = dependency;
        this.settings = settings;
        this.callExecutor = callExecutor;
        this.circuitBreaker = registry.circuitBreaker(dependency, consecutiveFailureConfig(settings));
        this.timeLimiter = TimeLimiter.of(dependency, TimeLimiterConfig.custom()
                .timeoutDuration(settings.getCallTimeout())
                .cancelRunningFuture(true)
                .build());

        circuitBreaker.getEventPublisher()
                .onError(event -> lastFailureAt = event.getCreationTime().toInstant())
                .onStateTransition(event -> handleTransition(
                        BreakerState.from(event.getStateTransition().getFromState()),
                        BreakerState.from(event.getStateTransition().getToState()),
                        event.getCreationTime().toInstant()));
    }

    static CircuitBreakerConfig consecutiveFailureConfig(PlatformProperties.Breaker settings) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getFailureThreshold())
                .minimumNumberOfCalls(settings.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(settings.getOpenDuration())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }

    /**
     * Runs the operation through the breaker.
     *
     * @throws CircuitOpenException        circuit open, operation not attempted
     * @throws ServiceUnavailableException operation failed or timed out (failure recorded)
     */
    public <T> T execute(Callable<T> operation) {
        totalCalls.incrementAndGet();
        try {
            T result = circuitBreaker.executeCallable(() -> timeLimiter.executeFutureSupplier(() -> submit(operation)));
            consecutiveFailures.set(0);
            return result;
        } catch (CallNotPermittedException e) {
            rejectedCalls.incrementAndGet();
            log.debug("Call rejected, circuit {} [dependency={}]", circuitBreaker.getState(), dependency);
            throw new CircuitOpenException(dependency, settings.getOpenDuration());
        } catch (TimeoutException e) {
            recordFailure();
            log.warn("Call timed out after {}ms [dependency={}]", settings.getCallTimeout().toMillis(), dependency);
            throw new ServiceUnavailableException(dependency, true,
                    "Call to '" + dependency + "' timed out after " + settings.getCallTimeout().toMillis() + "ms", e);
        } catch (Exception e) {
            recordFailure();
            log.warn("Call failed [dependency={}, consecutiveFailures={}]: {}",
                    dependency, consecutiveFailures.get(), e.getMessage());
            throw new ServiceUnavailableException(dependency, false,
                    "Call to '" + dependency + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Same as {@link #execute} but reports expected failures as a {@link CallResult}
     * instead of throwing. An open circuit is always DEGRADED.
     */
    public <T> CallResult<T> call(Callable<T> operation) {
        return call(operation, null);
    }

    public <T> CallResult<T> call(Callable<T> operation, Supplier<T> fallback) {
        try {
            return CallResult.success(execute(operation));
        } catch (CircuitOpenException e) {
            return CallResult.degraded(fallback != null ? fallback.get() : null, e);
        } catch (ServiceUnavailableException e) {
            if (fallback != null) {
                return CallResult.degraded(fallback.get(), e);
            }
            return CallResult.failed(e);
        }
    }

    public BreakerState getState() {
        return BreakerState.from(circuitBreaker.getState());
    }

    public String getDependency() {
        return dependency;
    }

    public CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(
                dependency,
                getState(),
                consecutiveFailures.get(),
                totalCalls.get(),
                failedCalls.get(),
                rejectedCalls.get(),
                lastFailureAt,
                lastTransitionAt,
                settings.getFailureThreshold(),
                settings.getOpenDuration(),
                settings.getCallTimeout());
    }

    public void addListener(BreakerStateListener listener) {
        listeners.add(listener);
    }

    /** Back to CLOSED with all counters cleared. */
    public void reset() {
        circuitBreaker.reset();
        consecutiveFailures.set(0);
        log.info("Circuit breaker reset [dependency={}]", dependency);
    }

    private <T> CompletableFuture<T> submit(Callable<T> operation) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return operation.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, callExecutor);
    }

    private void recordFailure() {
        failedCalls.incrementAndGet();
        consecutiveFailures.incrementAndGet();
    }

    private void handleTransition(BreakerState from, BreakerState to, Instant at) {
        if (from == to) {
            return;
        }
        lastTransitionAt = at;
        if (to == BreakerState.CLOSED) {
            consecutiveFailures.set(0);
        }
        log.warn("Circuit breaker {} → {} [dependency={}]", from, to, dependency);
        for (BreakerStateListener listener : listeners) {
            try {
                listener.onTransition(dependency, from, to);
            } catch (RuntimeException e) {
                log.error("Breaker listener failed [dependency={}]", dependency, e);
            }
        }
    }
}
