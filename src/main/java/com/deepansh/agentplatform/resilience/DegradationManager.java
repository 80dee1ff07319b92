package com.deepansh.agentplatform.resilience;

import com.deepansh.agentplatform.config.PlatformProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates per-dependency health flags into one {@link DegradationLevel}.
 *
 * Level rules, first match wins:
 * - nothing unhealthy                                          → NORMAL
 * - strict majority unhealthy, or every core dependency down   → MINIMAL
 * - more than one unhealthy, or any critical dependency down   → DEGRADED
 * - exactly one non-critical dependency unhealthy              → PARTIAL
 *
 * The level is a pure function of the current flag set, so concurrent
 * watchers reporting in any order converge on the same status.
 * {@link #setServiceStatus} is the only mutator of health state.
 */
@Service
@Slf4j
public class DegradationManager {

    private final Map<String, Boolean> healthFlags = new ConcurrentHashMap<>();
    private final Set<String> criticalDependencies = ConcurrentHashMap.newKeySet();
    private final Set<String> coreDependencies;
    private final List<DegradationListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final Object recomputeLock = new Object();

    private volatile DegradationStatus status;

    public DegradationManager(PlatformProperties properties, Clock clock) {
        this.clock = clock;
        PlatformProperties.Resilience resilience = properties.getResilience();
        this.coreDependencies = Set.copyOf(resilience.getCoreDependencies());

        resilience.getCriticalDependencies().forEach(name -> registerDependency(name, true));
        resilience.getCoreDependencies().forEach(name -> registerDependency(name, false));
        registerDependency(DependencyNames.EVENT_TRANSPORT, false);

        synchronized (recomputeLock) {
            this.status = recompute();
        }
        log.info("Degradation tracking started [dependencies={}, critical={}, core={}]",
                new TreeSet<>(healthFlags.keySet()), new TreeSet<>(criticalDependencies), coreDependencies);
    }

    /**
     * Registers a dependency as healthy. Re-registering keeps the current flag
     * but may upgrade the dependency to critical.
     */
    public void registerDependency(String name, boolean critical) {
        requireName(name);
        synchronized (recomputeLock) {
            healthFlags.putIfAbsent(name, Boolean.TRUE);
            if (critical) {
                criticalDependencies.add(name);
            }
            if (status != null) {
                status = recompute();
            }
        }
    }

    /**
     * Records a health change reported by a dependency watcher or circuit breaker.
     * Unknown names are registered as non-critical. Repeating the current flag is a no-op.
     */
    public void setServiceStatus(String name, boolean healthy) {
        requireName(name);
        DegradationStatus before;
        DegradationStatus after;

        synchronized (recomputeLock) {
            Boolean previous = healthFlags.put(name, healthy);
            if (previous != null && previous == healthy) {
                return;
            }
            before = status;
            after = recompute();
            status = after;
        }

        if (healthy) {
            log.info("Dependency recovered [dependency={}, level={}]", name, after.level());
        } else {
            log.warn("Dependency unhealthy [dependency={}, level={}, affected={}]",
                    name, after.level(), after.affectedDependencies());
        }
        if (before.level() != after.level()) {
            log.warn("Degradation level changed {} → {}", before.level(), after.level());
        }

        for (DegradationListener listener : listeners) {
            try {
                listener.onServiceStatusChanged(name, healthy, after);
            } catch (RuntimeException e) {
                log.error("Degradation listener failed for dependency={}", name, e);
            }
        }
    }

    public DegradationStatus getDegradationStatus() {
        return status;
    }

    /** Unknown dependencies are assumed healthy. */
    public boolean isHealthy(String name) {
        return healthFlags.getOrDefault(name, Boolean.TRUE);
    }

    public boolean isCritical(String name) {
        return criticalDependencies.contains(name);
    }

    public SortedMap<String, Boolean> getServiceStatuses() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(healthFlags));
    }

    public void addListener(DegradationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DegradationListener listener) {
        listeners.remove(listener);
    }

    private DegradationStatus recompute() {
        SortedSet<String> unhealthy = new TreeSet<>();
        healthFlags.forEach((name, healthy) -> {
            if (!healthy) {
                unhealthy.add(name);
            }
        });
        int total = healthFlags.size();
        return new DegradationStatus(classify(unhealthy, total), unhealthy, total, clock.instant());
    }

    private DegradationLevel classify(Set<String> unhealthy, int total) {
        if (unhealthy.isEmpty()) {
            return DegradationLevel.NORMAL;
        }
        boolean majorityDown = unhealthy.size() * 2 > total;
        boolean coreDown = !coreDependencies.isEmpty() && unhealthy.containsAll(coreDependencies);
        if (majorityDown || coreDown) {
            return DegradationLevel.MINIMAL;
        }
        boolean criticalDown = unhealthy.stream().anyMatch(criticalDependencies::contains);
        if (unhealthy.size() > 1 || criticalDown) {
            return DegradationLevel.DEGRADED;
        }
        return DegradationLevel.PARTIAL;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("dependency name must not be blank");
        }
    }
}
