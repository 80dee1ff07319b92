package com.deepansh.agentplatform.health;

import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.resilience.CallResult;
import com.deepansh.agentplatform.resilience.DependencyCircuitBreakers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodically runs every enabled {@link DependencyProbe} through its circuit breaker.
 *
 * The probe result itself is not written to the degradation manager: the
 * breaker's OPEN and CLOSED transitions are what flip the health flag, so a
 * single blip does not degrade the system.
 */
@Component
@Slf4j
public class DependencyProbeScheduler {

    private final List<DependencyProbe> probes;
    private final DependencyCircuitBreakers breakers;
    private final boolean enabled;

    public DependencyProbeScheduler(List<DependencyProbe> probes,
                                    DependencyCircuitBreakers breakers,
                                    PlatformProperties properties) {
        this.probes = probes;
        this.breakers = breakers;
        this.enabled = properties.getProbes().isEnabled();
        probes.stream()
                .filter(DependencyProbe::isEnabled)
                .forEach(probe -> breakers.forDependency(probe.dependencyName()));
    }

    @Scheduled(initialDelayString = "${platform.probes.interval:PT15S}",
            fixedDelayString = "${platform.probes.interval:PT15S}")
    public void scheduledProbe() {
        if (enabled) {
            probeAll();
        }
    }

    /** @return outcome per probed dependency, in probe order */
    public Map<String, CallResult.Status> probeAll() {
        Map<String, CallResult.Status> outcomes = new LinkedHashMap<>();
        for (DependencyProbe probe : probes) {
            if (!probe.isEnabled()) {
                continue;
            }
            CallResult<Boolean> result = breakers.call(probe.dependencyName(), () -> {
                probe.probe();
                return Boolean.TRUE;
            }, null);
            outcomes.put(probe.dependencyName(), result.getStatus());
            if (!result.isSuccess()) {
                log.debug("Probe did not succeed [dependency={}, status={}]: {}",
                        probe.dependencyName(), result.getStatus(),
                        result.getError().map(Throwable::getMessage).orElse("n/a"));
            }
        }
        return outcomes;
    }
}
