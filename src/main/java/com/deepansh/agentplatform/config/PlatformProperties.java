package com.deepansh.agentplatform.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed configuration for the registry, lifecycle thresholds,
 * event delivery and dependency resilience.
 * Bound from application.yml under the "platform" prefix.
 */
@ConfigurationProperties(prefix = "platform")
@Validated
@Data
public class PlatformProperties {

    @Valid
    private Registry registry = new Registry();

    @Valid
    private Lifecycle lifecycle = new Lifecycle();

    @Valid
    private Events events = new Events();

    @Valid
    private Resilience resilience = new Resilience();

    @Valid
    private Probes probes = new Probes();

    @Data
    public static class Registry {
        /** Default deadline for an agent factory call when the caller gives none */
        @NotNull
        private Duration agentCreationTimeout = Duration.ofSeconds(30);

        /** Below this share of sessions with a wired emitter, wiring is reported CRITICAL */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minEmitterCoverage = 0.8;

        /** Factory calls one user may have running at once, including abandoned ones */
        @Min(1)
        private int maxConcurrentCreationsPerUser = 2;
    }

    @Data
    public static class Lifecycle {
        @Min(1)
        private int agentWarningThreshold = 40;

        @Min(1)
        private int maxAgentsPerUser = 50;

        @Min(1)
        private int maxTotalSessions = 500;

        @Min(1)
        private int maxTotalAgents = 5000;

        @NotNull
        private Duration maxSessionAge = Duration.ofHours(24);

        /** Rough per-agent footprint used when an instance reports none */
        @Min(0)
        private long defaultAgentMemoryBytes = 2L * 1024 * 1024;

        @Min(0)
        private long memoryWarningBytes = 64L * 1024 * 1024;

        @Min(0)
        private long memoryCriticalBytes = 128L * 1024 * 1024;

        @NotNull
        private Duration reclaimInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Events {
        @Min(1)
        private int queueCapacity = 50;

        @NotNull
        private Duration deliveryTimeout = Duration.ofSeconds(2);

        /**
         * Time a caller spends draining a backlog before the rest is handed to a
         * background flush. Bounds emit/connect even when the channel is slow.
         */
        @NotNull
        private Duration flushBudget = Duration.ofMillis(500);

        @Min(16)
        private int maxErrorMessageLength = 500;

        /** SSE emitter timeout; zero keeps the stream open until the client leaves */
        @NotNull
        private Duration streamTimeout = Duration.ZERO;
    }

    @Data
    public static class Resilience {
        /** Dependencies whose failure alone makes the system DEGRADED */
        private List<String> criticalDependencies = new ArrayList<>(List.of("storage"));

        /** All of these unhealthy at once makes the system MINIMAL */
        private List<String> coreDependencies = new ArrayList<>(List.of("storage", "cache", "model-provider"));

        @Valid
        private Breaker defaults = new Breaker();

        /** Per-dependency overrides keyed by dependency name */
        private Map<String, Breaker> breakers = new LinkedHashMap<>();

        public Breaker breakerFor(String dependency) {
            return breakers.getOrDefault(dependency, defaults);
        }
    }

    @Data
    public static class Breaker {
        @Min(1)
        private int failureThreshold = 3;

        @NotNull
        private Duration openDuration = Duration.ofSeconds(30);

        @NotNull
        private Duration callTimeout = Duration.ofSeconds(5);

        public static Breaker of(int failureThreshold, Duration openDuration, Duration callTimeout) {
            Breaker breaker = new Breaker();
            breaker.setFailureThreshold(failureThreshold);
            breaker.setOpenDuration(openDuration);
            breaker.setCallTimeout(callTimeout);
            return breaker;
        }
    }

    @Data
    public static class Probes {
        private boolean enabled = true;

        @NotNull
        private Duration interval = Duration.ofSeconds(15);

        @Valid
        private ModelProvider modelProvider = new ModelProvider();

        @Data
        public static class ModelProvider {
            /** Empty disables the model-provider probe */
            private String healthUrl = "";
            private String apiKey = "";
            private int connectTimeoutMs = 2000;
            private int readTimeoutMs = 4000;
        }
    }
}
