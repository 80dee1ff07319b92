package com.deepansh.agentplatform.registry.report;

import com.deepansh.agentplatform.resilience.DegradationLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RegistryHealthReport {

    HealthStatus status;
    int totalSessions;
    int totalAgents;
    @Singular
    List<String> registeredAgentTypes;
    DegradationLevel degradationLevel;
    long uptimeSeconds;
    long reclaimedSessions;
    @Singular
    List<String> issues;
}
