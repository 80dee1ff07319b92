package com.deepansh.agentplatform.registry.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class EmergencyCleanupReport {

    Instant timestamp;
    int usersCleaned;
    int agentsCleaned;
    @Singular
    List<String> errors;
}
