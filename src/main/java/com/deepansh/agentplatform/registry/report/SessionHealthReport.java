package com.deepansh.agentplatform.registry.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SessionHealthReport {

    String userId;
    HealthStatus status;
    int agentCount;
    long estimatedMemoryBytes;
    long ageSeconds;
    long idleSeconds;
    @Singular
    List<String> issues;

    public static SessionHealthReport noSession(String userId) {
        return SessionHealthReport.builder()
                .userId(userId)
                .status(HealthStatus.NO_SESSION)
                .build();
    }
}
