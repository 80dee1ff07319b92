package com.deepansh.agentplatform.registry.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CleanupReport {

    public enum Status { CLEANED, NO_SESSION }

    String userId;
    Status status;
    int agentsCleaned;
    @Singular
    List<String> errors;

    public static CleanupReport noSession(String userId) {
        return CleanupReport.builder()
                .userId(userId)
                .status(Status.NO_SESSION)
                .agentsCleaned(0)
                .build();
    }
}
