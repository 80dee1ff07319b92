package com.deepansh.agentplatform.registry.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class MonitoringReport {

    Instant timestamp;
    int totalUsers;
    int totalAgents;
    @Singular
    Map<String, SessionHealthReport> users;
    @Singular
    List<String> globalIssues;
}
