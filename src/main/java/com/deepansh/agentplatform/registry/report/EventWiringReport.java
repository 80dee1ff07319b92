package com.deepansh.agentplatform.registry.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class EventWiringReport {

    public enum Health { HEALTHY, CRITICAL }

    boolean bridgeConfigured;
    int totalSessions;
    int sessionsWithEmitter;
    int usersWithLiveConnection;
    /** Share of sessions with an emitter; 1.0 when there are no sessions */
    double coverage;
    Health health;
    @Singular
    List<String> criticalIssues;
    @Singular
    Map<String, UserWiring> userDetails;

    @Value
    public static class UserWiring {
        boolean hasEmitter;
        boolean liveConnection;
        int pendingEvents;
        int agentCount;
    }
}
