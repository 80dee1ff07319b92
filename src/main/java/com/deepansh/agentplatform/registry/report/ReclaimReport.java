package com.deepansh.agentplatform.registry.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of reclaiming least-recently-active sessions over the process ceiling.
 */
@Value
@Builder
public class ReclaimReport {

    int sessionsBefore;
    int sessionsReclaimed;
    int agentsReclaimed;
    @Singular
    List<String> reclaimedUsers;
    @Singular
    List<String> errors;
}
