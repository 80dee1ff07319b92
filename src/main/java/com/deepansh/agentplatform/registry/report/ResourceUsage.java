package com.deepansh.agentplatform.registry.report;

import java.time.Instant;

/**
 * Resource summary for one user's session as last seen by the lifecycle manager.
 */
public record ResourceUsage(
        String userId,
        int agentCount,
        long estimatedMemoryBytes,
        Instant createdAt,
        Instant lastActivityAt
) {}
