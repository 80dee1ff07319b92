package com.deepansh.agentplatform.resilience;

import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable snapshot of the system degradation level.
 */
public record DegradationStatus(
        DegradationLevel level,
        SortedSet<String> affectedDependencies,
        int totalDependencies,
        Instant lastRecomputedAt
) {

    public DegradationStatus {
        affectedDependencies = Collections.unmodifiableSortedSet(new TreeSet<>(affectedDependencies));
    }

    public boolean isNormal() {
        return level == DegradationLevel.NORMAL;
    }
}
