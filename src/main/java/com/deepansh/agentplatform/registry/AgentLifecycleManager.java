package com.deepansh.agentplatform.registry;

import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.registry.report.HealthStatus;
import com.deepansh.agentplatform.registry.report.ResourceUsage;
import com.deepansh.agentplatform.registry.report.SessionHealthReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks per-user resource usage and classifies it against configured thresholds.
 *
 * Holds no reference to the registry. The registry reports session snapshots
 * in, and gets back health reports and the user ids it should reclaim.
 */
@Component
@Slf4j
public class AgentLifecycleManager {

    private final Map<String, ResourceUsage> usageByUser = new ConcurrentHashMap<>();
    private final PlatformProperties.Lifecycle thresholds;
    private final Clock clock;
    private final AtomicLong reclaimedSessions = new AtomicLong();

    public AgentLifecycleManager(PlatformProperties properties, Clock clock) {
        this.thresholds = properties.getLifecycle();
        this.clock = clock;
    }

    public void track(UserAgentSession session) {
        usageByUser.put(session.getUserId(), session.usage(thresholds.getDefaultAgentMemoryBytes()));
    }

    public void untrack(String userId) {
        usageByUser.remove(userId);
    }

    public Optional<ResourceUsage> getUsage(String userId) {
        return Optional.ofNullable(usageByUser.get(userId));
    }

    public long defaultAgentMemoryBytes() {
        return thresholds.getDefaultAgentMemoryBytes();
    }

    public int trackedUsers() {
        return usageByUser.size();
    }

    /** Classifies the last usage recorded for a user. */
    public SessionHealthReport monitorMemoryUsage(String userId) {
        ResourceUsage usage = usageByUser.get(userId);
        if (usage == null) {
            return SessionHealthReport.noSession(userId);
        }
        return assess(usage);
    }

    /** Classifies a usage snapshot without recording it. */
    public SessionHealthReport assess(ResourceUsage usage) {
        Instant now = clock.instant();
        long ageSeconds = Duration.between(usage.createdAt(), now).toSeconds();
        long idleSeconds = Duration.between(usage.lastActivityAt(), now).toSeconds();

        HealthStatus status = HealthStatus.HEALTHY;
        List<String> issues = new ArrayList<>();

        if (usage.agentCount() > thresholds.getMaxAgentsPerUser()) {
            status = status.worst(HealthStatus.CRITICAL);
            issues.add("Too many agents: " + usage.agentCount() + " (max " + thresholds.getMaxAgentsPerUser() + ")");
        } else if (usage.agentCount() >= thresholds.getAgentWarningThreshold()) {
            status = status.worst(HealthStatus.WARNING);
            issues.add("High agent count: " + usage.agentCount());
        }

        long memory = usage.estimatedMemoryBytes();
        if (memory >= thresholds.getMemoryCriticalBytes()) {
            status = status.worst(HealthStatus.CRITICAL);
            issues.add("Memory critical: " + toMegabytes(memory) + "MB");
        } else if (memory >= thresholds.getMemoryWarningBytes()) {
            status = status.worst(HealthStatus.WARNING);
            issues.add("High memory usage: " + toMegabytes(memory) + "MB");
        }

        if (ageSeconds > thresholds.getMaxSessionAge().toSeconds()) {
            status = status.worst(HealthStatus.WARNING);
            issues.add(String.format(Locale.ROOT, "Session too old: %.1fh", ageSeconds / 3600.0));
        }

        return SessionHealthReport.builder()
                .userId(usage.userId())
                .status(status)
                .agentCount(usage.agentCount())
                .estimatedMemoryBytes(memory)
                .ageSeconds(ageSeconds)
                .idleSeconds(idleSeconds)
                .issues(issues)
                .build();
    }

    /** Process-wide findings for the whole registry snapshot. */
    public List<String> globalIssues(int totalSessions, int totalAgents) {
        List<String> issues = new ArrayList<>();
        if (totalSessions > thresholds.getMaxTotalSessions()) {
            issues.add("Too many sessions: " + totalSessions + " (max " + thresholds.getMaxTotalSessions() + ")");
        }
        if (totalAgents > thresholds.getMaxTotalAgents()) {
            issues.add("Too many agents in process: " + totalAgents + " (max " + thresholds.getMaxTotalAgents() + ")");
        }
        return issues;
    }

    /** Session count over the ceiling is WARNING; agent total over the ceiling is CRITICAL. */
    public HealthStatus classifyProcess(int totalSessions, int totalAgents) {
        if (totalAgents > thresholds.getMaxTotalAgents()) {
            return HealthStatus.CRITICAL;
        }
        if (totalSessions > thresholds.getMaxTotalSessions()) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Least recently active users beyond the session ceiling, oldest activity first.
     * Empty when the snapshot is within limits.
     */
    public List<String> selectSessionsToReclaim(Collection<UserAgentSession> sessions) {
        int excess = sessions.size() - thresholds.getMaxTotalSessions();
        if (excess <= 0) {
            return List.of();
        }
        List<String> victims = sessions.stream()
                .sorted(Comparator.comparing(UserAgentSession::getLastActivityAt))
                .limit(excess)
                .map(UserAgentSession::getUserId)
                .toList();
        log.warn("Session ceiling exceeded, reclaiming least recently active [sessions={}, max={}, reclaiming={}]",
                sessions.size(), thresholds.getMaxTotalSessions(), victims.size());
        return victims;
    }

    public void recordReclaimed(int count) {
        reclaimedSessions.addAndGet(count);
    }

    public long getReclaimedSessions() {
        return reclaimedSessions.get();
    }

    private static long toMegabytes(long bytes) {
        return bytes / (1024 * 1024);
    }
}
