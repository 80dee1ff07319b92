package com.deepansh.agentplatform.registry;

import com.deepansh.agentplatform.agent.AgentFactory;
import com.deepansh.agentplatform.agent.AgentFactoryRegistry;
import com.deepansh.agentplatform.agent.AgentInstance;
import com.deepansh.agentplatform.agent.ExecutionContext;
import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.event.EventBridge;
import com.deepansh.agentplatform.exception.AgentAlreadyRegisteredException;
import com.deepansh.agentplatform.exception.ContextValidationException;
import com.deepansh.agentplatform.exception.FactoryException;
import com.deepansh.agentplatform.exception.IsolationViolationException;
import com.deepansh.agentplatform.registry.report.CleanupReport;
import com.deepansh.agentplatform.registry.report.EmergencyCleanupReport;
import com.deepansh.agentplatform.registry.report.EventWiringReport;
import com.deepansh.agentplatform.registry.report.HealthStatus;
import com.deepansh.agentplatform.registry.report.MonitoringReport;
import com.deepansh.agentplatform.registry.report.ReclaimReport;
import com.deepansh.agentplatform.registry.report.RegistryHealthReport;
import com.deepansh.agentplatform.registry.report.ResetReport;
import com.deepansh.agentplatform.registry.report.SessionHealthReport;
import com.deepansh.agentplatform.resilience.DegradationLevel;
import com.deepansh.agentplatform.resilience.DegradationManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns every user's {@link UserAgentSession} and mediates all access to them.
 *
 * Isolation model:
 * - sessions live in a concurrent map keyed by user id; creation is atomic per key
 * - each session guards its own agents with its own lock
 * - every entry point checks the caller's user id against the data it touches
 *   and fails with {@link IsolationViolationException} on a mismatch
 * - factories run on a dedicated executor under a deadline, never while any
 *   session lock is held; an abandoned factory call is interrupted, and each
 *   user has a bounded number of factory calls running at once
 *
 * Nothing here is static: two registries in one process share no state.
 */
@Service
@Slf4j
public class AgentRegistry {

    private final ConcurrentMap<String, UserAgentSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Integer> creationsInFlight = new ConcurrentHashMap<>();
    private final AgentFactoryRegistry factories;
    private final AgentLifecycleManager lifecycleManager;
    private final DegradationManager degradationManager;
    private final AsyncTaskExecutor creationExecutor;
    private final Clock clock;
    private final PlatformProperties.Registry settings;
    private final Instant startedAt;

    private volatile EventBridge eventBridge;

    public AgentRegistry(AgentFactoryRegistry factories,
                         AgentLifecycleManager lifecycleManager,
                         DegradationManager degradationManager,
                         PlatformProperties properties,
                         @Qualifier("agentCreationExecutor") AsyncTaskExecutor creationExecutor,
                         Clock clock,
                         ObjectProvider<EventBridge> eventBridge) {
        this.factories = factories;
        this.lifecycleManager = lifecycleManager;
        this.degradationManager = degradationManager;
        this.creationExecutor = creationExecutor;
        this.clock = clock;
        this.settings = properties.getRegistry();
        this.startedAt = clock.instant();
        eventBridge.ifAvailable(this::setEventBridge);
    }

    // ─── Sessions ────────────────────────────────────────────────────────────

    /** Returns the user's session, creating an empty one on first use. */
    public UserAgentSession getOrCreateSession(String userId) {
        requireUserId(userId);
        UserAgentSession existing = sessions.get(userId);
        if (existing != null) {
            existing.touch();
            return existing;
        }

        UserAgentSession created = newSession(userId);
        UserAgentSession winner = sessions.putIfAbsent(userId, created);
        if (winner != null) {
            winner.touch();
            return winner;
        }
        trackUsage(created);
        log.info("Session created [userId={}, activeSessions={}]", userId, sessions.size());
        return created;
    }

    public Optional<UserAgentSession> findSession(String userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    public int sessionCount() {
        return sessions.size();
    }

    // ─── Agents ──────────────────────────────────────────────────────────────

    public AgentInstance createAgentForUser(String userId, String agentType, ExecutionContext context) {
        return createAgentForUser(userId, agentType, context, settings.getAgentCreationTimeout());
    }

    /**
     * Builds an agent through its registered factory and stores it in the user's session.
     *
     * The factory gets a context bound to this user's emitter. It runs on the
     * creation executor and is interrupted once {@code deadline} passes; an
     * instance that arrives later anyway is released, never registered.
     *
     * @throws ContextValidationException      context missing or incomplete
     * @throws IsolationViolationException     context or produced agent belongs to another user
     * @throws AgentAlreadyRegisteredException agent type already present
     * @throws FactoryException                no factory, factory failed, deadline exceeded,
     *                                         or too many creations already running for the user
     */
    public AgentInstance createAgentForUser(String userId, String agentType,
                                            ExecutionContext context, Duration deadline) {
        requireUserId(userId);
        if (agentType == null || agentType.isBlank()) {
            throw new ContextValidationException("agentType is required for user " + userId);
        }
        if (context == null) {
            throw new ContextValidationException("execution context is required for user " + userId);
        }
        context.validate();
        if (!userId.equals(context.getUserId())) {
            throw new IsolationViolationException(userId, context.getUserId(), "createAgentForUser");
        }

        UserAgentSession session = getOrCreateSession(userId);
        if (session.hasAgent(agentType)) {
            throw new AgentAlreadyRegisteredException(userId, agentType);
        }

        AgentInstance instance;
        try {
            AgentFactory factory = factories.find(agentType)
                    .orElseThrow(() -> new FactoryException(agentType,
                            "No factory registered for agent type '" + agentType + "'"));
            ExecutionContext bound = context.forAgent(agentType, session.getEmitter().orElse(null));
            instance = invokeFactory(userId, factory, bound, deadline);
        } catch (FactoryException e) {
            log.error("Agent creation failed [userId={}, agentType={}, runId={}]: {}",
                    userId, agentType, context.getRunId(), e.getMessage());
            notifyCreationFailure(session, context, agentType, e);
            throw e;
        }

        if (!userId.equals(instance.getUserId()) || !agentType.equals(instance.getAgentType())) {
            releaseQuietly(instance);
            throw new IsolationViolationException(userId + "/" + agentType,
                    instance.getUserId() + "/" + instance.getAgentType(), "createAgentForUser");
        }

        switch (session.register(agentType, instance)) {
            case REGISTERED -> {
                trackUsage(session);
                log.info("Agent created [userId={}, agentType={}, instanceId={}, agents={}]",
                        userId, agentType, instance.getInstanceId(), session.getAgentCount());
                return instance;
            }
            case DUPLICATE -> {
                releaseQuietly(instance);
                throw new AgentAlreadyRegisteredException(userId, agentType);
            }
            default -> {
                releaseQuietly(instance);
                FactoryException closed = new FactoryException(agentType,
                        "Session for user '" + userId + "' was closed while agent '" + agentType + "' was being created");
                log.warn("Discarded agent for closed session [userId={}, agentType={}]", userId, agentType);
                throw closed;
            }
        }
    }

    /** Pure lookup: never creates a session or an agent. */
    public Optional<AgentInstance> getUserAgent(String userId, String agentType) {
        UserAgentSession session = sessions.get(userId);
        if (session == null) {
            return Optional.empty();
        }
        return session.getAgent(agentType);
    }

    /** @return true if an agent was removed and released */
    public boolean removeUserAgent(String userId, String agentType) {
        UserAgentSession session = sessions.get(userId);
        if (session == null) {
            return false;
        }
        Optional<AgentInstance> removed = session.remove(agentType);
        if (removed.isEmpty()) {
            return false;
        }
        releaseQuietly(removed.get());
        trackUsage(session);
        log.info("Agent removed [userId={}, agentType={}]", userId, agentType);
        return true;
    }

    // ─── Cleanup ─────────────────────────────────────────────────────────────

    /**
     * Removes the user's session, releases its agents and drops their undelivered
     * events. Never throws; failures are reported in the result.
     */
    public CleanupReport cleanupUserSession(String userId) {
        UserAgentSession session = userId != null ? sessions.remove(userId) : null;
        if (session == null) {
            return CleanupReport.noSession(userId);
        }
        List<String> errors = new ArrayList<>();
        int released = teardown(session, errors);

        EventBridge bridge = eventBridge;
        if (bridge != null) {
            try {
                bridge.clearPending(userId);
            } catch (RuntimeException e) {
                errors.add("Failed to clear pending events: " + e.getMessage());
            }
        }

        log.info("Session cleaned up [userId={}, agents={}, errors={}]", userId, released, errors.size());
        return CleanupReport.builder()
                .userId(userId)
                .status(CleanupReport.Status.CLEANED)
                .agentsCleaned(released)
                .errors(errors)
                .build();
    }

    /**
     * Swaps in a fresh empty session and tears down the old one. Agents created
     * afterwards are new instances. Pending events are kept for the user.
     */
    public ResetReport resetUserAgents(String userId) {
        requireUserId(userId);
        UserAgentSession fresh = newSession(userId);
        UserAgentSession previous = sessions.put(userId, fresh);
        trackUsage(fresh);

        if (previous == null) {
            log.info("Reset requested with no prior session [userId={}]", userId);
            return ResetReport.builder()
                    .userId(userId)
                    .status(ResetReport.Status.NO_SESSION)
                    .agentsReset(0)
                    .build();
        }

        List<String> errors = new ArrayList<>();
        int released = teardown(previous, errors);
        log.info("Session reset [userId={}, agents={}, errors={}]", userId, released, errors.size());
        return ResetReport.builder()
                .userId(userId)
                .status(ResetReport.Status.RESET)
                .agentsReset(released)
                .errors(errors)
                .build();
    }

    /** Cleans every session, continuing past individual failures. */
    public EmergencyCleanupReport emergencyCleanupAll() {
        List<String> userIds = new ArrayList<>(sessions.keySet());
        log.warn("Emergency cleanup of all sessions started [sessions={}]", userIds.size());

        int usersCleaned = 0;
        int agentsCleaned = 0;
        List<String> errors = new ArrayList<>();
        for (String userId : userIds) {
            try {
                CleanupReport report = cleanupUserSession(userId);
                if (report.getStatus() == CleanupReport.Status.CLEANED) {
                    usersCleaned++;
                    agentsCleaned += report.getAgentsCleaned();
                }
                report.getErrors().forEach(error -> errors.add(userId + ": " + error));
            } catch (RuntimeException e) {
                log.error("Emergency cleanup failed [userId={}]", userId, e);
                errors.add(userId + ": " + e.getMessage());
            }
        }

        log.warn("Emergency cleanup finished [users={}, agents={}, errors={}]",
                usersCleaned, agentsCleaned, errors.size());
        return EmergencyCleanupReport.builder()
                .timestamp(clock.instant())
                .usersCleaned(usersCleaned)
                .agentsCleaned(agentsCleaned)
                .errors(errors)
                .build();
    }

    /** Cleans up the least recently active sessions above the configured ceiling. */
    public ReclaimReport reclaimIfOverCapacity() {
        List<UserAgentSession> snapshot = List.copyOf(sessions.values());
        List<String> victims = lifecycleManager.selectSessionsToReclaim(snapshot);

        ReclaimReport.ReclaimReportBuilder report = ReclaimReport.builder().sessionsBefore(snapshot.size());
        int reclaimed = 0;
        int agents = 0;
        for (String userId : victims) {
            CleanupReport cleanup = cleanupUserSession(userId);
            if (cleanup.getStatus() == CleanupReport.Status.CLEANED) {
                reclaimed++;
                agents += cleanup.getAgentsCleaned();
                report.reclaimedUser(userId);
            }
            cleanup.getErrors().forEach(error -> report.error(userId + ": " + error));
        }
        lifecycleManager.recordReclaimed(reclaimed);
        return report.sessionsReclaimed(reclaimed).agentsReclaimed(agents).build();
    }

    // ─── Observability ───────────────────────────────────────────────────────

    /** Read-only sweep over a snapshot of all sessions. */
    public MonitoringReport monitorAllUsers() {
        List<UserAgentSession> snapshot = List.copyOf(sessions.values());

        Map<String, SessionHealthReport> users = new TreeMap<>();
        List<String> globalIssues = new ArrayList<>();
        int totalAgents = 0;
        for (UserAgentSession session : snapshot) {
            SessionHealthReport report = lifecycleManager.assess(session.usage(defaultMemory()));
            users.put(session.getUserId(), report);
            totalAgents += report.getAgentCount();
            if (report.getStatus() != HealthStatus.HEALTHY) {
                report.getIssues().forEach(issue -> globalIssues.add(session.getUserId() + ": " + issue));
            }
        }
        globalIssues.addAll(lifecycleManager.globalIssues(snapshot.size(), totalAgents));

        if (!globalIssues.isEmpty()) {
            log.warn("Monitoring found {} issue(s) across {} session(s)", globalIssues.size(), snapshot.size());
        }
        return MonitoringReport.builder()
                .timestamp(clock.instant())
                .totalUsers(snapshot.size())
                .totalAgents(totalAgents)
                .users(users)
                .globalIssues(globalIssues)
                .build();
    }

    /** Rebinds every session's emitter to the given bridge. */
    public void setEventBridge(EventBridge bridge) {
        this.eventBridge = bridge;
        for (UserAgentSession session : List.copyOf(sessions.values())) {
            session.bindEmitter(bridge != null ? bridge.emitterFor(session.getUserId()) : null);
        }
        log.info("Event bridge {} [sessions={}]", bridge != null ? "attached" : "detached", sessions.size());
    }

    public EventWiringReport diagnoseEventWiring() {
        EventBridge bridge = eventBridge;
        List<UserAgentSession> snapshot = List.copyOf(sessions.values());

        int withEmitter = 0;
        int live = 0;
        Map<String, EventWiringReport.UserWiring> details = new TreeMap<>();
        for (UserAgentSession session : snapshot) {
            boolean hasEmitter = session.getEmitter().isPresent();
            boolean connected = bridge != null && bridge.hasLiveConnection(session.getUserId());
            int pending = bridge != null ? bridge.pendingCount(session.getUserId()) : 0;
            if (hasEmitter) {
                withEmitter++;
            }
            if (connected) {
                live++;
            }
            details.put(session.getUserId(),
                    new EventWiringReport.UserWiring(hasEmitter, connected, pending, session.getAgentCount()));
        }

        double coverage = snapshot.isEmpty() ? 1.0 : (double) withEmitter / snapshot.size();
        List<String> critical = new ArrayList<>();
        if (bridge == null) {
            critical.add("No event bridge configured: users will not receive agent events");
        }
        if (coverage < settings.getMinEmitterCoverage()) {
            critical.add(String.format(Locale.ROOT, "Only %.0f%% of sessions have an event emitter (minimum %.0f%%)",
                    coverage * 100, settings.getMinEmitterCoverage() * 100));
        }

        return EventWiringReport.builder()
                .bridgeConfigured(bridge != null)
                .totalSessions(snapshot.size())
                .sessionsWithEmitter(withEmitter)
                .usersWithLiveConnection(live)
                .coverage(coverage)
                .health(critical.isEmpty() ? EventWiringReport.Health.HEALTHY : EventWiringReport.Health.CRITICAL)
                .criticalIssues(critical)
                .userDetails(details)
                .build();
    }

    public RegistryHealthReport getRegistryHealth() {
        MonitoringReport monitoring = monitorAllUsers();
        DegradationLevel level = degradationManager.getDegradationStatus().level();

        HealthStatus status = lifecycleManager.classifyProcess(monitoring.getTotalUsers(), monitoring.getTotalAgents());
        for (SessionHealthReport user : monitoring.getUsers().values()) {
            status = status.worst(user.getStatus());
        }
        List<String> issues = new ArrayList<>(monitoring.getGlobalIssues());
        if (level == DegradationLevel.MINIMAL) {
            status = status.worst(HealthStatus.CRITICAL);
            issues.add("System running in MINIMAL mode");
        } else if (level != DegradationLevel.NORMAL) {
            status = status.worst(HealthStatus.WARNING);
            issues.add("System degraded: " + level);
        }
        if (monitoring.getTotalUsers() > 0 && factories.factoryCount() == 0) {
            status = status.worst(HealthStatus.WARNING);
            issues.add("No agent factories registered");
        }

        return RegistryHealthReport.builder()
                .status(status)
                .totalSessions(monitoring.getTotalUsers())
                .totalAgents(monitoring.getTotalAgents())
                .registeredAgentTypes(factories.getAgentTypes())
                .degradationLevel(level)
                .uptimeSeconds(Duration.between(startedAt, clock.instant()).toSeconds())
                .reclaimedSessions(lifecycleManager.getReclaimedSessions())
                .issues(issues)
                .build();
    }

    @PreDestroy
    public void shutdown() {
        if (!sessions.isEmpty()) {
            emergencyCleanupAll();
        }
    }

    // ─── Internals ───────────────────────────────────────────────────────────

    private UserAgentSession newSession(String userId) {
        UserAgentSession session = new UserAgentSession(userId, clock);
        EventBridge bridge = eventBridge;
        if (bridge != null) {
            session.bindEmitter(bridge.emitterFor(userId));
        }
        return session;
    }

    private AgentInstance invokeFactory(String userId, AgentFactory factory,
                                        ExecutionContext context, Duration deadline) {
        String agentType = context.getAgentType();
        if (!acquireCreationSlot(userId)) {
            throw new FactoryException(agentType, "Too many agent creations in progress for user '" + userId
                    + "' (max " + settings.getMaxConcurrentCreationsPerUser() + ")");
        }

        FactoryCall call = new FactoryCall(factory, context, () -> releaseCreationSlot(userId));
        Future<AgentInstance> creation;
        try {
            creation = creationExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            releaseCreationSlot(userId);
            throw new FactoryException(agentType, "Agent creation capacity exhausted, could not start '"
                    + agentType + "'", e);
        }

        try {
            AgentInstance instance = creation.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            if (instance == null) {
                throw new FactoryException(agentType, "Factory for '" + agentType + "' returned no agent");
            }
            return instance;
        } catch (TimeoutException e) {
            abandon(call, creation);
            throw new FactoryException(agentType,
                    "Creating agent '" + agentType + "' exceeded deadline of " + deadline.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(call, creation);
            throw new FactoryException(agentType, "Interrupted while creating agent '" + agentType + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new FactoryException(agentType,
                    "Factory for '" + agentType + "' failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Interrupts a factory call its caller gave up on. If the worker handed its
     * instance over just as the deadline passed, that instance is released here.
     */
    private void abandon(FactoryCall call, Future<AgentInstance> creation) {
        if (call.abandon()) {
            creation.cancel(true);
            call.settleIfNeverStarted();
            return;
        }
        try {
            AgentInstance late = creation.get();
            if (late != null) {
                log.warn("Releasing agent that arrived after its deadline [userId={}, agentType={}]",
                        late.getUserId(), late.getAgentType());
                releaseQuietly(late);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to release a late agent");
        } catch (ExecutionException e) {
            log.warn("Late factory call failed after hand-over: {}", e.getMessage());
        }
    }

    /** False when the user already has the maximum number of factory calls running. */
    private boolean acquireCreationSlot(String userId) {
        int running = creationsInFlight.merge(userId, 1, Integer::sum);
        if (running > settings.getMaxConcurrentCreationsPerUser()) {
            releaseCreationSlot(userId);
            log.warn("Agent creation refused, too many in progress [userId={}, max={}]",
                    userId, settings.getMaxConcurrentCreationsPerUser());
            return false;
        }
        return true;
    }

    private void releaseCreationSlot(String userId) {
        creationsInFlight.computeIfPresent(userId, (id, running) -> running > 1 ? running - 1 : null);
    }

    int creationsInFlight(String userId) {
        return creationsInFlight.getOrDefault(userId, 0);
    }

    /** Records usage for the session unless it has already been closed. */
    void trackUsage(UserAgentSession session) {
        session.ifOpen(() -> lifecycleManager.track(session));
    }

    private int teardown(UserAgentSession session, List<String> errors) {
        int released = 0;
        try {
            UserAgentSession.Teardown teardown = session.closeAndReleaseAll();
            released = teardown.agentsReleased();
            errors.addAll(teardown.errors());
        } catch (RuntimeException e) {
            log.error("Session teardown failed [userId={}]", session.getUserId(), e);
            errors.add("Teardown failed: " + e.getMessage());
        }
        // the session is closed, so no late track of it can follow this untrack
        lifecycleManager.untrack(session.getUserId());
        UserAgentSession current = sessions.get(session.getUserId());
        if (current != null) {
            trackUsage(current);
        }
        return released;
    }

    private void notifyCreationFailure(UserAgentSession session, ExecutionContext context,
                                       String agentType, FactoryException error) {
        session.getEmitter().ifPresent(emitter -> {
            try {
                emitter.agentError(context.getThreadId(), agentType, error.getMessage(),
                        Map.of("run_id", context.getRunId(), "phase", "creation"));
            } catch (RuntimeException e) {
                log.warn("Could not emit creation failure [userId={}, agentType={}]: {}",
                        session.getUserId(), agentType, e.getMessage());
            }
        });
    }

    static void releaseQuietly(AgentInstance instance) {
        try {
            instance.release();
        } catch (Exception e) {
            log.warn("Agent release failed [userId={}, agentType={}]: {}",
                    instance.getUserId(), instance.getAgentType(), e.getMessage());
        }
    }

    private long defaultMemory() {
        return lifecycleManager.defaultAgentMemoryBytes();
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ContextValidationException("userId is required");
        }
    }
}
