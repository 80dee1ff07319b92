package com.deepansh.agentplatform.registry;

import com.deepansh.agentplatform.agent.AgentInstance;
import com.deepansh.agentplatform.event.UserEventEmitter;
import com.deepansh.agentplatform.exception.IsolationViolationException;
import com.deepansh.agentplatform.registry.report.ResourceUsage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Everything the platform holds for one user: their agents by type, their
 * event emitter and activity timestamps.
 *
 * The agent map is guarded by this session's own lock. No operation here ever
 * touches another session, so users never contend with each other.
 * Once closed a session accepts no new agents.
 */
@Slf4j
public class UserAgentSession {

    enum Registration { REGISTERED, DUPLICATE, CLOSED }

    private final String userId;
    private final Clock clock;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AgentInstance> agents = new LinkedHashMap<>();

    private volatile Instant lastActivityAt;
    private volatile UserEventEmitter emitter;
    private volatile boolean closed;

    UserAgentSession(String userId, Clock clock) {
        this.userId = userId;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivityAt = createdAt;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public boolean isClosed() {
        return closed;
    }

    public Optional<UserEventEmitter> getEmitter() {
        return Optional.ofNullable(emitter);
    }

    public Optional<AgentInstance> getAgent(String agentType) {
        lock.lock();
        try {
            return Optional.ofNullable(agents.get(agentType));
        } finally {
            lock.unlock();
        }
    }

    public boolean hasAgent(String agentType) {
        return getAgent(agentType).isPresent();
    }

    public int getAgentCount() {
        lock.lock();
        try {
            return agents.size();
        } finally {
            lock.unlock();
        }
    }

    public SortedSet<String> getAgentTypes() {
        lock.lock();
        try {
            return new TreeSet<>(agents.keySet());
        } finally {
            lock.unlock();
        }
    }

    /** Estimated footprint; agents that report zero count as {@code defaultPerAgent}. */
    public long estimatedMemoryBytes(long defaultPerAgent) {
        lock.lock();
        try {
            long total = 0;
            for (AgentInstance agent : agents.values()) {
                long reported = agent.estimatedMemoryBytes();
                total += reported > 0 ? reported : defaultPerAgent;
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    public ResourceUsage usage(long defaultPerAgent) {
        lock.lock();
        try {
            return new ResourceUsage(userId, agents.size(), estimatedMemoryBytes(defaultPerAgent),
                    createdAt, lastActivityAt);
        } finally {
            lock.unlock();
        }
    }

    /** Runs {@code action} under this session's lock unless the session is closed. */
    boolean ifOpen(Runnable action) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            action.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    void touch() {
        lastActivityAt = clock.instant();
    }

    void bindEmitter(UserEventEmitter emitter) {
        if (emitter != null && !userId.equals(emitter.getUserId())) {
            throw new IsolationViolationException(userId, emitter.getUserId(), "bindEmitter");
        }
        this.emitter = emitter;
    }

    Registration register(String agentType, AgentInstance agent) {
        lock.lock();
        try {
            if (closed) {
                return Registration.CLOSED;
            }
            if (agents.containsKey(agentType)) {
                return Registration.DUPLICATE;
            }
            agents.put(agentType, agent);
            touch();
            return Registration.REGISTERED;
        } finally {
            lock.unlock();
        }
    }

    Optional<AgentInstance> remove(String agentType) {
        lock.lock();
        try {
            AgentInstance removed = agents.remove(agentType);
            if (removed != null) {
                touch();
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the session and releases every agent. Release failures are
     * collected, never thrown, so one bad agent cannot block the rest.
     *
     * @return number of agents that were held plus any release errors
     */
    Teardown closeAndReleaseAll() {
        List<AgentInstance> drained;
        lock.lock();
        try {
            closed = true;
            drained = new ArrayList<>(agents.values());
            agents.clear();
        } finally {
            lock.unlock();
        }
        emitter = null;

        List<String> errors = new ArrayList<>();
        for (AgentInstance agent : drained) {
            try {
                agent.release();
            } catch (Exception e) {
                log.warn("Agent release failed [userId={}, agentType={}]: {}",
                        userId, agent.getAgentType(), e.getMessage());
                errors.add("Failed to release " + agent.getAgentType() + ": " + e.getMessage());
            }
        }
        return new Teardown(drained.size(), errors);
    }

    record Teardown(int agentsReleased, List<String> errors) {}
}
