package com.deepansh.agentplatform.agent;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stock {@link AgentInstance} for factories that only need identity plus an
 * optional release hook. Release runs the hook at most once.
 */
@Slf4j
@Getter
public class DefaultAgentInstance implements AgentInstance {

    private final String instanceId = UUID.randomUUID().toString();
    private final String userId;
    private final String agentType;
    private final ExecutionContext context;
    private final Instant createdAt;
    private final long estimatedMemoryBytes;
    private final AutoCloseable releaseHook;
    private final AtomicBoolean released = new AtomicBoolean();

    public DefaultAgentInstance(ExecutionContext context, long estimatedMemoryBytes, AutoCloseable releaseHook) {
        this.userId = context.getUserId();
        this.agentType = context.getAgentType();
        this.context = context;
        this.createdAt = Instant.now();
        this.estimatedMemoryBytes = estimatedMemoryBytes;
        this.releaseHook = releaseHook;
    }

    public static DefaultAgentInstance of(ExecutionContext context) {
        return new DefaultAgentInstance(context, 0L, null);
    }

    @Override
    public long estimatedMemoryBytes() {
        return estimatedMemoryBytes;
    }

    @Override
    public void release() throws Exception {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        if (releaseHook != null) {
            releaseHook.close();
        }
        log.debug("Agent released [userId={}, agentType={}, instanceId={}]", userId, agentType, instanceId);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public String toString() {
        return "DefaultAgentInstance{" + agentType + "@" + userId + ", id=" + instanceId + "}";
    }
}
