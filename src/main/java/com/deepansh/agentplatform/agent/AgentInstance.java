package com.deepansh.agentplatform.agent;

/**
 * Opaque handle to one agent's state, owned by exactly one user session.
 *
 * The registry checks {@link #getUserId()} and {@link #getAgentType()} against
 * the request that created it before the handle becomes visible.
 */
public interface AgentInstance {

    String getInstanceId();

    String getUserId();

    String getAgentType();

    /** Self-reported footprint; zero means unknown and a configured default is used. */
    default long estimatedMemoryBytes() {
        return 0L;
    }

    /** Releases whatever the agent holds. Called once when it leaves its session. */
    default void release() throws Exception {
    }
}
