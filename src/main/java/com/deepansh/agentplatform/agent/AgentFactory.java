package com.deepansh.agentplatform.agent;

/**
 * Builds agents of one type. Registered once at startup; every {@code AgentFactory}
 * bean is picked up by {@link AgentFactoryRegistry}.
 *
 * The context is already bound to the requesting user, the agent type, and that
 * user's event emitter. The returned instance must be tagged with the same user
 * and type. May perform I/O; the registry bounds the call with a deadline.
 */
public interface AgentFactory {

    /** Unique agent type name, e.g. "triage" or "data_helper" */
    String getAgentType();

    AgentInstance create(ExecutionContext context) throws Exception;
}
