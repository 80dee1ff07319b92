package com.deepansh.agentplatform.exception;

/**
 * The session already holds an agent of the requested type. Existing agents are
 * only replaced through explicit removal or reset.
 */
public class AgentAlreadyRegisteredException extends AgentPlatformException {

    public AgentAlreadyRegisteredException(String userId, String agentType) {
        super(String.format("Agent '%s' already exists for user '%s'", agentType, userId));
    }
}
