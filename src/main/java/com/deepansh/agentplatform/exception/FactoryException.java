package com.deepansh.agentplatform.exception;

/**
 * The factory for an agent type is unregistered, threw, or missed its deadline.
 * The user's session is left exactly as it was before the call.
 */
public class FactoryException extends AgentPlatformException {

    private final String agentType;

    public FactoryException(String agentType, String message) {
        super(message);
        this.agentType = agentType;
    }

    public FactoryException(String agentType, String message, Throwable cause) {
        super(message, cause);
        this.agentType = agentType;
    }

    public String getAgentType() {
        return agentType;
    }
}
