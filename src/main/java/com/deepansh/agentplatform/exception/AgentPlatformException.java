package com.deepansh.agentplatform.exception;

/**
 * Root of the platform's unchecked exception hierarchy.
 */
public class AgentPlatformException extends RuntimeException {

    public AgentPlatformException(String message) {
        super(message);
    }

    public AgentPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
