package com.deepansh.agentplatform.exception;

/**
 * Execution context is missing a required field. Raised before any state is touched.
 */
public class ContextValidationException extends AgentPlatformException {

    public ContextValidationException(String message) {
        super(message);
    }
}
