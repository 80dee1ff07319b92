package com.deepansh.agentplatform.exception;

/**
 * A circuit-protected call failed or timed out. The failure has already been
 * counted against the dependency's breaker when this is thrown.
 */
public class ServiceUnavailableException extends AgentPlatformException {

    private final String dependency;
    private final boolean timedOut;

    public ServiceUnavailableException(String dependency, boolean timedOut, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
        this.timedOut = timedOut;
    }

    public String getDependency() {
        return dependency;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
