package com.deepansh.agentplatform.exception;

/**
 * An operation tried to cross a user boundary: a context for one user used
 * against another user's session, an agent tagged for the wrong user, or an
 * event routed to a channel it does not belong to.
 *
 * Always a programming error. Never retried and never silently corrected.
 */
public class IsolationViolationException extends AgentPlatformException {

    private final String expectedUserId;
    private final String actualUserId;

    public IsolationViolationException(String expectedUserId, String actualUserId, String operation) {
        super(String.format("Isolation violation in %s: expected user '%s' but got '%s'",
                operation, expectedUserId, actualUserId));
        this.expectedUserId = expectedUserId;
        this.actualUserId = actualUserId;
    }

    public String getExpectedUserId() {
        return expectedUserId;
    }

    public String getActualUserId() {
        return actualUserId;
    }
}
