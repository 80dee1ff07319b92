package com.deepansh.agentplatform.agent;

import com.deepansh.agentplatform.event.UserEventEmitter;
import com.deepansh.agentplatform.exception.ContextValidationException;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Caller-supplied context for agent creation. The auth layer has already
 * validated the identity fields; the registry only checks they are present
 * and consistent with the target user.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionContext {

    String userId;

    /** Identifies one logical run; required */
    String runId;

    /** Conversation/correlation id echoed on emitted events; optional */
    String threadId;

    String requestId;

    /** Set by the registry when the context is bound for a specific agent */
    String agentType;

    /** Set by the registry; null when no event bridge is wired */
    UserEventEmitter events;

    @Builder.Default
    Map<String, Object> attributes = Map.of();

    public void validate() {
        if (userId == null || userId.isBlank()) {
            throw new ContextValidationException("execution context is missing userId");
        }
        if (runId == null || runId.isBlank()) {
            throw new ContextValidationException("execution context is missing runId for user " + userId);
        }
    }

    /** Child context handed to a factory: same identity, bound agent type and emitter. */
    public ExecutionContext forAgent(String agentType, UserEventEmitter events) {
        return toBuilder()
                .agentType(agentType)
                .events(events)
                .build();
    }
}
