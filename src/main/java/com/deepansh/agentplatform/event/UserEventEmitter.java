package com.deepansh.agentplatform.event;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User-scoped handle onto the {@link EventBridge}. Every event built here carries
 * the bound user id, so an agent holding this emitter has no way to address
 * another user's channel.
 */
public class UserEventEmitter {

    private static final Map<String, String> DEATH_MESSAGES = Map.of(
            "timeout", "The %s agent took too long to respond and has been stopped. Please try again.",
            "no_heartbeat", "Lost connection with the %s agent. Please refresh and try again.",
            "silent_failure", "The %s agent stopped unexpectedly. Please refresh the page.",
            "memory_limit", "The %s agent ran out of resources. Please try with a simpler request.",
            "cancelled", "The %s agent was cancelled. You can start a new request.");

    private final String userId;
    private final EventBridge bridge;
    private final EventPayloadSanitizer sanitizer;
    private final Clock clock;

    UserEventEmitter(String userId, EventBridge bridge, EventPayloadSanitizer sanitizer, Clock clock) {
        this.userId = userId;
        this.bridge = bridge;
        this.sanitizer = sanitizer;
        this.clock = clock;
    }

    public String getUserId() {
        return userId;
    }

    public DeliveryResult emit(AgentEventType type, String threadId, Map<String, Object> payload) {
        AgentEvent event = AgentEvent.builder()
                .type(type)
                .userId(userId)
                .threadId(threadId)
                .payload(payload != null ? payload : Map.of())
                .timestamp(clock.millis())
                .build();
        return bridge.emit(userId, event);
    }

    public DeliveryResult agentStarted(String threadId, String agentName, Map<String, Object> context) {
        Map<String, Object> payload = base(agentName, "started");
        payload.put("context", context != null ? context : Map.of());
        payload.put("message", agentName + " has started processing your request");
        return emit(AgentEventType.AGENT_STARTED, threadId, payload);
    }

    public DeliveryResult agentThinking(String threadId, String agentName, String reasoning, Integer stepNumber) {
        Map<String, Object> payload = base(agentName, "thinking");
        payload.put("reasoning", reasoning);
        if (stepNumber != null) {
            payload.put("step_number", stepNumber);
        }
        return emit(AgentEventType.AGENT_THINKING, threadId, payload);
    }

    public DeliveryResult toolExecuting(String threadId, String agentName, String toolName, Map<String, ?> parameters) {
        Map<String, Object> payload = base(agentName, "executing");
        payload.put("tool_name", toolName);
        payload.put("parameters", sanitizer.sanitizeContext(parameters));
        return emit(AgentEventType.TOOL_EXECUTING, threadId, payload);
    }

    public DeliveryResult toolCompleted(String threadId, String agentName, String toolName,
                                        Map<String, ?> result, long durationMs) {
        Map<String, Object> payload = base(agentName, "completed");
        payload.put("tool_name", toolName);
        payload.put("result", sanitizer.sanitizeContext(result));
        payload.put("duration_ms", durationMs);
        return emit(AgentEventType.TOOL_COMPLETED, threadId, payload);
    }

    public DeliveryResult agentCompleted(String threadId, String agentName, Map<String, Object> result) {
        Map<String, Object> payload = base(agentName, "completed");
        payload.put("result", result != null ? result : Map.of());
        return emit(AgentEventType.AGENT_COMPLETED, threadId, payload);
    }

    public DeliveryResult agentError(String threadId, String agentName, String error, Map<String, ?> errorContext) {
        Map<String, Object> payload = base(agentName, "error");
        payload.put("error_message", sanitizer.sanitizeMessage(error));
        payload.put("error_context", sanitizer.sanitizeContext(errorContext));
        payload.put("message", agentName + " encountered an issue processing your request");
        return emit(AgentEventType.AGENT_ERROR, threadId, payload);
    }

    /** Terminal notice for an agent that stopped without reporting an error itself. */
    public DeliveryResult agentDeath(String threadId, String agentName, String cause, Map<String, ?> deathContext) {
        Map<String, Object> payload = base(agentName, "dead");
        payload.put("death_cause", cause);
        payload.put("death_context", sanitizer.sanitizeContext(deathContext));
        payload.put("message", deathMessage(cause, agentName));
        payload.put("recovery_action", "refresh_required");
        return emit(AgentEventType.AGENT_DEATH, threadId, payload);
    }

    public DeliveryResult progressUpdate(String threadId, String agentName, Map<String, ?> progress) {
        Map<String, Object> payload = base(agentName, "in_progress");
        payload.put("progress", sanitizer.sanitizeContext(progress));
        return emit(AgentEventType.PROGRESS_UPDATE, threadId, payload);
    }

    static String deathMessage(String cause, String agentName) {
        String template = DEATH_MESSAGES.get(cause);
        if (template == null) {
            return "The " + agentName + " agent encountered a critical error. Please refresh and try again.";
        }
        return String.format(template, agentName);
    }

    private Map<String, Object> base(String agentName, String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_name", agentName);
        payload.put("status", status);
        return payload;
    }
}
