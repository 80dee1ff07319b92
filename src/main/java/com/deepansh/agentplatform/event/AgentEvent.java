package com.deepansh.agentplatform.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One progress/result event for exactly one user.
 *
 * Wire shape: {@code {type, payload, user_id, thread_id, timestamp}}
 * where timestamp is epoch milliseconds and thread_id may be null.
 */
@Value
@Builder
@JsonPropertyOrder({"type", "payload", "user_id", "thread_id", "timestamp"})
public class AgentEvent {

    AgentEventType type;

    @Builder.Default
    Map<String, Object> payload = Map.of();

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("thread_id")
    String threadId;

    long timestamp;
}
