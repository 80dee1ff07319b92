package com.deepansh.agentplatform.event;

import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.resilience.DegradationManager;
import com.deepansh.agentplatform.support.RecordingChannel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UserEventEmitterTest {

    private RecordingChannel channel;
    private UserEventEmitter emitter;

    @BeforeEach
    void setUp() {
        PlatformProperties props = new PlatformProperties();
        props.getEvents().setMaxErrorMessageLength(40);
        EventBridge bridge = new EventBridge(props, new DegradationManager(props, Clock.systemUTC()),
                new SimpleAsyncTaskExecutor("emitter-test-"), Clock.systemUTC());
        channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);
        emitter = bridge.emitterFor("alice");
    }

    @Test
    void agentStarted_carriesUserAndThread() {
        emitter.agentStarted("thread-9", "planner", Map.of("goal", "summarise"));

        AgentEvent event = channel.received().get(0);
        assertThat(event.getType()).isEqualTo(AgentEventType.AGENT_STARTED);
        assertThat(event.getUserId()).isEqualTo("alice");
        assertThat(event.getThreadId()).isEqualTo("thread-9");
        assertThat(event.getPayload()).containsEntry("agent_name", "planner").containsEntry("status", "started");
    }

    @Test
    void agentError_redactsSecretsAndTruncates() {
        emitter.agentError("t-1", "planner", "login failed password=hunter2 while calling the upstream service",
                Map.of("api_key", "sk-123", "attempt", 2));

        Map<String, Object> payload = channel.received().get(0).getPayload();
        String message = (String) payload.get("error_message");
        assertThat(message).doesNotContain("hunter2").endsWith("...[truncated]");
        assertThat(payload.get("error_context")).isEqualTo(Map.of("api_key", "[REDACTED]", "attempt", 2));
    }

    @Test
    void toolExecuting_scrubsBearerTokensInParameters() {
        emitter.toolExecuting("t-1", "planner", "http_get", Map.of("header", "Bearer abc.def"));

        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) channel.received().get(0).getPayload().get("parameters");
        assertThat(params.get("header")).isEqualTo("Bearer [REDACTED]");
    }

    @Test
    void agentDeath_knownCause_usesFriendlyMessage() {
        emitter.agentDeath("t-1", "planner", "timeout", null);

        Map<String, Object> payload = channel.received().get(0).getPayload();
        assertThat((String) payload.get("message")).contains("took too long");
        assertThat(payload).containsEntry("recovery_action", "refresh_required");
    }

    @Test
    void deathMessage_unknownCause_fallsBackToGenericMessage() {
        assertThat(UserEventEmitter.deathMessage("disk_full", "planner"))
                .contains("planner").contains("critical error");
    }

    @Test
    void agentEvent_serializesToWireShape() throws Exception {
        emitter.agentCompleted("t-1", "planner", Map.of("answer", 42));

        JsonNode json = new ObjectMapper().readTree(
                new ObjectMapper().writeValueAsString(channel.received().get(0)));
        assertThat(json.get("type").asText()).isEqualTo("agent_completed");
        assertThat(json.get("user_id").asText()).isEqualTo("alice");
        assertThat(json.get("thread_id").asText()).isEqualTo("t-1");
        assertThat(json.get("timestamp").asLong()).isPositive();
    }
}
