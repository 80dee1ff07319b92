package com.deepansh.agentplatform.api;

import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.event.EventBridge;
import com.deepansh.agentplatform.event.SseUserEventChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live agent event stream for one user.
 *
 * GET /api/v1/events/{userId} opens an SSE stream. Connecting replaces the
 * user's previous stream and first replays anything queued while they were away.
 * The caller is assumed to be authenticated as {userId} upstream.
 */
@RestController
@RequestMapping("/api/v1/events")
@Slf4j
public class EventStreamController {

    private final EventBridge eventBridge;
    private final ObjectMapper objectMapper;
    private final long streamTimeoutMs;

    public EventStreamController(EventBridge eventBridge, ObjectMapper objectMapper, PlatformProperties properties) {
        this.eventBridge = eventBridge;
        this.objectMapper = objectMapper;
        this.streamTimeoutMs = properties.getEvents().getStreamTimeout().toMillis();
    }

    @GetMapping(value = "/{userId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String userId) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        SseUserEventChannel[] holder = new SseUserEventChannel[1];
        holder[0] = new SseUserEventChannel(userId, emitter, objectMapper,
                () -> eventBridge.disconnect(userId, holder[0]));

        eventBridge.connect(userId, holder[0]);
        log.info("Event stream opened [userId={}]", userId);
        return emitter;
    }
}
