package com.deepansh.agentplatform.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Server-Sent Events transport for one user. Each event is written as a named
 * SSE event whose data is the JSON wire form of {@link AgentEvent}.
 */
@Slf4j
public class SseUserEventChannel implements UserEventChannel {

    private final String userId;
    private final SseEmitter emitter;
    private final ObjectMapper objectMapper;
    private volatile boolean open = true;

    public SseUserEventChannel(String userId, SseEmitter emitter, ObjectMapper objectMapper) {
        this(userId, emitter, objectMapper, () -> { });
    }

    /**
     * @param onClosed runs once the client goes away (completion, timeout or error)
     */
    public SseUserEventChannel(String userId, SseEmitter emitter, ObjectMapper objectMapper, Runnable onClosed) {
        this.userId = userId;
        this.emitter = emitter;
        this.objectMapper = objectMapper;
        emitter.onCompletion(() -> {
            open = false;
            onClosed.run();
        });
        emitter.onTimeout(() -> {
            open = false;
            onClosed.run();
        });
        emitter.onError(e -> {
            open = false;
            log.debug("SSE channel error [userId={}]: {}", userId, e.getMessage());
            onClosed.run();
        });
    }

    @Override
    public String getUserId() {
        return userId;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(AgentEvent event) throws IOException {
        if (!open) {
            throw new IOException("SSE channel closed for user " + userId);
        }
        String json = objectMapper.writeValueAsString(event);
        try {
            emitter.send(SseEmitter.event()
                    .name(event.getType().getWireName())
                    .data(json, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            open = false;
            throw e instanceof IOException ? (IOException) e : new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (open) {
            open = false;
            emitter.complete();
        }
    }
}
