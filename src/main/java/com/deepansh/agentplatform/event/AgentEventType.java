package com.deepansh.agentplatform.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event tags sent over a user's live channel. The wire value is the lowercase name.
 */
public enum AgentEventType {
    AGENT_STARTED("agent_started"),
    AGENT_THINKING("agent_thinking"),
    TOOL_EXECUTING("tool_executing"),
    TOOL_COMPLETED("tool_completed"),
    AGENT_COMPLETED("agent_completed"),
    AGENT_ERROR("agent_error"),
    AGENT_DEATH("agent_death"),
    PROGRESS_UPDATE("progress_update"),
    /** Synthesized by the bridge when queued history had to be dropped */
    EVENTS_TRUNCATED("events_truncated");

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == AGENT_COMPLETED || this == AGENT_ERROR || this == AGENT_DEATH;
    }
}
