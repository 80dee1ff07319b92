package com.deepansh.agentplatform.event;

import java.util.Map;

public record EventBridgeStats(
        long deliveredEvents,
        long queuedEvents,
        long droppedEvents,
        int connectedUsers,
        Map<String, Integer> pendingByUser
) {}
