package com.deepansh.agentplatform.event;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of undelivered events for one user. Drop-oldest on overflow,
 * keeping a count of what was dropped so the user can be told.
 *
 * Not thread-safe; the bridge guards each queue with its user's lock.
 */
class PendingEventQueue {

    private final int capacity;
    private final Deque<AgentEvent> events = new ArrayDeque<>();
    private long droppedSinceLastFlush;

    PendingEventQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /** @return true if an older event was evicted to make room */
    boolean offer(AgentEvent event) {
        boolean evicted = false;
        if (events.size() >= capacity) {
            events.pollFirst();
            droppedSinceLastFlush++;
            evicted = true;
        }
        events.addLast(event);
        return evicted;
    }

    AgentEvent peek() {
        return events.peekFirst();
    }

    AgentEvent poll() {
        return events.pollFirst();
    }

    boolean isEmpty() {
        return events.isEmpty() && droppedSinceLastFlush == 0;
    }

    int size() {
        return events.size();
    }

    long getDroppedSinceLastFlush() {
        return droppedSinceLastFlush;
    }

    void acknowledgeDropped() {
        droppedSinceLastFlush = 0;
    }

    void clear() {
        events.clear();
        droppedSinceLastFlush = 0;
    }
}
