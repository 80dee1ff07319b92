package com.deepansh.agentplatform.event;

public enum DeliveryResult {
    /** Written to the user's live channel */
    DELIVERED,
    /** Held in the user's pending queue until the transport recovers */
    QUEUED
}
