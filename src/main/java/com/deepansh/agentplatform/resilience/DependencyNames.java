package com.deepansh.agentplatform.resilience;

/**
 * Well-known dependency names. Any other name may be registered at runtime.
 */
public final class DependencyNames {

    public static final String STORAGE = "storage";
    public static final String CACHE = "cache";
    public static final String MODEL_PROVIDER = "model-provider";
    public static final String EVENT_TRANSPORT = "event-transport";

    private DependencyNames() {
    }
}
