package com.deepansh.agentplatform.resilience;

/**
 * Notified after a dependency flag changes, outside the manager's lock.
 */
@FunctionalInterface
public interface DegradationListener {

    void onServiceStatusChanged(String dependency, boolean healthy, DegradationStatus status);
}
