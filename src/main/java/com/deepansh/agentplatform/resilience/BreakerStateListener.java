package com.deepansh.agentplatform.resilience;

@FunctionalInterface
public interface BreakerStateListener {

    void onTransition(String dependency, BreakerState from, BreakerState to);
}
