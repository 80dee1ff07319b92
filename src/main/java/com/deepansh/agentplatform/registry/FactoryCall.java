package com.deepansh.agentplatform.registry;

import com.deepansh.agentplatform.agent.AgentFactory;
import com.deepansh.agentplatform.agent.AgentInstance;
import com.deepansh.agentplatform.agent.ExecutionContext;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One factory invocation on the creation executor.
 *
 * The worker and the waiting caller settle it exactly once: either the worker
 * hands the instance over, or the caller abandons the call and the worker
 * releases whatever it still produces. {@code onFinished} runs exactly once,
 * when the worker is done or when the call is cancelled before it started.
 */
@Slf4j
final class FactoryCall implements Callable<AgentInstance> {

    private enum Outcome { PENDING, HANDED_OVER, ABANDONED }

    private final AgentFactory factory;
    private final ExecutionContext context;
    private final Runnable onFinished;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicReference<Outcome> outcome = new AtomicReference<>(Outcome.PENDING);

    FactoryCall(AgentFactory factory, ExecutionContext context, Runnable onFinished) {
        this.factory = factory;
        this.context = context;
        this.onFinished = onFinished;
    }

    @Override
    public AgentInstance call() throws Exception {
        if (!started.compareAndSet(false, true)) {
            return null;
        }
        try {
            AgentInstance instance = factory.create(context);
            if (instance != null && !outcome.compareAndSet(Outcome.PENDING, Outcome.HANDED_OVER)) {
                log.warn("Releasing agent that arrived after its deadline [userId={}, agentType={}]",
                        instance.getUserId(), instance.getAgentType());
                AgentRegistry.releaseQuietly(instance);
                return null;
            }
            return instance;
        } finally {
            onFinished.run();
        }
    }

    /**
     * Gives up on the call.
     *
     * @return false if the worker already handed its instance over; the caller
     *         then owns that instance and must release it
     */
    boolean abandon() {
        return outcome.compareAndSet(Outcome.PENDING, Outcome.ABANDONED);
    }

    /** After a cancel: runs {@code onFinished} here if the worker never started. */
    void settleIfNeverStarted() {
        if (started.compareAndSet(false, true)) {
            onFinished.run();
        }
    }
}
