package com.deepansh.agentplatform.support;

import com.deepansh.agentplatform.event.AgentEvent;
import com.deepansh.agentplatform.event.UserEventChannel;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory channel that records what it was sent. Can be told to fail, to be
 * slow, or to block until released (optionally ignoring interrupts, like a
 * socket write that never returns).
 */
public class RecordingChannel implements UserEventChannel {

    private final String userId;
    private final List<AgentEvent> received = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failing;
    private volatile CountDownLatch gate;
    private volatile boolean ignoreInterrupts;
    private volatile Duration sendDelay = Duration.ZERO;

    public RecordingChannel(String userId) {
        this.userId = userId;
    }

    public List<AgentEvent> received() {
        return received;
    }

    public void failSends(boolean failing) {
        this.failing = failing;
    }

    /** Sends block until {@link #release()} is called. */
    public void blockSends() {
        this.gate = new CountDownLatch(1);
    }

    /** Sends block until {@link #release()}, and interrupting them has no effect. */
    public void hangSends() {
        this.ignoreInterrupts = true;
        this.gate = new CountDownLatch(1);
    }

    /** Every send succeeds, but only after {@code delay}. */
    public void delayEachSend(Duration delay) {
        this.sendDelay = delay;
    }

    public void release() {
        CountDownLatch current = gate;
        gate = null;
        if (current != null) {
            current.countDown();
        }
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
        CountDownLatch current = gate;
        if (current != null) {
            if (ignoreInterrupts) {
                awaitIgnoringInterrupts(current);
            } else {
                try {
                    current.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
        }
        if (!sendDelay.isZero()) {
            try {
                Thread.sleep(sendDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        if (failing) {
            throw new IOException("connection reset");
        }
        received.add(event);
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        boolean interrupted = false;
        while (latch.getCount() > 0 && System.nanoTime() < deadline) {
            try {
                latch.await(50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        open = false;
    }
}
