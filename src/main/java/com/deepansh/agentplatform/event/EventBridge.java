package com.deepansh.agentplatform.event;

import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.exception.IsolationViolationException;
import com.deepansh.agentplatform.resilience.DegradationManager;
import com.deepansh.agentplatform.resilience.DegradationStatus;
import com.deepansh.agentplatform.resilience.DependencyNames;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Routes agent events to the owning user's live channel.
 *
 * Per-user delivery flow:
 * 1. Event user id must match the target user (isolation check)
 * 2. If the user has an open channel, their transport is healthy, the shared
 *    event transport is healthy, and nothing is pending: deliver now with a
 *    bounded wait
 * 3. Otherwise, or if that delivery fails or times out: append to the user's
 *    bounded pending queue and stop trying synchronously
 * 4. On recovery (reconnect, per-user transport healthy, shared transport
 *    healthy) the queue is flushed in order before anything newer goes out
 *
 * All state for a user sits behind that user's own lock, so a slow channel
 * only ever holds up the same user's emitters. Each channel has at most one
 * write in flight; a write that outlives its timeout is interrupted and the
 * user's later events queue behind it rather than taking another thread.
 * A caller drains a backlog for at most {@code flush-budget}, then leaves the
 * remainder to a background flush.
 *
 * Delivery is at-least-once: a write that times out may still land on the
 * channel and be sent again by the next flush.
 */
@Component
@Slf4j
public class EventBridge {

    private final Map<String, UserEventState> states = new ConcurrentHashMap<>();
    private final DegradationManager degradationManager;
    private final AsyncTaskExecutor deliveryExecutor;
    private final Clock clock;
    private final Duration deliveryTimeout;
    private final Duration flushBudget;
    private final int queueCapacity;
    private final EventPayloadSanitizer sanitizer;

    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong queuedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    private volatile boolean shutdown;

    public EventBridge(PlatformProperties properties,
                       DegradationManager degradationManager,
                       @Qualifier("eventDeliveryExecutor") AsyncTaskExecutor deliveryExecutor,
                       Clock clock) {
        PlatformProperties.Events events = properties.getEvents();
        this.degradationManager = degradationManager;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
        this.deliveryTimeout = events.getDeliveryTimeout();
        this.flushBudget = events.getFlushBudget();
        this.queueCapacity = events.getQueueCapacity();
        this.sanitizer = new EventPayloadSanitizer(events.getMaxErrorMessageLength());

        degradationManager.addListener(this::onServiceStatusChanged);
    }

    /** An emitter that can only ever address {@code userId}. */
    public UserEventEmitter emitterFor(String userId) {
        requireUserId(userId);
        return new UserEventEmitter(userId, this, sanitizer, clock);
    }

    public DeliveryResult emit(String userId, AgentEvent event) {
        requireUserId(userId);
        if (!userId.equals(event.getUserId())) {
            throw new IsolationViolationException(userId, event.getUserId(), "emit");
        }

        UserEventState state = stateFor(userId);
        state.lock.lock();
        try {
            if (!state.queue.isEmpty() || !canDeliver(state)) {
                enqueue(state, event);
                // a previously blocked user may be deliverable again; drain in order
                if (canDeliver(state)) {
                    drainWithinBudget(state);
                }
                return state.queue.isEmpty() ? DeliveryResult.DELIVERED : DeliveryResult.QUEUED;
            }

            if (deliver(state, event)) {
                return DeliveryResult.DELIVERED;
            }
            enqueue(state, event);
            return DeliveryResult.QUEUED;
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Registers the user's live channel, replacing any previous one, and
     * flushes anything queued while they were away.
     */
    public void connect(String userId, UserEventChannel channel) {
        requireUserId(userId);
        if (!userId.equals(channel.getUserId())) {
            throw new IsolationViolationException(userId, channel.getUserId(), "connect");
        }
        UserEventState state = stateFor(userId);
        UserEventChannel previous;
        state.lock.lock();
        try {
            previous = state.channel;
            state.channel = channel;
            state.transportHealthy = true;
            log.info("Event channel connected [userId={}, pending={}]", userId, state.queue.size());
            if (canDeliver(state)) {
                drainWithinBudget(state);
            }
        } finally {
            state.lock.unlock();
        }
        if (previous != null && previous != channel) {
            previous.close();
        }
    }

    /** Detaches the channel only if it is still the registered one. */
    public void disconnect(String userId, UserEventChannel channel) {
        UserEventState state = states.get(userId);
        if (state == null) {
            return;
        }
        state.lock.lock();
        try {
            if (state.channel == channel) {
                state.channel = null;
                log.info("Event channel disconnected [userId={}]", userId);
            }
        } finally {
            state.lock.unlock();
        }
    }

    public boolean hasLiveConnection(String userId) {
        UserEventState state = states.get(userId);
        UserEventChannel channel = state != null ? state.channel : null;
        return channel != null && channel.isOpen();
    }

    /**
     * Marks one user's transport up or down. Going healthy flushes their queue.
     */
    public void markTransportHealthy(String userId, boolean healthy) {
        requireUserId(userId);
        UserEventState state = stateFor(userId);
        state.lock.lock();
        try {
            state.transportHealthy = healthy;
            log.info("Transport marked {} [userId={}, pending={}]",
                    healthy ? "healthy" : "unhealthy", userId, state.queue.size());
            if (healthy && canDeliver(state)) {
                drainWithinBudget(state);
            }
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Drains the user's backlog within the flush budget; anything left continues
     * in the background.
     *
     * @return number of events (including a truncation marker) delivered by this call
     */
    public int flush(String userId) {
        UserEventState state = states.get(userId);
        if (state == null) {
            return 0;
        }
        state.lock.lock();
        try {
            return canDeliver(state) ? drainWithinBudget(state) : 0;
        } finally {
            state.lock.unlock();
        }
    }

    public int flushAll() {
        int total = 0;
        for (String userId : states.keySet()) {
            total += flush(userId);
        }
        return total;
    }

    public int pendingCount(String userId) {
        UserEventState state = states.get(userId);
        if (state == null) {
            return 0;
        }
        state.lock.lock();
        try {
            return state.queue.size();
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Drops a user's undelivered events, e.g. when their session is torn down.
     * A live channel stays registered.
     */
    public int clearPending(String userId) {
        UserEventState state = states.get(userId);
        if (state == null) {
            return 0;
        }
        state.lock.lock();
        try {
            int cleared = state.queue.size();
            state.queue.clear();
            if (state.channel == null) {
                states.remove(userId, state);
            }
            return cleared;
        } finally {
            state.lock.unlock();
        }
    }

    public EventBridgeStats getStats() {
        Map<String, Integer> pending = new TreeMap<>();
        int connected = 0;
        for (Map.Entry<String, UserEventState> entry : states.entrySet()) {
            int size = pendingCount(entry.getKey());
            if (size > 0) {
                pending.put(entry.getKey(), size);
            }
            if (hasLiveConnection(entry.getKey())) {
                connected++;
            }
        }
        return new EventBridgeStats(deliveredCount.get(), queuedCount.get(), droppedCount.get(),
                connected, pending);
    }

    @PreDestroy
    public void shutdown() {
        shutdown = true;
        states.values().forEach(state -> {
            UserEventChannel channel = state.channel;
            if (channel != null) {
                channel.close();
            }
        });
        log.info("Event bridge shut down [delivered={}, queued={}, dropped={}]",
                deliveredCount.get(), queuedCount.get(), droppedCount.get());
    }

    void onServiceStatusChanged(String dependency, boolean healthy, DegradationStatus status) {
        if (healthy && DependencyNames.EVENT_TRANSPORT.equals(dependency)) {
            int flushed = flushAll();
            log.info("Shared event transport recovered, flushed {} queued events", flushed);
        }
    }

    private boolean canDeliver(UserEventState state) {
        UserEventChannel channel = state.channel;
        return !shutdown
                && channel != null
                && channel.isOpen()
                && state.transportHealthy
                && degradationManager.isHealthy(DependencyNames.EVENT_TRANSPORT);
    }

    /**
     * Caller holds the user's lock. Delivers in order until the queue is empty,
     * a write fails or the budget is spent. A backlog left by the budget is
     * continued by a background flush.
     */
    private int drainWithinBudget(UserEventState state) {
        int delivered = drain(state, System.nanoTime() + flushBudget.toNanos());
        if (!state.queue.isEmpty() && canDeliver(state)) {
            scheduleBackgroundFlush(state);
        }
        return delivered;
    }

    /** Caller holds the user's lock. Stops at the first failure, keeping the rest queued. */
    private int drain(UserEventState state, long deadlineNanos) {
        int delivered = 0;
        long dropped = state.queue.getDroppedSinceLastFlush();
        if (dropped > 0) {
            AgentEvent marker = truncationMarker(state.userId, dropped);
            if (!deliver(state, marker)) {
                return delivered;
            }
            state.queue.acknowledgeDropped();
            delivered++;
        }
        while (state.queue.size() > 0 && System.nanoTime() < deadlineNanos) {
            if (!deliver(state, state.queue.peek())) {
                log.warn("Flush interrupted [userId={}, delivered={}, remaining={}]",
                        state.userId, delivered, state.queue.size());
                return delivered;
            }
            state.queue.poll();
            delivered++;
        }
        if (delivered > 0) {
            log.info("Flushed queued events [userId={}, delivered={}, remaining={}]",
                    state.userId, delivered, state.queue.size());
        }
        return delivered;
    }

    /** Caller holds the user's lock. At most one background flush per user. */
    private void scheduleBackgroundFlush(UserEventState state) {
        if (state.backgroundFlush) {
            return;
        }
        state.backgroundFlush = true;
        try {
            deliveryExecutor.execute(() -> continueFlush(state));
        } catch (RejectedExecutionException e) {
            state.backgroundFlush = false;
            log.warn("Background flush rejected, backlog waits for the next emit [userId={}, pending={}]",
                    state.userId, state.queue.size());
        }
    }

    /** Drains in budget-sized slices, releasing the lock between slices so emitters get in. */
    private void continueFlush(UserEventState state) {
        boolean more = true;
        while (more) {
            state.lock.lock();
            try {
                int delivered = canDeliver(state)
                        ? drain(state, System.nanoTime() + flushBudget.toNanos())
                        : 0;
                more = delivered > 0 && !state.queue.isEmpty() && canDeliver(state);
                if (!more) {
                    state.backgroundFlush = false;
                }
            } finally {
                state.lock.unlock();
            }
        }
    }

    /**
     * Caller holds the user's lock. A failed or timed-out write marks this user's
     * transport unhealthy. While an earlier write to the same channel is still
     * running, nothing new is submitted and the event stays queued.
     */
    private boolean deliver(UserEventState state, AgentEvent event) {
        UserEventChannel channel = state.channel;
        InFlightWrite previous = state.inFlight;
        if (previous != null && previous.channel == channel && previous.isRunning()) {
            log.debug("Earlier write still in flight, keeping event queued [userId={}, type={}]",
                    state.userId, event.getType().getWireName());
            return false;
        }

        InFlightWrite attempt = new InFlightWrite(channel);
        Future<Void> write;
        try {
            write = deliveryExecutor.submit(() -> {
                attempt.started = true;
                try {
                    channel.send(event);
                } finally {
                    attempt.finished = true;
                }
                return null;
            });
        } catch (RejectedExecutionException e) {
            log.warn("Delivery capacity exhausted, keeping event queued [userId={}, type={}]",
                    state.userId, event.getType().getWireName());
            return false;
        }
        attempt.future = write;
        state.inFlight = attempt;

        try {
            write.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
            state.inFlight = null;
            deliveredCount.incrementAndGet();
            return true;
        } catch (TimeoutException e) {
            write.cancel(true);
            log.warn("Event delivery timed out after {}ms, queueing further events [userId={}, type={}]",
                    deliveryTimeout.toMillis(), state.userId, event.getType().getWireName());
        } catch (ExecutionException e) {
            state.inFlight = null;
            log.warn("Event delivery failed, queueing further events [userId={}, type={}]: {}",
                    state.userId, event.getType().getWireName(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            write.cancel(true);
            log.warn("Interrupted while delivering event [userId={}]", state.userId);
        }
        state.transportHealthy = false;
        return false;
    }

    private void enqueue(UserEventState state, AgentEvent event) {
        queuedCount.incrementAndGet();
        if (state.queue.offer(event)) {
            droppedCount.incrementAndGet();
            log.warn("Pending queue full, dropped oldest event [userId={}, capacity={}]",
                    state.userId, queueCapacity);
        }
        log.debug("Event queued [userId={}, type={}, pending={}]",
                state.userId, event.getType().getWireName(), state.queue.size());
    }

    private AgentEvent truncationMarker(String userId, long dropped) {
        return AgentEvent.builder()
                .type(AgentEventType.EVENTS_TRUNCATED)
                .userId(userId)
                .payload(Map.of(
                        "dropped_events", dropped,
                        "message", dropped + " earlier update(s) were dropped while you were disconnected"))
                .timestamp(clock.millis())
                .build();
    }

    private UserEventState stateFor(String userId) {
        return states.computeIfAbsent(userId, id -> new UserEventState(id, queueCapacity));
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    private static final class UserEventState {
        private final String userId;
        private final ReentrantLock lock = new ReentrantLock();
        private final PendingEventQueue queue;
        private volatile UserEventChannel channel;
        private volatile boolean transportHealthy = true;
        private InFlightWrite inFlight;
        private boolean backgroundFlush;

        private UserEventState(String userId, int capacity) {
            this.userId = userId;
            this.queue = new PendingEventQueue(capacity);
        }
    }

    /** A submitted channel write. Cancelling its future does not mean its thread has let go. */
    private static final class InFlightWrite {
        private final UserEventChannel channel;
        private volatile Future<Void> future;
        private volatile boolean started;
        private volatile boolean finished;

        private InFlightWrite(UserEventChannel channel) {
            this.channel = channel;
        }

        private boolean isRunning() {
            if (started) {
                return !finished;
            }
            return future != null && !future.isDone();
        }
    }
}
