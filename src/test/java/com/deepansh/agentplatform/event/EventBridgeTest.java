package com.deepansh.agentplatform.event;

import com.deepansh.agentplatform.config.AsyncConfig;
import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.exception.IsolationViolationException;
import com.deepansh.agentplatform.resilience.DegradationManager;
import com.deepansh.agentplatform.resilience.DependencyNames;
import com.deepansh.agentplatform.support.RecordingChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventBridgeTest {

    private ThreadPoolTaskExecutor executor;
    private PlatformProperties props;
    private DegradationManager degradationManager;
    private EventBridge bridge;

    @BeforeEach
    void setUp() {
        executor = new AsyncConfig().eventDeliveryExecutor();
        executor.initialize();
        props = new PlatformProperties();
        props.getEvents().setQueueCapacity(10);
        props.getEvents().setDeliveryTimeout(Duration.ofMillis(200));
        degradationManager = new DegradationManager(props, Clock.systemUTC());
        bridge = new EventBridge(props, degradationManager, executor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.getThreadPoolExecutor().shutdownNow();
    }

    @Test
    void emit_liveChannel_deliversImmediately() {
        RecordingChannel channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);

        DeliveryResult result = bridge.emit("alice", event("alice", 1));

        assertThat(result).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(sequence(channel)).containsExactly(1);
        assertThat(bridge.pendingCount("alice")).isZero();
    }

    @Test
    void emit_noChannel_queuesUntilConnect() {
        for (int i = 1; i <= 3; i++) {
            assertThat(bridge.emit("alice", event("alice", i))).isEqualTo(DeliveryResult.QUEUED);
        }
        assertThat(bridge.pendingCount("alice")).isEqualTo(3);

        RecordingChannel channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);

        assertThat(sequence(channel)).containsExactly(1, 2, 3);
        assertThat(bridge.pendingCount("alice")).isZero();
    }

    @Test
    void transportOutage_queuedEventsFlushInOrderBeforeNextEvent() {
        RecordingChannel channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);
        bridge.markTransportHealthy("alice", false);

        for (int i = 1; i <= 5; i++) {
            bridge.emit("alice", event("alice", i));
        }
        assertThat(channel.received()).isEmpty();

        bridge.markTransportHealthy("alice", true);
        bridge.emit("alice", event("alice", 6));

        assertThat(sequence(channel)).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void emit_queueOverflow_dropsOldestAndSendsTruncationMarkerFirst() {
        props.getEvents().setQueueCapacity(3);
        bridge = new EventBridge(props, degradationManager, executor, Clock.systemUTC());

        for (int i = 1; i <= 5; i++) {
            bridge.emit("alice", event("alice", i));
        }
        assertThat(bridge.pendingCount("alice")).isEqualTo(3);

        RecordingChannel channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);

        List<AgentEvent> received = channel.received();
        assertThat(received).hasSize(4);
        assertThat(received.get(0).getType()).isEqualTo(AgentEventType.EVENTS_TRUNCATED);
        assertThat(received.get(0).getPayload()).containsEntry("dropped_events", 2L);
        assertThat(received.get(0).getUserId()).isEqualTo("alice");
        assertThat(sequence(channel)).containsExactly(3, 4, 5);
        assertThat(bridge.getStats().droppedEvents()).isEqualTo(2);
    }

    @Test
    void emit_eventForAnotherUser_throwsIsolationViolation() {
        RecordingChannel channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);

        assertThatThrownBy(() -> bridge.emit("alice", event("bob", 1)))
                .isInstanceOf(IsolationViolationException.class);
        assertThat(channel.received()).isEmpty();
    }

    @Test
    void connect_channelOwnedByAnotherUser_throwsIsolationViolation() {
        assertThatThrownBy(() -> bridge.connect("alice", new RecordingChannel("bob")))
                .isInstanceOf(IsolationViolationException.class);
        assertThat(bridge.hasLiveConnection("alice")).isFalse();
    }

    @Test
    void emit_onlyReachesOwnersChannel() {
        RecordingChannel alice = new RecordingChannel("alice");
        RecordingChannel bob = new RecordingChannel("bob");
        bridge.connect("alice", alice);
        bridge.connect("bob", bob);

        bridge.emitterFor("alice").progressUpdate("t-1", "planner", Map.of("pct", 50));

        assertThat(alice.received()).hasSize(1);
        assertThat(bob.received()).isEmpty();
    }

    @Test
    void emit_failingChannel_queuesAndMarksTransportUnhealthy() {
        RecordingChannel channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);
        channel.failSends(true);

        assertThat(bridge.emit("alice", event("alice", 1))).isEqualTo(DeliveryResult.QUEUED);
        channel.failSends(false);
        // transport stays down until recovery is signalled
        assertThat(bridge.emit("alice", event("alice", 2))).isEqualTo(DeliveryResult.QUEUED);
        assertThat(channel.received()).isEmpty();

        bridge.markTransportHealthy("alice", true);

        assertThat(sequence(channel)).containsExactly(1, 2);
    }

    @Test
    void emit_slowChannel_timesOutWithoutBlockingOtherUsers() throws Exception {
        RecordingChannel slow = new RecordingChannel("alice");
        RecordingChannel fast = new RecordingChannel("bob");
        bridge.connect("alice", slow);
        bridge.connect("bob", fast);
        slow.blockSends();

        CompletableFuture<DeliveryResult> aliceEmit =
                CompletableFuture.supplyAsync(() -> bridge.emit("alice", event("alice", 1)));
        DeliveryResult bobResult = bridge.emit("bob", event("bob", 1));

        assertThat(bobResult).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(aliceEmit.get(2, TimeUnit.SECONDS)).isEqualTo(DeliveryResult.QUEUED);
        assertThat(bridge.pendingCount("alice")).isEqualTo(1);
        slow.release();
    }

    @Test
    void emit_manyHungChannels_doNotStarveHealthyUser() {
        List<RecordingChannel> hung = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            RecordingChannel channel = new RecordingChannel("stuck-" + i);
            channel.hangSends();
            bridge.connect("stuck-" + i, channel);
            hung.add(channel);
        }
        for (int i = 0; i < 6; i++) {
            assertThat(bridge.emit("stuck-" + i, event("stuck-" + i, 1))).isEqualTo(DeliveryResult.QUEUED);
        }

        RecordingChannel bob = new RecordingChannel("bob");
        bridge.connect("bob", bob);

        assertThat(bridge.emit("bob", event("bob", 1))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(sequence(bob)).containsExactly(1);
        hung.forEach(RecordingChannel::release);
    }

    @Test
    void emit_whileEarlierWriteStillHangs_queuesWithoutWaiting() {
        RecordingChannel channel = new RecordingChannel("alice");
        channel.hangSends();
        bridge.connect("alice", channel);
        assertThat(bridge.emit("alice", event("alice", 1))).isEqualTo(DeliveryResult.QUEUED);
        bridge.markTransportHealthy("alice", true);

        long started = System.nanoTime();
        DeliveryResult result = bridge.emit("alice", event("alice", 2));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(result).isEqualTo(DeliveryResult.QUEUED);
        assertThat(elapsedMs).isLessThan(150);
        assertThat(bridge.pendingCount("alice")).isEqualTo(2);
        channel.release();
    }

    @Test
    void connect_backlogOnSlowChannel_returnsWithinBudgetAndFinishesInBackground() throws Exception {
        props.getEvents().setQueueCapacity(20);
        props.getEvents().setDeliveryTimeout(Duration.ofSeconds(1));
        props.getEvents().setFlushBudget(Duration.ofMillis(200));
        bridge = new EventBridge(props, degradationManager, executor, Clock.systemUTC());
        for (int i = 1; i <= 10; i++) {
            bridge.emit("alice", event("alice", i));
        }
        RecordingChannel channel = new RecordingChannel("alice");
        channel.delayEachSend(Duration.ofMillis(150));

        long started = System.nanoTime();
        bridge.connect("alice", channel);
        long connectMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(connectMs).isLessThan(1000);
        assertThat(channel.received().size()).isLessThan(10);

        bridge.emit("alice", event("alice", 11));

        awaitUntil(() -> channel.received().size() == 11, Duration.ofSeconds(5));
        assertThat(sequence(channel))
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 11).boxed().collect(Collectors.toList()));
        assertThat(bridge.pendingCount("alice")).isZero();
    }

    @Test
    void sharedTransportRecovery_flushesQueuedEvents() {
        RecordingChannel channel = new RecordingChannel("alice");
        bridge.connect("alice", channel);
        degradationManager.setServiceStatus(DependencyNames.EVENT_TRANSPORT, false);

        bridge.emit("alice", event("alice", 1));
        bridge.emit("alice", event("alice", 2));
        assertThat(channel.received()).isEmpty();

        degradationManager.setServiceStatus(DependencyNames.EVENT_TRANSPORT, true);

        assertThat(sequence(channel)).containsExactly(1, 2);
    }

    @Test
    void connect_replacesAndClosesPreviousChannel() {
        RecordingChannel first = new RecordingChannel("alice");
        RecordingChannel second = new RecordingChannel("alice");
        bridge.connect("alice", first);
        bridge.connect("alice", second);

        bridge.emit("alice", event("alice", 1));

        assertThat(first.isOpen()).isFalse();
        assertThat(first.received()).isEmpty();
        assertThat(sequence(second)).containsExactly(1);
    }

    @Test
    void disconnect_staleChannel_keepsCurrentOne() {
        RecordingChannel first = new RecordingChannel("alice");
        RecordingChannel second = new RecordingChannel("alice");
        bridge.connect("alice", first);
        bridge.connect("alice", second);

        bridge.disconnect("alice", first);

        assertThat(bridge.hasLiveConnection("alice")).isTrue();
    }

    @Test
    void clearPending_dropsQueuedEvents() {
        bridge.emit("alice", event("alice", 1));
        bridge.emit("alice", event("alice", 2));

        assertThat(bridge.clearPending("alice")).isEqualTo(2);
        assertThat(bridge.pendingCount("alice")).isZero();
        assertThat(bridge.clearPending("nobody")).isZero();
    }

    @Test
    void getStats_reportsPendingPerUser() {
        bridge.emit("alice", event("alice", 1));
        bridge.connect("bob", new RecordingChannel("bob"));
        bridge.emit("bob", event("bob", 1));

        EventBridgeStats stats = bridge.getStats();

        assertThat(stats.pendingByUser()).containsExactly(Map.entry("alice", 1));
        assertThat(stats.connectedUsers()).isEqualTo(1);
        assertThat(stats.deliveredEvents()).isEqualTo(1);
    }

    private static AgentEvent event(String userId, int seq) {
        return AgentEvent.builder()
                .type(AgentEventType.PROGRESS_UPDATE)
                .userId(userId)
                .payload(Map.of("seq", seq))
                .timestamp(System.currentTimeMillis())
                .build();
    }

    private static void awaitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(condition.getAsBoolean()).as("condition met within %s", timeout).isTrue();
    }

    private static List<Integer> sequence(RecordingChannel channel) {
        return channel.received().stream()
                .filter(e -> e.getType() == AgentEventType.PROGRESS_UPDATE)
                .map(e -> (Integer) e.getPayload().get("seq"))
                .toList();
    }
}
