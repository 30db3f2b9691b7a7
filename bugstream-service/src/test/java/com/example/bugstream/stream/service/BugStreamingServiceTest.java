package com.example.bugstream.stream.service;

import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.dto.stream.StreamingStats;
import com.example.bugstream.shared.util.Constants.BugEventType;
import com.example.bugstream.shared.util.Constants.CloseCodes;
import com.example.bugstream.shared.util.Constants.StreamFormat;
import com.example.bugstream.shared.util.Constants.StreamType;
import com.example.bugstream.stream.model.StreamConnection;
import com.example.bugstream.stream.support.RecordingTransport;
import com.example.bugstream.stream.support.StreamTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static com.example.bugstream.stream.support.StreamTestContext.bug;
import static org.assertj.core.api.Assertions.assertThat;

class BugStreamingServiceTest {

    private StreamTestContext ctx;
    private VirtualTimeScheduler scheduler;
    private BugStreamingService service;

    @BeforeEach
    void setUp() {
        ctx = new StreamTestContext();
        scheduler = VirtualTimeScheduler.create();
        service = new BugStreamingService(ctx.properties, ctx.registry, ctx.queues, ctx.deliveryScheduler,
                ctx.livenessMonitor, scheduler, ctx.clock);
        service.initialize();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        scheduler.dispose();
    }

    @Test
    void deliveryLoopFlushesQueuedEventsEachInterval() {
        RecordingTransport transport = new RecordingTransport();
        StreamConnection connection = ctx.connect(transport);
        ctx.subscriptions.subscribe(connection, StreamType.NEW_BUGS, null, StreamFormat.COMPACT);
        transport.clear();

        assertThat(service.broadcastBugUpdate(ctx.bugEvent(BugEventType.CREATED, bug("b1", "open", "low", null)))).isTrue();
        assertThat(transport.messagesOfType("event")).isEmpty();

        scheduler.advanceTimeBy(Duration.ofMillis(1000));

        assertThat(transport.messagesOfType("event")).hasSize(1);
    }

    @Test
    void livenessLoopHeartbeatsEveryPeriod() {
        RecordingTransport transport = new RecordingTransport();
        ctx.connect(transport);

        scheduler.advanceTimeBy(Duration.ofMillis(30_000));

        assertThat(transport.messagesOfType("heartbeat")).hasSize(1);
    }

    @Test
    void shutdownClosesEveryConnectionWithGoingAway() {
        RecordingTransport a = new RecordingTransport();
        RecordingTransport b = new RecordingTransport();
        ctx.connect(a);
        ctx.connect(b);

        service.shutdown();
        service.shutdown();

        assertThat(ctx.registry.size()).isZero();
        assertThat(a.getCloseCode()).isEqualTo(CloseCodes.GOING_AWAY);
        assertThat(b.getCloseReason()).isEqualTo(CloseCodes.REASON_SHUTDOWN);
        assertThat(a.getCloseCalls()).isEqualTo(1);
        assertThat(service.isShutdown()).isTrue();
    }

    @Test
    void loopsStopAfterShutdown() {
        service.shutdown();
        service.broadcastBugUpdate(ctx.bugEvent(BugEventType.CREATED, bug("b1", "open", "low", null)));

        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertThat(ctx.queues.bugQueueDepth()).isEqualTo(1);
    }

    @Test
    void eventsWithoutTypeAreStillQueued() {
        assertThat(service.broadcastBugUpdate(BugUpdateEvent.builder().eventId("evt-untyped").bugId("b9").build()))
                .isTrue();
        assertThat(service.broadcastAnalyticsUpdate(AnalyticsUpdateEvent.builder().eventId("evt-raw").build()))
                .isTrue();

        assertThat(ctx.queues.bugQueueDepth()).isEqualTo(1);
        assertThat(ctx.queues.analyticsQueueDepth()).isEqualTo(1);
    }

    @Test
    void statsSummarizeConnectionsAndQueues() {
        StreamConnection anonymous = ctx.connect(new RecordingTransport());
        StreamConnection authenticated = ctx.connect(new RecordingTransport(), StreamTestContext.VALID_KEY);
        ctx.subscriptions.subscribe(anonymous, StreamType.BUG_UPDATES, null, StreamFormat.JSON);
        ctx.subscriptions.subscribe(authenticated, StreamType.BUG_UPDATES, null, StreamFormat.JSON);
        ctx.subscriptions.subscribe(authenticated, StreamType.ANALYTICS, null, StreamFormat.JSON);
        service.broadcastBugUpdate(ctx.bugEvent(BugEventType.CREATED, bug("b1", "open", "low", null)));
        ctx.clock.advance(Duration.ofSeconds(20));

        StreamingStats stats = service.getStreamingStats();

        assertThat(stats.getTotalConnections()).isEqualTo(2);
        assertThat(stats.getAuthenticatedConnections()).isEqualTo(1);
        assertThat(stats.getTotalSubscriptions()).isEqualTo(3);
        assertThat(stats.getSubscriptionsByType()).containsEntry("bug_updates", 2).containsEntry("analytics", 1);
        assertThat(stats.getQueuedEvents()).isEqualTo(1);
        assertThat(stats.getQueuedAnalytics()).isZero();
        assertThat(stats.getAverageConnectionDuration()).isEqualTo(20);
    }

    @Test
    void emptyServiceReportsZeroAverageDuration() {
        assertThat(service.getStreamingStats().getAverageConnectionDuration()).isZero();
    }
}
