package com.example.bugstream.stream.integration;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.dto.event.AnalyticsData;
import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugSnapshot;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.dto.event.FieldChange;
import com.example.bugstream.shared.util.Constants.AnalyticsType;
import com.example.bugstream.shared.util.Constants.BugEventType;
import com.example.bugstream.shared.util.Constants.EventSource;
import com.example.bugstream.shared.util.Constants.TelemetryEvents;
import com.example.bugstream.stream.service.BugStreamingService;
import com.example.bugstream.stream.telemetry.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.bugstream.stream.support.StreamTestContext.bug;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StreamingIntegrationServiceTest {

    @Mock
    private BugStreamingService bugStreamingService;
    @Mock
    private TelemetrySink telemetrySink;

    private AppProperties properties;
    private StreamingIntegrationService integration;

    private final StreamingEventContext context = new StreamingEventContext("alice", EventSource.UI, "corr-123");
    private final BugSnapshot bug = bug("b1", "open", "high", null);

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        integration = new StreamingIntegrationService(bugStreamingService, telemetrySink, properties,
                Schedulers.immediate(), Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createdEventIsBufferedUntilFlush() {
        BugUpdateEvent event = integration.onBugCreated(bug, context);

        assertThat(event.getEventType()).isEqualTo(BugEventType.CREATED);
        assertThat(event.getEventId()).startsWith("evt_");
        assertThat(event.getMetadata().getCorrelationId()).isEqualTo("corr-123");
        assertThat(event.getMetadata().getSource()).isEqualTo("ui");
        assertThat(event.getMetadata().getTriggeredBy()).isEqualTo("alice");
        verify(bugStreamingService, never()).broadcastBugUpdate(any());
        verify(telemetrySink).track(eq(TelemetryEvents.BUG_CREATED), anyMap());

        assertThat(integration.flush()).isEqualTo(1);
        verify(bugStreamingService).broadcastBugUpdate(event);
        assertThat(integration.bufferedEvents()).isZero();
    }

    @Test
    void fullBufferFlushesInOrder() {
        properties.getIntegration().setBufferSize(3);

        BugUpdateEvent first = integration.onBugCreated(bug, context);
        BugUpdateEvent second = integration.onBugAssigned(bug, null, "bob", "triage", context);
        BugUpdateEvent third = integration.onBugCommented(bug, new BugComment("c1", "looking", "bob"), context);

        InOrder order = inOrder(bugStreamingService);
        order.verify(bugStreamingService).broadcastBugUpdate(first);
        order.verify(bugStreamingService).broadcastBugUpdate(second);
        order.verify(bugStreamingService).broadcastBugUpdate(third);
        assertThat(integration.bufferedEvents()).isZero();
    }

    @Test
    void concurrentFlushesKeepProducerOrder() throws Exception {
        properties.getIntegration().setBufferSize(3);
        List<String> enqueued = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch stalled = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            BugUpdateEvent event = invocation.getArgument(0);
            if ("b2".equals(event.getBugId())) {
                stalled.countDown();
                assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            }
            enqueued.add(event.getBugId());
            return true;
        }).when(bugStreamingService).broadcastBugUpdate(any());

        integration.onBugCreated(bug("b1", "open", "high", null), context);
        integration.onBugCreated(bug("b2", "open", "high", null), context);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> periodic = executor.submit(integration::flush);
            assertThat(stalled.await(5, TimeUnit.SECONDS)).isTrue();

            Future<?> producer = executor.submit(() -> {
                integration.onBugCreated(bug("b3", "open", "high", null), context);
                integration.onBugCreated(bug("b4", "open", "high", null), context);
                integration.onBugCreated(bug("b5", "open", "high", null), context);
            });
            long deadline = System.currentTimeMillis() + 5000;
            while (integration.bufferedEvents() < 3 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(integration.bufferedEvents()).isEqualTo(3);

            release.countDown();
            assertThat(periodic.get(5, TimeUnit.SECONDS)).isEqualTo(2);
            producer.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertThat(enqueued).containsExactly("b1", "b2", "b3", "b4", "b5");
        assertThat(integration.bufferedEvents()).isZero();
    }

    @Test
    void statusChangeToResolvedUsesResolvedEventType() {
        BugUpdateEvent resolved = integration.onBugStatusChanged(bug, "in_progress", "resolved", "fixed", context);
        BugUpdateEvent reopened = integration.onBugStatusChanged(bug, "resolved", "reopened", null, context);
        BugUpdateEvent triaged = integration.onBugStatusChanged(bug, "open", "triaged", null, context);

        assertThat(resolved.getEventType()).isEqualTo(BugEventType.RESOLVED);
        assertThat(reopened.getEventType()).isEqualTo(BugEventType.REOPENED);
        assertThat(triaged.getEventType()).isEqualTo(BugEventType.STATUS_CHANGED);

        FieldChange change = resolved.getChanges().get(0);
        assertThat(change.getField()).isEqualTo("status");
        assertThat(change.getPreviousValue()).isEqualTo("in_progress");
        assertThat(change.getNewValue()).isEqualTo("resolved");
        assertThat(change.getChangedBy()).isEqualTo("alice");
        assertThat(change.getReason()).isEqualTo("fixed");
    }

    @Test
    void updateChangesAreAttributedToTrigger() {
        List<FieldChange> changes = List.of(FieldChange.builder().field("title").previousValue("a").newValue("b").build());

        BugUpdateEvent event = integration.onBugUpdated(bug, changes, context);

        assertThat(event.getChanges()).extracting(FieldChange::getChangedBy).containsExactly("alice");
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingCorrelationIdIsGenerated() {
        BugUpdateEvent event = integration.onBugCreated(bug, StreamingEventContext.system("scheduler"));

        assertThat(event.getMetadata().getCorrelationId()).startsWith("corr_");

        ArgumentCaptor<Map<String, Object>> captured = ArgumentCaptor.forClass(Map.class);
        verify(telemetrySink).track(eq(TelemetryEvents.BUG_CREATED), captured.capture());
        assertThat(captured.getValue()).containsEntry("correlationId", event.getMetadata().getCorrelationId());
    }

    @Test
    void analyticsUpdatesBypassTheBuffer() {
        AnalyticsUpdateEvent event = integration.onAnalyticsUpdated(AnalyticsType.PATTERNS,
                AnalyticsData.builder().build(), null, context);

        verify(bugStreamingService).broadcastAnalyticsUpdate(event);
        verify(telemetrySink).track(eq(TelemetryEvents.ANALYTICS_UPDATED), anyMap());
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
    }
}
