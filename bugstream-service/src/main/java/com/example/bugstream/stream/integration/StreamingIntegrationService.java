package com.example.bugstream.stream.integration;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.dto.event.AnalyticsData;
import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugSnapshot;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.dto.event.EventMetadata;
import com.example.bugstream.shared.dto.event.FieldChange;
import com.example.bugstream.shared.dto.event.TimeRange;
import com.example.bugstream.shared.util.Constants.AnalyticsType;
import com.example.bugstream.shared.util.Constants.BugEventType;
import com.example.bugstream.shared.util.Constants.TelemetryEvents;
import com.example.bugstream.shared.util.IdGenerator;
import com.example.bugstream.stream.service.BugStreamingService;
import com.example.bugstream.stream.telemetry.TelemetrySink;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Turns bug lifecycle callbacks into stream events. Bug events are buffered and handed to the
 * streaming service in order, either when the buffer fills or on the periodic flush. Analytics
 * events go straight through.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StreamingIntegrationService {

    private static final String STATUS_RESOLVED = "resolved";
    private static final String STATUS_REOPENED = "reopened";

    private final BugStreamingService bugStreamingService;
    private final TelemetrySink telemetrySink;
    private final AppProperties appProperties;
    private final Scheduler streamScheduler;
    private final Clock clock;

    private final List<BugUpdateEvent> buffer = new ArrayList<>();
    // Held from copy through enqueue so concurrent flushes cannot interleave batches.
    private final ReentrantLock flushLock = new ReentrantLock();
    private Disposable flushLoop;

    @PostConstruct
    public void startFlushLoop() {
        Duration interval = Duration.ofMillis(appProperties.getIntegration().getFlushInterval());
        flushLoop = Flux.interval(interval, streamScheduler)
                .onBackpressureDrop()
                .doOnNext(tick -> {
                    try {
                        flush();
                    } catch (RuntimeException e) {
                        log.error("Error flushing integration buffer: {}", e.getMessage(), e);
                    }
                })
                .subscribe();
    }

    @PreDestroy
    public void stopFlushLoop() {
        if (flushLoop != null) {
            flushLoop.dispose();
        }
        flush();
    }

    public BugUpdateEvent onBugCreated(BugSnapshot bug, StreamingEventContext context) {
        String correlationId = correlationIdOf(context);
        log.info("Processing bug creation event for bug {} (triggeredBy={}, correlationId={})",
                bug.getId(), context.triggeredBy(), correlationId);

        BugUpdateEvent event = newEvent(BugEventType.CREATED, bug, null, context, correlationId);
        buffer(event);

        Map<String, Object> properties = baseTelemetry(event, context, correlationId);
        telemetrySink.track(TelemetryEvents.BUG_CREATED, properties);
        return event;
    }

    public BugUpdateEvent onBugUpdated(BugSnapshot bug, List<FieldChange> changes, StreamingEventContext context) {
        String correlationId = correlationIdOf(context);
        List<FieldChange> attributed = changes.stream()
                .map(change -> change.toBuilder().changedBy(context.triggeredBy()).build())
                .collect(Collectors.toList());
        log.info("Processing bug update event for bug {} (fields=[{}], triggeredBy={}, correlationId={})",
                bug.getId(), attributed.stream().map(FieldChange::getField).collect(Collectors.joining(", ")),
                context.triggeredBy(), correlationId);

        BugUpdateEvent event = newEvent(BugEventType.UPDATED, bug, attributed, context, correlationId);
        buffer(event);

        Map<String, Object> properties = baseTelemetry(event, context, correlationId);
        properties.put("changedFields", attributed.size());
        telemetrySink.track(TelemetryEvents.BUG_UPDATED, properties);
        return event;
    }

    /**
     * A move to {@code resolved} or {@code reopened} is published under its own event type so
     * that resolution streams see it.
     */
    public BugUpdateEvent onBugStatusChanged(BugSnapshot bug, String previousStatus, String newStatus,
                                             String reason, StreamingEventContext context) {
        String correlationId = correlationIdOf(context);
        log.info("Processing bug status change for bug {}: {} -> {} (reason={}, correlationId={})",
                bug.getId(), previousStatus, newStatus, reason, correlationId);

        BugEventType eventType = BugEventType.STATUS_CHANGED;
        if (STATUS_RESOLVED.equals(newStatus)) {
            eventType = BugEventType.RESOLVED;
        } else if (STATUS_REOPENED.equals(newStatus)) {
            eventType = BugEventType.REOPENED;
        }

        FieldChange change = FieldChange.builder()
                .field("status")
                .previousValue(previousStatus)
                .newValue(newStatus)
                .changedBy(context.triggeredBy())
                .reason(reason)
                .build();
        BugUpdateEvent event = newEvent(eventType, bug, List.of(change), context, correlationId);
        buffer(event);

        Map<String, Object> properties = baseTelemetry(event, context, correlationId);
        properties.put("previousStatus", previousStatus);
        properties.put("newStatus", newStatus);
        properties.put("reason", reason);
        telemetrySink.track(TelemetryEvents.BUG_STATUS_CHANGED, properties);
        return event;
    }

    public BugUpdateEvent onBugAssigned(BugSnapshot bug, String previousAssignee, String newAssignee,
                                        String reason, StreamingEventContext context) {
        String correlationId = correlationIdOf(context);
        log.info("Processing bug assignment for bug {}: {} -> {} (correlationId={})",
                bug.getId(), previousAssignee, newAssignee, correlationId);

        FieldChange change = FieldChange.builder()
                .field("assigned_to")
                .previousValue(previousAssignee)
                .newValue(newAssignee)
                .changedBy(context.triggeredBy())
                .reason(reason)
                .build();
        BugUpdateEvent event = newEvent(BugEventType.ASSIGNED, bug, List.of(change), context, correlationId);
        buffer(event);

        Map<String, Object> properties = baseTelemetry(event, context, correlationId);
        properties.put("previousAssignee", previousAssignee);
        properties.put("newAssignee", newAssignee);
        properties.put("reason", reason);
        telemetrySink.track(TelemetryEvents.BUG_ASSIGNED, properties);
        return event;
    }

    public BugUpdateEvent onBugCommented(BugSnapshot bug, BugComment comment, StreamingEventContext context) {
        String correlationId = correlationIdOf(context);
        log.info("Processing bug comment {} on bug {} by {} (correlationId={})",
                comment.id(), bug.getId(), comment.author(), correlationId);

        FieldChange change = FieldChange.builder()
                .field("comments")
                .newValue(comment)
                .changedBy(context.triggeredBy())
                .build();
        BugUpdateEvent event = newEvent(BugEventType.COMMENTED, bug, List.of(change), context, correlationId);
        buffer(event);

        Map<String, Object> properties = baseTelemetry(event, context, correlationId);
        properties.put("commentId", comment.id());
        properties.put("author", comment.author());
        telemetrySink.track(TelemetryEvents.BUG_COMMENTED, properties);
        return event;
    }

    public AnalyticsUpdateEvent onAnalyticsUpdated(AnalyticsType analyticsType, AnalyticsData data,
                                                   TimeRange timeRange, StreamingEventContext context) {
        String correlationId = correlationIdOf(context);
        log.info("Processing analytics update ({}) triggeredBy={} correlationId={}",
                analyticsType.getValue(), context.triggeredBy(), correlationId);

        AnalyticsUpdateEvent event = AnalyticsUpdateEvent.builder()
                .eventId(IdGenerator.eventId())
                .analyticsType(analyticsType)
                .data(data)
                .timeRange(timeRange)
                .timestamp(Instant.now(clock))
                .build();
        bugStreamingService.broadcastAnalyticsUpdate(event);

        Map<String, Object> properties = new HashMap<>();
        properties.put("eventId", event.getEventId());
        properties.put("analyticsType", analyticsType.getValue());
        properties.put("triggeredBy", context.triggeredBy());
        properties.put("correlationId", correlationId);
        telemetrySink.track(TelemetryEvents.ANALYTICS_UPDATED, properties);
        return event;
    }

    /**
     * Hands every buffered bug event to the streaming service, oldest first.
     *
     * @return number of events flushed
     */
    public int flush() {
        flushLock.lock();
        try {
            List<BugUpdateEvent> events;
            synchronized (buffer) {
                if (buffer.isEmpty()) {
                    return 0;
                }
                events = new ArrayList<>(buffer);
                buffer.clear();
            }
            log.debug("Flushing {} buffered bug events to the streaming service", events.size());
            events.forEach(bugStreamingService::broadcastBugUpdate);
            return events.size();
        } finally {
            flushLock.unlock();
        }
    }

    public int bufferedEvents() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    private void buffer(BugUpdateEvent event) {
        boolean full;
        synchronized (buffer) {
            buffer.add(event);
            full = buffer.size() >= appProperties.getIntegration().getBufferSize();
        }
        if (full) {
            flush();
        }
    }

    private BugUpdateEvent newEvent(BugEventType eventType, BugSnapshot bug, List<FieldChange> changes,
                                    StreamingEventContext context, String correlationId) {
        return BugUpdateEvent.builder()
                .eventId(IdGenerator.eventId())
                .eventType(eventType)
                .bugId(bug.getId())
                .bug(bug)
                .changes(changes)
                .timestamp(Instant.now(clock))
                .metadata(EventMetadata.builder()
                        .triggeredBy(context.triggeredBy())
                        .source(context.source() != null ? context.source().getValue() : null)
                        .correlationId(correlationId)
                        .build())
                .build();
    }

    private static Map<String, Object> baseTelemetry(BugUpdateEvent event, StreamingEventContext context,
                                                     String correlationId) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("bugId", event.getBugId());
        properties.put("eventId", event.getEventId());
        properties.put("triggeredBy", context.triggeredBy());
        properties.put("correlationId", correlationId);
        return properties;
    }

    private static String correlationIdOf(StreamingEventContext context) {
        return StringUtils.hasText(context.correlationId()) ? context.correlationId() : IdGenerator.correlationId();
    }
}
