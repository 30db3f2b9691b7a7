package com.example.bugstream.stream.controller;

import com.example.bugstream.shared.config.CorrelationIdFilter;
import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.dto.event.EventMetadata;
import com.example.bugstream.shared.dto.stream.StreamingStats;
import com.example.bugstream.shared.util.IdGenerator;
import com.example.bugstream.stream.service.BugStreamingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/stream-admin")
@RequiredArgsConstructor
@Slf4j
public class StreamAdminController {

    private final BugStreamingService bugStreamingService;
    private final Clock clock;

    @GetMapping("/stats")
    public ResponseEntity<StreamingStats> getStats() {
        return ResponseEntity.ok(bugStreamingService.getStreamingStats());
    }

    @PostMapping("/events/bugs")
    public ResponseEntity<Map<String, Boolean>> publishBugEvent(
            @Valid @RequestBody BugUpdateEvent request,
            @RequestHeader(value = CorrelationIdFilter.CORRELATION_ID_HEADER, required = false) String correlationId) {
        BugUpdateEvent event = completeBugEvent(request, correlationId);
        log.info("Received {} event {} for bug {}", event.getEventType().getValue(), event.getEventId(), event.getBugId());
        boolean accepted = bugStreamingService.broadcastBugUpdate(event);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", accepted));
    }

    @PostMapping("/events/analytics")
    public ResponseEntity<Map<String, Boolean>> publishAnalyticsEvent(@Valid @RequestBody AnalyticsUpdateEvent request) {
        AnalyticsUpdateEvent event = request.toBuilder()
                .eventId(request.getEventId() != null ? request.getEventId() : IdGenerator.eventId())
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : Instant.now(clock))
                .build();
        log.info("Received {} analytics event {}", event.getAnalyticsType().getValue(), event.getEventId());
        boolean accepted = bugStreamingService.broadcastAnalyticsUpdate(event);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", accepted));
    }

    private BugUpdateEvent completeBugEvent(BugUpdateEvent request, String headerCorrelationId) {
        EventMetadata metadata = request.getMetadata();
        if (metadata == null || metadata.getCorrelationId() == null) {
            metadata = EventMetadata.builder()
                    .triggeredBy(metadata != null ? metadata.getTriggeredBy() : null)
                    .source(metadata != null ? metadata.getSource() : null)
                    .correlationId(headerCorrelationId != null ? headerCorrelationId : IdGenerator.correlationId())
                    .build();
        }
        return request.toBuilder()
                .eventId(request.getEventId() != null ? request.getEventId() : IdGenerator.eventId())
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : Instant.now(clock))
                .metadata(metadata)
                .build();
    }
}
