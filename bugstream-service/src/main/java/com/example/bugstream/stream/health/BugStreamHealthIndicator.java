package com.example.bugstream.stream.health;

import com.example.bugstream.stream.service.BugStreamingService;
import com.example.bugstream.stream.service.ConnectionRegistry;
import com.example.bugstream.stream.service.EventIngestionQueues;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reported as {@code bugStream}. DOWN once the service has shut down or a queue is backlogged.
 */
@Component("bugStream")
@RequiredArgsConstructor
public class BugStreamHealthIndicator implements HealthIndicator {

    private final BugStreamingService bugStreamingService;
    private final ConnectionRegistry connectionRegistry;
    private final EventIngestionQueues queues;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("connections", connectionRegistry.size());
        details.put("queuedEvents", queues.bugQueueDepth());
        details.put("queuedAnalytics", queues.analyticsQueueDepth());
        details.put("droppedEvents", queues.droppedBugEvents());
        details.put("droppedAnalytics", queues.droppedAnalyticsEvents());

        boolean backlogged = queues.isBacklogged();
        details.put("queueBacklog", backlogged);
        details.put("shutdown", bugStreamingService.isShutdown());

        Health.Builder builder = backlogged || bugStreamingService.isShutdown() ? Health.down() : Health.up();
        return builder.withDetails(details).build();
    }
}
