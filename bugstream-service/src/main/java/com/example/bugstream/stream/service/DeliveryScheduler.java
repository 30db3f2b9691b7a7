package com.example.bugstream.stream.service;

import com.example.bugstream.shared.aspect.Monitored;
import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.config.MonitoringConfig;
import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.stream.model.StreamConnection;
import com.example.bugstream.stream.model.StreamSubscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Drains the ingestion queues in bounded batches and fans each event out to every matching
 * subscription. Events reach a given subscription in queue order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DeliveryScheduler {

    private final EventIngestionQueues queues;
    private final ConnectionRegistry connectionRegistry;
    private final EventMatcher eventMatcher;
    private final EventFormatter eventFormatter;
    private final StreamMessageFactory messageFactory;
    private final AppProperties appProperties;
    private final MonitoringConfig.BugStreamMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * One delivery pass over both queues.
     *
     * @return number of event messages written
     */
    @Monitored("delivery")
    public int tick() {
        long start = clock.millis();
        int delivered = deliverBugEvents() + deliverAnalyticsEvents();

        metricsCollector.recordTimer("bugstream.delivery.tick", clock.millis() - start);
        metricsCollector.setGauge("bugstream.queue.depth", queues.bugQueueDepth(), "queue", "bug");
        metricsCollector.setGauge("bugstream.queue.depth", queues.analyticsQueueDepth(), "queue", "analytics");
        return delivered;
    }

    int deliverBugEvents() {
        List<BugUpdateEvent> events = queues.drainBugEvents(appProperties.getDelivery().getBugBatchSize());
        if (events.isEmpty()) {
            return 0;
        }

        List<StreamConnection> connections = connectionRegistry.connections();
        int delivered = 0;
        for (BugUpdateEvent event : events) {
            try {
                for (StreamConnection connection : connections) {
                    for (StreamSubscription subscription : connection.subscriptionSnapshot()) {
                        if (eventMatcher.matches(event, subscription)) {
                            Object payload = eventFormatter.format(event, subscription.getFormat());
                            if (deliver(connection, subscription, payload, event.correlationId())) {
                                delivered++;
                            }
                        }
                    }
                }
            } catch (RuntimeException e) {
                log.error("Failed to fan out bug event {}: {}", event.getEventId(), e.getMessage(), e);
            }
        }
        log.debug("Delivered {} bug events as {} messages to {} connections", events.size(), delivered, connections.size());
        return delivered;
    }

    int deliverAnalyticsEvents() {
        List<AnalyticsUpdateEvent> events = queues.drainAnalyticsEvents(appProperties.getDelivery().getAnalyticsBatchSize());
        if (events.isEmpty()) {
            return 0;
        }

        List<StreamConnection> connections = connectionRegistry.connections();
        int delivered = 0;
        for (AnalyticsUpdateEvent event : events) {
            try {
                for (StreamConnection connection : connections) {
                    for (StreamSubscription subscription : connection.subscriptionSnapshot()) {
                        if (eventMatcher.matches(event, subscription)) {
                            Object payload = eventFormatter.format(event, subscription.getFormat());
                            if (deliver(connection, subscription, payload, null)) {
                                delivered++;
                            }
                        }
                    }
                }
            } catch (RuntimeException e) {
                log.error("Failed to fan out analytics event {}: {}", event.getEventId(), e.getMessage(), e);
            }
        }
        log.debug("Delivered {} analytics events as {} messages", events.size(), delivered);
        return delivered;
    }

    /**
     * Closed or closing transports are skipped; their own close path cleans them up.
     */
    private boolean deliver(StreamConnection connection, StreamSubscription subscription, Object payload, String correlationId) {
        if (!connection.isOpen()) {
            return false;
        }
        long sequence = subscription.nextSequence(Instant.now(clock));
        boolean sent = connectionRegistry.send(connection,
                messageFactory.createEvent(subscription.getId(), payload, correlationId, sequence));
        metricsCollector.incrementCounter("bugstream.messages.delivered", "status", sent ? "success" : "failed");
        return sent;
    }
}
