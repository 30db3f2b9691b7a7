package com.example.bugstream.stream.service;

import com.example.bugstream.shared.aspect.Monitored;
import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.dto.stream.StreamingStats;
import com.example.bugstream.shared.util.Constants.CloseCodes;
import com.example.bugstream.stream.model.StreamConnection;
import com.example.bugstream.stream.model.StreamSubscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the streaming engine. Producers hand events in here; the delivery and liveness
 * loops run on a single shared scheduler thread so their passes never overlap.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BugStreamingService {

    private final AppProperties appProperties;
    private final ConnectionRegistry connectionRegistry;
    private final EventIngestionQueues queues;
    private final DeliveryScheduler deliveryScheduler;
    private final LivenessMonitor livenessMonitor;
    private final Scheduler streamScheduler;
    private final Clock clock;

    private final Disposable.Composite loops = Disposables.composite();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    @PostConstruct
    public void initialize() {
        Duration deliveryInterval = Duration.ofMillis(appProperties.getDelivery().getInterval());
        Duration heartbeatInterval = Duration.ofMillis(appProperties.getStream().getHeartbeatInterval());

        loops.add(Flux.interval(deliveryInterval, streamScheduler)
                .onBackpressureDrop()
                .doOnNext(tick -> runSafely("delivery", deliveryScheduler::tick))
                .subscribe());
        loops.add(Flux.interval(heartbeatInterval, streamScheduler)
                .onBackpressureDrop()
                .doOnNext(tick -> runSafely("liveness", livenessMonitor::runPass))
                .subscribe());

        log.info("Bug streaming service initialized on path {} (max connections={}, delivery every {}ms, heartbeat every {}ms)",
                appProperties.getStream().getPath(), appProperties.getStream().getMaxConnections(),
                deliveryInterval.toMillis(), heartbeatInterval.toMillis());
    }

    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down bug streaming service");
        loops.dispose();
        int closed = connectionRegistry.closeAll(CloseCodes.GOING_AWAY, CloseCodes.REASON_SHUTDOWN);
        log.info("Bug streaming service shut down, {} connections closed", closed);
    }

    /**
     * Queues a bug event for the next delivery pass. Returns immediately.
     *
     * @return false if the queue refused the event
     */
    @Monitored("ingest")
    public boolean broadcastBugUpdate(BugUpdateEvent event) {
        boolean accepted = queues.enqueueBugEvent(event);
        log.debug("Bug event {} ({}) for bug {} {}", event.getEventId(), event.getEventType(),
                event.getBugId(), accepted ? "queued" : "rejected");
        return accepted;
    }

    @Monitored("ingest")
    public boolean broadcastAnalyticsUpdate(AnalyticsUpdateEvent event) {
        boolean accepted = queues.enqueueAnalyticsEvent(event);
        log.debug("Analytics event {} ({}) {}", event.getEventId(), event.getAnalyticsType(),
                accepted ? "queued" : "rejected");
        return accepted;
    }

    public StreamingStats getStreamingStats() {
        List<StreamConnection> connections = connectionRegistry.connections();
        Instant now = Instant.now(clock);

        int authenticated = 0;
        int subscriptions = 0;
        long totalAgeSeconds = 0;
        Map<String, Integer> byType = new TreeMap<>();
        for (StreamConnection connection : connections) {
            if (connection.isAuthenticated()) {
                authenticated++;
            }
            totalAgeSeconds += connection.age(now).getSeconds();
            for (StreamSubscription subscription : connection.subscriptionSnapshot()) {
                subscriptions++;
                byType.merge(subscription.getType().getValue(), 1, Integer::sum);
            }
        }

        return StreamingStats.builder()
                .totalConnections(connections.size())
                .authenticatedConnections(authenticated)
                .totalSubscriptions(subscriptions)
                .subscriptionsByType(byType)
                .queuedEvents(queues.bugQueueDepth())
                .queuedAnalytics(queues.analyticsQueueDepth())
                .droppedEvents(queues.droppedBugEvents())
                .droppedAnalytics(queues.droppedAnalyticsEvents())
                .averageConnectionDuration(connections.isEmpty() ? 0 : totalAgeSeconds / connections.size())
                .build();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private void runSafely(String loop, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Error during {} pass: {}", loop, e.getMessage(), e);
        }
    }
}
