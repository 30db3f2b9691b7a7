package com.example.bugstream.stream.service;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The two independent ingestion buffers: bug updates and analytics updates.
 */
@Component
@Slf4j
public class EventIngestionQueues {

    private final BoundedEventQueue<BugUpdateEvent> bugEvents;
    private final BoundedEventQueue<AnalyticsUpdateEvent> analyticsEvents;

    public EventIngestionQueues(AppProperties appProperties) {
        AppProperties.Queue queue = appProperties.getQueue();
        this.bugEvents = new BoundedEventQueue<>("bug-events", queue.getBugCapacity(),
                queue.getOverflowPolicy(), queue.getDepthWarningThreshold());
        this.analyticsEvents = new BoundedEventQueue<>("analytics-events", queue.getAnalyticsCapacity(),
                queue.getOverflowPolicy(), queue.getDepthWarningThreshold());
        log.info("Ingestion queues ready (bug capacity={}, analytics capacity={}, overflow={})",
                queue.getBugCapacity(), queue.getAnalyticsCapacity(), queue.getOverflowPolicy());
    }

    public boolean enqueueBugEvent(BugUpdateEvent event) {
        return bugEvents.offer(event);
    }

    public boolean enqueueAnalyticsEvent(AnalyticsUpdateEvent event) {
        return analyticsEvents.offer(event);
    }

    public List<BugUpdateEvent> drainBugEvents(int maxEvents) {
        return bugEvents.drain(maxEvents);
    }

    public List<AnalyticsUpdateEvent> drainAnalyticsEvents(int maxEvents) {
        return analyticsEvents.drain(maxEvents);
    }

    public int bugQueueDepth() {
        return bugEvents.size();
    }

    public int analyticsQueueDepth() {
        return analyticsEvents.size();
    }

    public long droppedBugEvents() {
        return bugEvents.droppedCount();
    }

    public long droppedAnalyticsEvents() {
        return analyticsEvents.droppedCount();
    }

    public boolean isBacklogged() {
        return bugEvents.isBacklogged() || analyticsEvents.isBacklogged();
    }
}
