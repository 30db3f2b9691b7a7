package com.example.bugstream.shared.dto.stream;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class StreamingStats {
    int totalConnections;
    int authenticatedConnections;
    int totalSubscriptions;
    Map<String, Integer> subscriptionsByType;
    int queuedEvents;
    int queuedAnalytics;
    long droppedEvents;
    long droppedAnalytics;
    /** Mean age of the live connections, in seconds. */
    long averageConnectionDuration;
}
