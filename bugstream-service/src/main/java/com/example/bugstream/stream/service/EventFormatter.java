package com.example.bugstream.stream.service;

import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugSnapshot;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.util.Constants.StreamFormat;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Projects events into the payload shape a subscription asked for.
 */
@Component
public class EventFormatter {

    public Object format(BugUpdateEvent event, StreamFormat format) {
        return switch (format) {
            case COMPACT -> compact(event);
            case DETAILED -> event;
            case JSON -> json(event);
        };
    }

    public Object format(AnalyticsUpdateEvent event, StreamFormat format) {
        return switch (format) {
            case COMPACT -> compact(event);
            case DETAILED -> event;
            case JSON -> json(event);
        };
    }

    private static Map<String, Object> compact(BugUpdateEvent event) {
        Map<String, Object> compact = new LinkedHashMap<>();
        compact.put("eventId", event.getEventId());
        compact.put("eventType", event.getEventType());
        compact.put("bugId", event.getBugId());
        compact.put("timestamp", event.getTimestamp());
        return compact;
    }

    private static Map<String, Object> json(BugUpdateEvent event) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("eventId", event.getEventId());
        json.put("eventType", event.getEventType());
        json.put("bugId", event.getBugId());
        json.put("bug", summarize(event.getBug()));
        json.put("changes", event.getChanges());
        json.put("timestamp", event.getTimestamp());
        return json;
    }

    private static Map<String, Object> compact(AnalyticsUpdateEvent event) {
        Map<String, Object> compact = new LinkedHashMap<>();
        compact.put("eventId", event.getEventId());
        compact.put("type", event.getAnalyticsType());
        compact.put("timestamp", event.getTimestamp());
        return compact;
    }

    private static Map<String, Object> json(AnalyticsUpdateEvent event) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("eventId", event.getEventId());
        json.put("analyticsType", event.getAnalyticsType());
        json.put("data", event.getData());
        json.put("timestamp", event.getTimestamp());
        return json;
    }

    private static Map<String, Object> summarize(BugSnapshot bug) {
        if (bug == null) {
            return null;
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", bug.getId());
        summary.put("title", bug.getTitle());
        summary.put("status", bug.getStatus());
        summary.put("severity", bug.getSeverity());
        summary.put("assigned_to", bug.getAssignedTo());
        return summary;
    }
}
