package com.example.bugstream.stream.service;

import com.example.bugstream.shared.dto.event.AnalyticsUpdateEvent;
import com.example.bugstream.shared.dto.event.BugSnapshot;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.dto.stream.StreamFilters;
import com.example.bugstream.shared.util.Constants.BugEventType;
import com.example.bugstream.shared.util.Constants.StreamType;
import com.example.bugstream.stream.model.StreamSubscription;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether an event belongs on a subscription: the stream type must accept the event type
 * and every non-empty filter must accept the bug.
 */
@Component
public class EventMatcher {

    private static final Set<String> RESOLVED_STATUSES = Set.of("resolved", "closed");

    public boolean matches(BugUpdateEvent event, StreamSubscription subscription) {
        return typeMatches(subscription.getType(), event.getEventType())
                && filtersMatch(subscription.getFilters(), event.getBug());
    }

    public boolean matches(AnalyticsUpdateEvent event, StreamSubscription subscription) {
        return subscription.getType() == StreamType.ANALYTICS;
    }

    /**
     * {@code bug_updates} takes every bug event; the other bug streams take exactly one event type.
     * Analytics, error pattern and user action streams never take bug events.
     */
    static boolean typeMatches(StreamType streamType, BugEventType eventType) {
        return switch (streamType) {
            case BUG_UPDATES -> true;
            case NEW_BUGS -> eventType == BugEventType.CREATED;
            case STATUS_CHANGES -> eventType == BugEventType.STATUS_CHANGED;
            case ASSIGNMENTS -> eventType == BugEventType.ASSIGNED;
            case COMMENTS -> eventType == BugEventType.COMMENTED;
            case RESOLUTIONS -> eventType == BugEventType.RESOLVED;
            default -> false;
        };
    }

    static boolean filtersMatch(StreamFilters filters, BugSnapshot bug) {
        if (filters == null) {
            return true;
        }
        String status = bug != null ? bug.getStatus() : null;

        if (!contains(filters.getStatus(), status)) {
            return false;
        }
        if (!contains(filters.getSeverity(), bug != null ? bug.getSeverity() : null)) {
            return false;
        }
        // unassigned bugs pass an assignee filter
        String assignee = bug != null ? bug.getAssignedTo() : null;
        if (assignee != null && !contains(filters.getAssignedTo(), assignee)) {
            return false;
        }
        if (!contains(filters.getBugType(), bug != null ? bug.getBugType() : null)) {
            return false;
        }
        if (!contains(filters.getPriority(), bug != null ? bug.getPriority() : null)) {
            return false;
        }
        if (Boolean.FALSE.equals(filters.getIncludeResolved())
                && status != null && RESOLVED_STATUSES.contains(status.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return searchMatches(filters.getSearch(), bug);
    }

    private static boolean contains(Collection<String> allowed, String value) {
        if (allowed == null || allowed.isEmpty()) {
            return true;
        }
        return value != null && allowed.contains(value);
    }

    private static boolean searchMatches(String search, BugSnapshot bug) {
        if (search == null || search.isBlank()) {
            return true;
        }
        if (bug == null) {
            return false;
        }
        String needle = search.trim().toLowerCase(Locale.ROOT);
        return containsIgnoreCase(bug.getTitle(), needle) || containsIgnoreCase(bug.getDescription(), needle);
    }

    private static boolean containsIgnoreCase(String text, String lowerNeedle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
