package com.example.bugstream.shared.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public final class Constants {

    private Constants() {}

    public static final String TOKEN_QUERY_PARAM = "token";
    public static final String BEARER_PREFIX = "Bearer ";

    public static final class CloseCodes {
        private CloseCodes() {}
        public static final int NORMAL = 1000;
        public static final int GOING_AWAY = 1001;
        public static final int INTERNAL_ERROR = 1011;
        public static final int TRY_AGAIN_LATER = 1013;

        public static final String REASON_OVERLOADED = "Server overloaded - maximum connections reached";
        public static final String REASON_TIMEOUT = "Connection timeout";
        public static final String REASON_SHUTDOWN = "Server shutting down";
        public static final String REASON_INTERNAL_ERROR = "Internal server error";
    }

    public static final class TelemetryEvents {
        private TelemetryEvents() {}
        public static final String CONNECTED = "websocket_connected";
        public static final String DISCONNECTED = "websocket_disconnected";
        public static final String SUBSCRIBED = "websocket_subscribed";
        public static final String UNSUBSCRIBED = "websocket_unsubscribed";
        public static final String BUG_CREATED = "bug_created_streamed";
        public static final String BUG_UPDATED = "bug_updated_streamed";
        public static final String BUG_STATUS_CHANGED = "bug_status_changed_streamed";
        public static final String BUG_ASSIGNED = "bug_assigned_streamed";
        public static final String BUG_COMMENTED = "bug_commented_streamed";
        public static final String ANALYTICS_UPDATED = "analytics_updated_streamed";
    }

    public enum StreamType {
        BUG_UPDATES("bug_updates"),
        NEW_BUGS("new_bugs"),
        STATUS_CHANGES("status_changes"),
        ASSIGNMENTS("assignments"),
        COMMENTS("comments"),
        RESOLUTIONS("resolutions"),
        ANALYTICS("analytics"),
        ERROR_PATTERNS("error_patterns"),
        USER_ACTIONS("user_actions");

        /** Stream types that require an authenticated connection. */
        public static final Set<StreamType> SENSITIVE = EnumSet.of(ANALYTICS, ERROR_PATTERNS, USER_ACTIONS);

        private final String value;

        StreamType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public boolean isSensitive() {
            return SENSITIVE.contains(this);
        }

        public static Optional<StreamType> find(String value) {
            return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
        }

        @JsonCreator
        public static StreamType fromValue(String value) {
            return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown stream type: " + value));
        }
    }

    public enum StreamFormat {
        JSON("json"),
        COMPACT("compact"),
        DETAILED("detailed");

        private final String value;

        StreamFormat(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public static Optional<StreamFormat> find(String value) {
            return Arrays.stream(values()).filter(f -> f.value.equals(value)).findFirst();
        }

        @JsonCreator
        public static StreamFormat fromValue(String value) {
            return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown stream format: " + value));
        }
    }

    public enum MessageType {
        SUBSCRIPTION_SUCCESS("subscription_success"),
        SUBSCRIPTION_ERROR("subscription_error"),
        EVENT("event"),
        HEARTBEAT("heartbeat"),
        ERROR("error");

        private final String value;

        MessageType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static MessageType fromValue(String value) {
            return Arrays.stream(values())
                    .filter(t -> t.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown message type: " + value));
        }
    }

    public enum BugEventType {
        CREATED("created"),
        UPDATED("updated"),
        STATUS_CHANGED("status_changed"),
        ASSIGNED("assigned"),
        COMMENTED("commented"),
        RESOLVED("resolved"),
        REOPENED("reopened");

        private final String value;

        BugEventType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static BugEventType fromValue(String value) {
            return Arrays.stream(values())
                    .filter(t -> t.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown bug event type: " + value));
        }
    }

    public enum AnalyticsType {
        SUMMARY("summary"),
        TRENDS("trends"),
        PATTERNS("patterns"),
        PERFORMANCE("performance");

        private final String value;

        AnalyticsType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static AnalyticsType fromValue(String value) {
            return Arrays.stream(values())
                    .filter(t -> t.value.equals(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown analytics type: " + value));
        }
    }

    public enum ControlAction {
        AUTHENTICATE("authenticate"),
        SUBSCRIBE("subscribe"),
        UNSUBSCRIBE("unsubscribe"),
        HEARTBEAT("heartbeat");

        private final String value;

        ControlAction(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public static Optional<ControlAction> find(String value) {
            return Arrays.stream(values()).filter(a -> a.value.equals(value)).findFirst();
        }
    }

    public enum OverflowPolicy {
        DROP_OLDEST,
        REJECT_NEW
    }

    public enum EventSource {
        API("api"),
        UI("ui"),
        SYSTEM("system"),
        WEBHOOK("webhook");

        private final String value;

        EventSource(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
