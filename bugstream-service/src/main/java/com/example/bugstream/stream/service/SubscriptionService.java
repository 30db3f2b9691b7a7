package com.example.bugstream.stream.service;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.dto.stream.StreamFilters;
import com.example.bugstream.shared.util.Constants.MessageType;
import com.example.bugstream.shared.util.Constants.StreamFormat;
import com.example.bugstream.shared.util.Constants.StreamType;
import com.example.bugstream.shared.util.Constants.TelemetryEvents;
import com.example.bugstream.shared.util.IdGenerator;
import com.example.bugstream.stream.model.StreamConnection;
import com.example.bugstream.stream.model.StreamSubscription;
import com.example.bugstream.stream.telemetry.TelemetrySink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies subscribe and unsubscribe requests to a connection's subscription set. Every rejection
 * is answered with a {@code subscription_error}; the connection stays open.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionService {

    public static final String ERROR_TYPE_REQUIRED = "Stream type required";
    public static final String ERROR_AUTH_REQUIRED = "Authentication required for this stream type";
    public static final String ERROR_LIMIT_REACHED = "Maximum subscriptions per connection reached";
    public static final String ERROR_ID_REQUIRED = "Subscription ID required";
    public static final String ERROR_NOT_FOUND = "Subscription not found";

    private final ConnectionRegistry connectionRegistry;
    private final StreamMessageFactory messageFactory;
    private final TelemetrySink telemetrySink;
    private final AppProperties appProperties;
    private final Clock clock;

    public Optional<StreamSubscription> subscribe(StreamConnection connection, StreamType type,
                                                  StreamFilters filters, StreamFormat format) {
        if (type == null) {
            reject(connection, ERROR_TYPE_REQUIRED);
            return Optional.empty();
        }
        if (type.isSensitive() && !connection.isAuthenticated()) {
            log.warn("Connection {} requested {} stream without authentication", connection.getId(), type.getValue());
            reject(connection, ERROR_AUTH_REQUIRED);
            return Optional.empty();
        }

        StreamSubscription subscription = StreamSubscription.builder()
                .id(IdGenerator.subscriptionId())
                .connectionId(connection.getId())
                .type(type)
                .filters(filters)
                .format(format)
                .createdAt(Instant.now(clock))
                .build();

        int maxSubscriptions = appProperties.getStream().getMaxSubscriptionsPerConnection();
        if (!connection.addSubscriptionIfBelow(subscription, maxSubscriptions)) {
            log.warn("Connection {} reached the limit of {} subscriptions", connection.getId(), maxSubscriptions);
            reject(connection, ERROR_LIMIT_REACHED);
            return Optional.empty();
        }

        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("type", subscription.getType());
        echo.put("filters", subscription.getFilters());
        echo.put("format", subscription.getFormat());
        connectionRegistry.send(connection,
                messageFactory.create(MessageType.SUBSCRIPTION_SUCCESS, subscription.getId(), echo, null));

        track(TelemetryEvents.SUBSCRIBED, connection, subscription.getId(), subscription.getType());
        log.info("Subscription {} created on connection {} (type={}, format={}, user='{}')",
                subscription.getId(), connection.getId(), type.getValue(), subscription.getFormat().getValue(),
                connection.getUserId());
        return Optional.of(subscription);
    }

    public boolean unsubscribe(StreamConnection connection, String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            reject(connection, ERROR_ID_REQUIRED);
            return false;
        }

        Optional<StreamSubscription> removed = connection.removeSubscription(subscriptionId);
        if (removed.isEmpty()) {
            reject(connection, ERROR_NOT_FOUND);
            return false;
        }

        connectionRegistry.send(connection, messageFactory.create(MessageType.SUBSCRIPTION_SUCCESS, subscriptionId,
                Map.of("message", "Subscription removed"), null));

        track(TelemetryEvents.UNSUBSCRIBED, connection, subscriptionId, removed.get().getType());
        log.info("Subscription {} removed from connection {}", subscriptionId, connection.getId());
        return true;
    }

    /**
     * Answers a client-initiated heartbeat with the current server time.
     */
    public void heartbeatAck(StreamConnection connection) {
        connectionRegistry.send(connection, messageFactory.createHeartbeat());
    }

    private void reject(StreamConnection connection, String error) {
        connectionRegistry.send(connection, messageFactory.createSubscriptionError(error));
    }

    private void track(String eventName, StreamConnection connection, String subscriptionId, StreamType type) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("connectionId", connection.getId());
        properties.put("subscriptionId", subscriptionId);
        properties.put("type", type.getValue());
        if (connection.isAuthenticated()) {
            properties.put("userId", connection.getUserId());
        }
        telemetrySink.track(eventName, properties);
    }
}
