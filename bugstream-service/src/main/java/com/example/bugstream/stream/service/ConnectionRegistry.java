package com.example.bugstream.stream.service;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.config.MonitoringConfig;
import com.example.bugstream.shared.dto.stream.StreamMessage;
import com.example.bugstream.shared.util.Constants.CloseCodes;
import com.example.bugstream.shared.util.Constants.TelemetryEvents;
import com.example.bugstream.shared.util.IdGenerator;
import com.example.bugstream.stream.model.ConnectionMetadata;
import com.example.bugstream.stream.model.StreamConnection;
import com.example.bugstream.stream.model.StreamSubscription;
import com.example.bugstream.stream.security.ApiKeyValidator;
import com.example.bugstream.stream.telemetry.TelemetrySink;
import com.example.bugstream.stream.transport.StreamTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live {@link StreamConnection}. This is the only place a connection is removed, and
 * removal always takes the connection's subscriptions with it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final Map<String, StreamConnection> connections = new ConcurrentHashMap<>();

    private final AppProperties appProperties;
    private final ApiKeyValidator apiKeyValidator;
    private final TelemetrySink telemetrySink;
    private final StreamMessageFactory messageFactory;
    private final MonitoringConfig.BugStreamMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * Registers a new transport. Emits an empty {@link Optional} when the connection cap is reached,
     * in which case the transport has already been closed with {@link CloseCodes#TRY_AGAIN_LATER}.
     */
    public Mono<Optional<StreamConnection>> accept(StreamTransport transport, String authToken, ConnectionMetadata metadata) {
        String connectionId = IdGenerator.connectionId();
        StreamConnection connection = new StreamConnection(connectionId, transport, metadata, Instant.now(clock));

        log.info("New streaming connection {} from {} (user agent: {})",
                connectionId, connection.getMetadata().getIpAddress(), connection.getMetadata().getUserAgent());

        if (!register(connection)) {
            log.warn("Rejecting connection {}: limit of {} connections reached",
                    connectionId, appProperties.getStream().getMaxConnections());
            transport.close(CloseCodes.TRY_AGAIN_LATER, CloseCodes.REASON_OVERLOADED);
            return Mono.just(Optional.empty());
        }

        Mono<Boolean> authentication = StringUtils.hasText(authToken)
                ? authenticate(connection, authToken)
                : Mono.just(false);

        return authentication.map(authenticated -> {
            send(connection, messageFactory.createHandshake(connectionId, connection.isAuthenticated()));

            Map<String, Object> properties = new HashMap<>();
            properties.put("connectionId", connectionId);
            properties.put("authenticated", connection.isAuthenticated());
            properties.put("ip", connection.getMetadata().getIpAddress());
            telemetrySink.track(TelemetryEvents.CONNECTED, properties);
            return Optional.of(connection);
        });
    }

    private synchronized boolean register(StreamConnection connection) {
        if (connections.size() >= appProperties.getStream().getMaxConnections()) {
            return false;
        }
        connections.put(connection.getId(), connection);
        return true;
    }

    /**
     * Validates the token and, on success, marks the connection authenticated. Never errors:
     * a rejected or failed validation leaves the connection as it was.
     */
    public Mono<Boolean> authenticate(StreamConnection connection, String token) {
        return apiKeyValidator.validate(token)
                .map(validation -> {
                    if (!validation.valid()) {
                        log.warn("Streaming authentication rejected for connection {}", connection.getId());
                        return false;
                    }
                    connection.markAuthenticated(validation.userId(), validation.apiKey());
                    log.info("Streaming connection {} authenticated as user {}", connection.getId(), connection.getUserId());
                    return true;
                })
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    log.warn("Streaming authentication failed for connection {}: {}", connection.getId(), error.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Closes the transport, drops the connection and all of its subscriptions.
     *
     * @return false when the connection was already gone
     */
    public boolean close(String connectionId, int code, String reason) {
        StreamConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }

        Collection<StreamSubscription> removed = connection.clearSubscriptions();
        try {
            connection.getTransport().close(code, reason);
        } catch (RuntimeException e) {
            log.warn("Error closing transport for connection {}: {}", connectionId, e.getMessage());
        }

        long durationMillis = connection.age(Instant.now(clock)).toMillis();
        metricsCollector.recordTimer("bugstream.connection.duration", durationMillis);

        log.info("Streaming connection {} closed (code={}, reason='{}', user='{}', subscriptions={})",
                connectionId, code, reason, connection.getUserId(), removed.size());

        Map<String, Object> properties = new HashMap<>();
        properties.put("connectionId", connectionId);
        properties.put("code", code);
        properties.put("reason", reason);
        properties.put("userId", connection.getUserId());
        properties.put("duration", durationMillis);
        telemetrySink.track(TelemetryEvents.DISCONNECTED, properties);
        return true;
    }

    /**
     * Protocol-level transport failure. The connection is torn down, never left half alive.
     */
    public void handleTransportError(String connectionId, Throwable error) {
        String userId = find(connectionId).map(StreamConnection::getUserId).orElse(null);
        log.error("Streaming connection {} error (user='{}'): {}", connectionId, userId, error.getMessage());
        metricsCollector.incrementCounter("bugstream.errors", "type", "transport");
        close(connectionId, CloseCodes.INTERNAL_ERROR, CloseCodes.REASON_INTERNAL_ERROR);
    }

    /**
     * Writes a message if the transport is open. Failures are logged and counted; a run of
     * consecutive failures tears the connection down.
     *
     * @return true if the frame was handed to the transport
     */
    public boolean send(StreamConnection connection, StreamMessage message) {
        if (!connection.isOpen()) {
            return false;
        }
        try {
            connection.getTransport().send(messageFactory.serialize(message));
            connection.setLastActivity(Instant.now(clock));
            connection.getConsecutiveSendFailures().set(0);
            return true;
        } catch (RuntimeException e) {
            int failures = connection.getConsecutiveSendFailures().incrementAndGet();
            log.error("Failed to send {} message to connection {} (consecutive failures: {}): {}",
                    message.getType().getValue(), connection.getId(), failures, e.getMessage());
            metricsCollector.incrementCounter("bugstream.errors", "type", "transport");

            if (failures >= appProperties.getStream().getMaxConsecutiveSendFailures()) {
                log.warn("Connection {} failed {} consecutive sends. Closing it.", connection.getId(), failures);
                close(connection.getId(), CloseCodes.INTERNAL_ERROR, CloseCodes.REASON_INTERNAL_ERROR);
            }
            return false;
        }
    }

    public void touch(StreamConnection connection) {
        connection.setLastActivity(Instant.now(clock));
    }

    public int closeAll(int code, String reason) {
        int closed = 0;
        for (String connectionId : new ArrayList<>(connections.keySet())) {
            if (close(connectionId, code, reason)) {
                closed++;
            }
        }
        return closed;
    }

    public Optional<StreamConnection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public List<StreamConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
