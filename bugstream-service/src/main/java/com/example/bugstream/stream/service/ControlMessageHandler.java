package com.example.bugstream.stream.service;

import com.example.bugstream.shared.config.MonitoringConfig;
import com.example.bugstream.shared.dto.stream.ControlMessage;
import com.example.bugstream.shared.util.Constants.ControlAction;
import com.example.bugstream.shared.util.Constants.MessageType;
import com.example.bugstream.shared.util.Constants.StreamFormat;
import com.example.bugstream.shared.util.Constants.StreamType;
import com.example.bugstream.stream.model.StreamConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses inbound control frames and dispatches them. Protocol faults are reported to the
 * offending client as {@code error} messages and never close the connection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ControlMessageHandler {

    public static final String ERROR_INVALID_FORMAT = "Invalid message format";
    public static final String ERROR_UNKNOWN_ACTION = "Unknown action";

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionService subscriptionService;
    private final StreamMessageFactory messageFactory;
    private final ObjectMapper objectMapper;
    private final MonitoringConfig.BugStreamMetricsCollector metricsCollector;

    public Mono<Void> handle(String connectionId, String payload) {
        Optional<StreamConnection> found = connectionRegistry.find(connectionId);
        if (found.isEmpty()) {
            return Mono.empty();
        }
        StreamConnection connection = found.get();

        ControlMessage message;
        try {
            message = parse(payload);
        } catch (InvalidControlMessageException e) {
            log.debug("Malformed control message on connection {}: {}", connectionId, e.getMessage());
            metricsCollector.incrementCounter("bugstream.errors", "type", "protocol");
            connectionRegistry.send(connection, messageFactory.createError(ERROR_INVALID_FORMAT, e.getMessage()));
            return Mono.empty();
        }

        connectionRegistry.touch(connection);
        log.debug("Control message on connection {}: action={}, type={}", connectionId, message.getAction(), message.getType());

        Optional<ControlAction> action = ControlAction.find(message.getAction());
        if (action.isEmpty()) {
            metricsCollector.incrementCounter("bugstream.errors", "type", "protocol");
            connectionRegistry.send(connection, messageFactory.createError(ERROR_UNKNOWN_ACTION, null));
            return Mono.empty();
        }

        switch (action.get()) {
            case AUTHENTICATE -> {
                return handleAuthenticate(connection, message);
            }
            case SUBSCRIBE -> handleSubscribe(connection, message);
            case UNSUBSCRIBE -> subscriptionService.unsubscribe(connection, message.getSubscriptionId());
            case HEARTBEAT -> subscriptionService.heartbeatAck(connection);
        }
        return Mono.empty();
    }

    ControlMessage parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidControlMessageException("Empty message");
        }
        try {
            ControlMessage message = objectMapper.readValue(payload, ControlMessage.class);
            if (message == null) {
                throw new InvalidControlMessageException("Message must be a JSON object");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new InvalidControlMessageException(e.getOriginalMessage(), e);
        }
    }

    private Mono<Void> handleAuthenticate(StreamConnection connection, ControlMessage message) {
        if (message.getAuthToken() == null || message.getAuthToken().isBlank()) {
            connectionRegistry.send(connection, messageFactory.create(MessageType.SUBSCRIPTION_ERROR,
                    authenticationResult(connection, "Authentication token required")));
            return Mono.empty();
        }
        return connectionRegistry.authenticate(connection, message.getAuthToken())
                .doOnNext(ignored -> {
                    MessageType type = connection.isAuthenticated()
                            ? MessageType.SUBSCRIPTION_SUCCESS
                            : MessageType.SUBSCRIPTION_ERROR;
                    connectionRegistry.send(connection, messageFactory.create(type, authenticationResult(connection, null)));
                })
                .then();
    }

    private Map<String, Object> authenticationResult(StreamConnection connection, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("authenticated", connection.isAuthenticated());
        data.put("userId", connection.getUserId());
        if (error != null) {
            data.put("error", error);
        }
        return data;
    }

    private void handleSubscribe(StreamConnection connection, ControlMessage message) {
        StreamType type = null;
        if (message.getType() != null) {
            Optional<StreamType> resolved = StreamType.find(message.getType());
            if (resolved.isEmpty()) {
                connectionRegistry.send(connection,
                        messageFactory.createSubscriptionError("Unknown stream type: " + message.getType()));
                return;
            }
            type = resolved.get();
        }

        StreamFormat format = StreamFormat.JSON;
        if (message.getFormat() != null) {
            Optional<StreamFormat> resolved = StreamFormat.find(message.getFormat());
            if (resolved.isEmpty()) {
                connectionRegistry.send(connection,
                        messageFactory.createSubscriptionError("Unknown stream format: " + message.getFormat()));
                return;
            }
            format = resolved.get();
        }

        subscriptionService.subscribe(connection, type, message.getFilters(), format);
    }
}
