package com.example.bugstream.stream.service;

import com.example.bugstream.shared.dto.stream.MessageMetadata;
import com.example.bugstream.shared.dto.stream.StreamMessage;
import com.example.bugstream.shared.util.Constants.MessageType;
import com.example.bugstream.shared.util.IdGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class StreamMessageFactory {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Generic factory for any server to client message.
     */
    public StreamMessage create(MessageType type, String subscriptionId, Object data, MessageMetadata metadata) {
        return StreamMessage.builder()
                .messageId(IdGenerator.messageId())
                .type(type)
                .subscriptionId(subscriptionId)
                .data(data)
                .timestamp(Instant.now(clock))
                .metadata(metadata)
                .build();
    }

    public StreamMessage create(MessageType type, Object data) {
        return create(type, null, data, null);
    }

    public StreamMessage createHandshake(String connectionId, boolean authenticated) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("connectionId", connectionId);
        data.put("authenticated", authenticated);
        data.put("serverTime", Instant.now(clock));
        return create(MessageType.HEARTBEAT, data);
    }

    public StreamMessage createHeartbeat() {
        return create(MessageType.HEARTBEAT, Map.of("serverTime", Instant.now(clock)));
    }

    public StreamMessage createError(String error, String details) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        if (details != null) {
            data.put("details", details);
        }
        return create(MessageType.ERROR, data);
    }

    public StreamMessage createSubscriptionError(String error) {
        return create(MessageType.SUBSCRIPTION_ERROR, Map.of("error", error));
    }

    public StreamMessage createEvent(String subscriptionId, Object payload, String correlationId, long sequenceNumber) {
        MessageMetadata metadata = MessageMetadata.builder()
                .correlationId(correlationId)
                .sequenceNumber(sequenceNumber)
                .build();
        return create(MessageType.EVENT, subscriptionId, payload, metadata);
    }

    /**
     * @throws IllegalStateException if the payload cannot be represented as JSON
     */
    public String serialize(StreamMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize stream message " + message.getMessageId(), e);
        }
    }
}
