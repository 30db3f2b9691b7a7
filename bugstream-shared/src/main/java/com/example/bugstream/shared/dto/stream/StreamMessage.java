package com.example.bugstream.shared.dto.stream;

import com.example.bugstream.shared.util.Constants.MessageType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The only envelope written to a client. One JSON object per WebSocket frame.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamMessage {
    String messageId;
    MessageType type;
    String subscriptionId;
    Object data;
    Instant timestamp;
    MessageMetadata metadata;
}
