package com.example.bugstream.shared.dto.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class EventMetadata {
    String triggeredBy;
    String source;
    String correlationId;
}
