package com.example.bugstream.shared.dto.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageMetadata {
    String correlationId;
    Long sequenceNumber;
}
