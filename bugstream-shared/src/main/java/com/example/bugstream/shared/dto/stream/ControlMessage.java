package com.example.bugstream.shared.dto.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client to server control frame. Action, type and format stay raw strings so that unknown
 * values can be answered with a protocol error instead of failing the whole parse.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ControlMessage {
    private String action;
    private String subscriptionId;
    private String type;
    private StreamFilters filters;
    private String format;
    private String authToken;
}
