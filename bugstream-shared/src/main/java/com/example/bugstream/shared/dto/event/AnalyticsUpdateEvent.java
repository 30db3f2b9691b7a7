package com.example.bugstream.shared.dto.event;

import com.example.bugstream.shared.util.Constants.AnalyticsType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsUpdateEvent {
    String eventId;
    @NotNull(message = "Analytics type is required")
    AnalyticsType analyticsType;
    AnalyticsData data;
    TimeRange timeRange;
    Instant timestamp;
}
