package com.example.bugstream.shared.dto.event;

import com.example.bugstream.shared.dto.Correlated;
import com.example.bugstream.shared.util.Constants.BugEventType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A change to a bug report, produced by the bug lifecycle and consumed once by the delivery scheduler.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BugUpdateEvent implements Correlated {
    String eventId;
    @NotNull(message = "Event type is required")
    BugEventType eventType;
    @NotBlank(message = "Bug ID is required")
    String bugId;
    @NotNull(message = "Bug snapshot is required")
    @Valid
    BugSnapshot bug;
    List<FieldChange> changes;
    Instant timestamp;
    EventMetadata metadata;

    @Override
    public String correlationId() {
        return metadata != null ? metadata.getCorrelationId() : null;
    }
}
