package com.example.bugstream.shared.dto.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Current state of a bug report at the moment an update event was produced.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BugSnapshot {
    @NotBlank(message = "Bug ID is required")
    String id;
    String title;
    String description;
    String status;
    String severity;
    String priority;
    @JsonProperty("bug_type")
    String bugType;
    @JsonProperty("assigned_to")
    String assignedTo;
    @JsonProperty("reported_by")
    String reportedBy;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("updated_at")
    Instant updatedAt;
    List<String> tags;
}
