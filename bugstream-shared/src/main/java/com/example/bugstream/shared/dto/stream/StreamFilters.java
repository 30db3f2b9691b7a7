package com.example.bugstream.shared.dto.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * Per-subscription predicate over the bug snapshot. Unset or empty fields match everything.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamFilters {

    private static final StreamFilters NONE = StreamFilters.builder().build();

    Set<String> status;
    Set<String> severity;
    Set<String> assignedTo;
    Set<String> bugType;
    Set<String> priority;
    Boolean includeResolved;
    Boolean includeArchived;
    Boolean realTimeOnly;
    String search;

    public static StreamFilters none() {
        return NONE;
    }
}
