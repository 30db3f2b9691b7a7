package com.example.bugstream.shared.dto.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldChange {
    String field;
    Object previousValue;
    Object newValue;
    String changedBy;
    String reason;
}
