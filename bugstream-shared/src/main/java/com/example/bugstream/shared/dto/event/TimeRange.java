package com.example.bugstream.shared.dto.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class TimeRange {
    Instant start;
    Instant end;
}
