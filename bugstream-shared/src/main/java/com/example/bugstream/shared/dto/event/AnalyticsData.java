package com.example.bugstream.shared.dto.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyticsData {
    Map<String, Double> metrics;
    List<TrendPoint> trends;
    List<PatternCount> patterns;

    @Value
    @Builder
    @Jacksonized
    public static class TrendPoint {
        String date;
        double value;
    }

    @Value
    @Builder
    @Jacksonized
    public static class PatternCount {
        String pattern;
        long count;
    }
}
