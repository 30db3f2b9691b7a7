package com.example.bugstream.stream.telemetry;

import com.example.bugstream.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsTelemetrySink implements TelemetrySink {

    private final MonitoringConfig.BugStreamMetricsCollector metricsCollector;

    @Override
    public void track(String eventName, Map<String, Object> properties) {
        metricsCollector.incrementCounter("bugstream.telemetry.events", "event", eventName);
        log.info("[TELEMETRY] {} {}", eventName, properties);
    }
}
