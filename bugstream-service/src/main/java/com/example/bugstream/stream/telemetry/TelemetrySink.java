package com.example.bugstream.stream.telemetry;

import java.util.Map;

/**
 * Receives named lifecycle events with structured properties.
 */
public interface TelemetrySink {

    void track(String eventName, Map<String, Object> properties);
}
