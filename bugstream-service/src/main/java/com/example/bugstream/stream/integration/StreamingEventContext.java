package com.example.bugstream.stream.integration;

import com.example.bugstream.shared.util.Constants.EventSource;

/**
 * Who or what caused a bug lifecycle change. A blank correlation id is replaced with a generated one.
 */
public record StreamingEventContext(String triggeredBy, EventSource source, String correlationId) {

    public static StreamingEventContext system(String triggeredBy) {
        return new StreamingEventContext(triggeredBy, EventSource.SYSTEM, null);
    }
}
