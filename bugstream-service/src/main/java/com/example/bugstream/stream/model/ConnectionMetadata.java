package com.example.bugstream.stream.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Descriptive transport details. Never used for authorization.
 */
@Getter
@ToString
@AllArgsConstructor
public class ConnectionMetadata {

    private static final ConnectionMetadata UNKNOWN = new ConnectionMetadata(null, null, "websocket");

    private final String ipAddress;
    private final String userAgent;
    private final String connectionSource;

    public static ConnectionMetadata unknown() {
        return UNKNOWN;
    }
}
