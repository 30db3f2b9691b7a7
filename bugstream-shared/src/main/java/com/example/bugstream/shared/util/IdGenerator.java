package com.example.bugstream.shared.util;

import java.util.UUID;

/**
 * Generates prefixed, process-unique identifiers, e.g. {@code conn_1718200000000_3f9a2c1b7}.
 */
public final class IdGenerator {

    public static final String CONNECTION_PREFIX = "conn";
    public static final String SUBSCRIPTION_PREFIX = "sub";
    public static final String MESSAGE_PREFIX = "msg";
    public static final String EVENT_PREFIX = "evt";
    public static final String CORRELATION_PREFIX = "corr";

    private IdGenerator() {}

    public static String connectionId() {
        return next(CONNECTION_PREFIX);
    }

    public static String subscriptionId() {
        return next(SUBSCRIPTION_PREFIX);
    }

    public static String messageId() {
        return next(MESSAGE_PREFIX);
    }

    public static String eventId() {
        return next(EVENT_PREFIX);
    }

    public static String correlationId() {
        return next(CORRELATION_PREFIX);
    }

    private static String next(String prefix) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return prefix + "_" + System.currentTimeMillis() + "_" + random;
    }
}
