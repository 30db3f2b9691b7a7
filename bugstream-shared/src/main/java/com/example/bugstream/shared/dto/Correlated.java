package com.example.bugstream.shared.dto;

/**
 * Implemented by payloads that carry a correlation id across producer and delivery.
 */
public interface Correlated {

    String correlationId();
}
