package com.example.bugstream.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method (or every method of a type) for latency and call-count metrics through
 * {@link MonitoringAspect}. Failures are also counted under {@code bugstream.errors}.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {
    /**
     * Operation category used as a metric name segment (e.g. "ingest", "delivery").
     */
    String value();
}
