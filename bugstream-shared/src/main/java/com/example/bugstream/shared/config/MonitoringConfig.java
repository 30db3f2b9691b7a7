package com.example.bugstream.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the streaming service: connection lifecycle, fan-out volume and queue depth.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder bugStreamMetrics() {
        return registry -> {
            registry.counter("bugstream.messages.delivered", "status", "success");
            registry.counter("bugstream.messages.delivered", "status", "failed");

            Timer.builder("bugstream.delivery.tick")
                    .description("Time taken to drain and fan out one delivery batch")
                    .register(registry);

            Timer.builder("bugstream.connection.duration")
                    .description("Lifetime of closed streaming connections")
                    .register(registry);

            registry.counter("bugstream.errors", "type", "transport");
            registry.counter("bugstream.errors", "type", "protocol");
        };
    }

    @Bean
    public BugStreamMetricsCollector bugStreamMetricsCollector(MeterRegistry registry) {
        return new BugStreamMetricsCollector(registry);
    }

    public static class BugStreamMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public BugStreamMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void incrementCounter(String name, double amount, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMillis, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMillis, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, double value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set((long) value);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
