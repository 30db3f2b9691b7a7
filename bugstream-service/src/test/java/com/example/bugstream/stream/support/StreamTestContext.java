package com.example.bugstream.stream.support;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.config.MonitoringConfig;
import com.example.bugstream.shared.dto.event.BugSnapshot;
import com.example.bugstream.shared.dto.event.BugUpdateEvent;
import com.example.bugstream.shared.dto.event.EventMetadata;
import com.example.bugstream.shared.util.Constants.BugEventType;
import com.example.bugstream.shared.util.IdGenerator;
import com.example.bugstream.stream.model.ConnectionMetadata;
import com.example.bugstream.stream.model.StreamConnection;
import com.example.bugstream.stream.security.PropertiesApiKeyValidator;
import com.example.bugstream.stream.service.ConnectionRegistry;
import com.example.bugstream.stream.service.ControlMessageHandler;
import com.example.bugstream.stream.service.DeliveryScheduler;
import com.example.bugstream.stream.service.EventFormatter;
import com.example.bugstream.stream.service.EventIngestionQueues;
import com.example.bugstream.stream.service.EventMatcher;
import com.example.bugstream.stream.service.LivenessMonitor;
import com.example.bugstream.stream.service.StreamMessageFactory;
import com.example.bugstream.stream.service.SubscriptionService;
import com.example.bugstream.stream.telemetry.TelemetrySink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires the streaming engine by hand against a {@link MutableClock}, a simple meter registry and
 * an in-memory telemetry sink. Properties may be changed before the first connection is accepted.
 */
public class StreamTestContext {

    public static final String VALID_KEY = "test-key-0001";
    public static final String VALID_USER = "alice";

    public final AppProperties properties = new AppProperties();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
    public final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MonitoringConfig.BugStreamMetricsCollector metrics =
            new MonitoringConfig.BugStreamMetricsCollector(meterRegistry);
    public final List<TrackedEvent> telemetry = new ArrayList<>();
    public final TelemetrySink telemetrySink = (name, props) -> telemetry.add(new TrackedEvent(name, props));

    public final StreamMessageFactory messageFactory;
    public final ConnectionRegistry registry;
    public final SubscriptionService subscriptions;
    public final ControlMessageHandler controlHandler;
    public final EventIngestionQueues queues;
    public final DeliveryScheduler deliveryScheduler;
    public final LivenessMonitor livenessMonitor;

    public record TrackedEvent(String name, Map<String, Object> properties) {}

    public StreamTestContext() {
        properties.getSecurity().getApiKeys().put(VALID_KEY, VALID_USER);

        messageFactory = new StreamMessageFactory(objectMapper, clock);
        registry = new ConnectionRegistry(properties, new PropertiesApiKeyValidator(properties), telemetrySink,
                messageFactory, metrics, clock);
        subscriptions = new SubscriptionService(registry, messageFactory, telemetrySink, properties, clock);
        controlHandler = new ControlMessageHandler(registry, subscriptions, messageFactory, objectMapper, metrics);
        queues = new EventIngestionQueues(properties);
        deliveryScheduler = new DeliveryScheduler(queues, registry, new EventMatcher(), new EventFormatter(),
                messageFactory, properties, metrics, clock);
        livenessMonitor = new LivenessMonitor(registry, messageFactory, properties, clock);
    }

    public StreamConnection connect(RecordingTransport transport) {
        return connect(transport, null);
    }

    public StreamConnection connect(RecordingTransport transport, String token) {
        StreamConnection connection = registry.accept(transport, token, new ConnectionMetadata("127.0.0.1", "junit", "websocket"))
                .block()
                .orElseThrow(() -> new IllegalStateException("connection rejected"));
        transport.clear();
        return connection;
    }

    public List<String> telemetryNames() {
        return telemetry.stream().map(TrackedEvent::name).collect(java.util.stream.Collectors.toList());
    }

    public static BugSnapshot bug(String id, String status, String severity, String assignedTo) {
        return BugSnapshot.builder()
                .id(id)
                .title("Bug " + id)
                .description("Description of " + id)
                .status(status)
                .severity(severity)
                .priority("normal")
                .bugType("functional")
                .assignedTo(assignedTo)
                .build();
    }

    public BugUpdateEvent bugEvent(BugEventType type, BugSnapshot bug) {
        return BugUpdateEvent.builder()
                .eventId(IdGenerator.eventId())
                .eventType(type)
                .bugId(bug.getId())
                .bug(bug)
                .timestamp(Instant.now(clock))
                .metadata(EventMetadata.builder().correlationId("corr-" + bug.getId()).source("api").build())
                .build();
    }
}
