package com.example.bugstream.shared.config;

import com.example.bugstream.shared.util.Constants.OverflowPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

@Data
@Validated
public class AppProperties {

    @Valid
    private final Stream stream = new Stream();
    @Valid
    private final Delivery delivery = new Delivery();
    @Valid
    private final Queue queue = new Queue();
    @Valid
    private final Integration integration = new Integration();
    private final Security security = new Security();
    private final Service service = new Service();

    @Data
    public static class Service {
        private String name = "bugstream";
    }

    @Data
    public static class Stream {
        @NotBlank
        private String path = "/api/stream";
        @Positive
        private int maxConnections = 1000;
        @Positive
        private int maxSubscriptionsPerConnection = 50;
        @Positive
        private long heartbeatInterval = 30000L;
        @Positive
        private int maxPayloadBytes = 1024 * 1024;
        @Positive
        private int maxConsecutiveSendFailures = 3;
    }

    @Data
    public static class Delivery {
        @Positive
        private long interval = 1000L;
        @Positive
        private int bugBatchSize = 100;
        @Positive
        private int analyticsBatchSize = 50;
    }

    @Data
    public static class Queue {
        @Positive
        private int bugCapacity = 10000;
        @Positive
        private int analyticsCapacity = 5000;
        @NotNull
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
        @Positive
        private int depthWarningThreshold = 5000;
    }

    @Data
    public static class Integration {
        @Positive
        private int bufferSize = 100;
        @Positive
        private long flushInterval = 2000L;
    }

    @Data
    public static class Security {
        /** API key to user id. */
        private Map<String, String> apiKeys = new HashMap<>();
    }
}
