package com.example.bugstream.stream.model;

import com.example.bugstream.stream.transport.StreamTransport;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One live client link and the subscriptions it owns.
 */
@Getter
public class StreamConnection {

    private final String id;
    private final StreamTransport transport;
    private final ConnectionMetadata metadata;
    private final Instant connectedAt;
    private final Map<String, StreamSubscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicInteger consecutiveSendFailures = new AtomicInteger();

    @Setter
    private volatile Instant lastActivity;
    private volatile boolean authenticated;
    private volatile String userId = "";
    private volatile String apiKey = "";

    public StreamConnection(String id, StreamTransport transport, ConnectionMetadata metadata, Instant connectedAt) {
        this.id = id;
        this.transport = transport;
        this.metadata = metadata != null ? metadata : ConnectionMetadata.unknown();
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public void markAuthenticated(String userId, String apiKey) {
        this.userId = userId;
        this.apiKey = apiKey;
        this.authenticated = true;
    }

    public boolean isOpen() {
        return transport.isOpen();
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public Optional<StreamSubscription> findSubscription(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    /**
     * Snapshot safe to iterate while other threads subscribe or unsubscribe.
     */
    public List<StreamSubscription> subscriptionSnapshot() {
        return new ArrayList<>(subscriptions.values());
    }

    /**
     * Adds the subscription unless the connection already holds {@code maxSubscriptions}.
     */
    public synchronized boolean addSubscriptionIfBelow(StreamSubscription subscription, int maxSubscriptions) {
        if (subscriptions.size() >= maxSubscriptions) {
            return false;
        }
        subscriptions.put(subscription.getId(), subscription);
        return true;
    }

    public Optional<StreamSubscription> removeSubscription(String subscriptionId) {
        return Optional.ofNullable(subscriptions.remove(subscriptionId));
    }

    public Collection<StreamSubscription> clearSubscriptions() {
        List<StreamSubscription> removed = subscriptionSnapshot();
        subscriptions.clear();
        return removed;
    }

    public Duration age(Instant now) {
        return Duration.between(connectedAt, now);
    }
}
