package com.example.bugstream.stream.model;

import com.example.bugstream.shared.dto.stream.StreamFilters;
import com.example.bugstream.shared.util.Constants.StreamFormat;
import com.example.bugstream.shared.util.Constants.StreamType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A client registration for one stream type. Holds the owning connection by id only.
 */
@Getter
@ToString(exclude = "sequence")
public class StreamSubscription {

    private final String id;
    private final String connectionId;
    private final StreamType type;
    private final StreamFilters filters;
    private final StreamFormat format;
    private final Instant createdAt;
    private volatile Instant lastActivity;
    private final AtomicLong sequence = new AtomicLong();

    @Builder
    private StreamSubscription(String id, String connectionId, StreamType type, StreamFilters filters,
                               StreamFormat format, Instant createdAt) {
        this.id = id;
        this.connectionId = connectionId;
        this.type = type;
        this.filters = filters != null ? filters : StreamFilters.none();
        this.format = format != null ? format : StreamFormat.JSON;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    /**
     * Marks a delivery and returns its 1-based position in this subscription's event stream.
     */
    public long nextSequence(Instant now) {
        this.lastActivity = now;
        return sequence.incrementAndGet();
    }
}
