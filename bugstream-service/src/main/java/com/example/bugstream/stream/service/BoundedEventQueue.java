package com.example.bugstream.stream.service;

import com.example.bugstream.shared.util.Constants.OverflowPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Strict FIFO buffer between event producers and the delivery loop. Offers never block: once the
 * capacity is reached the {@link OverflowPolicy} decides whether the oldest event or the new one is lost.
 */
@Slf4j
public class BoundedEventQueue<T> {

    private final String name;
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private final int depthWarningThreshold;

    private final Deque<T> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean backlogged;

    public BoundedEventQueue(String name, int capacity, OverflowPolicy overflowPolicy, int depthWarningThreshold) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.overflowPolicy = overflowPolicy;
        this.depthWarningThreshold = depthWarningThreshold;
    }

    /**
     * @return false only when the queue is full and the policy is {@link OverflowPolicy#REJECT_NEW}
     */
    public boolean offer(T item) {
        lock.lock();
        try {
            if (items.size() >= capacity) {
                long total = dropped.incrementAndGet();
                if (overflowPolicy == OverflowPolicy.REJECT_NEW) {
                    logOverflow(total, "rejecting new event");
                    return false;
                }
                items.pollFirst();
                logOverflow(total, "dropping oldest event");
            }
            items.addLast(item);
            if (!backlogged && items.size() >= depthWarningThreshold) {
                backlogged = true;
                log.warn("Queue '{}' depth reached {} (warning threshold {}). Delivery is falling behind.",
                        name, items.size(), depthWarningThreshold);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes up to {@code maxItems} events from the head, in arrival order.
     */
    public List<T> drain(int maxItems) {
        lock.lock();
        try {
            int count = Math.min(maxItems, items.size());
            List<T> batch = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                batch.add(items.pollFirst());
            }
            if (backlogged && items.size() < depthWarningThreshold) {
                backlogged = false;
                log.info("Queue '{}' depth back to {}", name, items.size());
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isBacklogged() {
        return backlogged;
    }

    public String getName() {
        return name;
    }

    private void logOverflow(long total, String action) {
        // first overflow, then every thousandth
        if (total == 1 || total % 1000 == 0) {
            log.warn("Queue '{}' is full (capacity {}), {}. Total dropped: {}", name, capacity, action, total);
        }
    }
}
