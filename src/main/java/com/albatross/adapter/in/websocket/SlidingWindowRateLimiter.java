package com.albatross.adapter.in.websocket;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Counts frames inside a trailing window. Every call is recorded, including rejected ones.
 */
public class SlidingWindowRateLimiter {

    private final int maxEvents;
    private final long windowMillis;
    private final LongSupplier clock;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxEvents, long windowMillis) {
        this(maxEvents, windowMillis, System::currentTimeMillis);
    }

    SlidingWindowRateLimiter(int maxEvents, long windowMillis, LongSupplier clock) {
        if (maxEvents <= 0 || windowMillis <= 0) {
            throw new IllegalArgumentException("maxEvents and windowMillis must be positive");
        }
        this.maxEvents = maxEvents;
        this.windowMillis = windowMillis;
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        long now = clock.getAsLong();
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() > windowMillis) {
            timestamps.pollFirst();
        }
        timestamps.addLast(now);
        return timestamps.size() <= maxEvents;
    }
}
