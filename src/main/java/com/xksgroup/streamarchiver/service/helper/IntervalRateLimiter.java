package com.xksgroup.streamarchiver.service.helper;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Hands out one permit per interval. Callers that arrive early are parked until their slot.
 * Permits are never returned; they simply expire with their slot.
 */
public class IntervalRateLimiter {

    private final String name;
    private final long intervalNanos;
    private long nextFreeSlot;

    public IntervalRateLimiter(String name, Duration interval) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Interval must not be negative: " + interval);
        }
        this.name = name;
        this.intervalNanos = interval.toNanos();
        this.nextFreeSlot = System.nanoTime();
    }

    public void acquire() throws InterruptedException {
        long waitNanos = reserve();
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    /**
     * Claims the next slot and returns how long the caller has to wait for it.
     */
    synchronized long reserve() {
        long now = System.nanoTime();
        long slot = Math.max(nextFreeSlot, now);
        nextFreeSlot = slot + intervalNanos;
        return slot - now;
    }

    public String getName() {
        return name;
    }
}
