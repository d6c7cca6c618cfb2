package com.xksgroup.streamarchiver.service.helper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IntervalRateLimiter Tests")
class IntervalRateLimiterTest {

    @Test
    @DisplayName("Should let the first caller through immediately")
    void testFirstPermitIsFree() {
        IntervalRateLimiter limiter = new IntervalRateLimiter("test", Duration.ofSeconds(10));
        assertTrue(limiter.reserve() <= 0);
    }

    @Test
    @DisplayName("Should space consecutive permits by the interval")
    void testPermitsAreSpaced() {
        IntervalRateLimiter limiter = new IntervalRateLimiter("test", Duration.ofSeconds(10));
        limiter.reserve();
        long second = limiter.reserve();
        long third = limiter.reserve();

        assertTrue(second > Duration.ofSeconds(9).toNanos(), "second caller waits about one interval");
        assertTrue(second <= Duration.ofSeconds(10).toNanos());
        assertTrue(third > Duration.ofSeconds(19).toNanos(), "third caller waits about two intervals");
    }

    @Test
    @DisplayName("Should never block with a zero interval")
    void testZeroInterval() {
        IntervalRateLimiter limiter = new IntervalRateLimiter("test", Duration.ZERO);
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.reserve() <= 0);
        }
        assertTimeoutPreemptively(Duration.ofSeconds(1), limiter::acquire);
        assertEquals("test", limiter.getName());
    }

    @Test
    @DisplayName("Should reject negative intervals")
    void testNegativeInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new IntervalRateLimiter("test", Duration.ofSeconds(-1)));
    }
}
