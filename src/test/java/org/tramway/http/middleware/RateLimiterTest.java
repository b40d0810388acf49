package org.tramway.http.middleware;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {

    static final class ManualClock extends Clock {

        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final ManualClock clock = new ManualClock();
    private final RateLimiter limiter = new RateLimiter(RateLimiterConfig.builder()
            .maxRequests(3)
            .window(Duration.ofSeconds(10))
            .build(), clock);

    @Test
    void countsDownRemainingRequests() {
        assertEquals(2, limiter.check("1.1.1.1").remaining());
        assertEquals(1, limiter.check("1.1.1.1").remaining());
        assertEquals(0, limiter.check("1.1.1.1").remaining());
    }

    @Test
    void rejectsOnceWindowIsExhausted() {
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.check("1.1.1.1").allowed());
        }
        clock.advance(Duration.ofSeconds(4));

        RateLimitResult result = limiter.check("1.1.1.1");

        assertFalse(result.allowed());
        assertEquals(0, result.remaining());
        assertEquals(6, result.retryAfterSeconds());
    }

    @Test
    void keysAreCountedIndependently() {
        for (int i = 0; i < 3; i++) {
            limiter.check("1.1.1.1");
        }

        assertFalse(limiter.check("1.1.1.1").allowed());
        assertTrue(limiter.check("2.2.2.2").allowed());
    }

    @Test
    void windowResetsAfterExpiry() {
        for (int i = 0; i < 4; i++) {
            limiter.check("1.1.1.1");
        }
        clock.advance(Duration.ofSeconds(10));

        RateLimitResult result = limiter.check("1.1.1.1");

        assertTrue(result.allowed());
        assertEquals(2, result.remaining());
    }

    @Test
    void expiredWindowsArePurgedWhenTableGrows() {
        for (int i = 0; i <= 10_000; i++) {
            limiter.check("10.0." + (i / 256) + "." + (i % 256));
        }
        clock.advance(Duration.ofSeconds(11));

        limiter.check("fresh");

        assertEquals(1, limiter.trackedKeys());
    }

}
