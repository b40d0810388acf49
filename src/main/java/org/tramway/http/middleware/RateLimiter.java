package org.tramway.http.middleware;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fixed-window request counter keyed by client. Safe for concurrent use.
 */
@Slf4j
public class RateLimiter {

    private static final int PURGE_THRESHOLD = 10_000;

    private final RateLimiterConfig config;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC());
    }

    public RateLimiter(RateLimiterConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public RateLimitResult check(String key) {
        Instant now = clock.instant();
        Window window = windows.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now, config.getWindow())) {
                return new Window(now, 1);
            }
            return new Window(current.start, current.count + 1);
        });

        if (windows.size() > PURGE_THRESHOLD) {
            purge(now);
        }

        if (window.count > config.getMaxRequests()) {
            Duration left = Duration.between(now, window.start.plus(config.getWindow()));
            long retryAfter = Math.max(1, (left.toMillis() + 999) / 1000);
            return new RateLimitResult(false, 0, retryAfter);
        }
        return new RateLimitResult(true, config.getMaxRequests() - window.count, 0);
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    int trackedKeys() {
        return windows.size();
    }

    private void purge(Instant now) {
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().isExpired(now, config.getWindow()));
        log.debug("Purged {} expired rate limit windows", before - windows.size());
    }

    private static final class Window {
        private final Instant start;
        private final int count;

        private Window(Instant start, int count) {
            this.start = start;
            this.count = count;
        }

        private boolean isExpired(Instant now, Duration length) {
            return !now.isBefore(start.plus(length));
        }
    }

}
