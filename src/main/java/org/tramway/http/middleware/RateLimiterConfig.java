package org.tramway.http.middleware;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Set;

@Getter
@Builder
public class RateLimiterConfig {

    @Builder.Default
    private final int maxRequests = 100;

    @Builder.Default
    private final Duration window = Duration.ofSeconds(60);

    @Builder.Default
    private final String message = "Too many requests. Please try again later.";

    /**
     * Path prefixes that bypass the limiter entirely, e.g. health checks.
     */
    @Builder.Default
    private final Set<String> skipPaths = Set.of();

    public static RateLimiterConfig defaults() {
        return RateLimiterConfig.builder().build();
    }

}
