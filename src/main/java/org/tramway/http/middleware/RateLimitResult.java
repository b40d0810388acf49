package org.tramway.http.middleware;

/**
 * Outcome of one {@link RateLimiter#check(String)} call.
 *
 * @param allowed      whether the request fits in the current window
 * @param remaining    requests left in the window after this one
 * @param retryAfterSeconds seconds until the window resets; zero when allowed
 */
public record RateLimitResult(boolean allowed, int remaining, long retryAfterSeconds) {
}
