package org.tramway.http.middleware;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.extern.slf4j.Slf4j;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.dto.ErrorResponse;

@Slf4j
public class RateLimitMiddleware implements Middleware {

    public static final String LIMIT_HEADER = "x-ratelimit-limit";
    public static final String REMAINING_HEADER = "x-ratelimit-remaining";

    private final RateLimiter limiter;

    public RateLimitMiddleware(RateLimiterConfig config) {
        this(new RateLimiter(config));
    }

    public RateLimitMiddleware(RateLimiter limiter) {
        this.limiter = limiter;
    }

    @Override
    public Response handle(Request request, Response response, Next next) throws Exception {
        RateLimiterConfig config = limiter.getConfig();
        if (config.getSkipPaths().stream().anyMatch(request.getPath()::startsWith)) {
            return next.proceed(request, response);
        }

        RateLimitResult result = limiter.check(request.ip());
        if (!result.allowed()) {
            log.debug("Rate limit exceeded for {}", request.ip());
            return response.status(HttpResponseStatus.TOO_MANY_REQUESTS)
                    .header(LIMIT_HEADER, config.getMaxRequests())
                    .header(REMAINING_HEADER, 0)
                    .header(HttpHeaderNames.RETRY_AFTER, result.retryAfterSeconds())
                    .json(ErrorResponse.builder()
                            .error("Too Many Requests")
                            .message(config.getMessage())
                            .retryAfter(result.retryAfterSeconds())
                            .build());
        }

        return next.proceed(request, response)
                .header(LIMIT_HEADER, config.getMaxRequests())
                .header(REMAINING_HEADER, result.remaining());
    }

}
