package org.tramway.http.middleware;

import lombok.extern.slf4j.Slf4j;
import org.tramway.http.Request;
import org.tramway.http.Response;

import java.util.concurrent.TimeUnit;

/**
 * Logs one line per request once the rest of the chain has produced a response.
 */
@Slf4j
public class LoggerMiddleware implements Middleware {

    @Override
    public Response handle(Request request, Response response, Next next) throws Exception {
        long start = System.nanoTime();
        try {
            Response result = next.proceed(request, response);
            log.info("{} {} {} - {}ms", request.getMethod(), request.getPath(), result.statusCode(), elapsedMillis(start));
            return result;
        } catch (Exception e) {
            log.info("{} {} failed after {}ms: {}", request.getMethod(), request.getPath(), elapsedMillis(start), e.getMessage());
            throw e;
        }
    }

    private static long elapsedMillis(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

}
