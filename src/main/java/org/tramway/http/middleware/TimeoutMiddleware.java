package org.tramway.http.middleware;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;
import org.tramway.exception.RequestCancelledException;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.dto.ErrorResponse;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds the time the rest of the chain may take. On expiry the request is cancelled,
 * the inner work is interrupted and the client gets {@code 408 Request Timeout}.
 */
@Slf4j
public class TimeoutMiddleware implements Middleware, AutoCloseable {

    private final Duration timeout;
    private final ExecutorService executor;

    public TimeoutMiddleware(Duration timeout) {
        this(timeout, Executors.newCachedThreadPool(new DefaultThreadFactory("tramway-timeout", true)));
    }

    public TimeoutMiddleware(Duration timeout, ExecutorService executor) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public Response handle(Request request, Response response, Next next) throws Exception {
        Future<Response> future = executor.submit(() -> next.proceed(request, response));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            request.cancel();
            future.cancel(true);
            log.warn("{} {} timed out after {}ms", request.getMethod(), request.getPath(), timeout.toMillis());
            return new Response()
                    .status(HttpResponseStatus.REQUEST_TIMEOUT)
                    .json(ErrorResponse.of("Request Timeout"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RequestCancelledException("Interrupted while waiting for " + request.getPath());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

}
