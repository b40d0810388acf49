package org.tramway.http.middleware;

import org.tramway.http.Request;
import org.tramway.http.Response;

/**
 * A unit of the middleware chain.
 * <p>
 * Implementations either delegate by returning {@code next.proceed(request, response)},
 * possibly doing work before and after the call, or short-circuit by returning a
 * response without calling {@code next}. Returning {@code null} or calling {@code next}
 * twice is a fault and ends the request with a 500.
 */
@FunctionalInterface
public interface Middleware {

    Response handle(Request request, Response response, Next next) throws Exception;

}
