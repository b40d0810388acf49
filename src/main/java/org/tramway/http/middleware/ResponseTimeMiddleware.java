package org.tramway.http.middleware;

import org.tramway.http.Request;
import org.tramway.http.Response;

import java.util.concurrent.TimeUnit;

public class ResponseTimeMiddleware implements Middleware {

    public static final String HEADER = "x-response-time";

    @Override
    public Response handle(Request request, Response response, Next next) throws Exception {
        long start = System.nanoTime();
        Response result = next.proceed(request, response);
        return result.header(HEADER, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) + "ms");
    }

}
