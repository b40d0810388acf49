package org.tramway.http.middleware;

import org.tramway.http.Request;
import org.tramway.http.Response;

import java.util.UUID;

public class RequestIdMiddleware implements Middleware {

    public static final String HEADER = "x-request-id";
    public static final String ATTRIBUTE = "requestId";

    @Override
    public Response handle(Request request, Response response, Next next) throws Exception {
        String requestId = UUID.randomUUID().toString();
        request.setAttribute(ATTRIBUTE, requestId);
        return next.proceed(request, response).header(HEADER, requestId);
    }

}
