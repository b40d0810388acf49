package org.tramway.http.middleware;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.common.HttpMethod;

/**
 * Answers preflight requests itself and decorates all other responses with CORS headers.
 */
public class CorsMiddleware implements Middleware {

    private final CorsOptions options;

    public CorsMiddleware() {
        this(CorsOptions.defaults());
    }

    public CorsMiddleware(CorsOptions options) {
        this.options = options;
    }

    @Override
    public Response handle(Request request, Response response, Next next) throws Exception {
        if (request.getMethod() == HttpMethod.OPTIONS) {
            response.status(HttpResponseStatus.NO_CONTENT)
                    .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, options.getOrigin())
                    .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, String.join(", ", options.getMethods()))
                    .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, String.join(", ", options.getAllowedHeaders()))
                    .header(HttpHeaderNames.ACCESS_CONTROL_MAX_AGE, options.getMaxAge());
            if (options.isCredentials()) {
                response.header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
            }
            return response;
        }

        Response result = next.proceed(request, response)
                .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, options.getOrigin());
        if (options.isCredentials()) {
            result.header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        }
        if (!options.getExposedHeaders().isEmpty()) {
            result.header(HttpHeaderNames.ACCESS_CONTROL_EXPOSE_HEADERS, String.join(", ", options.getExposedHeaders()));
        }
        return result;
    }

}
