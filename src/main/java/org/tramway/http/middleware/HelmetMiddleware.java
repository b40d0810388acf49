package org.tramway.http.middleware;

import org.tramway.http.Request;
import org.tramway.http.Response;

/**
 * Adds a fixed set of security headers to every response.
 */
public class HelmetMiddleware implements Middleware {

    @Override
    public Response handle(Request request, Response response, Next next) throws Exception {
        return next.proceed(request, response)
                .header("x-content-type-options", "nosniff")
                .header("x-frame-options", "DENY")
                .header("x-xss-protection", "1; mode=block")
                .header("strict-transport-security", "max-age=31536000; includeSubDomains")
                .header("content-security-policy", "default-src 'self'")
                .header("x-permitted-cross-domain-policies", "none")
                .header("referrer-policy", "strict-origin-when-cross-origin");
    }

}
