package org.tramway.http.middleware;

import org.junit.jupiter.api.Test;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.common.HttpMethod;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseDecoratorMiddlewareTest {

    @Test
    void helmetAddsSecurityHeaders() throws Exception {
        Response response = new MiddlewareChain().use(new HelmetMiddleware())
                .execute(Request.of(HttpMethod.GET, "/"), new Response(), (request, res) -> res.send("ok"));

        assertEquals("nosniff", response.header("x-content-type-options"));
        assertEquals("DENY", response.header("x-frame-options"));
        assertEquals("1; mode=block", response.header("x-xss-protection"));
        assertEquals("max-age=31536000; includeSubDomains", response.header("strict-transport-security"));
        assertEquals("default-src 'self'", response.header("content-security-policy"));
        assertEquals("none", response.header("x-permitted-cross-domain-policies"));
        assertEquals("strict-origin-when-cross-origin", response.header("referrer-policy"));
    }

    @Test
    void requestIdIsSharedBetweenAttributeAndHeader() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        Response response = new MiddlewareChain().use(new RequestIdMiddleware())
                .execute(Request.of(HttpMethod.GET, "/"), new Response(), (request, res) -> {
                    seen.set(request.attribute(RequestIdMiddleware.ATTRIBUTE, String.class));
                    return res.send("ok");
                });

        assertNotNull(seen.get());
        assertEquals(seen.get(), response.header(RequestIdMiddleware.HEADER));
        assertEquals(36, seen.get().length());
    }

    @Test
    void responseTimeIsReportedInMillis() throws Exception {
        Response response = new MiddlewareChain().use(new ResponseTimeMiddleware())
                .execute(Request.of(HttpMethod.GET, "/"), new Response(), (request, res) -> res.send("ok"));

        assertTrue(response.header(ResponseTimeMiddleware.HEADER).matches("\\d+ms"));
    }

    @Test
    void loggerPassesResponseAndErrorsThrough() throws Exception {
        MiddlewareChain chain = new MiddlewareChain().use(new LoggerMiddleware());

        Response response = chain.execute(Request.of(HttpMethod.GET, "/"), new Response(), (request, res) -> res.status(202).send("ok"));
        assertEquals(202, response.statusCode());

        assertThrows(IllegalStateException.class, () -> chain.execute(Request.of(HttpMethod.GET, "/"), new Response(),
                (request, res) -> {
                    throw new IllegalStateException("boom");
                }));
    }

}
