package org.tramway.http.middleware;

import org.junit.jupiter.api.Test;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.common.HttpMethod;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class CorsMiddlewareTest {

    @Test
    void preflightShortCircuitsWithNoContent() throws Exception {
        AtomicBoolean reached = new AtomicBoolean();
        MiddlewareChain chain = new MiddlewareChain().use(new CorsMiddleware());

        Response response = chain.execute(Request.of(HttpMethod.OPTIONS, "/api/users"), new Response(), (request, res) -> {
            reached.set(true);
            return res.send("handler");
        });

        assertFalse(reached.get());
        assertEquals(204, response.statusCode());
        assertEquals("*", response.header("access-control-allow-origin"));
        assertEquals("GET, POST, PUT, DELETE, PATCH, OPTIONS", response.header("access-control-allow-methods"));
        assertEquals("Content-Type, Authorization", response.header("access-control-allow-headers"));
        assertEquals("86400", response.header("access-control-max-age"));
        assertNull(response.header("access-control-allow-credentials"));
    }

    @Test
    void decoratesRegularResponses() throws Exception {
        CorsOptions options = CorsOptions.builder()
                .origin("https://app.example.com")
                .credentials(true)
                .exposedHeaders(List.of("x-request-id"))
                .build();
        MiddlewareChain chain = new MiddlewareChain().use(new CorsMiddleware(options));

        Response response = chain.execute(Request.of(HttpMethod.GET, "/"), new Response(), (request, res) -> res.send("ok"));

        assertEquals("ok", response.bodyAsString());
        assertEquals("https://app.example.com", response.header("access-control-allow-origin"));
        assertEquals("true", response.header("access-control-allow-credentials"));
        assertEquals("x-request-id", response.header("access-control-expose-headers"));
        assertNull(response.header("access-control-allow-methods"));
    }

}
