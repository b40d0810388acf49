package org.tramway.http.middleware;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.common.HttpMethod;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeoutMiddlewareTest {

    private final TimeoutMiddleware timeout = new TimeoutMiddleware(Duration.ofMillis(200));

    @AfterEach
    void tearDown() {
        timeout.close();
    }

    @Test
    void fastHandlerCompletesNormally() throws Exception {
        Response response = new MiddlewareChain().use(timeout)
                .execute(Request.of(HttpMethod.GET, "/"), new Response(), (request, res) -> res.send("quick"));

        assertEquals(200, response.statusCode());
        assertEquals("quick", response.bodyAsString());
    }

    @Test
    void slowHandlerIsCutOffWithRequestTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        Request request = Request.of(HttpMethod.GET, "/slow");

        Response response = new MiddlewareChain().use(timeout)
                .execute(request, new Response(), (req, res) -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                    return res.send("late");
                });

        assertEquals(408, response.statusCode());
        assertEquals("{\"error\":\"Request Timeout\"}", response.bodyAsString());
        assertTrue(request.isCancelled());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void handlerErrorsAreUnwrapped() {
        MiddlewareChain chain = new MiddlewareChain().use(timeout);

        assertThrows(IllegalArgumentException.class, () -> chain.execute(Request.of(HttpMethod.GET, "/"), new Response(),
                (request, res) -> {
                    throw new IllegalArgumentException("bad");
                }));
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new TimeoutMiddleware(Duration.ZERO));
    }

}
