package org.tramway.http.routing;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.Test;
import org.tramway.exception.HttpException;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.annotation.HttpRoute;
import org.tramway.http.annotation.PathParam;
import org.tramway.http.annotation.QueryParam;
import org.tramway.http.annotation.RequestBody;
import org.tramway.http.common.HttpMethod;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControllerRegistrationTest {

    public record Item(String name, int quantity) {
    }

    public static class ItemController {

        @HttpRoute(path = "/items/{id}")
        public Item get(@PathParam("id") String id, @QueryParam("qty") int quantity) {
            return new Item(id, quantity);
        }

        @HttpRoute(path = "/items", method = HttpMethod.POST)
        public Response create(@RequestBody Item item, Response response) {
            return response.created(item);
        }

        @HttpRoute(path = "/items/:id/echo", method = HttpMethod.PUT)
        public String echo(@PathParam("id") long id, @RequestBody String body) {
            return id + ":" + body;
        }

        @HttpRoute(path = "/items/:id", method = HttpMethod.DELETE)
        public void delete(@PathParam("id") String id) {
        }

        @HttpRoute(path = "/items/fail")
        public String fail() {
            throw HttpException.forbidden("nope");
        }
    }

    public static class BrokenController {

        @HttpRoute(path = "/broken")
        public String broken(String unannotated) {
            return unannotated;
        }
    }

    private final Router router = new Router().registerController(new ItemController());

    private Response call(HttpMethod method, String uri, String body) throws Exception {
        Request request = new Request(method, uri, new DefaultHttpHeaders().set(HttpHeaderNames.CONTENT_TYPE, "application/json"),
                body.getBytes(StandardCharsets.UTF_8), null);
        RouteMatch match = router.match(method, request.getPath()).orElseThrow();
        request.bindParams(match.pathParams());
        return match.route().handler().handle(request, new Response());
    }

    @Test
    void bindsPathAndQueryParameters() throws Exception {
        Response response = call(HttpMethod.GET, "/items/apple?qty=3", "");

        assertEquals(200, response.statusCode());
        assertEquals("{\"name\":\"apple\",\"quantity\":3}", response.bodyAsString());
    }

    @Test
    void bindsJsonBodyAndPassesResponseThrough() throws Exception {
        Response response = call(HttpMethod.POST, "/items", "{\"name\":\"pear\",\"quantity\":2}");

        assertEquals(201, response.statusCode());
        assertTrue(response.bodyAsString().contains("\"pear\""));
    }

    @Test
    void stringResultIsSentAsText() throws Exception {
        Response response = call(HttpMethod.PUT, "/items/12/echo", "hello");

        assertEquals("12:hello", response.bodyAsString());
        assertTrue(response.header(HttpHeaderNames.CONTENT_TYPE).startsWith("text/plain"));
    }

    @Test
    void voidResultIsNoContent() throws Exception {
        assertEquals(204, call(HttpMethod.DELETE, "/items/1", "").statusCode());
    }

    @Test
    void unconvertiblePathParamIsBadRequest() {
        HttpException error = assertThrows(HttpException.class, () -> call(HttpMethod.PUT, "/items/abc/echo", "x"));

        assertEquals(HttpResponseStatus.BAD_REQUEST, error.getStatus());
    }

    @Test
    void missingPrimitiveQueryParamIsBadRequest() {
        HttpException error = assertThrows(HttpException.class, () -> call(HttpMethod.GET, "/items/apple", ""));

        assertEquals(HttpResponseStatus.BAD_REQUEST, error.getStatus());
    }

    @Test
    void invalidJsonBodyIsBadRequest() {
        HttpException error = assertThrows(HttpException.class, () -> call(HttpMethod.POST, "/items", "{not json"));

        assertEquals(HttpResponseStatus.BAD_REQUEST, error.getStatus());
    }

    @Test
    void exceptionsFromControllerMethodsAreUnwrapped() {
        HttpException error = assertThrows(HttpException.class, () -> call(HttpMethod.GET, "/items/fail", ""));

        assertEquals(HttpResponseStatus.FORBIDDEN, error.getStatus());
    }

    @Test
    void unbindableParameterFailsAtRegistration() {
        assertThrows(IllegalArgumentException.class, () -> new Router().registerController(new BrokenController()));
    }

}
