package org.tramway.http.endpoint.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.junit.jupiter.api.Test;
import org.tramway.app.AppSettings;
import org.tramway.app.Application;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.common.HttpMethod;
import org.tramway.http.routing.Router;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UserControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Application app = createApp();

    private static Application createApp() {
        AppSettings settings = AppSettings.defaults();
        Router api = new Router().registerController(new UserController());
        return new Application(settings)
                .registerController(new HealthController(settings))
                .use("/api", api);
    }

    private Response call(HttpMethod method, String uri, String body) {
        Request request = new Request(method, uri,
                new DefaultHttpHeaders().set(HttpHeaderNames.CONTENT_TYPE, "application/json"),
                body.getBytes(StandardCharsets.UTF_8), null);
        return app.handle(request);
    }

    private static JsonNode json(Response response) throws Exception {
        return MAPPER.readTree(response.getBody());
    }

    @Test
    void healthReportsEnvironment() throws Exception {
        JsonNode body = json(call(HttpMethod.GET, "/health", ""));

        assertEquals("ok", body.get("status").asText());
        assertEquals("development", body.get("env").asText());
    }

    @Test
    void userLifecycle() throws Exception {
        Response created = call(HttpMethod.POST, "/api/users", "{\"name\":\"Ada\",\"email\":\"ada@example.com\",\"age\":36}");
        assertEquals(201, created.statusCode());
        String id = json(created).get("id").asText();

        JsonNode fetched = json(call(HttpMethod.GET, "/api/users/" + id, ""));
        assertEquals("Ada", fetched.get("name").asText());
        assertEquals(36, fetched.get("age").asInt());

        Response updated = call(HttpMethod.PUT, "/api/users/" + id, "{\"name\":\"Ada L.\",\"email\":\"ada@example.com\"}");
        assertEquals("Ada L.", json(updated).get("name").asText());

        JsonNode list = json(call(HttpMethod.GET, "/api/users", ""));
        assertEquals(1, list.get("total").asInt());
        assertEquals(1, list.get("data").size());

        assertEquals(204, call(HttpMethod.DELETE, "/api/users/" + id, "").statusCode());
        assertEquals(404, call(HttpMethod.GET, "/api/users/" + id, "").statusCode());
        assertEquals(404, call(HttpMethod.DELETE, "/api/users/" + id, "").statusCode());
    }

    @Test
    void listHonoursLimit() throws Exception {
        for (int i = 0; i < 3; i++) {
            call(HttpMethod.POST, "/api/users", "{\"name\":\"u" + i + "\",\"email\":\"u" + i + "@example.com\"}");
        }

        JsonNode list = json(call(HttpMethod.GET, "/api/users?limit=2", ""));

        assertEquals(3, list.get("total").asInt());
        assertEquals(2, list.get("data").size());
    }

    @Test
    void invalidInputIsBadRequest() throws Exception {
        Response missingName = call(HttpMethod.POST, "/api/users", "{\"email\":\"x@example.com\"}");
        assertEquals(400, missingName.statusCode());
        assertEquals("name is required", json(missingName).get("error").asText());

        assertEquals(400, call(HttpMethod.POST, "/api/users", "{\"name\":\"x\",\"email\":\"nope\"}").statusCode());
        assertEquals(400, call(HttpMethod.POST, "/api/users", "not json").statusCode());
        assertEquals(400, call(HttpMethod.GET, "/api/users?limit=many", "").statusCode());
    }

    @Test
    void updatingUnknownUserIsNotFound() {
        assertEquals(404, call(HttpMethod.PUT, "/api/users/missing", "{\"name\":\"x\",\"email\":\"x@example.com\"}").statusCode());
    }

}
