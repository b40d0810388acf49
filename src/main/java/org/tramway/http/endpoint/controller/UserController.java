package org.tramway.http.endpoint.controller;

import lombok.extern.slf4j.Slf4j;
import org.tramway.exception.HttpException;
import org.tramway.http.Response;
import org.tramway.http.annotation.HttpRoute;
import org.tramway.http.annotation.PathParam;
import org.tramway.http.annotation.QueryParam;
import org.tramway.http.annotation.RequestBody;
import org.tramway.http.common.HttpMethod;
import org.tramway.http.endpoint.dto.UserListResponse;
import org.tramway.http.endpoint.dto.UserRequest;
import org.tramway.http.endpoint.dto.UserResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory user store exposed as a small REST resource.
 */
@Slf4j
public class UserController {

    private final Map<String, UserResponse> users = new ConcurrentHashMap<>();

    @HttpRoute(path = "/users", method = HttpMethod.GET)
    public UserListResponse list(@QueryParam("limit") Integer limit) {
        List<UserResponse> all = new ArrayList<>(users.values());
        if (limit != null && limit >= 0 && limit < all.size()) {
            all = all.subList(0, limit);
        }
        return new UserListResponse(all, users.size());
    }

    @HttpRoute(path = "/users/:id", method = HttpMethod.GET)
    public UserResponse get(@PathParam("id") String id) {
        UserResponse user = users.get(id);
        if (user == null) {
            throw HttpException.notFound("User " + id + " not found");
        }
        return user;
    }

    @HttpRoute(path = "/users", method = HttpMethod.POST)
    public Response create(@RequestBody UserRequest request, Response response) {
        validate(request);
        UserResponse user = UserResponse.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .email(request.getEmail())
                .age(request.getAge())
                .build();
        users.put(user.getId(), user);
        log.info("Created user {}", user.getId());
        return response.created(user);
    }

    @HttpRoute(path = "/users/:id", method = HttpMethod.PUT)
    public UserResponse update(@PathParam("id") String id, @RequestBody UserRequest request) {
        validate(request);
        UserResponse updated = UserResponse.builder()
                .id(id)
                .name(request.getName())
                .email(request.getEmail())
                .age(request.getAge())
                .build();
        if (users.replace(id, updated) == null) {
            throw HttpException.notFound("User " + id + " not found");
        }
        return updated;
    }

    @HttpRoute(path = "/users/:id", method = HttpMethod.DELETE)
    public void delete(@PathParam("id") String id) {
        if (users.remove(id) == null) {
            throw HttpException.notFound("User " + id + " not found");
        }
        log.info("Deleted user {}", id);
    }

    private void validate(UserRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw HttpException.badRequest("name is required");
        }
        if (request.getEmail() == null || !request.getEmail().contains("@")) {
            throw HttpException.badRequest("email is invalid");
        }
    }

}
