package org.tramway.http.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tramway.exception.HttpException;
import org.tramway.http.Handler;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.annotation.PathParam;
import org.tramway.http.annotation.QueryParam;
import org.tramway.http.annotation.RequestBody;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;

/**
 * Adapts an {@link org.tramway.http.annotation.HttpRoute} method to the {@link Handler} contract.
 * Parameter bindings are validated when the controller is registered.
 */
final class ControllerHandler implements Handler {

    private final Object controller;
    private final Method method;
    private final ObjectMapper objectMapper;
    private final boolean takesResponse;

    ControllerHandler(Object controller, Method method, ObjectMapper objectMapper) {
        this.controller = controller;
        this.method = method;
        this.objectMapper = objectMapper;

        boolean response = false;
        for (Parameter param : method.getParameters()) {
            if (param.getType().equals(Response.class)) {
                response = true;
            } else if (!param.getType().equals(Request.class)
                    && !param.isAnnotationPresent(PathParam.class)
                    && !param.isAnnotationPresent(QueryParam.class)
                    && !param.isAnnotationPresent(RequestBody.class)) {
                throw new IllegalArgumentException("Cannot bind parameter '" + param.getName() + "' of "
                        + controller.getClass().getSimpleName() + "." + method.getName());
            }
        }
        this.takesResponse = response;
        this.method.setAccessible(true);
    }

    @Override
    public Response handle(Request request, Response response) throws Exception {
        Parameter[] parameters = method.getParameters();
        Object[] args = new Object[parameters.length];

        for (int i = 0; i < parameters.length; i++) {
            Parameter param = parameters[i];

            if (param.getType().equals(Request.class)) {
                args[i] = request;

            } else if (param.getType().equals(Response.class)) {
                args[i] = response;

            } else if (param.isAnnotationPresent(PathParam.class)) {
                String name = param.getAnnotation(PathParam.class).value();
                args[i] = convert(name, request.param(name), param.getType());

            } else if (param.isAnnotationPresent(QueryParam.class)) {
                String name = param.getAnnotation(QueryParam.class).value();
                args[i] = convert(name, request.queryParam(name).orElse(null), param.getType());

            } else {
                args[i] = readBody(request, param.getType());
            }
        }

        Object result;
        try {
            result = method.invoke(controller, args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
        return toResponse(result, response);
    }

    private Object convert(String name, String value, Class<?> type) {
        if (value == null) {
            if (type.isPrimitive()) {
                throw HttpException.badRequest("Missing value for parameter '" + name + "'");
            }
            return null;
        }
        if (type.equals(String.class)) {
            return value;
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw HttpException.badRequest("Invalid value for parameter '" + name + "': " + value);
        }
    }

    private Object readBody(Request request, Class<?> type) {
        if (type.equals(String.class)) {
            return request.bodyAsString();
        }
        if (type.equals(byte[].class)) {
            return request.getBody();
        }
        try {
            return objectMapper.readValue(request.getBody(), type);
        } catch (JsonProcessingException e) {
            throw HttpException.badRequest("Invalid JSON body: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw HttpException.badRequest("Unreadable request body");
        }
    }

    private Response toResponse(Object result, Response response) {
        if (result instanceof Response returned) {
            return returned;
        }
        if (result == null) {
            return takesResponse ? response : response.noContent();
        }
        if (result instanceof String text) {
            return response.send(text);
        }
        return response.json(result);
    }

    @Override
    public String toString() {
        return controller.getClass().getSimpleName() + "." + method.getName();
    }

}
