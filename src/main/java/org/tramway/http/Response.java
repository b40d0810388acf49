package org.tramway.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.cookie.DefaultCookie;
import io.netty.handler.codec.http.cookie.ServerCookieEncoder;
import lombok.extern.slf4j.Slf4j;
import org.tramway.http.dto.ErrorResponse;

import java.nio.charset.StandardCharsets;

/**
 * Response builder handed down the middleware chain. Every setter returns {@code this},
 * so handlers can finish with a single expression:
 * <pre>{@code
 * return res.status(201).json(user);
 * }</pre>
 */
@Slf4j
public class Response {

    public static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final byte[] EMPTY = new byte[0];

    private HttpResponseStatus status = HttpResponseStatus.OK;
    private final HttpHeaders headers = new DefaultHttpHeaders();
    private byte[] body = EMPTY;

    public Response status(int code) {
        this.status = HttpResponseStatus.valueOf(code);
        return this;
    }

    public Response status(HttpResponseStatus status) {
        this.status = status;
        return this;
    }

    public Response header(CharSequence name, Object value) {
        headers.set(name, value);
        return this;
    }

    public Response contentType(String contentType) {
        return header(HttpHeaderNames.CONTENT_TYPE, contentType);
    }

    public Response send(String text) {
        this.body = text.getBytes(StandardCharsets.UTF_8);
        if (!headers.contains(HttpHeaderNames.CONTENT_TYPE)) {
            contentType("text/plain; charset=utf-8");
        }
        return this;
    }

    public Response sendBytes(byte[] bytes) {
        this.body = bytes;
        return this;
    }

    public Response json(Object data) {
        try {
            this.body = OBJECT_MAPPER.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize response body of type {}", data.getClass().getName(), e);
            this.status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            this.body = ("{\"error\":\"Serialization error\"}").getBytes(StandardCharsets.UTF_8);
        }
        return contentType(JSON_CONTENT_TYPE);
    }

    public Response html(String html) {
        this.body = html.getBytes(StandardCharsets.UTF_8);
        return contentType("text/html; charset=utf-8");
    }

    public Response redirect(String location) {
        return status(HttpResponseStatus.FOUND).header(HttpHeaderNames.LOCATION, location);
    }

    public Response redirectPermanent(String location) {
        return status(HttpResponseStatus.MOVED_PERMANENTLY).header(HttpHeaderNames.LOCATION, location);
    }

    public Response notFound() {
        return status(HttpResponseStatus.NOT_FOUND).json(ErrorResponse.of("Not Found"));
    }

    public Response badRequest(String message) {
        return status(HttpResponseStatus.BAD_REQUEST).json(ErrorResponse.of(message));
    }

    public Response unauthorized() {
        return status(HttpResponseStatus.UNAUTHORIZED).json(ErrorResponse.of("Unauthorized"));
    }

    public Response forbidden() {
        return status(HttpResponseStatus.FORBIDDEN).json(ErrorResponse.of("Forbidden"));
    }

    public Response internalError(String message) {
        return status(HttpResponseStatus.INTERNAL_SERVER_ERROR).json(ErrorResponse.of(message));
    }

    public Response created(Object data) {
        return status(HttpResponseStatus.CREATED).json(data);
    }

    public Response noContent() {
        this.status = HttpResponseStatus.NO_CONTENT;
        this.body = EMPTY;
        return this;
    }

    public Response cors(String origin) {
        return header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, origin)
                .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, PUT, DELETE, PATCH, OPTIONS")
                .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type, Authorization");
    }

    public Response cookie(String name, String value, CookieOptions options) {
        DefaultCookie cookie = new DefaultCookie(name, value);
        cookie.setPath(options.getPath());
        cookie.setDomain(options.getDomain());
        cookie.setMaxAge(options.getMaxAge());
        cookie.setSecure(options.isSecure());
        cookie.setHttpOnly(options.isHttpOnly());
        cookie.setSameSite(options.getSameSite());
        headers.add(HttpHeaderNames.SET_COOKIE, ServerCookieEncoder.STRICT.encode(cookie));
        return this;
    }

    public Response clearCookie(String name) {
        return cookie(name, "", CookieOptions.builder().maxAge(0).build());
    }

    public HttpResponseStatus getStatus() {
        return status;
    }

    public int statusCode() {
        return status.code();
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    public String header(CharSequence name) {
        return headers.get(name);
    }

    public byte[] getBody() {
        return body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public FullHttpResponse toNettyResponse() {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(body)
        );
        response.headers().set(headers);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return response;
    }

}
