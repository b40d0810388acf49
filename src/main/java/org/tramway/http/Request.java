package org.tramway.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Getter;
import org.tramway.http.common.HttpMethod;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An inbound request as handed over by the transport layer.
 * <p>
 * One instance belongs to one request; route parameters are bound once, after the
 * route has been matched. Attributes are the place where middleware passes values
 * further down the chain.
 */
@Getter
public class Request {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final HttpMethod method;
    private final String uri;
    private final String path;
    private final Map<String, List<String>> query;
    private final HttpHeaders headers;
    private final byte[] body;
    private final SocketAddress remoteAddress;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile Map<String, String> params = Collections.emptyMap();

    public Request(HttpMethod method, String uri, HttpHeaders headers, byte[] body, SocketAddress remoteAddress) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        this.method = method;
        this.uri = uri;
        this.path = decoder.rawPath().isEmpty() ? "/" : decoder.rawPath();
        this.query = decoder.parameters();
        this.headers = headers;
        this.body = body;
        this.remoteAddress = remoteAddress;
    }

    public static Request of(HttpMethod method, String uri) {
        return new Request(method, uri, new DefaultHttpHeaders(), new byte[0], null);
    }

    public void bindParams(Map<String, String> pathParams) {
        if (!params.isEmpty()) {
            throw new IllegalStateException("Route parameters already bound for " + method + " " + path);
        }
        this.params = Collections.unmodifiableMap(pathParams);
    }

    public String param(String name) {
        return params.get(name);
    }

    public Optional<String> queryParam(String name) {
        List<String> values = query.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public <T> T json(Class<T> type) throws IOException {
        return OBJECT_MAPPER.readValue(body, type);
    }

    public <T> T attribute(String name, Class<T> type) {
        return type.cast(attributes.get(name));
    }

    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    public String contentType() {
        return headers.get(HttpHeaderNames.CONTENT_TYPE);
    }

    public boolean isJson() {
        String contentType = contentType();
        return contentType != null && contentType.contains("application/json");
    }

    public boolean accepts(String contentType) {
        String accept = headers.get(HttpHeaderNames.ACCEPT);
        return accept != null && accept.contains(contentType);
    }

    public Optional<String> bearerToken() {
        String authorization = headers.get(HttpHeaderNames.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith("Bearer ")) {
            return Optional.empty();
        }
        return Optional.of(authorization.substring("Bearer ".length()));
    }

    public String host() {
        return headers.get(HttpHeaderNames.HOST);
    }

    public String userAgent() {
        return headers.get(HttpHeaderNames.USER_AGENT);
    }

    public boolean isXhr() {
        return "XMLHttpRequest".equalsIgnoreCase(headers.get("X-Requested-With"));
    }

    public String ip() {
        if (remoteAddress instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return remoteAddress != null ? remoteAddress.toString() : "unknown";
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

}
