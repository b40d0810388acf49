package org.tramway.http.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.tramway.http.Handler;
import org.tramway.http.annotation.HttpRoute;
import org.tramway.http.common.HttpMethod;
import org.tramway.http.middleware.Middleware;
import org.tramway.http.middleware.MiddlewareChain;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Maps a method and path to a handler.
 * <p>
 * Routes live in one segment trie per method. Lookup prefers, at every segment, a literal
 * match over a named parameter over a wildcard, and falls back to the next option when a
 * more specific branch dead-ends deeper down. Registration happens during setup on a single
 * thread; once {@link #freeze() frozen} the router is read-only and safe for concurrent
 * {@link #match} calls.
 * <p>
 * Middleware added with {@link #use(Middleware)} wraps this router's handlers when the
 * router is mounted into another one.
 */
@Slf4j
public class Router {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Map<HttpMethod, RouteNode> trees = new EnumMap<>(HttpMethod.class);
    private final List<RouteDefinition> routes = new ArrayList<>();
    private final MiddlewareChain middleware = new MiddlewareChain();
    private final boolean caseSensitive;
    private final boolean strict;
    private volatile boolean frozen;

    public Router() {
        this(false, false);
    }

    @Builder
    private Router(boolean caseSensitive, boolean strict) {
        this.caseSensitive = caseSensitive;
        this.strict = strict;
    }

    public RouteDefinition register(HttpMethod method, String pattern, Handler handler) {
        return register(method, PathPattern.parse(pattern), handler);
    }

    public RouteDefinition register(HttpMethod method, PathPattern pattern, Handler handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        if (frozen) {
            throw new IllegalStateException("Router is frozen; cannot register " + method + " " + pattern);
        }

        RouteDefinition definition = new RouteDefinition(method, pattern, handler);
        PathPattern key = strict ? pattern : pattern.withoutTrailingSlash();
        trees.computeIfAbsent(method, m -> new RouteNode()).insert(key, definition, caseSensitive);
        routes.add(definition);
        log.debug("Registered route {} {}", method, pattern);
        return definition;
    }

    public Router get(String pattern, Handler handler) {
        register(HttpMethod.GET, pattern, handler);
        return this;
    }

    public Router post(String pattern, Handler handler) {
        register(HttpMethod.POST, pattern, handler);
        return this;
    }

    public Router put(String pattern, Handler handler) {
        register(HttpMethod.PUT, pattern, handler);
        return this;
    }

    public Router delete(String pattern, Handler handler) {
        register(HttpMethod.DELETE, pattern, handler);
        return this;
    }

    public Router patch(String pattern, Handler handler) {
        register(HttpMethod.PATCH, pattern, handler);
        return this;
    }

    public Router head(String pattern, Handler handler) {
        register(HttpMethod.HEAD, pattern, handler);
        return this;
    }

    public Router options(String pattern, Handler handler) {
        register(HttpMethod.OPTIONS, pattern, handler);
        return this;
    }

    public Router all(String pattern, Handler handler) {
        PathPattern parsed = PathPattern.parse(pattern);
        for (HttpMethod method : HttpMethod.values()) {
            register(method, parsed, handler);
        }
        return this;
    }

    public Router use(Middleware unit) {
        if (frozen) {
            throw new IllegalStateException("Router is frozen; cannot add middleware");
        }
        middleware.use(unit);
        return this;
    }

    /**
     * Registers every route of {@code child} under {@code prefix}. The prefix may contain
     * parameters; their names must not repeat in the child patterns. The child is frozen
     * afterwards, since routes added to it later would never be seen here.
     */
    public Router mount(String prefix, Router child) {
        if (child == this) {
            throw new IllegalArgumentException("Router cannot be mounted into itself");
        }
        PathPattern prefixPattern = PathPattern.parse(prefix);
        child.freeze();
        for (RouteDefinition route : child.routes) {
            PathPattern combined = route.pattern().prefixedWith(prefixPattern);
            register(route.method(), combined, child.middleware.wrap(route.handler()));
        }
        log.debug("Mounted {} routes under {}", child.routes.size(), prefixPattern);
        return this;
    }

    public Router group(String prefix, Consumer<Router> configure) {
        Router group = new Router(caseSensitive, strict);
        configure.accept(group);
        return mount(prefix, group);
    }

    public Router registerController(Object controller) {
        int registered = 0;
        for (Method method : controller.getClass().getDeclaredMethods()) {
            if (method.isAnnotationPresent(HttpRoute.class)) {
                HttpRoute routeAnnotation = method.getAnnotation(HttpRoute.class);
                register(routeAnnotation.method(), routeAnnotation.path(),
                        new ControllerHandler(controller, method, OBJECT_MAPPER));
                registered++;
            }
        }
        if (registered == 0) {
            log.warn("Controller {} declares no @HttpRoute methods", controller.getClass().getName());
        }
        return this;
    }

    /**
     * Try to find a matching route for the given method and path.
     * Returns an Optional with RouteMatch if a match is found, otherwise empty.
     *
     * @throws MalformedPathException if a path segment carries an invalid percent-escape
     */
    public Optional<RouteMatch> match(HttpMethod method, String path) {
        RouteNode root = trees.get(method);
        if (root == null) {
            return Optional.empty();
        }

        int query = path.indexOf('?');
        List<String> segments = PathDecoder.split(query >= 0 ? path.substring(0, query) : path);
        if (!strict && !segments.isEmpty() && segments.get(segments.size() - 1).isEmpty()) {
            segments.remove(segments.size() - 1);
        }
        for (int i = 0; i < segments.size(); i++) {
            segments.set(i, PathDecoder.decodeSegment(segments.get(i)));
        }

        List<String> captured = new ArrayList<>();
        RouteDefinition route = root.find(segments, 0, captured, caseSensitive);
        if (route == null) {
            return Optional.empty();
        }

        List<String> names = route.pattern().getParamNames();
        Map<String, String> pathParams = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            pathParams.put(names.get(i), captured.get(i));
        }
        return Optional.of(new RouteMatch(route, pathParams));
    }

    public void freeze() {
        if (!frozen) {
            middleware.freeze();
            frozen = true;
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean hasMiddleware() {
        return !middleware.isEmpty();
    }

    public List<RouteDefinition> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

}
