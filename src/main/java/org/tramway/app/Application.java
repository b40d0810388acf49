package org.tramway.app;

import lombok.extern.slf4j.Slf4j;
import org.tramway.http.Handler;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.middleware.Middleware;
import org.tramway.http.middleware.MiddlewareChain;
import org.tramway.http.routing.RouteMatch;
import org.tramway.http.routing.Router;
import org.tramway.http.staticfiles.StaticConfig;
import org.tramway.http.staticfiles.StaticFileHandler;
import org.tramway.server.TramwayHttp;
import org.tramway.server.dto.ServerProperties;

import java.util.Objects;
import java.util.Optional;

/**
 * The application context: one router, one global middleware chain, and the handlers used
 * when no route matches or something fails.
 * <p>
 * Everything is configured on the setup thread. {@link #freeze()} (called by
 * {@link #listen}) seals router and chain; from then on {@link #handle(Request)} may run on
 * any number of threads.
 * <p>
 * Global middleware wraps route lookup as well as the handler, so it also sees requests that
 * end in a 404.
 */
@Slf4j
public class Application {

    private final AppSettings settings;
    private final Router router;
    private final MiddlewareChain middleware = new MiddlewareChain();
    private Handler notFoundHandler = (request, response) -> response.notFound();
    private ErrorHandler errorHandler;
    private volatile boolean frozen;

    public Application() {
        this(AppSettings.defaults());
    }

    public Application(AppSettings settings) {
        this.settings = settings;
        this.router = Router.builder()
                .caseSensitive(settings.isCaseSensitiveRouting())
                .strict(settings.isStrictRouting())
                .build();
        this.errorHandler = new DefaultErrorHandler(settings.isDevelopment());
    }

    public Application use(Middleware unit) {
        requireNotFrozen();
        middleware.use(unit);
        return this;
    }

    public Application use(String prefix, Router child) {
        requireNotFrozen();
        router.mount(prefix, child);
        return this;
    }

    public Application get(String pattern, Handler handler) {
        requireNotFrozen();
        router.get(pattern, handler);
        return this;
    }

    public Application post(String pattern, Handler handler) {
        requireNotFrozen();
        router.post(pattern, handler);
        return this;
    }

    public Application put(String pattern, Handler handler) {
        requireNotFrozen();
        router.put(pattern, handler);
        return this;
    }

    public Application delete(String pattern, Handler handler) {
        requireNotFrozen();
        router.delete(pattern, handler);
        return this;
    }

    public Application patch(String pattern, Handler handler) {
        requireNotFrozen();
        router.patch(pattern, handler);
        return this;
    }

    public Application all(String pattern, Handler handler) {
        requireNotFrozen();
        router.all(pattern, handler);
        return this;
    }

    public Application registerController(Object controller) {
        requireNotFrozen();
        router.registerController(controller);
        return this;
    }

    /**
     * Serves files below {@code config.getRoot()} for GET and HEAD requests under {@code prefix}.
     */
    public Application serveStatic(String prefix, StaticConfig config) {
        requireNotFrozen();
        StaticFileHandler handler = new StaticFileHandler(config, "path");
        router.group(prefix, files -> files
                .get("/*path", handler)
                .head("/*path", handler));
        return this;
    }

    public Application notFound(Handler handler) {
        requireNotFrozen();
        this.notFoundHandler = Objects.requireNonNull(handler, "handler");
        return this;
    }

    public Application onError(ErrorHandler handler) {
        requireNotFrozen();
        this.errorHandler = Objects.requireNonNull(handler, "handler");
        return this;
    }

    /**
     * Seals router and chain.
     *
     * @throws IllegalStateException if middleware was added to the root router directly, where
     *                               it would never run; global middleware belongs in {@link #use(Middleware)}
     */
    public void freeze() {
        if (!frozen) {
            if (router.hasMiddleware()) {
                throw new IllegalStateException("Middleware added via getRouter().use() never runs on the root router; use Application.use() instead");
            }
            router.freeze();
            middleware.freeze();
            frozen = true;
            log.info("Application frozen with {} routes and {} middleware", router.getRoutes().size(), middleware.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Starts the HTTP server and blocks until it shuts down.
     */
    public void listen(ServerProperties properties) throws InterruptedException {
        freeze();
        new TramwayHttp(this, properties).start();
    }

    public Response handle(Request request) {
        Response response = new Response();
        try {
            return middleware.execute(request, response, this::dispatch);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            return handleError(request, e);
        }
    }

    private Response dispatch(Request request, Response response) throws Exception {
        Optional<RouteMatch> match = router.match(request.getMethod(), request.getPath());
        if (match.isEmpty()) {
            log.debug("No route for {} {}", request.getMethod(), request.getPath());
            return notFoundHandler.handle(request, response);
        }
        request.bindParams(match.get().pathParams());
        return match.get().route().handler().handle(request, response);
    }

    private Response handleError(Request request, Throwable error) {
        try {
            Response response = errorHandler.handle(request, error);
            if (response != null) {
                return response;
            }
            log.error("Error handler returned no response for {} {}", request.getMethod(), request.getPath());
        } catch (Exception e) {
            log.error("Error handler failed for {} {}", request.getMethod(), request.getPath(), e);
        }
        return new Response().internalError("Internal Server Error");
    }

    private void requireNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Application is already serving; configure it before listen()");
        }
    }

    public Router getRouter() {
        return router;
    }

    public AppSettings getSettings() {
        return settings;
    }

}
