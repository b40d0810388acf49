package org.tramway.http.middleware;

import org.tramway.exception.MiddlewareFaultException;
import org.tramway.exception.RequestCancelledException;
import org.tramway.http.Handler;
import org.tramway.http.Request;
import org.tramway.http.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered middleware around a terminal handler, executed onion-style: code before
 * {@code next} runs in registration order, code after it in reverse order.
 * <p>
 * Units are appended during setup only. After {@link #freeze()} the chain is immutable
 * and may be executed by any number of threads at once; each execution keeps its own
 * cursor. Nesting depth equals the chain length, which is capped at {@value #MAX_MIDDLEWARE}.
 */
public class MiddlewareChain {

    public static final int MAX_MIDDLEWARE = 128;

    private List<Middleware> units = new ArrayList<>();
    private volatile boolean frozen;

    public MiddlewareChain use(Middleware middleware) {
        Objects.requireNonNull(middleware, "middleware");
        if (frozen) {
            throw new IllegalStateException("Middleware chain is frozen; register middleware before serving");
        }
        if (units.size() >= MAX_MIDDLEWARE) {
            throw new IllegalStateException("Middleware chain cannot hold more than " + MAX_MIDDLEWARE + " units");
        }
        units.add(middleware);
        return this;
    }

    public void freeze() {
        if (!frozen) {
            units = List.copyOf(units);
            frozen = true;
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public Response execute(Request request, Response response, Handler terminal) throws Exception {
        return new Invocation(units, terminal).invoke(0, request, response);
    }

    /**
     * Composes a snapshot of the current units with {@code terminal} into a single handler.
     */
    public Handler wrap(Handler terminal) {
        List<Middleware> snapshot = List.copyOf(units);
        if (snapshot.isEmpty()) {
            return terminal;
        }
        return (request, response) -> new Invocation(snapshot, terminal).invoke(0, request, response);
    }

    private static final class Invocation {

        private final List<Middleware> units;
        private final Handler terminal;

        private Invocation(List<Middleware> units, Handler terminal) {
            this.units = units;
            this.terminal = terminal;
        }

        private Response invoke(int index, Request request, Response response) throws Exception {
            if (request.isCancelled()) {
                throw new RequestCancelledException("Request " + request.getMethod() + " " + request.getPath() + " was cancelled");
            }
            if (index == units.size()) {
                Response result = terminal.handle(request, response);
                if (result == null) {
                    throw new MiddlewareFaultException("Handler for " + request.getMethod() + " " + request.getPath() + " returned no response");
                }
                return result;
            }

            Middleware unit = units.get(index);
            AtomicBoolean forwarded = new AtomicBoolean();
            Next next = (nextRequest, nextResponse) -> {
                if (!forwarded.compareAndSet(false, true)) {
                    throw new MiddlewareFaultException("Middleware #" + index + " (" + unit.getClass().getName() + ") called next more than once");
                }
                return invoke(index + 1, nextRequest, nextResponse);
            };

            Response result = unit.handle(request, response, next);
            if (result == null) {
                throw new MiddlewareFaultException("Middleware #" + index + " (" + unit.getClass().getName() + ") neither forwarded nor produced a response");
            }
            return result;
        }

    }

}
