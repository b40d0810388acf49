package org.tramway.http.routing;

import java.util.Map;

/**
 * Outcome of a successful lookup. {@code pathParams} iterates in pattern order.
 */
public record RouteMatch(RouteDefinition route, Map<String, String> pathParams) {

    public PathPattern pattern() {
        return route.pattern();
    }

    public String param(String name) {
        return pathParams.get(name);
    }

}
