package org.tramway.http.routing;

import org.tramway.http.Handler;
import org.tramway.http.common.HttpMethod;

public record RouteDefinition(HttpMethod method, PathPattern pattern, Handler handler) {

}
