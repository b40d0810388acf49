package org.tramway.http;

/**
 * Terminal unit of a request: produces the response for a matched route.
 */
@FunctionalInterface
public interface Handler {

    Response handle(Request request, Response response) throws Exception;

}
