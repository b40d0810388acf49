package org.tramway.app;

import org.tramway.http.Request;
import org.tramway.http.Response;

/**
 * Turns a failure raised anywhere in the chain into the response sent to the client.
 */
@FunctionalInterface
public interface ErrorHandler {

    Response handle(Request request, Throwable error);

}
