package org.tramway.http.middleware;

import org.tramway.http.Request;
import org.tramway.http.Response;

/**
 * Continuation into the rest of the chain. May be invoked at most once.
 */
@FunctionalInterface
public interface Next {

    Response proceed(Request request, Response response) throws Exception;

}
