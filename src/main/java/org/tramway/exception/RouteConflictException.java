package org.tramway.exception;

/**
 * Raised at setup time when a route cannot be registered: it is structurally identical
 * to a route already registered for the same method, or its pattern repeats a parameter name.
 */
public class RouteConflictException extends RuntimeException {

    public RouteConflictException(String message) {
        super(message);
    }

}
