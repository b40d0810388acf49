package org.tramway.exception;

/**
 * A middleware or handler broke the chain contract: it produced no response,
 * or it invoked {@code next} more than once.
 */
public class MiddlewareFaultException extends RuntimeException {

    public MiddlewareFaultException(String message) {
        super(message);
    }

}
