package org.tramway.exception;

public class RequestCancelledException extends RuntimeException {

    public RequestCancelledException(String message) {
        super(message);
    }

}
