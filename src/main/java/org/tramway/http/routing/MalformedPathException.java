package org.tramway.http.routing;

public class MalformedPathException extends IllegalArgumentException {

    public MalformedPathException(String message, Throwable cause) {
        super(message, cause);
    }

}
