package org.tramway.exception;

import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Getter;

/**
 * Thrown from handlers and middleware to end the request with a specific status.
 * The message becomes the {@code error} field of the JSON body.
 */
@Getter
public class HttpException extends RuntimeException {

    private final HttpResponseStatus status;

    public HttpException(HttpResponseStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpException(HttpResponseStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public static HttpException notFound(String message) {
        return new HttpException(HttpResponseStatus.NOT_FOUND, message);
    }

    public static HttpException badRequest(String message) {
        return new HttpException(HttpResponseStatus.BAD_REQUEST, message);
    }

    public static HttpException unauthorized(String message) {
        return new HttpException(HttpResponseStatus.UNAUTHORIZED, message);
    }

    public static HttpException forbidden(String message) {
        return new HttpException(HttpResponseStatus.FORBIDDEN, message);
    }

}
