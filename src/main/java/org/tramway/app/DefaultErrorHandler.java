package org.tramway.app;

import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tramway.exception.HttpException;
import org.tramway.exception.MiddlewareFaultException;
import org.tramway.exception.RequestCancelledException;
import org.tramway.http.Request;
import org.tramway.http.Response;
import org.tramway.http.dto.ErrorResponse;
import org.tramway.http.routing.MalformedPathException;

@Slf4j
@RequiredArgsConstructor
public class DefaultErrorHandler implements ErrorHandler {

    private final boolean exposeDetails;

    @Override
    public Response handle(Request request, Throwable error) {
        if (error instanceof HttpException httpError) {
            log.debug("{} {} ended with {}: {}", request.getMethod(), request.getPath(), httpError.getStatus().code(), httpError.getMessage());
            return new Response()
                    .status(httpError.getStatus())
                    .json(ErrorResponse.of(httpError.getMessage()));
        }

        if (error instanceof MalformedPathException) {
            log.debug("Rejected malformed path {}: {}", request.getPath(), error.getMessage());
            return new Response().badRequest("Bad Request");
        }

        if (error instanceof RequestCancelledException) {
            log.debug("Request {} {} cancelled before completion", request.getMethod(), request.getPath());
            return new Response()
                    .status(HttpResponseStatus.SERVICE_UNAVAILABLE)
                    .json(ErrorResponse.of("Request Cancelled"));
        }

        if (error instanceof MiddlewareFaultException) {
            log.error("Middleware fault on {} {}: {}", request.getMethod(), request.getPath(), error.getMessage());
        } else {
            log.error("Unhandled error on {} {}", request.getMethod(), request.getPath(), error);
        }

        ErrorResponse body = ErrorResponse.builder()
                .error("Internal Server Error")
                .message(exposeDetails ? error.getMessage() : null)
                .build();
        return new Response()
                .status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                .json(body);
    }

}
