package com.albatross.adapter.in.web;

import com.albatross.adapter.in.web.GlobalExceptionHandler.ErrorResponse;
import com.albatross.domain.error.CoreError;
import com.albatross.infrastructure.context.RequestContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps expected command and query failures to HTTP responses.
 */
final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<ErrorResponse> from(CoreError error) {
        return ResponseEntity.status(statusOf(error))
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    static HttpStatus statusOf(CoreError error) {
        if (error instanceof CoreError.NotFound) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof CoreError.Validation) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof CoreError.Unauthorized) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (error instanceof CoreError.Forbidden) {
            return HttpStatus.FORBIDDEN;
        }
        if (error instanceof CoreError.Concurrency || error instanceof CoreError.AlreadyExists) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
