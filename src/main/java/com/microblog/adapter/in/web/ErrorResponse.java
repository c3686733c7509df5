package com.microblog.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microblog.domain.error.DomainError;
import com.microblog.domain.error.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Error body shared by controllers, the exception handler and the auth filter.
 */
public record ErrorResponse(
    @JsonProperty("result") boolean result,
    @JsonProperty("error_type") String errorType,
    @JsonProperty("error_message") String errorMessage
) {

    public static ErrorResponse of(String errorType, String errorMessage) {
        return new ErrorResponse(false, errorType, errorMessage);
    }

    public static ErrorResponse from(DomainError error) {
        return of(error.code(), error.message());
    }

    /**
     * The only place an error kind is turned into an HTTP status.
     */
    public static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(DomainError error) {
        return ResponseEntity.status(statusOf(error.kind())).body(from(error));
    }
}
