package com.realgaming.marketplace.common.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum GlobalErrorCode implements ErrorCode {

    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "G-400", "Invalid request."),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "G-404", "Resource not found."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "G-405", "Method not allowed."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "G-500", "Internal server error."),
    REQUEST_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "G-503", "The request timed out. Please try again later.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
