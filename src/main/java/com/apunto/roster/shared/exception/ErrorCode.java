package com.apunto.roster.shared.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Validation error"),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),

    UPSTREAM_UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Access token expired or invalid"),
    UPSTREAM_UNAVAILABLE(HttpStatus.BAD_GATEWAY, "Error calling Battle.net profile API"),

    PERSISTENCE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to persist profile data"),
    SYNC_IN_PROGRESS(HttpStatus.CONFLICT, "A profile sync is already running for this user"),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected internal error");

    private final HttpStatus httpStatus;
    private final String defaultMessage;

    ErrorCode(HttpStatus httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
