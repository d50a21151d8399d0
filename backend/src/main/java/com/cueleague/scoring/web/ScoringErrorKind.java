package com.cueleague.scoring.web;

import org.springframework.http.HttpStatus;

public enum ScoringErrorKind {
    INVALID_TRANSITION(HttpStatus.CONFLICT, "invalid_transition", false),
    IDENTITY_VIOLATION(HttpStatus.FORBIDDEN, "identity_violation", false),
    CONSTRAINT_VIOLATION(HttpStatus.UNPROCESSABLE_ENTITY, "constraint_violation", false),
    WRITE_CONFLICT(HttpStatus.CONFLICT, "write_conflict", true),
    TRANSPORT_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "transport_failure", true),
    NOT_FOUND(HttpStatus.NOT_FOUND, "not_found", false);

    private final HttpStatus status;
    private final String code;
    private final boolean retryable;

    ScoringErrorKind(HttpStatus status, String code, boolean retryable) {
        this.status = status;
        this.code = code;
        this.retryable = retryable;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }

    public boolean retryable() {
        return retryable;
    }
}
