package com.cueleague.scoring.web;

import lombok.Getter;

@Getter
public class ScoringException extends RuntimeException {

    private final ScoringErrorKind kind;

    public ScoringException(ScoringErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScoringException(ScoringErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ScoringException invalidTransition(String detail) {
        return new ScoringException(ScoringErrorKind.INVALID_TRANSITION, detail);
    }

    public static ScoringException identityViolation(String detail) {
        return new ScoringException(ScoringErrorKind.IDENTITY_VIOLATION, detail);
    }

    public static ScoringException constraintViolation(String detail) {
        return new ScoringException(ScoringErrorKind.CONSTRAINT_VIOLATION, detail);
    }

    public static ScoringException writeConflict(String detail) {
        return new ScoringException(ScoringErrorKind.WRITE_CONFLICT, detail);
    }

    public static ScoringException writeConflict(String detail, Throwable cause) {
        return new ScoringException(ScoringErrorKind.WRITE_CONFLICT, detail, cause);
    }

    public static ScoringException transportFailure(String detail, Throwable cause) {
        return new ScoringException(ScoringErrorKind.TRANSPORT_FAILURE, detail, cause);
    }

    public static ScoringException notFound(String detail) {
        return new ScoringException(ScoringErrorKind.NOT_FOUND, detail);
    }
}
