package com.deepansh.sectools.auth;

import com.deepansh.sectools.exception.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * Result of checking one request's Authorization header.
 */
public enum AuthDecision {

    AUTHENTICATED(null, HttpStatus.OK, null),
    UNAUTHORIZED(ErrorKind.UNAUTHORIZED, HttpStatus.UNAUTHORIZED, "Missing or malformed Authorization header"),
    FORBIDDEN(ErrorKind.FORBIDDEN, HttpStatus.FORBIDDEN, "Invalid bearer token");

    private final ErrorKind kind;
    private final HttpStatus status;
    private final String message;

    AuthDecision(ErrorKind kind, HttpStatus status, String message) {
        this.kind = kind;
        this.status = status;
        this.message = message;
    }

    public ErrorKind kind() {
        return kind;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }
}
