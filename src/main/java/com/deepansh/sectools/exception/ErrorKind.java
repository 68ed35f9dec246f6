package com.deepansh.sectools.exception;

/**
 * Every way a tool call can fail. Callers only ever see these as the
 * "error" message of a JSON body (or an HTTP status for the auth kinds).
 */
public enum ErrorKind {
    INVALID_FORMAT,
    INVALID_VALUE,
    BLOCKED,
    TIMEOUT,
    INFRASTRUCTURE_FAILURE,
    RATE_LIMITED,
    NOT_FOUND,
    UNAUTHORIZED,
    FORBIDDEN
}
