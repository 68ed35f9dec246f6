package com.deepansh.sectools.exception;

import lombok.Getter;

/**
 * Raised by the sanitizers when a caller-supplied value cannot be used.
 * Tools catch it and turn the message into {"error": ...}; it never
 * reaches the transport layer.
 */
@Getter
public class ToolInputException extends RuntimeException {

    private final ErrorKind kind;

    public ToolInputException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
