package com.deepansh.sectools.core;

import com.deepansh.sectools.exception.ErrorKind;

/**
 * Outcome of one bounded external call (a process run or an NVD request).
 *
 * {@code code} is the exit code or HTTP status (-1 when the call never
 * produced one), {@code output} is stdout or the response body and
 * {@code diagnostics} is stderr. Created per call and never shared.
 */
public record ExternalCallResult(
        Outcome outcome,
        Source source,
        int code,
        String output,
        String diagnostics,
        String message
) {

    public enum Outcome {
        SUCCESS,
        RATE_LIMITED,
        INFRASTRUCTURE_FAILURE,
        TIMEOUT,
        NOT_FOUND
    }

    public enum Source {
        PROCESS,
        HTTP
    }

    public ExternalCallResult {
        output = output != null ? output : "";
        diagnostics = diagnostics != null ? diagnostics : "";
    }

    public static ExternalCallResult processCompleted(Outcome outcome, int exitCode, String stdout,
                                                      String stderr, String message) {
        return new ExternalCallResult(outcome, Source.PROCESS, exitCode, stdout, stderr, message);
    }

    public static ExternalCallResult processFailed(Outcome outcome, String message) {
        return new ExternalCallResult(outcome, Source.PROCESS, -1, "", "", message);
    }

    public static ExternalCallResult http(Outcome outcome, int status, String body, String message) {
        return new ExternalCallResult(outcome, Source.HTTP, status, body, "", message);
    }

    public static ExternalCallResult httpFailed(Outcome outcome, String message) {
        return new ExternalCallResult(outcome, Source.HTTP, -1, "", "", message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    /** null for a successful call */
    public ErrorKind errorKind() {
        return switch (outcome) {
            case SUCCESS -> null;
            case RATE_LIMITED -> ErrorKind.RATE_LIMITED;
            case INFRASTRUCTURE_FAILURE -> ErrorKind.INFRASTRUCTURE_FAILURE;
            case TIMEOUT -> ErrorKind.TIMEOUT;
            case NOT_FOUND -> ErrorKind.NOT_FOUND;
        };
    }
}
