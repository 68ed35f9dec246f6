package com.deepansh.sectools.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps every {@link ExternalCallResult} to exactly one JSON-object string.
 *
 * | Outcome                   | Shape                                                 |
 * |---------------------------|-------------------------------------------------------|
 * | SUCCESS, payload          | payload verbatim, or the shaper's object as JSON      |
 * | SUCCESS, empty payload    | {"message": "No output", "stderr": tail}              |
 * | any failure (process)     | {"error": msg, "stderr": tail, "stdout": tail}        |
 * | any failure (HTTP)        | {"error": msg, "body": prefix}                        |
 *
 * Diagnostic strings are bounded: the last 2000 chars of process streams,
 * the first 500 chars of an HTTP body. Blank diagnostics are omitted.
 *
 * Never throws.
 */
@Component
@Slf4j
public class ResponseNormalizer {

    public static final int MAX_DIAGNOSTIC_CHARS = 2000;
    public static final int MAX_BODY_CHARS = 500;

    private static final String SERIALIZATION_FAILURE = "{\"error\": \"Failed to serialize response\"}";

    private final ObjectMapper objectMapper;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reshapes a successful payload into a JSON-serializable object.
     * May throw; a failure is reported as a parse error.
     */
    @FunctionalInterface
    public interface SuccessShaper {
        Object shape(String payload) throws Exception;
    }

    public String normalize(ExternalCallResult result) {
        return normalize(result, null);
    }

    public String normalize(ExternalCallResult result, SuccessShaper shaper) {
        if (result.isSuccess()) {
            return normalizeSuccess(result, shaper);
        }

        log.debug("Normalizing {} failure from {}: {}", result.errorKind(), result.source(), result.message());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", result.message() != null ? result.message() : "External call failed");

        if (result.source() == ExternalCallResult.Source.HTTP) {
            putIfPresent(body, "body", head(result.output(), MAX_BODY_CHARS));
        } else {
            putIfPresent(body, "stderr", tail(result.diagnostics(), MAX_DIAGNOSTIC_CHARS));
            putIfPresent(body, "stdout", tail(result.output(), MAX_DIAGNOSTIC_CHARS));
        }
        return toJson(body);
    }

    /** {"error": message} for callers rejected before any external call. */
    public String error(String message) {
        return toJson(Map.of("error", message));
    }

    /** Last {@value #MAX_DIAGNOSTIC_CHARS} characters of a diagnostic stream, stripped. */
    public String diagnosticTail(String value) {
        return tail(value, MAX_DIAGNOSTIC_CHARS).strip();
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize tool response", e);
            return SERIALIZATION_FAILURE;
        }
    }

    private String normalizeSuccess(ExternalCallResult result, SuccessShaper shaper) {
        String payload = result.output();

        if (payload.isBlank()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "No output");
            body.put("stderr", tail(result.diagnostics(), MAX_DIAGNOSTIC_CHARS));
            return toJson(body);
        }

        if (shaper == null) {
            return payload;
        }

        try {
            return toJson(shaper.shape(payload));
        } catch (Exception e) {
            log.warn("Could not reshape successful response: {}", e.getMessage());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Failed to parse response");
            body.put("body", head(payload, MAX_BODY_CHARS));
            return toJson(body);
        }
    }

    private static void putIfPresent(Map<String, Object> body, String key, String value) {
        if (value != null && !value.isBlank()) {
            body.put(key, value);
        }
    }

    static String tail(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(value.length() - max);
    }

    static String head(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max);
    }
}
