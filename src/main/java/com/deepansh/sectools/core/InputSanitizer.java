package com.deepansh.sectools.core;

import com.deepansh.sectools.exception.ErrorKind;
import com.deepansh.sectools.exception.ToolInputException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns untrusted caller strings into values that may reach an external call.
 *
 * The base {@link #sanitize(Object, int)} never fails: it removes control
 * characters (U+0000-U+001F, U+007F-U+009F), strips surrounding whitespace and
 * truncates to the field maximum. Deciding whether an empty result is
 * acceptable is up to the calling tool; the layered helpers below encode the
 * common decisions and throw {@link ToolInputException} when they reject.
 */
public final class InputSanitizer {

    public static final int MAX_CVE_ID_LENGTH = 30;
    public static final int MAX_KEYWORD_LENGTH = 256;
    public static final int MAX_TARGET_LENGTH = 1024;
    public static final int MAX_COMMAND_LENGTH = 4096;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");
    private static final Pattern PACKAGE_MANAGER = Pattern.compile("[A-Za-z0-9_-]{1,32}");

    private InputSanitizer() {
    }

    public static String sanitize(Object raw, int maxLength) {
        if (raw == null) return "";
        String cleaned = CONTROL_CHARS.matcher(raw.toString()).replaceAll("").strip();
        return cleaned.length() > maxLength ? cleaned.substring(0, maxLength) : cleaned;
    }

    /**
     * Normalises a CVE identifier: "  cve-2024-1234 " becomes "CVE-2024-1234".
     */
    public static String sanitizeCveId(Object raw) {
        String cveId = sanitize(raw, Integer.MAX_VALUE).toUpperCase(Locale.ROOT);
        if (cveId.length() > MAX_CVE_ID_LENGTH) {
            throw new ToolInputException(ErrorKind.INVALID_VALUE, "CVE ID too long");
        }
        if (!cveId.startsWith("CVE-")) {
            throw new ToolInputException(ErrorKind.INVALID_FORMAT,
                    "Invalid CVE ID format. Expected CVE-YYYY-NNNNN");
        }
        return cveId;
    }

    public static String sanitizeKeyword(Object raw) {
        String keyword = sanitize(raw, MAX_KEYWORD_LENGTH);
        if (keyword.isEmpty()) {
            throw new ToolInputException(ErrorKind.INVALID_VALUE,
                    "Keyword must not be empty after sanitization");
        }
        return keyword;
    }

    public static Severity sanitizeSeverity(Object raw) {
        String value = sanitize(raw, 32).toLowerCase(Locale.ROOT);
        for (Severity severity : Severity.values()) {
            if (severity.cliValue().equals(value)) return severity;
        }
        throw new ToolInputException(ErrorKind.INVALID_VALUE,
                "Invalid severity '" + value + "'. Valid values: " + String.join(", ", Severity.cliValues()));
    }

    /**
     * Sanitizes a required path, image reference or scan target.
     */
    public static String requireField(Object raw, String fieldName, int maxLength) {
        String value = sanitize(raw, maxLength);
        if (value.isEmpty()) {
            throw new ToolInputException(ErrorKind.INVALID_VALUE, "'" + fieldName + "' is required");
        }
        return value;
    }

    /**
     * Like {@link #requireField} for a positional scanner argument, which must
     * not be mistaken for an option by the scanner's own flag parser.
     */
    public static String requireTarget(Object raw, String fieldName) {
        String value = requireField(raw, fieldName, MAX_TARGET_LENGTH);
        if (value.startsWith("-")) {
            throw new ToolInputException(ErrorKind.INVALID_VALUE, "'" + fieldName + "' must not start with '-'");
        }
        return value;
    }

    public static String sanitizePackageManager(Object raw) {
        String value = sanitize(raw, 64);
        if (!PACKAGE_MANAGER.matcher(value).matches()) {
            throw new ToolInputException(ErrorKind.INVALID_VALUE,
                    "Invalid package manager '" + value + "'");
        }
        return value;
    }

    /**
     * Parses an integer argument and clamps it into [min, max].
     * Values outside the int range still clamp to the nearest bound.
     * Missing or unparseable values fall back to the default.
     */
    public static int clampInt(Object raw, int defaultValue, int min, int max) {
        if (raw == null) return defaultValue;
        BigDecimal value;
        if (raw instanceof BigDecimal decimal) {
            value = decimal;
        } else if (raw instanceof BigInteger integer) {
            value = new BigDecimal(integer);
        } else if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d)) return defaultValue;
            if (Double.isInfinite(d)) return d > 0 ? max : min;
            value = BigDecimal.valueOf(d);
        } else if (raw instanceof Number number) {
            value = BigDecimal.valueOf(number.longValue());
        } else {
            try {
                value = new BigDecimal(new BigInteger(sanitize(raw, 64)));
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        if (value.compareTo(BigDecimal.valueOf(min)) < 0) return min;
        if (value.compareTo(BigDecimal.valueOf(max)) > 0) return max;
        return value.intValue();
    }
}
