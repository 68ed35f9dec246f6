package com.deepansh.sectools.core;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Vulnerability severity levels as understood by Grype's --fail-on flag.
 */
public enum Severity {
    NEGLIGIBLE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String cliValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<String> cliValues() {
        return Arrays.stream(values()).map(Severity::cliValue).toList();
    }
}
