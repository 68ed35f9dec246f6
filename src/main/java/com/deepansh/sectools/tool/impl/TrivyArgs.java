package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.exception.ErrorKind;
import com.deepansh.sectools.exception.ToolInputException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Argument building shared by the Trivy tools.
 */
final class TrivyArgs {

    static final List<String> SEVERITIES = List.of("UNKNOWN", "LOW", "MEDIUM", "HIGH", "CRITICAL");

    static final Map<String, Object> SEVERITY_SCHEMA = Map.of(
            "type", "string",
            "description", "Comma-separated severities to report, e.g. HIGH,CRITICAL. "
                    + "Valid: " + String.join(", ", SEVERITIES) + ". Default: all"
    );

    private TrivyArgs() {
    }

    /**
     * trivy &lt;subcommand&gt; --format json --quiet [--severity S] &lt;target&gt;
     */
    static List<String> scan(String subcommand, String target, Object rawSeverity) {
        List<String> args = new ArrayList<>(List.of(subcommand, "--format", "json", "--quiet"));
        String severity = severityList(rawSeverity);
        if (severity != null) {
            args.add("--severity");
            args.add(severity);
        }
        args.add(target);
        return args;
    }

    /** null when no filter was requested */
    static String severityList(Object raw) {
        String value = InputSanitizer.sanitize(raw, 64).toUpperCase(Locale.ROOT);
        if (value.isEmpty()) return null;

        List<String> levels = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        for (String level : levels) {
            if (!SEVERITIES.contains(level)) {
                throw new ToolInputException(ErrorKind.INVALID_VALUE,
                        "Invalid severity '" + level + "'. Valid values: " + String.join(", ", SEVERITIES));
            }
        }
        return levels.isEmpty() ? null : String.join(",", levels);
    }
}
