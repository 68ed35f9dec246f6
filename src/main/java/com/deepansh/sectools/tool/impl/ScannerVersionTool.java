package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.exception.ErrorKind;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.tool.ScannerRunner;
import com.deepansh.sectools.tool.SecurityTool;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Version of one of the installed scanners.
 * Trivy and Snyk take --version; Grype uses a "version" subcommand.
 */
@Component
public class ScannerVersionTool implements SecurityTool {

    private static final List<String> SCANNERS = List.of("trivy", "grype", "snyk");

    private final ToolProperties toolProperties;
    private final ScannerRunner runner;

    public ScannerVersionTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.toolProperties = toolProperties;
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "scanner_version";
    }

    @Override
    public String getDescription() {
        return """
                Report the installed version of a scanner (trivy, grype or snyk).
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "scanner", Map.of(
                                "type", "string",
                                "enum", SCANNERS,
                                "description", "Which scanner to query"
                        )
                ),
                "required", List.of("scanner")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String name = InputSanitizer.requireField(arguments.get("scanner"), "scanner", 16)
                    .toLowerCase(Locale.ROOT);

            ToolProperties.Scanner scanner;
            List<String> args;
            switch (name) {
                case "trivy" -> { scanner = toolProperties.trivy(); args = List.of("--version"); }
                case "grype" -> { scanner = toolProperties.grype(); args = List.of("version"); }
                case "snyk" -> { scanner = toolProperties.snyk(); args = List.of("--version"); }
                default -> throw new ToolInputException(ErrorKind.INVALID_VALUE,
                        "Unknown scanner '" + name + "'. Valid values: " + String.join(", ", SCANNERS));
            }

            ExternalCallResult result = runner.invoke(scanner, args, ProcessInvoker.EXIT_OK);
            return runner.normalizer().normalize(result, stdout -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("scanner", name);
                body.put("version", stdout.strip());
                return body;
            });
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
