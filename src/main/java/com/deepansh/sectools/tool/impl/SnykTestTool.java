package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.tool.ScannerRunner;
import com.deepansh.sectools.tool.SecurityTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Open-source dependency test with Snyk.
 *
 * Snyk exits 1 when vulnerabilities are found; the JSON report is still
 * complete, so {0, 1} both count as success.
 */
@Component
@Slf4j
public class SnykTestTool implements SecurityTool {

    private final ToolProperties.Scanner snyk;
    private final ScannerRunner runner;

    public SnykTestTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.snyk = toolProperties.snyk();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "snyk_test";
    }

    @Override
    public String getDescription() {
        return """
                Test a project's open-source dependencies for known vulnerabilities with Snyk.
                Requires the Snyk CLI to be authenticated (see snyk_auth_status).
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Project directory containing a manifest, e.g. /workspace/app"
                        ),
                        "package_manager", Map.of(
                                "type", "string",
                                "description", "Force a package manager, e.g. npm, maven, pip. Default: auto-detect"
                        )
                ),
                "required", List.of("path")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String path = InputSanitizer.requireTarget(arguments.get("path"), "path");

            List<String> args = new ArrayList<>(List.of("test", path));
            Object packageManager = arguments.get("package_manager");
            if (packageManager != null && !InputSanitizer.sanitize(packageManager, 64).isEmpty()) {
                args.add("--package-manager");
                args.add(InputSanitizer.sanitizePackageManager(packageManager));
            }
            args.add("--json");

            log.info("Snyk test: {}", path);
            return runner.run(snyk, args, ProcessInvoker.EXIT_OK_OR_FINDINGS);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
