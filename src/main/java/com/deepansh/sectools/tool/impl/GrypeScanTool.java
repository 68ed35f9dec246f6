package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.core.Severity;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.tool.ScannerRunner;
import com.deepansh.sectools.tool.SecurityTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Vulnerability scan with Grype.
 *
 * Runs: grype &lt;target&gt; -o json [--fail-on &lt;severity&gt;]
 * The target may be an image reference, "dir:/path", "sbom:/path.json" etc.
 * With --fail-on, Grype exits 1 when a finding reaches the threshold. The
 * scan itself succeeded in that case, so exit codes {0, 1} are success.
 */
@Component
@Slf4j
public class GrypeScanTool implements SecurityTool {

    private final ToolProperties.Scanner grype;
    private final ScannerRunner runner;

    public GrypeScanTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.grype = toolProperties.grype();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "grype_scan";
    }

    @Override
    public String getDescription() {
        return """
                Scan an image, directory or SBOM for known vulnerabilities with Grype.
                Target examples: "alpine:3.19", "dir:/workspace/app", "sbom:/workspace/sbom.json".
                Returns Grype's JSON report (matches[]).
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "target", Map.of(
                                "type", "string",
                                "description", "What to scan: image reference, dir:<path> or sbom:<path>"
                        ),
                        "fail_on", Map.of(
                                "type", "string",
                                "enum", Severity.cliValues(),
                                "description", "Severity threshold reported as a failed gate"
                        )
                ),
                "required", List.of("target")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String target = InputSanitizer.requireTarget(arguments.get("target"), "target");

            List<String> args = new ArrayList<>(List.of(target, "-o", "json"));
            Object failOn = arguments.get("fail_on");
            if (failOn != null && !InputSanitizer.sanitize(failOn, 32).isEmpty()) {
                args.add("--fail-on");
                args.add(InputSanitizer.sanitizeSeverity(failOn).cliValue());
            }

            log.info("Grype scan: {}", target);
            return runner.run(grype, args, ProcessInvoker.EXIT_OK_OR_FINDINGS);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
