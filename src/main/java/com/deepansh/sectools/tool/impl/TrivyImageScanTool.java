package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.tool.ScannerRunner;
import com.deepansh.sectools.tool.SecurityTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Container image scan with Trivy.
 *
 * Runs: trivy image --format json --quiet [--severity S] &lt;image&gt;
 * Trivy exits 0 whether or not vulnerabilities are found (no --exit-code),
 * so only 0 counts as success. The JSON report is passed through untouched.
 */
@Component
@Slf4j
public class TrivyImageScanTool implements SecurityTool {

    private final ToolProperties.Scanner trivy;
    private final ScannerRunner runner;

    public TrivyImageScanTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.trivy = toolProperties.trivy();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "trivy_scan_image";
    }

    @Override
    public String getDescription() {
        return """
                Scan a container image for known vulnerabilities with Trivy.
                Returns Trivy's JSON report (Results[].Vulnerabilities[]).
                E.g: image "nginx:1.25" or "ghcr.io/org/app@sha256:...".
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "image", Map.of(
                                "type", "string",
                                "description", "Image reference to scan, e.g. nginx:latest"
                        ),
                        "severity", TrivyArgs.SEVERITY_SCHEMA
                ),
                "required", List.of("image")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String image = InputSanitizer.requireTarget(arguments.get("image"), "image");
            List<String> args = TrivyArgs.scan("image", image, arguments.get("severity"));
            log.info("Trivy image scan: {}", image);
            return runner.run(trivy, args, ProcessInvoker.EXIT_OK);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
