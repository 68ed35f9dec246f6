package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.tool.ScannerRunner;
import com.deepansh.sectools.tool.SecurityTool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class TrivySbomScanTool implements SecurityTool {

    private final ToolProperties.Scanner trivy;
    private final ScannerRunner runner;

    public TrivySbomScanTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.trivy = toolProperties.trivy();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "trivy_scan_sbom";
    }

    @Override
    public String getDescription() {
        return """
                Scan a CycloneDX or SPDX SBOM file for known vulnerabilities with Trivy.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Path to the SBOM file, e.g. /workspace/sbom.cdx.json"
                        )
                ),
                "required", List.of("path")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String path = InputSanitizer.requireTarget(arguments.get("path"), "path");
            return runner.run(trivy, TrivyArgs.scan("sbom", path, null), ProcessInvoker.EXIT_OK);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
