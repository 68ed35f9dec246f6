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
 * Filesystem / project directory scan with Trivy (lockfiles, OS packages, binaries).
 */
@Component
@Slf4j
public class TrivyFilesystemScanTool implements SecurityTool {

    private final ToolProperties.Scanner trivy;
    private final ScannerRunner runner;

    public TrivyFilesystemScanTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.trivy = toolProperties.trivy();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "trivy_scan_filesystem";
    }

    @Override
    public String getDescription() {
        return """
                Scan a local directory or file for vulnerable dependencies with Trivy.
                Use this for source checkouts, extracted root filesystems or build outputs.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Path on the server to scan, e.g. /workspace/app"
                        ),
                        "severity", TrivyArgs.SEVERITY_SCHEMA
                ),
                "required", List.of("path")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String path = InputSanitizer.requireTarget(arguments.get("path"), "path");
            log.info("Trivy filesystem scan: {}", path);
            return runner.run(trivy, TrivyArgs.scan("fs", path, arguments.get("severity")), ProcessInvoker.EXIT_OK);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
