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
 * Static analysis (SAST) of source code with Snyk Code. Output is SARIF-style JSON.
 */
@Component
@Slf4j
public class SnykCodeTestTool implements SecurityTool {

    private final ToolProperties.Scanner snyk;
    private final ScannerRunner runner;

    public SnykCodeTestTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.snyk = toolProperties.snyk();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "snyk_code_test";
    }

    @Override
    public String getDescription() {
        return """
                Run Snyk Code static analysis over a source directory and report security issues
                in first-party code (injection, hardcoded secrets, unsafe APIs).
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Source directory to analyse"
                        )
                ),
                "required", List.of("path")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String path = InputSanitizer.requireTarget(arguments.get("path"), "path");
            log.info("Snyk code test: {}", path);
            return runner.run(snyk, List.of("code", "test", path, "--json"), ProcessInvoker.EXIT_OK_OR_FINDINGS);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
