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
 * Infrastructure-as-code misconfiguration scan (Terraform, Kubernetes, CloudFormation).
 */
@Component
@Slf4j
public class SnykIacTestTool implements SecurityTool {

    private final ToolProperties.Scanner snyk;
    private final ScannerRunner runner;

    public SnykIacTestTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.snyk = toolProperties.snyk();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "snyk_iac_test";
    }

    @Override
    public String getDescription() {
        return """
                Scan infrastructure-as-code files (Terraform, Kubernetes manifests, CloudFormation)
                for security misconfigurations with Snyk.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "IaC file or directory, e.g. /infra/main.tf"
                        )
                ),
                "required", List.of("path")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String path = InputSanitizer.requireTarget(arguments.get("path"), "path");
            log.info("Snyk IaC test: {}", path);
            return runner.run(snyk, List.of("iac", "test", path, "--json"), ProcessInvoker.EXIT_OK_OR_FINDINGS);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
