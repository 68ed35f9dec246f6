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

@Component
@Slf4j
public class SnykContainerTestTool implements SecurityTool {

    private final ToolProperties.Scanner snyk;
    private final ScannerRunner runner;

    public SnykContainerTestTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.snyk = toolProperties.snyk();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "snyk_container_test";
    }

    @Override
    public String getDescription() {
        return """
                Test a container image for vulnerable OS packages and application dependencies with Snyk.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "image", Map.of(
                                "type", "string",
                                "description", "Image reference, e.g. nginx:1.25"
                        )
                ),
                "required", List.of("image")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String image = InputSanitizer.requireTarget(arguments.get("image"), "image");
            log.info("Snyk container test: {}", image);
            return runner.run(snyk, List.of("container", "test", image, "--json"), ProcessInvoker.EXIT_OK_OR_FINDINGS);
        } catch (ToolInputException e) {
            return runner.normalizer().error(e.getMessage());
        }
    }
}
