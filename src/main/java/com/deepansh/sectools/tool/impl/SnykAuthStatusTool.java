package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.tool.ScannerRunner;
import com.deepansh.sectools.tool.SecurityTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports whether the Snyk CLI holds valid credentials.
 * A failed whoami is an answer here, not an error.
 */
@Component
@Slf4j
public class SnykAuthStatusTool implements SecurityTool {

    private final ToolProperties.Scanner snyk;
    private final ScannerRunner runner;

    public SnykAuthStatusTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.snyk = toolProperties.snyk();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "snyk_auth_status";
    }

    @Override
    public String getDescription() {
        return """
                Check whether the Snyk CLI is authenticated and, if so, as which user.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        ExternalCallResult result = runner.invoke(snyk, List.of("whoami", "--experimental"), ProcessInvoker.EXIT_OK);

        Map<String, Object> body = new LinkedHashMap<>();
        if (result.isSuccess()) {
            body.put("authenticated", true);
            body.put("user", result.output().strip());
        } else {
            log.warn("Snyk is not authenticated: {}", result.message());
            body.put("authenticated", false);
            body.put("error", result.message());
            String stderr = runner.normalizer().diagnosticTail(result.diagnostics());
            if (!stderr.isEmpty()) {
                body.put("stderr", stderr);
            }
        }
        return runner.normalizer().toJson(body);
    }
}
