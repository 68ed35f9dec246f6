package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.tool.ScannerRunner;
import com.deepansh.sectools.tool.SecurityTool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reports the state of Grype's local vulnerability database (schema, build date, validity).
 */
@Component
public class GrypeDbStatusTool implements SecurityTool {

    private final ToolProperties.Scanner grype;
    private final ScannerRunner runner;

    public GrypeDbStatusTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.grype = toolProperties.grype();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "grype_db_status";
    }

    @Override
    public String getDescription() {
        return """
                Show the status of Grype's local vulnerability database: location, schema version,
                build date and whether it is valid. Check this before trusting scan results.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return runner.run(grype, List.of("db", "status", "-o", "json"), ProcessInvoker.EXIT_OK);
    }
}
