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
 * Downloads the latest Grype vulnerability database.
 * Grype prints a human-readable line rather than JSON, so it is wrapped.
 */
@Component
@Slf4j
public class GrypeDbUpdateTool implements SecurityTool {

    private final ToolProperties.Scanner grype;
    private final ScannerRunner runner;

    public GrypeDbUpdateTool(ToolProperties toolProperties, ScannerRunner runner) {
        this.grype = toolProperties.grype();
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "grype_db_update";
    }

    @Override
    public String getDescription() {
        return """
                Update Grype's local vulnerability database to the latest published build.
                May take a minute on first run.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        log.info("Updating Grype vulnerability database");
        ExternalCallResult result = runner.invoke(grype, List.of("db", "update"), ProcessInvoker.EXIT_OK);
        return runner.normalizer().normalize(result, stdout -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("updated", true);
            body.put("output", stdout.strip());
            return body;
        });
    }
}
