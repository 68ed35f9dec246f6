package com.deepansh.sectools.config;

import com.deepansh.sectools.core.CommandAllowlist;
import com.deepansh.sectools.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the effective configuration once the context is up.
 * Secrets are reported as set / not set, never printed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StartupInfoRunner implements ApplicationRunner {

    private final ToolProperties toolProperties;
    private final CommandAllowlist commandAllowlist;
    private final ToolRegistry toolRegistry;
    private final Environment environment;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Security tools server listening on {}:{}",
                environment.getProperty("server.address", "0.0.0.0"),
                environment.getProperty("server.port", "8080"));
        log.info("Tools: {} registered {}", toolRegistry.toolCount(), toolRegistry.getToolNames());
        log.info("NVD: baseUrl={} apiKey={}", toolProperties.nvd().baseUrl(),
                mask(toolProperties.nvd().apiKey()));
        log.info("Scanners: trivy={} grype={} snyk={}", toolProperties.trivy().binary(),
                toolProperties.grype().binary(), toolProperties.snyk().binary());
        log.info("Allowed commands: {}", commandAllowlist.describe());

        if (!toolProperties.security().authEnabled()) {
            log.warn("MCP_AUTH_TOKEN not set. Server is running WITHOUT authentication; "
                    + "every caller can run scans and commands.");
        }
    }

    static String mask(String secret) {
        if (secret == null || secret.isBlank()) return "<not set>";
        return "****";
    }
}
