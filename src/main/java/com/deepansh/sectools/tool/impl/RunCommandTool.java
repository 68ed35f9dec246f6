package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.CommandAllowlist;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.core.ResponseNormalizer;
import com.deepansh.sectools.core.ShellTokenizer;
import com.deepansh.sectools.exception.ErrorKind;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.tool.SecurityTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs an allowlisted command on the host.
 *
 * The command line is split with POSIX word rules and the resulting argv is
 * executed directly. No shell ever sees it, so pipes, redirects and
 * substitutions reach the program as literal arguments.
 */
@Component
@Slf4j
public class RunCommandTool implements SecurityTool {

    private final CommandAllowlist allowlist;
    private final ProcessInvoker processInvoker;
    private final ResponseNormalizer normalizer;
    private final ToolProperties.Commands commands;

    public RunCommandTool(CommandAllowlist allowlist, ProcessInvoker processInvoker,
                          ResponseNormalizer normalizer, ToolProperties toolProperties) {
        this.allowlist = allowlist;
        this.processInvoker = processInvoker;
        this.normalizer = normalizer;
        this.commands = toolProperties.commands();
    }

    @Override
    public String getName() {
        return "run_command";
    }

    @Override
    public String getDescription() {
        return """
                Run a read-only diagnostic command on the host, e.g. "uname -a" or "df -h".
                Only allowlisted programs may run. Shell syntax (pipes, redirects, $(...)) is not interpreted.
                Allowed: %s
                """.formatted(allowlist.describe());
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "command", Map.of(
                                "type", "string",
                                "description", "Command line to run"
                        ),
                        "timeout_seconds", Map.of(
                                "type", "integer",
                                "description", "Timeout in seconds (1-" + commands.maxTimeoutSeconds()
                                        + "). Default: " + commands.defaultTimeoutSeconds()
                        )
                ),
                "required", List.of("command")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String commandLine = InputSanitizer.requireField(
                    arguments.get("command"), "command", InputSanitizer.MAX_COMMAND_LENGTH);
            List<String> argv = ShellTokenizer.split(commandLine);

            if (!allowlist.isAllowed(argv)) {
                String program = argv.isEmpty() ? "" : argv.get(0);
                log.warn("Blocked command: {}", program);
                throw new ToolInputException(ErrorKind.BLOCKED,
                        "Command '" + program + "' is not allowed. Allowed commands: " + allowlist.describe());
            }

            int timeoutSeconds = InputSanitizer.clampInt(arguments.get("timeout_seconds"),
                    commands.defaultTimeoutSeconds(), 1, commands.maxTimeoutSeconds());

            log.info("Running command: {} (timeout {}s)", argv.get(0), timeoutSeconds);
            return normalizer.normalize(
                    processInvoker.run(argv, Duration.ofSeconds(timeoutSeconds), ProcessInvoker.EXIT_OK));
        } catch (ToolInputException e) {
            return normalizer.error(e.getMessage());
        }
    }
}
