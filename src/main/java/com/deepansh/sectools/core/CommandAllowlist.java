package com.deepansh.sectools.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a tokenized command may run.
 *
 * This is a textual check on argv[0] only. It does not look inside arguments,
 * resolve paths or follow symlinks; the invoker executing argv directly
 * (never through a shell) is what keeps metacharacters inert.
 *
 * Built once from configuration and never mutated.
 */
@Slf4j
public class CommandAllowlist {

    public static final String ALLOW_ALL = "all";

    private final Set<String> allowedCommands;
    private final boolean allowAll;

    public CommandAllowlist(Collection<String> configured) {
        this.allowAll = configured.stream().anyMatch(ALLOW_ALL::equalsIgnoreCase);
        this.allowedCommands = configured.stream()
                .filter(c -> !ALLOW_ALL.equalsIgnoreCase(c))
                .collect(Collectors.toUnmodifiableSet());

        if (allowAll) {
            log.warn("Command allowlist disabled ({}): run_command will execute any program", ALLOW_ALL);
        } else {
            log.info("Command allowlist: {}", allowedCommands);
        }
    }

    public boolean isAllowed(List<String> argv) {
        if (argv == null || argv.isEmpty()) return false;
        if (allowAll) return true;
        return allowedCommands.contains(argv.get(0));
    }

    public boolean isAllowAll() {
        return allowAll;
    }

    /** Sorted, for messages */
    public String describe() {
        if (allowAll) return ALLOW_ALL;
        return allowedCommands.stream()
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
