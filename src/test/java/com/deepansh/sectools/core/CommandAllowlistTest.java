package com.deepansh.sectools.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommandAllowlistTest {

    private final CommandAllowlist allowlist = new CommandAllowlist(List.of("whoami", "id", "uname"));

    @Test
    void isAllowed_listedCommand_isAllowed() {
        assertThat(allowlist.isAllowed(List.of("uname", "-a"))).isTrue();
    }

    @Test
    void isAllowed_unlistedCommand_isBlocked() {
        assertThat(allowlist.isAllowed(List.of("rm", "-rf", "/"))).isFalse();
    }

    @Test
    void isAllowed_emptyArgv_isNeverAllowed() {
        assertThat(allowlist.isAllowed(List.of())).isFalse();
        assertThat(new CommandAllowlist(List.of("ALL")).isAllowed(List.of())).isFalse();
    }

    @Test
    void isAllowed_comparesExecutableNameExactly() {
        assertThat(allowlist.isAllowed(List.of("/usr/bin/whoami"))).isFalse();
        assertThat(allowlist.isAllowed(List.of("WHOAMI"))).isFalse();
    }

    @Test
    void isAllowed_allSentinel_allowsAnyNonEmptyCommand() {
        CommandAllowlist open = new CommandAllowlist(List.of("All"));
        assertThat(open.isAllowAll()).isTrue();
        assertThat(open.isAllowed(List.of("rm", "-rf", "/tmp/x"))).isTrue();
    }

    @Test
    void describe_isSorted() {
        assertThat(allowlist.describe()).isEqualTo("id, uname, whoami");
    }
}
