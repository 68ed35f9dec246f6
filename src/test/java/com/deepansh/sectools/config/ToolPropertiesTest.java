package com.deepansh.sectools.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolPropertiesTest {

    @Test
    void defaults_matchHardenedProfile() {
        ToolProperties props = ToolProperties.defaults();

        assertThat(props.security().authEnabled()).isFalse();
        assertThat(props.nvd().baseUrl()).isEqualTo("https://services.nvd.nist.gov/rest/json/cves/2.0");
        assertThat(props.nvd().hasApiKey()).isFalse();
        assertThat(props.commands().getAllowedList())
                .containsExactly("whoami", "id", "uname", "hostname", "uptime", "date", "df", "free", "ps");
        assertThat(props.trivy().binary()).isEqualTo("trivy");
        assertThat(props.snyk().timeoutSeconds()).isEqualTo(300);
    }

    @Test
    void allowedList_trimsAndDropsBlanks() {
        ToolProperties.Commands commands = new ToolProperties.Commands(" whoami, ,id ,", 30, 300, "/etc/os-release");

        assertThat(commands.getAllowedList()).containsExactly("whoami", "id");
    }

    @Test
    void authEnabled_onlyForNonBlankToken() {
        assertThat(new ToolProperties.Security("   ").authEnabled()).isFalse();
        assertThat(new ToolProperties.Security("s3cret").authEnabled()).isTrue();
    }

    @Test
    void startupSummary_masksSecrets() {
        assertThat(StartupInfoRunner.mask("")).isEqualTo("<not set>");
        assertThat(StartupInfoRunner.mask("abc123")).isEqualTo("****").doesNotContain("abc");
    }
}
