package com.deepansh.sectools.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed, immutable configuration for all tools.
 * Bound once at startup from application.yml under the "tools" prefix:
 *
 * tools:
 *   security:
 *     auth-token: ${MCP_AUTH_TOKEN:}
 *   nvd:
 *     base-url: https://services.nvd.nist.gov/rest/json/cves/2.0
 *     api-key: ${NVD_API_KEY:}
 *     timeout-seconds: 30
 *   commands:
 *     allowed: whoami,id,uname
 *   trivy:
 *     binary: trivy
 *     timeout-seconds: 300
 *
 * Nothing mutates these records after binding; every component receives the
 * slice it needs through its constructor.
 */
@ConfigurationProperties(prefix = "tools")
@Validated
public record ToolProperties(
        @Valid Security security,
        @Valid Nvd nvd,
        @Valid Commands commands,
        @Valid Scanner trivy,
        @Valid Scanner grype,
        @Valid Scanner snyk
) {

    public ToolProperties {
        security = security != null ? security : new Security("");
        nvd      = nvd != null ? nvd : Nvd.defaults();
        commands = commands != null ? commands : Commands.defaults();
        trivy    = trivy != null ? trivy : new Scanner("trivy", 300);
        grype    = grype != null ? grype : new Scanner("grype", 300);
        snyk     = snyk != null ? snyk : new Scanner("snyk", 300);
    }

    public static ToolProperties defaults() {
        return new ToolProperties(null, null, null, null, null, null);
    }

    public record Security(@DefaultValue("") String authToken) {

        /** Empty token = auth disabled */
        public boolean authEnabled() {
            return authToken != null && !authToken.isBlank();
        }
    }

    public record Nvd(
            @NotBlank @DefaultValue("https://services.nvd.nist.gov/rest/json/cves/2.0") String baseUrl,
            @DefaultValue("") String apiKey,
            @Min(1) @DefaultValue("30") int timeoutSeconds
    ) {

        public static Nvd defaults() {
            return new Nvd("https://services.nvd.nist.gov/rest/json/cves/2.0", "", 30);
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    public record Commands(
            // Comma-separated executable names; "all" disables the check
            @DefaultValue("whoami,id,uname,hostname,uptime,date,df,free,ps") String allowed,
            @Min(1) @DefaultValue("30") int defaultTimeoutSeconds,
            @Min(1) @Max(3600) @DefaultValue("300") int maxTimeoutSeconds,
            @NotBlank @DefaultValue("/etc/os-release") String osReleasePath
    ) {

        public static Commands defaults() {
            return new Commands("whoami,id,uname,hostname,uptime,date,df,free,ps", 30, 300, "/etc/os-release");
        }

        public List<String> getAllowedList() {
            if (allowed == null || allowed.isBlank()) return List.of();
            return Arrays.stream(allowed.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    public record Scanner(
            @NotBlank String binary,
            @Min(1) @DefaultValue("300") int timeoutSeconds
    ) {

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }
}
