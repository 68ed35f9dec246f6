package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.ExternalCallResult.Outcome;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.core.ResponseNormalizer;
import com.deepansh.sectools.tool.ScannerRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Argument vectors and exit-code handling of the scanner tools, with the
 * process invoker mocked out.
 */
class ScannerToolsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolProperties props = ToolProperties.defaults();

    private ProcessInvoker invoker;
    private ScannerRunner runner;

    @BeforeEach
    void setUp() {
        invoker = mock(ProcessInvoker.class);
        runner = new ScannerRunner(invoker, new ResponseNormalizer(objectMapper));
        when(invoker.run(anyList(), any(Duration.class), anySet()))
                .thenReturn(ExternalCallResult.processCompleted(Outcome.SUCCESS, 0, "{\"ok\": true}", "", null));
    }

    @SuppressWarnings("unchecked")
    private List<String> capturedArgv() {
        ArgumentCaptor<List<String>> argv = ArgumentCaptor.forClass(List.class);
        verify(invoker).run(argv.capture(), any(Duration.class), anySet());
        return argv.getValue();
    }

    @SuppressWarnings("unchecked")
    private Set<Integer> capturedSuccessCodes() {
        ArgumentCaptor<Set<Integer>> codes = ArgumentCaptor.forClass(Set.class);
        verify(invoker).run(anyList(), any(Duration.class), codes.capture());
        return codes.getValue();
    }

    @Test
    void trivyImage_buildsJsonScanWithSeverityFilter() {
        String result = new TrivyImageScanTool(props, runner)
                .execute(Map.of("image", "alpine:3.19", "severity", "high, critical"));

        assertThat(result).isEqualTo("{\"ok\": true}");
        assertThat(capturedArgv()).containsExactly(
                "trivy", "image", "--format", "json", "--quiet", "--severity", "HIGH,CRITICAL", "alpine:3.19");
    }

    @Test
    void trivyImage_invalidSeverity_neverRunsScanner() throws Exception {
        String result = new TrivyImageScanTool(props, runner)
                .execute(Map.of("image", "alpine:3.19", "severity", "extreme"));

        assertThat(objectMapper.readTree(result).get("error").asText()).contains("Invalid severity 'EXTREME'");
        verifyNoInteractions(invoker);
    }

    @Test
    void trivyImage_optionLikeTarget_isRejected() throws Exception {
        String result = new TrivyImageScanTool(props, runner).execute(Map.of("image", "--help"));

        assertThat(objectMapper.readTree(result).get("error").asText()).isEqualTo("'image' must not start with '-'");
        verifyNoInteractions(invoker);
    }

    @Test
    void trivyFilesystem_withoutSeverity_omitsFlag() {
        new TrivyFilesystemScanTool(props, runner).execute(Map.of("path", "/workspace/app"));

        assertThat(capturedArgv()).containsExactly("trivy", "fs", "--format", "json", "--quiet", "/workspace/app");
    }

    @Test
    void trivySbom_scansFile() {
        new TrivySbomScanTool(props, runner).execute(Map.of("path", "/workspace/sbom.json"));

        assertThat(capturedArgv()).containsExactly("trivy", "sbom", "--format", "json", "--quiet", "/workspace/sbom.json");
        assertThat(capturedSuccessCodes()).containsExactly(0);
    }

    @Test
    void trivy_missingTarget_isRequired() throws Exception {
        String result = new TrivySbomScanTool(props, runner).execute(Map.of());

        assertThat(objectMapper.readTree(result).get("error").asText()).isEqualTo("'path' is required");
    }

    @Test
    void grypeScan_failOnUsesLowercaseSeverity_andAcceptsExitOne() {
        new GrypeScanTool(props, runner).execute(Map.of("target", "dir:/workspace", "fail_on", "HIGH"));

        assertThat(capturedArgv()).containsExactly("grype", "dir:/workspace", "-o", "json", "--fail-on", "high");
        assertThat(capturedSuccessCodes()).containsExactlyInAnyOrder(0, 1);
    }

    @Test
    void grypeScan_invalidFailOn_returnsError() throws Exception {
        String result = new GrypeScanTool(props, runner).execute(Map.of("target", "alpine", "fail_on", "extreme"));

        assertThat(objectMapper.readTree(result).get("error").asText())
                .isEqualTo("Invalid severity 'extreme'. Valid values: negligible, low, medium, high, critical");
        verifyNoInteractions(invoker);
    }

    @Test
    void grypeDbStatus_requestsJson() {
        new GrypeDbStatusTool(props, runner).execute(Map.of());

        assertThat(capturedArgv()).containsExactly("grype", "db", "status", "-o", "json");
    }

    @Test
    void grypeDbUpdate_wrapsPlainTextOutput() throws Exception {
        when(invoker.run(anyList(), any(Duration.class), anySet())).thenReturn(
                ExternalCallResult.processCompleted(Outcome.SUCCESS, 0, "Vulnerability database updated\n", "", null));

        JsonNode json = objectMapper.readTree(new GrypeDbUpdateTool(props, runner).execute(Map.of()));

        assertThat(json.get("updated").asBoolean()).isTrue();
        assertThat(json.get("output").asText()).isEqualTo("Vulnerability database updated");
        assertThat(capturedArgv()).containsExactly("grype", "db", "update");
    }

    @Test
    void snykTest_withoutPackageManager() {
        new SnykTestTool(props, runner).execute(Map.of("path", "/app"));

        assertThat(capturedArgv()).containsExactly("snyk", "test", "/app", "--json");
        assertThat(capturedSuccessCodes()).containsExactlyInAnyOrder(0, 1);
    }

    @Test
    void snykTest_withPackageManager() {
        new SnykTestTool(props, runner).execute(Map.of("path", "/app", "package_manager", "npm"));

        assertThat(capturedArgv()).containsExactly("snyk", "test", "/app", "--package-manager", "npm", "--json");
    }

    @Test
    void snykCodeContainerAndIac_buildExpectedCommands() {
        new SnykCodeTestTool(props, runner).execute(Map.of("path", "/src"));
        new SnykContainerTestTool(props, runner).execute(Map.of("image", "nginx:1.25"));
        new SnykIacTestTool(props, runner).execute(Map.of("path", "/infra/main.tf"));

        verify(invoker).run(eq(List.of("snyk", "code", "test", "/src", "--json")), any(Duration.class), anySet());
        verify(invoker).run(eq(List.of("snyk", "container", "test", "nginx:1.25", "--json")), any(Duration.class), anySet());
        verify(invoker).run(eq(List.of("snyk", "iac", "test", "/infra/main.tf", "--json")), any(Duration.class), anySet());
    }

    @Test
    void snykAuthStatus_success_reportsUser() throws Exception {
        when(invoker.run(anyList(), any(Duration.class), anySet())).thenReturn(
                ExternalCallResult.processCompleted(Outcome.SUCCESS, 0, "dev@example.com\n", "", null));

        JsonNode json = objectMapper.readTree(new SnykAuthStatusTool(props, runner).execute(Map.of()));

        assertThat(json.get("authenticated").asBoolean()).isTrue();
        assertThat(json.get("user").asText()).isEqualTo("dev@example.com");
        assertThat(capturedArgv()).containsExactly("snyk", "whoami", "--experimental");
    }

    @Test
    void snykAuthStatus_failure_isNotAuthenticated() throws Exception {
        when(invoker.run(anyList(), any(Duration.class), anySet())).thenReturn(
                ExternalCallResult.processCompleted(Outcome.INFRASTRUCTURE_FAILURE, 2, "",
                        "Authentication error", "snyk exited with code 2"));

        JsonNode json = objectMapper.readTree(new SnykAuthStatusTool(props, runner).execute(Map.of()));

        assertThat(json.get("authenticated").asBoolean()).isFalse();
        assertThat(json.get("error").asText()).isEqualTo("snyk exited with code 2");
        assertThat(json.get("stderr").asText()).isEqualTo("Authentication error");
    }

    @Test
    void snykAuthStatus_longStderr_keepsOnlyTail() throws Exception {
        String stderr = "x".repeat(50_000) + "token expired";
        when(invoker.run(anyList(), any(Duration.class), anySet())).thenReturn(
                ExternalCallResult.processCompleted(Outcome.INFRASTRUCTURE_FAILURE, 2, "",
                        stderr, "snyk exited with code 2"));

        JsonNode json = objectMapper.readTree(new SnykAuthStatusTool(props, runner).execute(Map.of()));

        assertThat(json.get("stderr").asText())
                .hasSizeLessThanOrEqualTo(ResponseNormalizer.MAX_DIAGNOSTIC_CHARS)
                .endsWith("token expired");
    }

    @Test
    void scannerVersion_grypeUsesSubcommand() throws Exception {
        when(invoker.run(anyList(), any(Duration.class), anySet())).thenReturn(
                ExternalCallResult.processCompleted(Outcome.SUCCESS, 0, "Version: 0.74.0\n", "", null));

        JsonNode json = objectMapper.readTree(new ScannerVersionTool(props, runner).execute(Map.of("scanner", "Grype")));

        assertThat(json.get("scanner").asText()).isEqualTo("grype");
        assertThat(json.get("version").asText()).isEqualTo("Version: 0.74.0");
        assertThat(capturedArgv()).containsExactly("grype", "version");
    }

    @Test
    void scannerVersion_unknownScanner_isRejected() throws Exception {
        String result = new ScannerVersionTool(props, runner).execute(Map.of("scanner", "nmap"));

        assertThat(objectMapper.readTree(result).get("error").asText()).startsWith("Unknown scanner 'nmap'");
        verifyNoInteractions(invoker);
    }

    @Test
    void scannerFailure_isNormalizedWithStderr() throws Exception {
        when(invoker.run(anyList(), any(Duration.class), anySet())).thenReturn(
                ExternalCallResult.processCompleted(Outcome.INFRASTRUCTURE_FAILURE, 2, "",
                        "FATAL image not found", "trivy exited with code 2"));

        JsonNode json = objectMapper.readTree(new TrivyImageScanTool(props, runner).execute(Map.of("image", "nope:1")));

        assertThat(json.get("error").asText()).isEqualTo("trivy exited with code 2");
        assertThat(json.get("stderr").asText()).isEqualTo("FATAL image not found");
    }

    @Test
    void scanners_useConfiguredBinaryAndTimeout() {
        ToolProperties custom = new ToolProperties(null, null, null,
                new ToolProperties.Scanner("/opt/trivy/bin/trivy", 42), null, null);

        new TrivyImageScanTool(custom, runner).execute(Map.of("image", "alpine"));

        verify(invoker).run(eq(List.of("/opt/trivy/bin/trivy", "image", "--format", "json", "--quiet", "alpine")),
                eq(Duration.ofSeconds(42)), anySet());
    }
}
