package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.ExternalCallResult.Outcome;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ResponseNormalizer;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.nvd.CveFormatter;
import com.deepansh.sectools.nvd.NvdClient;
import com.deepansh.sectools.tool.SecurityTool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Looks up one CVE in the National Vulnerability Database and returns
 * the condensed record produced by {@link CveFormatter}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NvdGetCveTool implements SecurityTool {

    private final NvdClient nvdClient;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "nvd_get_cve";
    }

    @Override
    public String getDescription() {
        return """
                Fetch details for a specific CVE from the National Vulnerability Database:
                description, CVSS score and vector, CWE classification and references.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "cve_id", Map.of(
                                "type", "string",
                                "description", "The CVE identifier, e.g. CVE-2024-1234"
                        )
                ),
                "required", List.of("cve_id")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String cveId;
        try {
            cveId = InputSanitizer.sanitizeCveId(arguments.get("cve_id"));
        } catch (ToolInputException e) {
            return normalizer.error(e.getMessage());
        }

        log.info("NVD lookup: {}", cveId);
        ExternalCallResult result = nvdClient.query(Map.of("cveId", cveId));
        if (result.isSuccess() && !hasVulnerabilities(result.output())) {
            result = ExternalCallResult.httpFailed(Outcome.NOT_FOUND, "CVE " + cveId + " not found");
        }
        return normalizer.normalize(result,
                body -> CveFormatter.format(objectMapper.readTree(body).path("vulnerabilities").get(0)));
    }

    // Unparseable bodies count as present so the normalizer reports the parse failure
    private boolean hasVulnerabilities(String body) {
        try {
            JsonNode vulnerabilities = objectMapper.readTree(body).path("vulnerabilities");
            return vulnerabilities.isArray() && !vulnerabilities.isEmpty();
        } catch (JsonProcessingException e) {
            return true;
        }
    }
}
