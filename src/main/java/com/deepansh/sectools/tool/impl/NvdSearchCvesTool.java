package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.InputSanitizer;
import com.deepansh.sectools.core.ResponseNormalizer;
import com.deepansh.sectools.exception.ToolInputException;
import com.deepansh.sectools.nvd.CveFormatter;
import com.deepansh.sectools.nvd.NvdClient;
import com.deepansh.sectools.tool.SecurityTool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword search against the NVD.
 *
 * Returns:
 * {
 *   "totalResults": 1234,
 *   "returned": 10,
 *   "vulnerabilities": [ {id, description, cvss, ...}, ... ]
 * }
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NvdSearchCvesTool implements SecurityTool {

    static final int DEFAULT_RESULTS = 10;
    static final int MAX_RESULTS = 50;

    private final NvdClient nvdClient;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "nvd_search_cves";
    }

    @Override
    public String getDescription() {
        return """
                Search the National Vulnerability Database by keyword, e.g. "apache log4j"
                or "nginx buffer overflow". Returns condensed CVE records.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "keyword", Map.of(
                                "type", "string",
                                "description", "Search term"
                        ),
                        "results", Map.of(
                                "type", "integer",
                                "description", "Maximum number of results (1-50). Default: 10"
                        )
                ),
                "required", List.of("keyword")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String keyword;
        try {
            keyword = InputSanitizer.sanitizeKeyword(arguments.get("keyword"));
        } catch (ToolInputException e) {
            return normalizer.error(e.getMessage());
        }
        int results = InputSanitizer.clampInt(arguments.get("results"), DEFAULT_RESULTS, 1, MAX_RESULTS);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("keywordSearch", keyword);
        params.put("resultsPerPage", results);

        log.info("NVD search: '{}' (max {})", keyword, results);
        ExternalCallResult result = nvdClient.query(params);
        return normalizer.normalize(result, this::shape);
    }

    private Map<String, Object> shape(String body) throws Exception {
        JsonNode root = objectMapper.readTree(body);
        JsonNode vulnerabilities = root.path("vulnerabilities");

        List<Map<String, Object>> formatted = new ArrayList<>();
        for (JsonNode vulnerability : vulnerabilities) {
            formatted.add(CveFormatter.format(vulnerability));
        }

        Map<String, Object> shaped = new LinkedHashMap<>();
        shaped.put("totalResults", root.path("totalResults").asInt(0));
        shaped.put("returned", formatted.size());
        shaped.put("vulnerabilities", formatted);
        return shaped;
    }
}
