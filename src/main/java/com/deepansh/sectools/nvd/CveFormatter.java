package com.deepansh.sectools.nvd;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the useful fields out of a raw NVD vulnerability object.
 * Output is optimized for LLM consumption: flat, small, no nested metric noise.
 */
public final class CveFormatter {

    private static final List<String> CVSS_METRIC_KEYS = List.of("cvssMetricV31", "cvssMetricV30", "cvssMetricV2");
    private static final int MAX_REFERENCES = 10;

    private CveFormatter() {
    }

    public static Map<String, Object> format(JsonNode vulnerability) {
        JsonNode cve = vulnerability.path("cve");

        Map<String, Object> formatted = new LinkedHashMap<>();
        formatted.put("id", cve.path("id").asText("unknown"));
        formatted.put("description", description(cve.path("descriptions")));
        formatted.put("published", cve.path("published").asText(""));
        formatted.put("lastModified", cve.path("lastModified").asText(""));
        formatted.put("cvss", cvss(cve.path("metrics")));
        formatted.put("cwes", cwes(cve.path("weaknesses")));
        formatted.put("references", references(cve.path("references")));
        return formatted;
    }

    // English first, then whatever comes first
    private static String description(JsonNode descriptions) {
        if (!descriptions.isArray() || descriptions.isEmpty()) return "No description";
        for (JsonNode d : descriptions) {
            if ("en".equals(d.path("lang").asText())) {
                return d.path("value").asText("");
            }
        }
        return descriptions.get(0).path("value").asText("");
    }

    private static Map<String, Object> cvss(JsonNode metrics) {
        Map<String, Object> cvss = new LinkedHashMap<>();
        for (String key : CVSS_METRIC_KEYS) {
            JsonNode metricList = metrics.path(key);
            if (!metricList.isArray() || metricList.isEmpty()) continue;

            JsonNode metric = metricList.get(0);
            JsonNode data = metric.path("cvssData");
            cvss.put("version", data.path("version").asText(""));
            cvss.put("baseScore", data.hasNonNull("baseScore") ? data.get("baseScore").numberValue() : null);
            // v2 keeps baseSeverity on the metric rather than in cvssData
            cvss.put("baseSeverity", data.path("baseSeverity").asText(metric.path("baseSeverity").asText("")));
            cvss.put("vectorString", data.path("vectorString").asText(""));
            break;
        }
        return cvss;
    }

    private static List<String> cwes(JsonNode weaknesses) {
        List<String> cwes = new ArrayList<>();
        for (JsonNode weakness : weaknesses) {
            for (JsonNode desc : weakness.path("description")) {
                String value = desc.path("value").asText("");
                if (value.startsWith("CWE-")) cwes.add(value);
            }
        }
        return cwes;
    }

    private static List<Map<String, String>> references(JsonNode references) {
        List<Map<String, String>> refs = new ArrayList<>();
        for (JsonNode ref : references) {
            if (refs.size() >= MAX_REFERENCES) break;
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("url", ref.path("url").asText(""));
            entry.put("source", ref.path("source").asText(""));
            refs.add(entry);
        }
        return refs;
    }
}
