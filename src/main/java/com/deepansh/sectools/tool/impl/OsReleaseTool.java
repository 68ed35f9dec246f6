package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ResponseNormalizer;
import com.deepansh.sectools.tool.SecurityTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns the host's os-release file as text. No parsing.
 */
@Component
@Slf4j
public class OsReleaseTool implements SecurityTool {

    private final Path osReleasePath;
    private final ResponseNormalizer normalizer;

    public OsReleaseTool(ToolProperties toolProperties, ResponseNormalizer normalizer) {
        this.osReleasePath = Path.of(toolProperties.commands().osReleasePath());
        this.normalizer = normalizer;
    }

    @Override
    public String getName() {
        return "os_release";
    }

    @Override
    public String getDescription() {
        return """
                Read the host's OS release information (distribution name and version).
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        try {
            String content = Files.readString(osReleasePath, StandardCharsets.UTF_8);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("path", osReleasePath.toString());
            body.put("content", content);
            return normalizer.toJson(body);
        } catch (NoSuchFileException e) {
            return normalizer.error(osReleasePath + " not found");
        } catch (IOException e) {
            log.error("Failed to read {}", osReleasePath, e);
            return normalizer.error("Failed to read " + osReleasePath + ": " + e.getMessage());
        }
    }
}
