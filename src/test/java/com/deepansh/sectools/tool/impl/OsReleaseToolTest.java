package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ResponseNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OsReleaseToolTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OsReleaseTool toolFor(Path path) {
        ToolProperties props = new ToolProperties(null, null,
                new ToolProperties.Commands("whoami", 30, 300, path.toString()), null, null, null);
        return new OsReleaseTool(props, new ResponseNormalizer(objectMapper));
    }

    @Test
    void execute_returnsFileContentVerbatim() throws Exception {
        Path osRelease = tempDir.resolve("os-release");
        Files.writeString(osRelease, "NAME=\"Alpine Linux\"\nVERSION_ID=3.19.1\n");

        JsonNode json = objectMapper.readTree(toolFor(osRelease).execute(Map.of()));

        assertThat(json.get("content").asText()).isEqualTo("NAME=\"Alpine Linux\"\nVERSION_ID=3.19.1\n");
        assertThat(json.get("path").asText()).isEqualTo(osRelease.toString());
    }

    @Test
    void execute_missingFile_returnsError() throws Exception {
        Path missing = tempDir.resolve("nope");

        JsonNode json = objectMapper.readTree(toolFor(missing).execute(Map.of()));

        assertThat(json.get("error").asText()).isEqualTo(missing + " not found");
    }
}
