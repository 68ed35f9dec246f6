package com.deepansh.sectools.api;

import com.deepansh.sectools.model.ToolCall;
import com.deepansh.sectools.tool.ToolDefinition;
import com.deepansh.sectools.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface over the tool registry.
 *
 * GET  /api/v1/tools          list tool definitions
 * POST /api/v1/tools/{name}   invoke a tool; body is its arguments object
 * GET  /api/v1/health
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class ToolController {

    private final ToolRegistry toolRegistry;

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDefinition>> listTools() {
        return ResponseEntity.ok(toolRegistry.getAllDefinitions());
    }

    @PostMapping(value = "/tools/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> invoke(@PathVariable String name,
                                         @RequestBody(required = false) Map<String, Object> arguments) {
        log.info("Tool request [{}]", name);
        String result = toolRegistry.execute(ToolCall.of(name, arguments));
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(result);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
