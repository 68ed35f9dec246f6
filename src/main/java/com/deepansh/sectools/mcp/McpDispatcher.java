package com.deepansh.sectools.mcp;

import com.deepansh.sectools.exception.UnknownToolException;
import com.deepansh.sectools.model.ToolCall;
import com.deepansh.sectools.tool.ToolDefinition;
import com.deepansh.sectools.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The Model Context Protocol subset this server speaks over JSON-RPC 2.0:
 *
 *   initialize  -> protocol version, capabilities, server info
 *   ping        -> {}
 *   tools/list  -> {"tools": [ {name, description, inputSchema}, ... ]}
 *   tools/call  -> {"content": [{"type": "text", "text": <tool json>}], "isError": bool}
 *
 * Messages without an id are notifications and get no response
 * ({@link Optional#empty()}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpDispatcher {

    static final String PROTOCOL_VERSION = "2024-11-05";
    static final String SERVER_NAME = "security-tools-server";
    static final String SERVER_VERSION = "0.1.0";

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public Optional<Map<String, Object>> handle(String rawMessage) {
        JsonNode message;
        try {
            message = objectMapper.readTree(rawMessage);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable JSON-RPC message: {}", e.getOriginalMessage());
            return Optional.of(error(null, JsonRpcError.PARSE_ERROR, "Parse error"));
        }
        return handle(message);
    }

    public Optional<Map<String, Object>> handle(JsonNode message) {
        if (message == null || !message.isObject() || !message.path("method").isTextual()) {
            return Optional.of(error(null, JsonRpcError.INVALID_REQUEST, "Invalid Request"));
        }

        String method = message.get("method").asText();
        JsonNode idNode = message.get("id");
        Object id = idNode == null ? null : objectMapper.convertValue(idNode, Object.class);
        JsonNode params = message.path("params");

        if (idNode == null) {
            log.debug("MCP notification: {}", method);
            return Optional.empty();
        }

        log.info("MCP request: method={} id={}", method, id);
        return Optional.of(switch (method) {
            case "initialize" -> result(id, initialize(params));
            case "ping" -> result(id, Map.of());
            case "tools/list" -> result(id, Map.of("tools", listTools()));
            case "tools/call" -> callTool(id, params);
            default -> error(id, JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + method);
        });
    }

    private Map<String, Object> initialize(JsonNode params) {
        String requested = params.path("protocolVersion").asText("");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("protocolVersion", requested.isBlank() ? PROTOCOL_VERSION : requested);
        body.put("capabilities", Map.of("tools", Map.of("listChanged", false)));
        body.put("serverInfo", Map.of("name", SERVER_NAME, "version", SERVER_VERSION));
        return body;
    }

    private List<Map<String, Object>> listTools() {
        return toolRegistry.getAllDefinitions().stream()
                .map(ToolDefinition::toMcpSchema)
                .toList();
    }

    private Map<String, Object> callTool(Object id, JsonNode params) {
        JsonNode name = params.path("name");
        if (!name.isTextual()) {
            return error(id, JsonRpcError.INVALID_PARAMS, "tools/call requires a tool name");
        }

        JsonNode argumentsNode = params.path("arguments");
        if (!argumentsNode.isMissingNode() && !argumentsNode.isNull() && !argumentsNode.isObject()) {
            return error(id, JsonRpcError.INVALID_PARAMS, "tools/call arguments must be an object");
        }
        Map<String, Object> arguments = argumentsNode.isObject()
                ? objectMapper.convertValue(argumentsNode, new TypeReference<Map<String, Object>>() {})
                : Map.of();

        String output;
        try {
            output = toolRegistry.execute(ToolCall.of(name.asText(), arguments));
        } catch (UnknownToolException e) {
            return error(id, JsonRpcError.INVALID_PARAMS, e.getMessage());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", List.of(Map.of("type", "text", "text", output)));
        body.put("isError", isErrorPayload(output));
        return result(id, body);
    }

    /**
     * A tool reports failure as a JSON object with a top-level "error" field.
     * Scanner reports can run to megabytes, so only top-level field names are
     * read and nested values are skipped without building a tree.
     */
    boolean isErrorPayload(String output) {
        if (output == null || !output.contains("\"error\"")) return false;
        try (JsonParser parser = objectMapper.getFactory().createParser(output)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) return false;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                if ("error".equals(parser.currentName())) return true;
                parser.nextToken();
                parser.skipChildren();
            }
            return false;
        } catch (IOException e) {
            log.debug("Tool output is not a JSON object: {}", e.getMessage());
            return false;
        }
    }

    private static Map<String, Object> result(Object id, Object result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("result", result);
        return response;
    }

    private static Map<String, Object> error(Object id, int code, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("error", Map.of("code", code, "message", message));
        return response;
    }
}
