package com.deepansh.sectools.api;

import com.deepansh.sectools.mcp.McpDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * MCP over plain HTTP POST.
 *
 * POST /mcp   one JSON-RPC message per request
 *   request       -> 200 with the JSON-RPC response
 *   notification  -> 202, empty body
 */
@RestController
@RequiredArgsConstructor
public class McpController {

    private final McpDispatcher dispatcher;

    @PostMapping(value = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> handle(@RequestBody String body) {
        return dispatcher.handle(body)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.accepted().build());
    }
}
