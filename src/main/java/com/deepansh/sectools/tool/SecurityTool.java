package com.deepansh.sectools.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and published through tools/list so clients know how to call the tool.
 *
 * Tool execution must NOT throw. Every outcome, including invalid input and
 * failed external calls, is returned as one JSON-object string; failures
 * carry an "error" key.
 */
public interface SecurityTool {

    /** Unique snake_case name clients use to invoke this tool */
    String getName();

    String getDescription();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters.
     */
    Map<String, Object> getInputSchema();

    /**
     * Execute the tool and return a JSON-object string.
     */
    String execute(Map<String, Object> arguments);
}
