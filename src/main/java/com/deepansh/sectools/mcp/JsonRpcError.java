package com.deepansh.sectools.mcp;

/**
 * JSON-RPC 2.0 error codes used by the MCP endpoint.
 */
public final class JsonRpcError {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;

    private JsonRpcError() {
    }
}
