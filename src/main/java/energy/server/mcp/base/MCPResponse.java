package energy.server.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * JSON-RPC response in MCP format. Holds either a result or an error, never both.
 */
public class MCPResponse {

    private static final String JSONRPC = "2.0";

    private final String id;
    private final JsonObject result;
    private final JsonObject error;

    private MCPResponse(String id, JsonObject result, JsonObject error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static MCPResponse success(String id, JsonObject result) {
        return new MCPResponse(id, result, null);
    }

    public static MCPResponse error(String id, int code, String message) {
        JsonObject error = new JsonObject()
            .put("code", code)
            .put("message", message);
        return new MCPResponse(id, null, error);
    }

    public String getId() {
        return id;
    }

    public JsonObject getResult() {
        return result;
    }

    public JsonObject getError() {
        return error;
    }

    public boolean isSuccess() {
        return result != null && error == null;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", JSONRPC)
            .put("id", id);

        if (isSuccess()) {
            json.put("result", result);
        } else {
            json.put("error", error);
        }
        return json;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "MCPResponse{id='" + id + "', result=" + result + "}";
        }
        return "MCPResponse{id='" + id + "', error=" + error + "}";
    }

    // Standard JSON-RPC error codes
    public static class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;
    }
}
