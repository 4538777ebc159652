package energy.server.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * A JSON-RPC 2.0 request as received on an MCP endpoint.
 */
public class MCPRequest {

    private final String jsonrpc;
    private final String id;
    private final String method;
    private final JsonObject params;

    public MCPRequest(String jsonrpc, String id, String method, JsonObject params) {
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public String getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    /**
     * Parse an incoming body. Clients send numeric ids as often as string ids,
     * so the id is kept in its textual form.
     */
    public static MCPRequest fromJson(JsonObject json) {
        if (json == null) {
            return new MCPRequest(null, null, null, new JsonObject());
        }
        Object rawId = json.getValue("id");
        return new MCPRequest(
            json.getString("jsonrpc"),
            rawId != null ? String.valueOf(rawId) : null,
            json.getString("method"),
            json.getJsonObject("params", new JsonObject())
        );
    }

    public boolean isValid() {
        return id != null && !id.isEmpty() &&
               method != null && !method.isEmpty() &&
               "2.0".equals(jsonrpc);
    }

    @Override
    public String toString() {
        return "MCPRequest{id='" + id + "', method='" + method + "', params=" + params + "}";
    }
}
