package energy.server.mcp.base;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MCPRequestTest {

    @Test
    void testNumericIdIsKeptAsText() {
        MCPRequest request = MCPRequest.fromJson(new JsonObject()
            .put("jsonrpc", "2.0").put("id", 42).put("method", "tools/list"));

        assertEquals("42", request.getId());
        assertTrue(request.isValid());
        assertTrue(request.getParams().isEmpty());
    }

    @Test
    void testNullBodyIsInvalid() {
        assertFalse(MCPRequest.fromJson(null).isValid());
    }

    @Test
    void testWrongVersionIsInvalid() {
        assertFalse(MCPRequest.fromJson(new JsonObject()
            .put("jsonrpc", "1.0").put("id", "1").put("method", "tools/list")).isValid());
    }

    @Test
    void testErrorResponseShape() {
        JsonObject json = MCPResponse.error("9", MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name").toJson();

        assertEquals("2.0", json.getString("jsonrpc"));
        assertEquals("9", json.getString("id"));
        assertEquals(-32602, json.getJsonObject("error").getInteger("code"));
        assertFalse(json.containsKey("result"));
    }
}
