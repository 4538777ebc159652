package energy.server.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Tool definition advertised on tools/list: name, description and JSON schema of its arguments.
 */
public class MCPTool {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;

    public MCPTool(String name, String description, JsonObject inputSchema) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", inputSchema);
    }

    /**
     * Build an object schema from its properties and the names of the required ones.
     */
    public static JsonObject objectSchema(JsonObject properties, String... required) {
        JsonArray requiredArray = new JsonArray();
        for (String name : required) {
            requiredArray.add(name);
        }
        return new JsonObject()
            .put("type", "object")
            .put("properties", properties)
            .put("required", requiredArray);
    }

    public static JsonObject stringProperty(String description) {
        return new JsonObject()
            .put("type", "string")
            .put("description", description);
    }

    @Override
    public String toString() {
        return "MCPTool{name='" + name + "', description='" + description + "'}";
    }
}
