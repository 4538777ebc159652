package energy.server.mcp.base;

import energy.server.services.LogUtil;
import energy.server.services.MCPRouterService;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base class for MCP tool servers.
 * Provides the protocol endpoints tools/list and tools/call and registers the
 * server's router with {@link MCPRouterService}.
 */
public abstract class MCPServerBase extends AbstractVerticle {

    private static final String COMPONENT = "MCPServerBase";

    protected Router router;
    protected final Map<String, MCPTool> tools = new LinkedHashMap<>();
    protected final String serverName;
    protected final String serverPath;

    protected MCPServerBase(String serverName, String serverPath) {
        this.serverName = serverName;
        this.serverPath = serverPath;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        router = Router.router(vertx);

        router.post("/tools/list").handler(this::handleToolsList);
        router.post("/tools/call").handler(this::handleToolCall);

        initializeTools();
        addRoutes(router);

        MCPRouterService.registerRouter(serverPath, router);
        LogUtil.logDetail(vertx, serverName + " registered router at path: " + serverPath, COMPONENT, "StartUp", "MCP");

        startPromise.complete();
    }

    /**
     * Register the tools provided by this server.
     */
    protected abstract void initializeTools();

    /**
     * Hook for routes beyond the MCP endpoints.
     */
    protected void addRoutes(Router router) {
    }

    protected void registerTool(MCPTool tool) {
        tools.put(tool.getName(), tool);
        LogUtil.logDebug(vertx, serverName + " registered tool: " + tool.getName(), COMPONENT, "StartUp", "MCP");
    }

    private void handleToolsList(RoutingContext ctx) {
        MCPRequest request = parse(ctx);
        if (request == null) {
            return;
        }
        if (!request.isValid()) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
            return;
        }

        JsonArray toolsArray = new JsonArray();
        for (MCPTool tool : tools.values()) {
            toolsArray.add(tool.toJson());
        }
        sendSuccess(ctx, request.getId(), new JsonObject().put("tools", toolsArray));
    }

    private void handleToolCall(RoutingContext ctx) {
        MCPRequest request = parse(ctx);
        if (request == null) {
            return;
        }
        if (!request.isValid()) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
            return;
        }

        JsonObject params = request.getParams();
        String toolName = params.getString("name");
        JsonObject arguments = params.getJsonObject("arguments", new JsonObject());

        if (toolName == null) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name");
            return;
        }
        if (!tools.containsKey(toolName)) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Tool not found: " + toolName);
            return;
        }

        try {
            executeTool(ctx, request.getId(), toolName, arguments);
        } catch (RuntimeException e) {
            LogUtil.logError(vertx, "Error handling tools/call for " + toolName, e, COMPONENT, "ToolCall", "MCP", true);
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
        }
    }

    private MCPRequest parse(RoutingContext ctx) {
        try {
            return MCPRequest.fromJson(ctx.body().asJsonObject());
        } catch (DecodeException | ClassCastException e) {
            LogUtil.logDebug(vertx, "Unparseable MCP body: " + e.getMessage(), COMPONENT, "Parse", "MCP");
            sendError(ctx, null, MCPResponse.ErrorCodes.PARSE_ERROR, "Parse error");
            return null;
        }
    }

    /**
     * Execute a specific tool and answer on {@code ctx}.
     */
    protected abstract void executeTool(RoutingContext ctx, String requestId, String toolName, JsonObject arguments);

    protected void sendSuccess(RoutingContext ctx, String requestId, JsonObject result) {
        MCPResponse response = MCPResponse.success(
            requestId != null ? requestId : UUID.randomUUID().toString(),
            result
        );

        ctx.response()
            .putHeader("content-type", "application/json")
            .end(response.toJson().encode());
    }

    protected void sendError(RoutingContext ctx, String requestId, int code, String message) {
        MCPResponse response = MCPResponse.error(
            requestId != null ? requestId : UUID.randomUUID().toString(),
            code,
            message
        );

        ctx.response()
            .putHeader("content-type", "application/json")
            .setStatusCode(400)
            .end(response.toJson().encode());
    }
}
