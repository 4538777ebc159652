package energy.server.mcp.servers;

import energy.server.cache.CacheService;
import energy.server.mcp.base.MCPResponse;
import energy.server.mcp.base.MCPServerBase;
import energy.server.mcp.base.MCPTool;
import energy.server.orchestration.EnergyToolService;
import energy.server.orchestration.ResponseEnvelope;
import energy.server.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import static energy.server.mcp.base.MCPTool.objectSchema;
import static energy.server.mcp.base.MCPTool.stringProperty;

/**
 * MCP server for building energy data: catalog, readings, totals, forecasts
 * and the server clock. Served at <code>/mcp/servers/energy</code>.
 *
 * Every tool answers with a JSON-RPC success whose result carries the
 * envelope twice, as text content and as structured content. Tool-level
 * failures are flagged with <code>isError</code>.
 */
public class EnergyToolServer extends MCPServerBase {

    public static final String SERVER_PATH = "/mcp/servers/energy";
    private static final String COMPONENT = "EnergyToolServer";

    private static final String TIMESTAMP_HINT = " (format: YYYY-MM-DD HH:MM:SS, e.g. 2024-09-01 00:00:00)";

    private final EnergyToolService service;
    private final CacheService caches;
    private final int defaultHorizon;
    private final int maxHorizon;

    public EnergyToolServer(EnergyToolService service, CacheService caches, int defaultHorizon, int maxHorizon) {
        super("EnergyToolServer", SERVER_PATH);
        this.service = service;
        this.caches = caches;
        this.defaultHorizon = defaultHorizon;
        this.maxHorizon = maxHorizon;
    }

    @Override
    protected void initializeTools() {
        registerTool(new MCPTool(
            "get_monitored_buildings",
            "List the buildings whose energy usage is monitored.",
            objectSchema(new JsonObject())
        ));

        registerTool(new MCPTool(
            "get_building_data_range",
            "Return the first and last timestamp with data for a building.",
            objectSchema(new JsonObject()
                .put("building", stringProperty("Building identifier (contains no spaces)")),
                "building")
        ));

        registerTool(new MCPTool(
            "get_energy_usages",
            "Return the cumulative kWh readings of a building between two timestamps, newest first. "
                + "Use the same start and end to look up a single reading.",
            objectSchema(windowProperties(), "start_date_time", "end_date_time", "building")
        ));

        registerTool(new MCPTool(
            "get_total_energy_usage",
            "Return the energy used by a building between two timestamps, in kWh.",
            objectSchema(windowProperties(), "start_date_time", "end_date_time", "building")
        ));

        registerTool(new MCPTool(
            "forecast_energy_usage",
            "Forecast the next readings of a building from its history between two timestamps. "
                + "Each step is 10 minutes; the default horizon of " + defaultHorizon + " steps is one day.",
            objectSchema(windowProperties()
                .put("horizon", new JsonObject()
                    .put("type", "integer")
                    .put("minimum", 1)
                    .put("maximum", maxHorizon)
                    .put("default", defaultHorizon)
                    .put("description", "Number of 10-minute steps to forecast")),
                "start_date_time", "end_date_time", "building")
        ));

        registerTool(new MCPTool(
            "get_current_time",
            "Return the current local date and time of the server.",
            objectSchema(new JsonObject())
        ));
    }

    private static JsonObject windowProperties() {
        return new JsonObject()
            .put("start_date_time", stringProperty("Start of the window" + TIMESTAMP_HINT))
            .put("end_date_time", stringProperty("End of the window, inclusive" + TIMESTAMP_HINT))
            .put("building", stringProperty("Building identifier (contains no spaces)"));
    }

    @Override
    protected void addRoutes(Router router) {
        router.get("/stats").handler(ctx -> ctx.response()
            .putHeader("content-type", "application/json")
            .end(caches.stats().encode()));
    }

    @Override
    protected void executeTool(RoutingContext ctx, String requestId, String toolName, JsonObject arguments) {
        LogUtil.logDetail(vertx, "Executing tool " + toolName + " with " + arguments.encode(), COMPONENT, "ToolCall", "MCP");

        Future<ResponseEnvelope> outcome;
        switch (toolName) {
            case "get_monitored_buildings":
                outcome = service.monitoredBuildings();
                break;
            case "get_building_data_range":
                outcome = service.buildingDataRange(text(arguments, "building"));
                break;
            case "get_energy_usages":
                outcome = service.energyUsages(
                    text(arguments, "start_date_time"), text(arguments, "end_date_time"), text(arguments, "building"));
                break;
            case "get_total_energy_usage":
                outcome = service.totalEnergyUsage(
                    text(arguments, "start_date_time"), text(arguments, "end_date_time"), text(arguments, "building"));
                break;
            case "forecast_energy_usage":
                Object rawHorizon = arguments.getValue("horizon");
                Integer horizon;
                try {
                    horizon = horizon(rawHorizon);
                } catch (NumberFormatException e) {
                    outcome = Future.succeededFuture(ResponseEnvelope.failure(
                        "horizon must be an integer, got '" + rawHorizon + "'"));
                    break;
                }
                outcome = service.forecastEnergyUsage(
                    text(arguments, "start_date_time"), text(arguments, "end_date_time"), text(arguments, "building"),
                    horizon);
                break;
            case "get_current_time":
                outcome = service.currentTime();
                break;
            default:
                sendError(ctx, requestId, MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Unknown tool: " + toolName);
                return;
        }

        outcome.onComplete(ar -> {
            ResponseEnvelope envelope = ar.succeeded()
                ? ar.result()
                : ResponseEnvelope.failure("Internal error: " + ar.cause().getMessage());
            sendSuccess(ctx, requestId, toToolResult(envelope));
        });
    }

    static JsonObject toToolResult(ResponseEnvelope envelope) {
        JsonObject structured = envelope.toJson();
        return new JsonObject()
            .put("content", new JsonArray().add(new JsonObject()
                .put("type", "text")
                .put("text", structured.encode())))
            .put("structuredContent", structured)
            .put("isError", !envelope.isSuccess());
    }

    private static String text(JsonObject arguments, String key) {
        Object value = arguments.getValue(key);
        return value == null ? null : String.valueOf(value);
    }

    static Integer horizon(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
                throw new NumberFormatException("not an integer: " + raw);
            }
            return ((Number) raw).intValue();
        }
        return Integer.parseInt(raw.toString().trim());
    }
}
