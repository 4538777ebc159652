package energy.server.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP entry point of the server. Owns the main router with the
 * <code>/health</code> endpoint and mounts the sub-routers of the tool servers.
 */
public class MCPRouterService extends AbstractVerticle {

    public static final String READY_ADDRESS = "mcp.router.ready";
    private static final String COMPONENT = "MCPRouterService";

    private static final Map<String, Router> pendingRouters = new ConcurrentHashMap<>();
    private static MCPRouterService instance;

    private final int port;
    private Router mainRouter;
    private HttpServer httpServer;

    public MCPRouterService(int port) {
        this.port = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        instance = this;

        mainRouter = Router.router(vertx);
        addGlobalHandlers();

        mainRouter.get("/health").handler(ctx -> ctx.response()
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("status", "healthy")
                .put("timestamp", System.currentTimeMillis())
                .encode()));

        // routers registered before this service started
        mountRegisteredRouters();

        HttpServerOptions options = new HttpServerOptions()
            .setPort(port)
            .setCompressionSupported(true)
            .setHandle100ContinueAutomatically(true);

        httpServer = vertx.createHttpServer(options);
        httpServer
            .requestHandler(mainRouter)
            .listen()
            .onSuccess(server -> {
                LogUtil.logInfo(vertx, "MCPRouterService started on port " + server.actualPort(), COMPONENT, "StartUp", "HTTP", true);
                vertx.eventBus().publish(READY_ADDRESS, new JsonObject()
                    .put("port", server.actualPort())
                    .put("timestamp", System.currentTimeMillis()));
                startPromise.complete();
            })
            .onFailure(err -> {
                LogUtil.logError(vertx, "Failed to start MCPRouterService", err, COMPONENT, "StartUp", "HTTP", true);
                startPromise.fail(err);
            });
    }

    /**
     * Port the server is bound to, useful when started on port 0.
     */
    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    private void addGlobalHandlers() {
        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("authorization");

        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        mainRouter.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(allowedHeaders)
            .allowedMethods(allowedMethods));

        mainRouter.route().handler(BodyHandler.create().setBodyLimit(1024 * 1024));

        mainRouter.route("/mcp/*").handler(ctx -> {
            ctx.response().putHeader("content-type", "application/json");
            ctx.next();
        });

        mainRouter.route("/mcp/*").failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode() == -1 ? 500 : ctx.statusCode();
            if (failure != null) {
                LogUtil.logError(vertx, "Unhandled failure on " + ctx.request().path(), failure, COMPONENT, "Request", "HTTP", false);
            }

            JsonObject error = new JsonObject()
                .put("jsonrpc", "2.0")
                .put("error", new JsonObject()
                    .put("code", statusCode)
                    .put("message", failure != null ? failure.getMessage() : "Unknown error"));

            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(error.encode());
        });
    }

    /**
     * Called by tool servers to expose their router under {@code path}.
     * Mounted immediately when the router service is running, otherwise on start.
     */
    public static void registerRouter(String path, Router subRouter) {
        if (instance != null && instance.mainRouter != null) {
            instance.mountRouter(path, subRouter);
        } else {
            pendingRouters.put(path, subRouter);
        }
    }

    private void mountRouter(String path, Router subRouter) {
        mainRouter.route(path + "/*").subRouter(subRouter);
        LogUtil.logDetail(vertx, "Mounted router at path: " + path, COMPONENT, "Service", "Router");
    }

    private void mountRegisteredRouters() {
        for (Map.Entry<String, Router> entry : pendingRouters.entrySet()) {
            mountRouter(entry.getKey(), entry.getValue());
        }
        pendingRouters.clear();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        instance = null;
        if (httpServer == null) {
            stopPromise.complete();
            return;
        }
        httpServer.close()
            .onSuccess(v -> {
                LogUtil.logInfo(vertx, "MCPRouterService stopped", COMPONENT, "Shutdown", "HTTP", false);
                stopPromise.complete();
            })
            .onFailure(stopPromise::fail);
    }
}
