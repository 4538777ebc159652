package energy.server;

import energy.server.cache.CacheService;
import energy.server.config.EnergyServerConfig;
import energy.server.forecast.ForecastInvoker;
import energy.server.forecast.SeasonalNaiveForecastModel;
import energy.server.mcp.servers.EnergyToolServer;
import energy.server.orchestration.EnergyToolService;
import energy.server.query.EnergyQueries;
import energy.server.query.JdbcQueryExecutor;
import energy.server.services.LogUtil;
import energy.server.services.Logger;
import energy.server.services.MCPRouterService;
import energy.server.services.StoreConnectionManager;
import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.WorkerExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Driver {
  public static int logLevel = 2; // 0=errors, 1=info, 2=detail, 3=debug, 4=data

  private static final String COMPONENT = "Driver";

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  private static Vertx vertx;

  private final EnergyServerConfig config;
  private StoreConnectionManager store;
  private WorkerExecutor forecastWorkers;
  private CacheService caches;

  private Driver(EnergyServerConfig config) {
    this.config = config;
  }

  /**
   * Buffer a log line until the Logger is deployed, then publish directly.
   * The buffer keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0);
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish(LogUtil.LOG_ADDRESS, message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish(LogUtil.LOG_ADDRESS, entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    captureOrPublishLog("=== Energy MCP Server Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    loadEnvironment();

    EnergyServerConfig config;
    try {
      config = EnergyServerConfig.load();
    } catch (IllegalStateException e) {
      System.err.println("FATAL: invalid configuration: " + e.getMessage());
      System.exit(1);
      return;
    }
    logLevel = config.getLogLevel();
    captureOrPublishLog("Configuration loaded: " + config.toString().replace(",", ";") + ",2,Driver,StartUp,Configuration");

    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(Math.max(4, config.getPoolMax()))
        .setEventLoopPoolSize(1)
    );

    Driver me = new Driver(config);
    Runtime.getRuntime().addShutdownHook(new Thread(me::shutdown, "energy-shutdown"));

    System.out.println("Deploying Logger as first component...");
    vertx.deployVerticle(new Logger(config.getDataPath()))
        .onSuccess(id -> {
          loggerReady = true;
          flushEmergencyBuffer();
          captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
          me.doIt();
        })
        .onFailure(err -> {
          System.err.println("FATAL: Logger deployment failed: " + err.getMessage());
          System.err.println("Cannot continue without logging capability");
          System.exit(1);
        });
  }

  private static void loadEnvironment() {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Configuration");
    } catch (Exception e) {
      // not fatal, the process environment may carry everything
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage().replace(",", ";") + ",1,Driver,StartUp,Configuration");
      System.err.println("Warning: Could not load .env.local file: " + e.getMessage());
    }
  }

  private void doIt() {
    LogUtil.logInfo(vertx, "Driver initialization starting", COMPONENT, "StartUp", "System", true);

    store = new StoreConnectionManager(vertx, config);
    store.initialize()
        .compose(v -> deployServers())
        .onSuccess(v -> LogUtil.logInfo(vertx, "Energy MCP server ready at http://localhost:" + config.getHttpPort()
            + EnergyToolServer.SERVER_PATH, COMPONENT, "StartUp", "System", true))
        .onFailure(err -> {
          LogUtil.logError(vertx, "Fatal error during startup", err, COMPONENT, "StartUp", "System", true);
          vertx.eventBus().request(Logger.FLUSH_ADDRESS, "flush")
              .onComplete(ar -> System.exit(1));
        });
  }

  private Future<Void> deployServers() {
    caches = new CacheService(Duration.ofMinutes(config.getCatalogTtlMinutes()), config.getForecastCacheSize());
    forecastWorkers = vertx.createSharedWorkerExecutor("forecast-worker", config.getForecastWorkers(), 5, TimeUnit.MINUTES);

    SeasonalNaiveForecastModel model = new SeasonalNaiveForecastModel(
        config.getSeasonLength(), config.getMaxContext(), config.getMaxHorizon());
    ForecastInvoker invoker = new ForecastInvoker(vertx, forecastWorkers, model, config.isQuantilesEnabled());
    EnergyToolService service = new EnergyToolService(
        vertx,
        new JdbcQueryExecutor(vertx, store.getDataSource()),
        new EnergyQueries(config.getEnergyTable()),
        invoker,
        caches,
        config.getDefaultHorizon(),
        config.getMaxHorizon(),
        Clock.systemDefaultZone());

    LogUtil.logInfo(vertx, "Deploying MCP Router Service...", COMPONENT, "StartUp", "MCP", false);
    return vertx.deployVerticle(new MCPRouterService(config.getHttpPort()))
        .compose(id -> {
          LogUtil.logInfo(vertx, "Deploying EnergyToolServer...", COMPONENT, "StartUp", "MCP", false);
          return vertx.deployVerticle(new EnergyToolServer(service, caches, config.getDefaultHorizon(), config.getMaxHorizon()));
        })
        .mapEmpty();
  }

  /**
   * Release caches, the forecast pool and the store pool, then flush the log.
   */
  private void shutdown() {
    if (vertx == null) {
      return;
    }
    System.out.println("Shutting down energy MCP server...");
    if (caches != null) {
      caches.shutdown();
    }
    if (forecastWorkers != null) {
      forecastWorkers.close();
    }

    CountDownLatch latch = new CountDownLatch(1);
    Future<Void> storeClosed = store == null ? Future.succeededFuture() : store.shutdown();
    storeClosed
        .recover(err -> Future.succeededFuture())
        .compose(v -> vertx.eventBus().request(Logger.FLUSH_ADDRESS, "flush").<Void>mapEmpty())
        .recover(err -> Future.succeededFuture())
        .compose(v -> vertx.close())
        .onComplete(ar -> latch.countDown());
    try {
      if (!latch.await(10, TimeUnit.SECONDS)) {
        System.err.println("Shutdown did not complete within 10 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
