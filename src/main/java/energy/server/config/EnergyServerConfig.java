package energy.server.config;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Runtime configuration of the energy server.
 *
 * Values are resolved from system properties first (dotenv loads
 * <code>.env.local</code> there) and then from the process environment.
 * Required keys fail fast; optional keys fall back to their defaults.
 */
public class EnergyServerConfig {

    public static final String DEFAULT_DATASOURCE_CLASS = "com.microsoft.sqlserver.jdbc.SQLServerDataSource";
    public static final String DEFAULT_TABLE = "dbo.Tech_All_KWH";

    // schema.table or table, each part a plain SQL identifier
    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final String dataSourceClass;
    private final int poolMax;
    private final int poolWaitTimeoutSeconds;
    private final int poolMaxReuseSeconds;
    private final String energyTable;
    private final int httpPort;
    private final int catalogTtlMinutes;
    private final int forecastCacheSize;
    private final int forecastWorkers;
    private final int defaultHorizon;
    private final int maxHorizon;
    private final boolean quantilesEnabled;
    private final int seasonLength;
    private final int maxContext;
    private final int logLevel;
    private final String dataPath;

    private EnergyServerConfig(Function<String, String> source) {
        this.dbUrl = required(source, "DB_URL");
        this.dbUser = required(source, "DB_USER");
        this.dbPassword = required(source, "DB_PASSWORD");
        this.dataSourceClass = optional(source, "DB_DATASOURCE_CLASS", DEFAULT_DATASOURCE_CLASS);
        this.poolMax = positiveInt(source, "DB_POOL_MAX", 20);
        this.poolWaitTimeoutSeconds = positiveInt(source, "DB_POOL_WAIT_TIMEOUT_S", 30);
        this.poolMaxReuseSeconds = positiveInt(source, "DB_POOL_MAX_REUSE_S", 1800);
        this.energyTable = tableName(optional(source, "ENERGY_TABLE", DEFAULT_TABLE));
        this.httpPort = positiveInt(source, "HTTP_PORT", 8000);
        this.catalogTtlMinutes = positiveInt(source, "CATALOG_TTL_MINUTES", 60);
        this.forecastCacheSize = positiveInt(source, "FORECAST_CACHE_SIZE", 128);
        this.forecastWorkers = positiveInt(source, "FORECAST_WORKERS", 2);
        this.maxHorizon = positiveInt(source, "FORECAST_MAX_HORIZON", 1024);
        this.defaultHorizon = positiveInt(source, "FORECAST_DEFAULT_HORIZON", 144);
        this.quantilesEnabled = Boolean.parseBoolean(optional(source, "FORECAST_QUANTILES", "true"));
        this.seasonLength = positiveInt(source, "FORECAST_SEASON_LENGTH", 144);
        this.maxContext = positiveInt(source, "FORECAST_MAX_CONTEXT", 4096);
        this.logLevel = intValue(source, "LOG_LEVEL", 2);
        this.dataPath = optional(source, "DATA_PATH", "./data/energy");

        if (defaultHorizon > maxHorizon) {
            throw new IllegalStateException("FORECAST_DEFAULT_HORIZON (" + defaultHorizon
                + ") exceeds FORECAST_MAX_HORIZON (" + maxHorizon + ")");
        }
        if (logLevel < 0 || logLevel > 4) {
            throw new IllegalStateException("LOG_LEVEL must be between 0 and 4, got " + logLevel);
        }
    }

    /**
     * Load from system properties, then environment variables.
     */
    public static EnergyServerConfig load() {
        return from(key -> {
            String value = System.getProperty(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getenv(key);
            }
            return value;
        });
    }

    public static EnergyServerConfig from(Function<String, String> source) {
        return new EnergyServerConfig(source);
    }

    private static String required(Function<String, String> source, String key) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalStateException("Required environment variable " + key + " is not set. " +
                "Please set it in your .env.local file or as an environment variable.");
        }
        return value.trim();
    }

    private static String optional(Function<String, String> source, String key, String defaultValue) {
        String value = source.apply(key);
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }

    private static int intValue(Function<String, String> source, String key, int defaultValue) {
        String value = optional(source, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static int positiveInt(Function<String, String> source, String key, int defaultValue) {
        int value = intValue(source, key, defaultValue);
        if (value <= 0) {
            throw new IllegalStateException(key + " must be positive, got " + value);
        }
        return value;
    }

    static String tableName(String value) {
        if (!TABLE_NAME.matcher(value).matches()) {
            throw new IllegalStateException("ENERGY_TABLE is not a valid table identifier: " + value);
        }
        return value;
    }

    public String getDbUrl() {
        return dbUrl;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public String getDataSourceClass() {
        return dataSourceClass;
    }

    public int getPoolMax() {
        return poolMax;
    }

    public int getPoolWaitTimeoutSeconds() {
        return poolWaitTimeoutSeconds;
    }

    public int getPoolMaxReuseSeconds() {
        return poolMaxReuseSeconds;
    }

    public String getEnergyTable() {
        return energyTable;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getCatalogTtlMinutes() {
        return catalogTtlMinutes;
    }

    public int getForecastCacheSize() {
        return forecastCacheSize;
    }

    public int getForecastWorkers() {
        return forecastWorkers;
    }

    public int getDefaultHorizon() {
        return defaultHorizon;
    }

    public int getMaxHorizon() {
        return maxHorizon;
    }

    public boolean isQuantilesEnabled() {
        return quantilesEnabled;
    }

    public int getSeasonLength() {
        return seasonLength;
    }

    public int getMaxContext() {
        return maxContext;
    }

    public int getLogLevel() {
        return logLevel;
    }

    public String getDataPath() {
        return dataPath;
    }

    @Override
    public String toString() {
        // no credentials
        return "EnergyServerConfig{dbUrl='" + dbUrl + "', table='" + energyTable + "', httpPort=" + httpPort
            + ", poolMax=" + poolMax + ", forecastWorkers=" + forecastWorkers + ", forecastCacheSize=" + forecastCacheSize
            + ", catalogTtlMinutes=" + catalogTtlMinutes + ", logLevel=" + logLevel + "}";
    }
}
