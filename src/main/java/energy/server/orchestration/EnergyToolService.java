package energy.server.orchestration;

import energy.server.cache.CacheService;
import energy.server.errors.EnergyServiceException;
import energy.server.errors.ErrorKind;
import energy.server.forecast.ForecastInvoker;
import energy.server.forecast.ForecastOutcome;
import energy.server.forecast.ForecastRequest;
import energy.server.query.EnergyQueries;
import energy.server.query.QueryExecutor;
import energy.server.query.ResultRow;
import energy.server.query.TimeSeriesExtractor;
import energy.server.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Coordinates the energy tools: validates input, resolves from cache or
 * computes through the query executor and forecast invoker, and shapes every
 * outcome into a {@link ResponseEnvelope}.
 *
 * <p>Returned futures never fail. Every failure is logged where it is caught
 * and reported as a failure envelope.</p>
 *
 * <p>Concurrent misses on the same forecast key each compute; the last
 * result stored wins.</p>
 */
public class EnergyToolService {

    private static final String COMPONENT = "EnergyToolService";

    public static final DateTimeFormatter INPUT_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private final Vertx vertx;
    private final QueryExecutor executor;
    private final EnergyQueries queries;
    private final ForecastInvoker invoker;
    private final CacheService caches;
    private final int defaultHorizon;
    private final int maxHorizon;
    private final Clock clock;

    public EnergyToolService(Vertx vertx, QueryExecutor executor, EnergyQueries queries, ForecastInvoker invoker,
                             CacheService caches, int defaultHorizon, int maxHorizon, Clock clock) {
        this.vertx = vertx;
        this.executor = executor;
        this.queries = queries;
        this.invoker = invoker;
        this.caches = caches;
        this.defaultHorizon = defaultHorizon;
        this.maxHorizon = maxHorizon;
        this.clock = clock;
    }

    public Future<ResponseEnvelope> monitoredBuildings() {
        return guard("get_monitored_buildings", () -> {
            List<String> cached = caches.catalog().get(CacheService.CATALOG_KEY);
            if (cached != null) {
                LogUtil.logDebug(vertx, "Catalog served from cache", COMPONENT, "Buildings", "Cache");
                return Future.succeededFuture(ResponseFormatter.buildings(cached));
            }
            return executor.execute(queries.buildings()).map(rows -> {
                List<String> buildings = new ArrayList<>();
                for (ResultRow row : rows) {
                    String building = row.getString(EnergyQueries.BUILDING);
                    if (building != null) {
                        buildings.add(building);
                    }
                }
                if (buildings.isEmpty()) {
                    throw EnergyServiceException.noData("No monitored buildings found");
                }
                List<String> catalog = Collections.unmodifiableList(buildings);
                caches.catalog().put(CacheService.CATALOG_KEY, catalog);
                return ResponseFormatter.buildings(catalog);
            });
        });
    }

    public Future<ResponseEnvelope> buildingDataRange(String building) {
        return guard("get_building_data_range", () -> {
            String b = requireBuilding(building);
            return executor.execute(queries.dataRange(b)).map(rows -> {
                ResultRow row = rows.isEmpty() ? null : rows.get(0);
                LocalDateTime start = row == null ? null : row.getDateTime(EnergyQueries.START_DATETIME);
                LocalDateTime end = row == null ? null : row.getDateTime(EnergyQueries.END_DATETIME);
                if (start == null || end == null) {
                    throw EnergyServiceException.noData("No data found for building " + b);
                }
                return ResponseFormatter.dataRange(b, start, end);
            });
        });
    }

    /**
     * Readings in the window, newest first. With start equal to end this is
     * the single reading at that instant.
     */
    public Future<ResponseEnvelope> energyUsages(String startDateTime, String endDateTime, String building) {
        return guard("get_energy_usages", () -> {
            String b = requireBuilding(building);
            LocalDateTime start = parseTimestamp("start_date_time", startDateTime);
            LocalDateTime end = parseTimestamp("end_date_time", endDateTime);
            requireOrdered(start, end);
            return executor.execute(queries.usages(b, start, end)).map(rows -> {
                if (rows.isEmpty()) {
                    throw EnergyServiceException.noData("No energy usage data found for building " + b
                        + " between " + startDateTime + " and " + endDateTime);
                }
                return ResponseFormatter.usages(b, start, end, rows);
            });
        });
    }

    public Future<ResponseEnvelope> totalEnergyUsage(String startDateTime, String endDateTime, String building) {
        return guard("get_total_energy_usage", () -> {
            String b = requireBuilding(building);
            LocalDateTime start = parseTimestamp("start_date_time", startDateTime);
            LocalDateTime end = parseTimestamp("end_date_time", endDateTime);
            requireOrdered(start, end);
            return executor.execute(queries.accumulatedBounds(b, start, end)).map(rows -> {
                ResultRow row = rows.isEmpty() ? null : rows.get(0);
                Double first = row == null ? null : numeric(row, EnergyQueries.START_ACCUMULATED);
                Double last = row == null ? null : numeric(row, EnergyQueries.END_ACCUMULATED);
                if (first == null || last == null) {
                    throw EnergyServiceException.noData("No energy usage data found for building " + b
                        + " between " + startDateTime + " and " + endDateTime);
                }
                return ResponseFormatter.totalUsage(b, start, end, Math.abs(last - first));
            });
        });
    }

    /**
     * Forecast the next {@code horizon} readings from the window's history.
     * A null horizon means the configured default.
     */
    public Future<ResponseEnvelope> forecastEnergyUsage(String startDateTime, String endDateTime, String building,
                                                        Integer horizon) {
        return guard("forecast_energy_usage", () -> {
            String b = requireBuilding(building);
            LocalDateTime start = parseTimestamp("start_date_time", startDateTime);
            LocalDateTime end = parseTimestamp("end_date_time", endDateTime);
            requireOrdered(start, end);
            int h = horizon == null ? defaultHorizon : horizon;
            if (h < 1 || h > maxHorizon) {
                throw EnergyServiceException.validation("horizon must be between 1 and " + maxHorizon + ", got " + h);
            }

            ForecastRequest key = new ForecastRequest(start, end, b, h);
            ForecastOutcome cached = caches.forecasts().get(key);
            if (cached != null) {
                LogUtil.logDebug(vertx, "Forecast served from cache: " + key, COMPONENT, "Forecast", "Cache");
                return Future.succeededFuture(ResponseFormatter.forecast(b, h, cached));
            }

            return executor.execute(queries.series(b, start, end))
                .compose(rows -> {
                    double[] series = TimeSeriesExtractor.extract(rows, EnergyQueries.DATA_VALUE);
                    return invoker.forecast(series, h)
                        .map(result -> new ForecastOutcome(series.length, result));
                })
                .map(outcome -> {
                    caches.forecasts().put(key, outcome);
                    LogUtil.logDetail(vertx, "Forecast computed and cached: " + key, COMPONENT, "Forecast", "Cache");
                    return ResponseFormatter.forecast(b, h, outcome);
                });
        });
    }

    public Future<ResponseEnvelope> currentTime() {
        return guard("get_current_time", () ->
            Future.succeededFuture(ResponseFormatter.currentTime(clock.getZone().getId(), LocalDateTime.now(clock))));
    }

    /**
     * Run one tool call and turn any failure, thrown or asynchronous, into a
     * failure envelope.
     */
    private Future<ResponseEnvelope> guard(String tool, Supplier<Future<ResponseEnvelope>> call) {
        LogUtil.logDetail(vertx, "Tool called: " + tool, COMPONENT, "Call", "Tool");
        Future<ResponseEnvelope> result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.recover(err -> {
            LogUtil.logError(vertx, tool + " failed", err, COMPONENT, "Call", "Tool", false);
            return Future.succeededFuture(ResponseEnvelope.failure(describe(err)));
        });
    }

    static String describe(Throwable err) {
        if (err instanceof EnergyServiceException) {
            return err.getMessage();
        }
        return "Internal error: " + err.getMessage();
    }

    private static Double numeric(ResultRow row, String column) {
        try {
            return row.getDouble(column);
        } catch (IllegalStateException e) {
            throw EnergyServiceException.database("Unexpected reading type: " + e.getMessage(), e);
        }
    }

    private static String requireBuilding(String building) {
        if (building == null || building.trim().isEmpty()) {
            throw EnergyServiceException.validation("building is required");
        }
        return building.trim();
    }

    static LocalDateTime parseTimestamp(String field, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw EnergyServiceException.validation(field + " is required");
        }
        try {
            return LocalDateTime.parse(value.trim(), INPUT_FORMAT);
        } catch (DateTimeParseException e) {
            throw new EnergyServiceException(ErrorKind.VALIDATION_ERROR,
                field + " must use the format YYYY-MM-DD HH:MM:SS, got '" + value + "'", e);
        }
    }

    private static void requireOrdered(LocalDateTime start, LocalDateTime end) {
        if (start.isAfter(end)) {
            throw EnergyServiceException.validation("start_date_time must not be after end_date_time");
        }
    }
}
