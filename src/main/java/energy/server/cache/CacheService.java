package energy.server.cache;

import energy.server.forecast.ForecastOutcome;
import energy.server.forecast.ForecastRequest;
import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Owns the two result caches of the server: the building catalog, kept for a
 * fixed time, and forecast results, kept by recency of use.
 * Created once at startup and cleared on shutdown.
 */
public class CacheService {

    public static final String CATALOG_KEY = "buildings";

    private final TimeBoundedCache<String, List<String>> catalogCache;
    private final LruCache<ForecastRequest, ForecastOutcome> forecastCache;

    public CacheService(Duration catalogTtl, int forecastCapacity) {
        this(catalogTtl, forecastCapacity, System::currentTimeMillis);
    }

    public CacheService(Duration catalogTtl, int forecastCapacity, LongSupplier clock) {
        this.catalogCache = new TimeBoundedCache<>(1, catalogTtl, clock);
        this.forecastCache = new LruCache<>(forecastCapacity);
    }

    public TimeBoundedCache<String, List<String>> catalog() {
        return catalogCache;
    }

    public LruCache<ForecastRequest, ForecastOutcome> forecasts() {
        return forecastCache;
    }

    public JsonObject stats() {
        return new JsonObject()
            .put("catalog", catalogCache.stats())
            .put("forecast", forecastCache.stats());
    }

    public void shutdown() {
        catalogCache.clear();
        forecastCache.clear();
    }
}
