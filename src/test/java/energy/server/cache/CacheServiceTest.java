package energy.server.cache;

import energy.server.forecast.ForecastOutcome;
import energy.server.forecast.ForecastRequest;
import energy.server.forecast.ForecastResult;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheServiceTest {

    @Test
    void testStatsAndShutdown() {
        CacheService caches = new CacheService(Duration.ofMinutes(60), 128);
        ForecastRequest key = new ForecastRequest(
            LocalDateTime.of(2024, 9, 1, 0, 0), LocalDateTime.of(2024, 9, 1, 23, 59, 59), "B1", 24);

        caches.catalog().put(CacheService.CATALOG_KEY, List.of("B1", "B2"));
        caches.forecasts().put(key, new ForecastOutcome(144, new ForecastResult(new double[24], null)));
        caches.catalog().get(CacheService.CATALOG_KEY);
        caches.forecasts().get(key);

        JsonObject stats = caches.stats();
        assertEquals(1L, stats.getJsonObject("catalog").getLong("hits"));
        assertEquals(1, stats.getJsonObject("catalog").getInteger("currentSize"));
        assertEquals(1L, stats.getJsonObject("forecast").getLong("hits"));
        assertEquals(128, stats.getJsonObject("forecast").getInteger("capacity"));

        caches.shutdown();

        assertEquals(0, caches.catalog().currentSize());
        assertEquals(0, caches.forecasts().currentSize());
    }
}
