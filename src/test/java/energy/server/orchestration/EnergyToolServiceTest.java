package energy.server.orchestration;

import energy.server.cache.CacheService;
import energy.server.forecast.ForecastInvoker;
import energy.server.forecast.ForecastModel;
import energy.server.forecast.SeasonalNaiveForecastModel;
import energy.server.query.EnergyQueries;
import energy.server.query.QueryExecutor;
import energy.server.query.QuerySpec;
import energy.server.query.ResultRow;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class EnergyToolServiceTest {

    private static final String DAY_START = "2024-09-01 00:00:00";
    private static final String DAY_END = "2024-09-01 23:59:59";

    private final AtomicLong now = new AtomicLong(1_725_000_000_000L);
    private final AtomicInteger modelCalls = new AtomicInteger();

    private WorkerExecutor workers;
    private CacheService caches;
    private RecordingQueryExecutor store;
    private EnergyToolService service;

    /**
     * Answers queries through a function of the query text and records every call.
     */
    static class RecordingQueryExecutor implements QueryExecutor {
        final List<QuerySpec> calls = new CopyOnWriteArrayList<>();
        Function<QuerySpec, Future<List<ResultRow>>> answer = q -> Future.succeededFuture(Collections.emptyList());

        @Override
        public Future<List<ResultRow>> execute(QuerySpec query) {
            calls.add(query);
            return answer.apply(query);
        }
    }

    private static List<ResultRow> readings(int count, double start, double step) {
        List<ResultRow> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(new ResultRow().put("DataValue", start + i * step));
        }
        return rows;
    }

    private static JsonObject json(ResponseEnvelope envelope) {
        return envelope.toJson();
    }

    @BeforeEach
    void setUp(Vertx vertx) {
        workers = vertx.createSharedWorkerExecutor("forecast-worker-test", 2);
        caches = new CacheService(Duration.ofMinutes(60), 128, now::get);
        store = new RecordingQueryExecutor();

        SeasonalNaiveForecastModel seasonal = new SeasonalNaiveForecastModel(144, 4096, 1024);
        ForecastModel counting = (series, horizon) -> {
            modelCalls.incrementAndGet();
            return seasonal.forecast(series, horizon);
        };

        service = new EnergyToolService(
            vertx,
            store,
            new EnergyQueries("dbo.Tech_All_KWH"),
            new ForecastInvoker(vertx, workers, counting, true),
            caches,
            144,
            1024,
            Clock.fixed(Instant.parse("2024-09-01T03:15:30Z"), ZoneId.of("UTC")));
    }

    @AfterEach
    void tearDown() {
        workers.close();
    }

    @Test
    @DisplayName("One day of readings with horizon 24 gives 24 points and 24x10 quantiles")
    void testForecastScenario(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(readings(144, 1000.0, 2.0));

        service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24)
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                JsonObject body = json(envelope);
                assertTrue(envelope.isSuccess(), body.encode());
                assertEquals("B1", body.getJsonObject("meta").getString("building"));
                assertEquals(24, body.getJsonObject("meta").getInteger("horizon"));
                assertEquals(144, body.getJsonObject("meta").getInteger("data_points"));

                JsonObject forecast = body.getJsonObject("forecast");
                assertEquals(24, forecast.getJsonArray("point_forecast").size());
                JsonArray quantiles = forecast.getJsonArray("quantile_forecast");
                assertEquals(24, quantiles.size());
                for (int i = 0; i < quantiles.size(); i++) {
                    assertEquals(10, quantiles.getJsonArray(i).size());
                }

                QuerySpec query = store.calls.get(0);
                assertEquals(List.of("B1", LocalDateTime.of(2024, 9, 1, 0, 0), LocalDateTime.of(2024, 9, 1, 23, 59, 59)),
                    query.getParams());
                testContext.completeNow();
            })));
    }

    @Test
    void testIdenticalForecastRequestsComputeOnce(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(readings(144, 1000.0, 2.0));

        service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24)
            .compose(first -> service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24)
                .map(second -> List.of(first, second)))
            .onComplete(testContext.succeeding(both -> testContext.verify(() -> {
                assertEquals(json(both.get(0)).encode(), json(both.get(1)).encode());
                assertEquals(1, modelCalls.get());
                assertEquals(1, store.calls.size());
                assertEquals(1L, caches.forecasts().hits());
                testContext.completeNow();
            })));
    }

    @Test
    void testDistinctForecastRequestsComputeEach(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(readings(144, 1000.0, 2.0));

        service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24)
            .compose(r -> service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 12))
            .compose(r -> service.forecastEnergyUsage(DAY_START, DAY_END, "B2", 24))
            .onComplete(testContext.succeeding(r -> testContext.verify(() -> {
                assertEquals(3, modelCalls.get());
                assertEquals(3, caches.forecasts().currentSize());
                testContext.completeNow();
            })));
    }

    @Test
    void testDefaultHorizon(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(readings(10, 1000.0, 2.0));

        service.forecastEnergyUsage(DAY_START, DAY_END, "B1", null)
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertEquals(144, json(envelope).getJsonObject("meta").getInteger("horizon"));
                assertEquals(144, json(envelope).getJsonObject("forecast").getJsonArray("point_forecast").size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Concurrent misses on the same key both compute and leave one cache entry")
    void testConcurrentMissesBothCompute(VertxTestContext testContext) {
        List<Promise<List<ResultRow>>> pending = new CopyOnWriteArrayList<>();
        store.answer = q -> {
            Promise<List<ResultRow>> promise = Promise.promise();
            pending.add(promise);
            return promise.future();
        };

        Future<ResponseEnvelope> first = service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24);
        Future<ResponseEnvelope> second = service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24);

        assertEquals(2, pending.size());
        pending.forEach(p -> p.complete(readings(144, 1000.0, 2.0)));

        Future.all(first, second)
            .onComplete(testContext.succeeding(r -> testContext.verify(() -> {
                assertTrue(first.result().isSuccess());
                assertTrue(second.result().isSuccess());
                assertEquals(2, modelCalls.get());
                assertEquals(1, caches.forecasts().currentSize());
                assertEquals(2L, caches.forecasts().misses());
                testContext.completeNow();
            })));
    }

    @Test
    void testForecastWithoutDataIsFailure(VertxTestContext testContext) {
        service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24)
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                assertTrue(json(envelope).containsKey("error"));
                assertFalse(json(envelope).containsKey("meta"));
                assertEquals(0, modelCalls.get());
                assertEquals(0, caches.forecasts().currentSize());
                testContext.completeNow();
            })));
    }

    @Test
    void testForecastModelFailureIsFailure(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(readings(1, 1000.0, 0.0));

        service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 24)
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                assertTrue(envelope.getError().contains("Forecast failed"), envelope.getError());
                assertEquals(0, caches.forecasts().currentSize());
                testContext.completeNow();
            })));
    }

    @Test
    void testHorizonOutOfRangeIsValidationFailure(VertxTestContext testContext) {
        service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 0)
            .compose(zero -> service.forecastEnergyUsage(DAY_START, DAY_END, "B1", 1025)
                .map(tooBig -> List.of(zero, tooBig)))
            .onComplete(testContext.succeeding(both -> testContext.verify(() -> {
                assertFalse(both.get(0).isSuccess());
                assertFalse(both.get(1).isSuccess());
                assertTrue(both.get(1).getError().contains("horizon"));
                assertTrue(store.calls.isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    void testCatalogIsCachedWithinTtl(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(
            new ResultRow().put("Building", "B1"),
            new ResultRow().put("Building", "B2")));

        service.monitoredBuildings()
            .compose(first -> service.monitoredBuildings().map(second -> List.of(first, second)))
            .onComplete(testContext.succeeding(both -> testContext.verify(() -> {
                assertEquals(json(both.get(0)).encode(), json(both.get(1)).encode());
                assertEquals(2, json(both.get(0)).getJsonObject("meta").getInteger("count"));
                assertEquals(new JsonArray().add("B1").add("B2"), json(both.get(0)).getJsonArray("buildings"));
                assertEquals(1, store.calls.size());
                testContext.completeNow();
            })));
    }

    @Test
    void testCatalogReloadedAfterTtl(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(new ResultRow().put("Building", "B1")));

        service.monitoredBuildings()
            .compose(first -> {
                now.addAndGet(Duration.ofMinutes(61).toMillis());
                return service.monitoredBuildings();
            })
            .compose(second -> service.monitoredBuildings())
            .onComplete(testContext.succeeding(third -> testContext.verify(() -> {
                assertTrue(third.isSuccess());
                assertEquals(2, store.calls.size());
                testContext.completeNow();
            })));
    }

    @Test
    void testEmptyCatalogIsFailureAndNotCached(VertxTestContext testContext) {
        service.monitoredBuildings()
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                assertEquals(0, caches.catalog().currentSize());
                testContext.completeNow();
            })));
    }

    @Test
    void testTotalUsageIsAbsoluteDifference(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(new ResultRow()
            .put("start_accumulated_val", 1500.0)
            .put("end_accumulated_val", 1000.0)));

        service.totalEnergyUsage(DAY_START, DAY_END, "B1")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                JsonObject body = json(envelope);
                assertEquals(500.0, body.getDouble("total_usage"));
                assertEquals("kWh", body.getJsonObject("meta").getString("unit"));
                assertEquals("2024-09-01T00:00:00", body.getJsonObject("meta").getString("start_date_time"));
                assertEquals("2024-09-01T23:59:59", body.getJsonObject("meta").getString("end_date_time"));
                testContext.completeNow();
            })));
    }

    @Test
    void testTotalUsageWithoutReadingsIsFailure(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(new ResultRow()
            .put("start_accumulated_val", null)
            .put("end_accumulated_val", null)));

        service.totalEnergyUsage(DAY_START, DAY_END, "B1")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                testContext.completeNow();
            })));
    }

    @Test
    void testEnergyUsagesFormatsTimestamps(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(
            new ResultRow().put("Building", "B1").put("DataValue", 1010.5)
                .put("DateTime", LocalDateTime.of(2024, 9, 1, 0, 10)),
            new ResultRow().put("Building", "B1").put("DataValue", 1000.0)
                .put("DateTime", LocalDateTime.of(2024, 9, 1, 0, 0))));

        service.energyUsages(DAY_START, DAY_END, "B1")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                JsonObject body = json(envelope);
                assertEquals(2, body.getJsonObject("meta").getInteger("count"));
                JsonObject newest = body.getJsonArray("energyUsageInfos").getJsonObject(0);
                assertEquals("B1", newest.getString("building"));
                assertEquals(1010.5, newest.getDouble("value"));
                assertEquals("2024-09-01T00:10:00", newest.getString("timestamp"));
                testContext.completeNow();
            })));
    }

    @Test
    void testSingleInstantLookup(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(
            new ResultRow().put("Building", "B1").put("DataValue", 1000.0)
                .put("DateTime", LocalDateTime.of(2024, 9, 1, 0, 0))));

        service.energyUsages(DAY_START, DAY_START, "B1")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertTrue(envelope.isSuccess());
                assertEquals(1, json(envelope).getJsonArray("energyUsageInfos").size());
                LocalDateTime instant = LocalDateTime.of(2024, 9, 1, 0, 0);
                assertEquals(List.of("B1", instant, instant), store.calls.get(0).getParams());
                testContext.completeNow();
            })));
    }

    @Test
    void testEnergyUsagesWithoutDataIsFailure(VertxTestContext testContext) {
        service.energyUsages(DAY_START, DAY_END, "B1")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                assertTrue(envelope.getError().contains("No energy usage data"));
                testContext.completeNow();
            })));
    }

    @Test
    void testInvalidTimestampsAreRejectedBeforeQuerying(VertxTestContext testContext) {
        service.energyUsages("2024-09-01T00:00:00", DAY_END, "B1")
            .compose(iso -> service.energyUsages("2024-02-30 00:00:00", DAY_END, "B1").map(feb30 -> List.of(iso, feb30)))
            .compose(prev -> service.energyUsages(DAY_END, DAY_START, "B1").map(reversed -> {
                List<ResponseEnvelope> all = new ArrayList<>(prev);
                all.add(reversed);
                return all;
            }))
            .onComplete(testContext.succeeding(all -> testContext.verify(() -> {
                for (ResponseEnvelope envelope : all) {
                    assertFalse(envelope.isSuccess());
                }
                assertTrue(all.get(0).getError().contains("YYYY-MM-DD HH:MM:SS"));
                assertTrue(all.get(2).getError().contains("must not be after"));
                assertTrue(store.calls.isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    void testMissingBuildingIsRejected(VertxTestContext testContext) {
        service.buildingDataRange("  ")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                assertEquals("building is required", envelope.getError());
                assertTrue(store.calls.isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    void testBuildingDataRange(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(new ResultRow()
            .put("START_DATETIME", LocalDateTime.of(2024, 1, 1, 0, 0))
            .put("END_DATETIME", LocalDateTime.of(2024, 9, 30, 23, 50))));

        service.buildingDataRange("B1")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                JsonObject body = json(envelope);
                assertEquals("B1", body.getString("building"));
                assertEquals("2024-01-01T00:00:00", body.getString("start_datetime"));
                assertEquals("2024-09-30T23:50:00", body.getString("end_datetime"));
                testContext.completeNow();
            })));
    }

    @Test
    void testBuildingWithoutDataIsFailure(VertxTestContext testContext) {
        store.answer = q -> Future.succeededFuture(List.of(new ResultRow()
            .put("start_datetime", null)
            .put("end_datetime", null)));

        service.buildingDataRange("B9")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                assertTrue(envelope.getError().contains("B9"));
                testContext.completeNow();
            })));
    }

    @Test
    void testStoreFailureIsReportedAsFailure(VertxTestContext testContext) {
        store.answer = q -> Future.failedFuture(new IllegalStateException("connection reset"));

        service.energyUsages(DAY_START, DAY_END, "B1")
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                assertFalse(envelope.isSuccess());
                assertEquals("Internal error: connection reset", envelope.getError());
                testContext.completeNow();
            })));
    }

    @Test
    void testCurrentTime(VertxTestContext testContext) {
        service.currentTime()
            .onComplete(testContext.succeeding(envelope -> testContext.verify(() -> {
                JsonObject body = json(envelope);
                assertEquals("UTC", body.getJsonObject("meta").getString("zone"));
                assertEquals("2024-09-01T03:15:30", body.getString("current_time"));
                testContext.completeNow();
            })));
    }
}
