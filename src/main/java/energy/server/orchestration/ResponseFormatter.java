package energy.server.orchestration;

import energy.server.forecast.ForecastOutcome;
import energy.server.query.EnergyQueries;
import energy.server.query.ResultRow;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Shapes tool results into envelopes. All timestamps leave the server as
 * ISO-8601 local date-times.
 */
public final class ResponseFormatter {

    public static final String ENERGY_UNIT = "kWh";

    private ResponseFormatter() {
    }

    public static String iso(LocalDateTime value) {
        return value == null ? null : value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    public static ResponseEnvelope buildings(List<String> buildings) {
        return ResponseEnvelope.success(
            new JsonObject().put("count", buildings.size()),
            new JsonObject().put("buildings", new JsonArray(buildings)));
    }

    public static ResponseEnvelope dataRange(String building, LocalDateTime start, LocalDateTime end) {
        return ResponseEnvelope.success(
            new JsonObject().put("building", building),
            new JsonObject()
                .put("building", building)
                .put("start_datetime", iso(start))
                .put("end_datetime", iso(end)));
    }

    public static ResponseEnvelope usages(String building, LocalDateTime start, LocalDateTime end, List<ResultRow> rows) {
        JsonArray infos = new JsonArray();
        for (ResultRow row : rows) {
            infos.add(new JsonObject()
                .put("building", row.getString(EnergyQueries.BUILDING))
                .put("value", row.getDouble(EnergyQueries.DATA_VALUE))
                .put("timestamp", iso(row.getDateTime(EnergyQueries.DATE_TIME))));
        }
        return ResponseEnvelope.success(
            new JsonObject()
                .put("building", building)
                .put("start_date_time", iso(start))
                .put("end_date_time", iso(end))
                .put("count", rows.size()),
            new JsonObject().put("energyUsageInfos", infos));
    }

    public static ResponseEnvelope totalUsage(String building, LocalDateTime start, LocalDateTime end, double total) {
        return ResponseEnvelope.success(
            new JsonObject()
                .put("building", building)
                .put("start_date_time", iso(start))
                .put("end_date_time", iso(end))
                .put("unit", ENERGY_UNIT),
            new JsonObject().put("total_usage", total));
    }

    public static ResponseEnvelope forecast(String building, int horizon, ForecastOutcome outcome) {
        return ResponseEnvelope.success(
            new JsonObject()
                .put("building", building)
                .put("horizon", horizon)
                .put("data_points", outcome.getDataPoints()),
            new JsonObject().put("forecast", outcome.getResult().toJson()));
    }

    public static ResponseEnvelope currentTime(String zone, LocalDateTime now) {
        return ResponseEnvelope.success(
            new JsonObject().put("zone", zone),
            new JsonObject().put("current_time", iso(now)));
    }
}
