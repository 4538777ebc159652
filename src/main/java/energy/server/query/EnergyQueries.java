package energy.server.query;

import java.time.LocalDateTime;

/**
 * SQL for the energy tools. The table name comes from validated
 * configuration; every caller value is a bound parameter.
 */
public class EnergyQueries {

    public static final String BUILDING = "Building";
    public static final String DATA_VALUE = "DataValue";
    public static final String DATE_TIME = "DateTime";
    public static final String START_DATETIME = "start_datetime";
    public static final String END_DATETIME = "end_datetime";
    public static final String START_ACCUMULATED = "start_accumulated_val";
    public static final String END_ACCUMULATED = "end_accumulated_val";

    private final String table;

    public EnergyQueries(String table) {
        this.table = table;
    }

    public QuerySpec buildings() {
        return QuerySpec.of("SELECT DISTINCT Building FROM " + table + " ORDER BY Building");
    }

    public QuerySpec dataRange(String building) {
        return QuerySpec.of("""
            SELECT MIN(DateTime) AS start_datetime, MAX(DateTime) AS end_datetime
            FROM %s
            WHERE Building = ?
            """.formatted(table), building);
    }

    public QuerySpec usages(String building, LocalDateTime start, LocalDateTime end) {
        return QuerySpec.of("""
            SELECT Building, DataValue, DateTime
            FROM %s
            WHERE Building = ? AND DateTime >= ? AND DateTime <= ?
            ORDER BY DateTime DESC
            """.formatted(table), building, start, end);
    }

    /**
     * First and last cumulative reading inside the window.
     */
    public QuerySpec accumulatedBounds(String building, LocalDateTime start, LocalDateTime end) {
        return QuerySpec.of("""
            SELECT
              (SELECT TOP 1 DataValue FROM %1$s
                 WHERE Building = ? AND DateTime >= ? AND DateTime <= ?
                 ORDER BY DateTime ASC) AS start_accumulated_val,
              (SELECT TOP 1 DataValue FROM %1$s
                 WHERE Building = ? AND DateTime >= ? AND DateTime <= ?
                 ORDER BY DateTime DESC) AS end_accumulated_val
            """.formatted(table), building, start, end, building, start, end);
    }

    public QuerySpec series(String building, LocalDateTime start, LocalDateTime end) {
        return QuerySpec.of("""
            SELECT DataValue
            FROM %s
            WHERE Building = ? AND DateTime >= ? AND DateTime <= ?
            ORDER BY DateTime ASC
            """.formatted(table), building, start, end);
    }
}
