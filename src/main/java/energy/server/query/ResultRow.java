package energy.server.query;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One row of a result set, in column order. Lookups ignore the case of the
 * column label since drivers do not agree on it. Timestamps are held as
 * {@link LocalDateTime}.
 */
public class ResultRow {

    private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> labels = new LinkedHashMap<>();

    public ResultRow put(String column, Object value) {
        Object normalized = value instanceof Timestamp ? ((Timestamp) value).toLocalDateTime() : value;
        String previous = labels.put(column.toLowerCase(Locale.ROOT), column);
        if (previous != null) {
            values.remove(previous);
        }
        values.put(column, normalized);
        return this;
    }

    public boolean has(String column) {
        return labels.containsKey(column.toLowerCase(Locale.ROOT));
    }

    public Object get(String column) {
        String label = labels.get(column.toLowerCase(Locale.ROOT));
        return label == null ? null : values.get(label);
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    /**
     * @return the value as a double, or null when absent
     * @throws IllegalStateException when the value is not numeric
     */
    public Double getDouble(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalStateException("Column " + column + " is not numeric: " + value.getClass().getSimpleName());
    }

    public LocalDateTime getDateTime(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        throw new IllegalStateException("Column " + column + " is not a timestamp: " + value.getClass().getSimpleName());
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
