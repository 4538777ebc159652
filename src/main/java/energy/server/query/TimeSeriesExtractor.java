package energy.server.query;

import energy.server.errors.EnergyServiceException;

import java.util.List;

/**
 * Projects result rows onto a numeric series. Rows must already be in
 * ascending time order; they are not re-sorted.
 */
public final class TimeSeriesExtractor {

    private TimeSeriesExtractor() {
    }

    public static double[] extract(List<ResultRow> rows, String valueColumn) {
        if (rows == null || rows.isEmpty()) {
            throw EnergyServiceException.noData("No readings found for the requested period");
        }

        double[] buffer = new double[rows.size()];
        int count = 0;
        for (ResultRow row : rows) {
            Double value;
            try {
                value = row.getDouble(valueColumn);
            } catch (IllegalStateException e) {
                throw EnergyServiceException.database("Unexpected reading type: " + e.getMessage(), e);
            }
            if (value != null) {
                buffer[count++] = value;
            }
        }

        if (count == 0) {
            throw EnergyServiceException.noData("No readings found for the requested period");
        }
        if (count == buffer.length) {
            return buffer;
        }
        double[] series = new double[count];
        System.arraycopy(buffer, 0, series, 0, count);
        return series;
    }
}
