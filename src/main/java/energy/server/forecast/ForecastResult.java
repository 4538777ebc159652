package energy.server.forecast;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Arrays;

/**
 * Output of a forecast: one point value per step and, when available,
 * ten values per step (index 0 the mean, then q10 to q90).
 */
public class ForecastResult {

    public static final int QUANTILE_COLUMNS = 10;

    private final double[] point;
    private final double[][] quantiles;

    public ForecastResult(double[] point, double[][] quantiles) {
        this.point = point.clone();
        this.quantiles = quantiles == null ? null : deepCopy(quantiles);
    }

    public double[] getPoint() {
        return point.clone();
    }

    public double[][] getQuantiles() {
        return quantiles == null ? null : deepCopy(quantiles);
    }

    public boolean hasQuantiles() {
        return quantiles != null;
    }

    public int horizon() {
        return point.length;
    }

    public ForecastResult withoutQuantiles() {
        return new ForecastResult(point, null);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject().put("point_forecast", toArray(point));
        if (quantiles != null) {
            JsonArray rows = new JsonArray();
            for (double[] row : quantiles) {
                rows.add(toArray(row));
            }
            json.put("quantile_forecast", rows);
        }
        return json;
    }

    private static JsonArray toArray(double[] values) {
        JsonArray array = new JsonArray();
        for (double v : values) {
            array.add(v);
        }
        return array;
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i] == null ? null : source[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForecastResult)) return false;
        ForecastResult that = (ForecastResult) o;
        return Arrays.equals(point, that.point) && Arrays.deepEquals(quantiles, that.quantiles);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(point) + Arrays.deepHashCode(quantiles);
    }
}
