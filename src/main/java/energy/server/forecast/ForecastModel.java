package energy.server.forecast;

/**
 * A forecasting model over a cumulative meter series.
 *
 * Implementations may be CPU heavy; callers run them off the event loop.
 */
public interface ForecastModel {

    /**
     * Forecast the next {@code horizon} values of {@code series}.
     *
     * @param series  readings in ascending time order
     * @param horizon number of future steps, positive
     * @return point forecast of length {@code horizon} and, optionally,
     *         quantiles shaped {@code horizon x 10}
     * @throws IllegalArgumentException if the series is too short to fit
     */
    ForecastResult forecast(double[] series, int horizon);

    /**
     * Name reported in logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
