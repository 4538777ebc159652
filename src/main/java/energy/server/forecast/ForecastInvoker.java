package energy.server.forecast;

import energy.server.errors.EnergyServiceException;
import energy.server.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;

/**
 * Runs the forecasting model on a dedicated worker pool so that the event
 * loop and the JDBC workers are never held by inference.
 *
 * The model is called exactly once per invocation. Any exception it throws,
 * and any output of the wrong shape, fails the returned future with a
 * FORECAST_ERROR.
 */
public class ForecastInvoker {

    private static final String COMPONENT = "ForecastInvoker";

    private final Vertx vertx;
    private final WorkerExecutor executor;
    private final ForecastModel model;
    private final boolean includeQuantiles;

    public ForecastInvoker(Vertx vertx, WorkerExecutor executor, ForecastModel model, boolean includeQuantiles) {
        this.vertx = vertx;
        this.executor = executor;
        this.model = model;
        this.includeQuantiles = includeQuantiles;
    }

    public Future<ForecastResult> forecast(double[] series, int horizon) {
        if (horizon <= 0) {
            return Future.failedFuture(EnergyServiceException.validation("horizon must be positive, got " + horizon));
        }
        double[] input = series.clone();

        return executor.<ForecastResult>executeBlocking(() -> {
            long startTime = System.currentTimeMillis();
            ForecastResult raw;
            try {
                raw = model.forecast(input, horizon);
            } catch (RuntimeException e) {
                throw EnergyServiceException.forecast("Forecast failed: " + e.getMessage(), e);
            }
            ForecastResult checked = checkShape(raw, horizon);
            LogUtil.logDebug(vertx, model.name() + " forecast " + horizon + " steps from " + input.length
                + " points in " + (System.currentTimeMillis() - startTime) + "ms", COMPONENT, "Forecast", "Model");
            return includeQuantiles ? checked : checked.withoutQuantiles();
        }, false);
    }

    static ForecastResult checkShape(ForecastResult result, int horizon) {
        if (result == null) {
            throw EnergyServiceException.forecast("Forecast model returned no result", null);
        }
        if (result.horizon() != horizon) {
            throw EnergyServiceException.forecast("Point forecast has " + result.horizon()
                + " steps, expected " + horizon, null);
        }
        if (result.hasQuantiles()) {
            double[][] quantiles = result.getQuantiles();
            if (quantiles.length != horizon) {
                throw EnergyServiceException.forecast("Quantile forecast has " + quantiles.length
                    + " steps, expected " + horizon, null);
            }
            for (double[] row : quantiles) {
                if (row == null || row.length != ForecastResult.QUANTILE_COLUMNS) {
                    throw EnergyServiceException.forecast("Quantile forecast rows must have "
                        + ForecastResult.QUANTILE_COLUMNS + " values", null);
                }
            }
        }
        return result;
    }
}
