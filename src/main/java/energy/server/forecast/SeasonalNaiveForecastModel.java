package energy.server.forecast;

import java.util.Arrays;

/**
 * Forecasts a cumulative meter by projecting its per-step consumption.
 *
 * <p>The model works on increments of the series. When at least one full
 * season of increments is available, each future step takes the mean of the
 * increments at the same phase of the past seasons; otherwise every step takes
 * the mean increment (drift). Quantiles widen with the square root of the
 * step, using the spread of the in-sample residuals.</p>
 *
 * <p>A meter that never decreased in its history is assumed never to
 * decrease: predicted increments are floored at zero and no quantile falls
 * below the last reading. Quantile columns are sorted per step so they never
 * cross.</p>
 */
public class SeasonalNaiveForecastModel implements ForecastModel {

    // standard normal quantiles for q10..q90
    private static final double[] Z = {
        -1.2816, -0.8416, -0.5244, -0.2533, 0.0, 0.2533, 0.5244, 0.8416, 1.2816
    };

    private final int seasonLength;
    private final int maxContext;
    private final int maxHorizon;

    public SeasonalNaiveForecastModel(int seasonLength, int maxContext, int maxHorizon) {
        if (seasonLength <= 0 || maxContext < 2 || maxHorizon <= 0) {
            throw new IllegalArgumentException("Invalid model configuration: season=" + seasonLength
                + ", maxContext=" + maxContext + ", maxHorizon=" + maxHorizon);
        }
        this.seasonLength = seasonLength;
        this.maxContext = maxContext;
        this.maxHorizon = maxHorizon;
    }

    @Override
    public ForecastResult forecast(double[] series, int horizon) {
        if (horizon <= 0 || horizon > maxHorizon) {
            throw new IllegalArgumentException("horizon must be between 1 and " + maxHorizon + ", got " + horizon);
        }
        if (series == null || series.length < 2) {
            throw new IllegalArgumentException("at least 2 readings are required, got "
                + (series == null ? 0 : series.length));
        }

        double[] context = series.length > maxContext
            ? Arrays.copyOfRange(series, series.length - maxContext, series.length)
            : series;

        double[] increments = new double[context.length - 1];
        boolean nonDecreasing = true;
        for (int i = 0; i < increments.length; i++) {
            increments[i] = context[i + 1] - context[i];
            if (increments[i] < 0) {
                nonDecreasing = false;
            }
        }

        boolean seasonal = increments.length >= seasonLength;
        double[] stepIncrements = seasonal ? seasonalIncrements(increments, horizon) : driftIncrements(increments, horizon);
        double sigma = seasonal ? seasonalResidualSigma(increments) : driftResidualSigma(increments);

        double last = context[context.length - 1];
        double[] point = new double[horizon];
        double[][] quantiles = new double[horizon][ForecastResult.QUANTILE_COLUMNS];

        double level = last;
        for (int h = 0; h < horizon; h++) {
            double step = nonDecreasing ? Math.max(0.0, stepIncrements[h]) : stepIncrements[h];
            level += step;
            point[h] = level;

            double spread = sigma * Math.sqrt(h + 1);
            quantiles[h][0] = level;
            for (int q = 0; q < Z.length; q++) {
                double value = level + Z[q] * spread;
                quantiles[h][q + 1] = nonDecreasing ? Math.max(last, value) : value;
            }
            Arrays.sort(quantiles[h], 1, ForecastResult.QUANTILE_COLUMNS);
        }

        return new ForecastResult(point, quantiles);
    }

    private double[] seasonalIncrements(double[] increments, int horizon) {
        int m = increments.length;
        int seasons = m / seasonLength;
        double[] result = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            int phase = h % seasonLength;
            double sum = 0.0;
            for (int k = 1; k <= seasons; k++) {
                sum += increments[m - k * seasonLength + phase];
            }
            result[h] = sum / seasons;
        }
        return result;
    }

    private static double[] driftIncrements(double[] increments, int horizon) {
        double[] result = new double[horizon];
        Arrays.fill(result, mean(increments));
        return result;
    }

    private double seasonalResidualSigma(double[] increments) {
        int count = increments.length - seasonLength;
        if (count <= 0) {
            return driftResidualSigma(increments);
        }
        double sumSq = 0.0;
        for (int i = seasonLength; i < increments.length; i++) {
            double r = increments[i] - increments[i - seasonLength];
            sumSq += r * r;
        }
        return Math.sqrt(sumSq / count);
    }

    private static double driftResidualSigma(double[] increments) {
        double mean = mean(increments);
        double sumSq = 0.0;
        for (double d : increments) {
            sumSq += (d - mean) * (d - mean);
        }
        return Math.sqrt(sumSq / increments.length);
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    @Override
    public String name() {
        return "SeasonalNaive(season=" + seasonLength + ")";
    }
}
