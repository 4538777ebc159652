package energy.server.forecast;

/**
 * A computed forecast together with the number of history points it was fitted on.
 */
public class ForecastOutcome {

    private final int dataPoints;
    private final ForecastResult result;

    public ForecastOutcome(int dataPoints, ForecastResult result) {
        this.dataPoints = dataPoints;
        this.result = result;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public ForecastResult getResult() {
        return result;
    }
}
