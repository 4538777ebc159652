package energy.server.forecast;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Arguments of one forecast call. Used as the forecast cache key, so two
 * requests are equal exactly when all four fields are equal.
 */
public class ForecastRequest {

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final String building;
    private final int horizon;

    public ForecastRequest(LocalDateTime start, LocalDateTime end, String building, int horizon) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.building = Objects.requireNonNull(building, "building");
        this.horizon = horizon;
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public String getBuilding() {
        return building;
    }

    public int getHorizon() {
        return horizon;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForecastRequest)) return false;
        ForecastRequest that = (ForecastRequest) o;
        return horizon == that.horizon
            && start.equals(that.start)
            && end.equals(that.end)
            && building.equals(that.building);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, building, horizon);
    }

    @Override
    public String toString() {
        return "ForecastRequest{building='" + building + "', start=" + start + ", end=" + end + ", horizon=" + horizon + "}";
    }
}
