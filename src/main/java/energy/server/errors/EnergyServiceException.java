package energy.server.errors;

/**
 * Unchecked exception raised by the query executor, extractor, forecast invoker
 * and input validation. The orchestrator turns it into a failure envelope.
 */
public class EnergyServiceException extends RuntimeException {

    private final ErrorKind kind;

    public EnergyServiceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EnergyServiceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static EnergyServiceException invalidQuery(String query) {
        return new EnergyServiceException(ErrorKind.INVALID_QUERY,
            "Only SELECT queries are allowed: " + abbreviate(query));
    }

    public static EnergyServiceException validation(String message) {
        return new EnergyServiceException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static EnergyServiceException noData(String message) {
        return new EnergyServiceException(ErrorKind.NO_DATA, message);
    }

    public static EnergyServiceException database(String message, Throwable cause) {
        return new EnergyServiceException(ErrorKind.DATABASE_ERROR, message, cause);
    }

    public static EnergyServiceException forecast(String message, Throwable cause) {
        return new EnergyServiceException(ErrorKind.FORECAST_ERROR, message, cause);
    }

    private static String abbreviate(String query) {
        if (query == null) {
            return "<null>";
        }
        String trimmed = query.trim();
        return trimmed.length() > 80 ? trimmed.substring(0, 80) + "..." : trimmed;
    }
}
