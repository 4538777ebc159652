package energy.server.errors;

/**
 * Failure categories surfaced by the query and forecast pipeline.
 */
public enum ErrorKind {
    /** Query text is not a read-only SELECT; nothing was executed. */
    INVALID_QUERY,
    /** Caller input is malformed or out of range. */
    VALIDATION_ERROR,
    /** The store returned no usable rows. */
    NO_DATA,
    /** Driver or connectivity failure, or an unexpected column type. */
    DATABASE_ERROR,
    /** The forecasting model failed or produced output of the wrong shape. */
    FORECAST_ERROR
}
