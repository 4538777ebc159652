package energy.server.services;

import energy.server.Driver;
import io.vertx.core.Vertx;

/**
 * Structured logging helpers. Every entry is published on the "log" address as
 * a CSV line (message,level,component,operation,category) and picked up by the
 * {@link Logger} verticle.
 */
public class LogUtil {

    // Log levels matching Driver.logLevel
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    public static final String LOG_ADDRESS = "log";

    private LogUtil() {
    }

    /**
     * Log an error that should appear in console and logs
     */
    public static void logError(Vertx vertx, String message, String component, String operation, String category, boolean showInConsole) {
        if (showInConsole) {
            System.err.println("[" + component + "] " + message);
        }
        publish(vertx, formatLogMessage(message, ERROR, component, operation, category));
    }

    /**
     * Log an error with its cause. The cause chain is flattened into the message so
     * nothing is lost when the caller only sees a summary.
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String operation, String category, boolean showInConsole) {
        String fullMessage = message + ": " + describe(throwable);

        if (showInConsole) {
            System.err.println("[" + component + "] " + fullMessage);
            if (Driver.logLevel >= DEBUG) {
                throwable.printStackTrace();
            }
        }

        publish(vertx, formatLogMessage(fullMessage, ERROR, component, operation, category));

        if (Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append("  at ").append(element).append(" | ");
            }
            publish(vertx, formatLogMessage("Stack trace: " + stackTrace, DEBUG, component, operation, category));
        }
    }

    /**
     * Log an info message (startup, status, etc)
     */
    public static void logInfo(Vertx vertx, String message, String component, String operation, String category, boolean showInConsole) {
        if (showInConsole && Driver.logLevel >= INFO) {
            System.out.println("[" + component + "] " + message);
        }
        if (Driver.logLevel >= INFO) {
            publish(vertx, formatLogMessage(message, INFO, component, operation, category));
        }
    }

    public static void logDetail(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DETAIL) {
            publish(vertx, formatLogMessage(message, DETAIL, component, operation, category));
        }
    }

    /**
     * Log a debug message (never shows in console, only in logs)
     */
    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DEBUG) {
            publish(vertx, formatLogMessage(message, DEBUG, component, operation, category));
        }
    }

    public static void logData(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DATA) {
            publish(vertx, formatLogMessage(message, DATA, component, operation, category));
        }
    }

    static String describe(Throwable throwable) {
        StringBuilder sb = new StringBuilder(String.valueOf(throwable.getMessage()));
        Throwable cause = throwable.getCause();
        while (cause != null && cause != cause.getCause()) {
            sb.append(" <- ").append(cause.getClass().getSimpleName()).append(": ").append(cause.getMessage());
            cause = cause.getCause();
        }
        return sb.toString();
    }

    /**
     * Commas are the CSV separator, so they are replaced inside the message.
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        String cleanMessage = String.valueOf(message).replace(",", ";").replace("\n", " ");
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }

    private static void publish(Vertx vertx, String line) {
        if (vertx != null) {
            vertx.eventBus().publish(LOG_ADDRESS, line);
        }
    }
}
