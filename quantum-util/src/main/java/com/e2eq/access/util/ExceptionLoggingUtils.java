package com.e2eq.access.util;

import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Utility class for consistent exception logging across the access-control modules.
 * Callers pass their own {@link Logger} so that messages keep the caller's category;
 * the single-argument variants fall back to this class's logger.
 */
public class ExceptionLoggingUtils {

    private static final Logger LOG = Logger.getLogger(ExceptionLoggingUtils.class);

    private ExceptionLoggingUtils() {
    }

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param log the category to log under
     * @param exception the exception to log, may be null
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logError(Logger log, Throwable exception, String message, Object... args) {
        log.errorf(exception, "%s: %s", format(message, args), describe(exception));
    }

    public static void logError(Throwable exception, String message, Object... args) {
        logError(LOG, exception, message, args);
    }

    /**
     * Log exception with full stack trace at WARN level
     *
     * @param log the category to log under
     * @param exception the exception to log, may be null
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Logger log, Throwable exception, String message, Object... args) {
        log.warnf(exception, "%s: %s", format(message, args), describe(exception));
    }

    public static void logWarn(Throwable exception, String message, Object... args) {
        logWarn(LOG, exception, message, args);
    }

    /**
     * Log exception with full stack trace at DEBUG level. Formatting is skipped entirely
     * when debug is disabled for the category.
     */
    public static void logDebug(Logger log, Throwable exception, String message, Object... args) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debugf(exception, "%s: %s", format(message, args), describe(exception));
    }

    /**
     * Log an ignored exception at DEBUG level with context information
     *
     * @param log the category to log under
     * @param exception the exception that was ignored
     * @param context where the exception was ignored (e.g. method name, operation)
     */
    public static void logIgnoredException(Logger log, Throwable exception, String context) {
        if (exception != null && log.isDebugEnabled()) {
            log.debugf(exception, "Exception ignored in %s: %s", context, describe(exception));
        }
    }

    /**
     * Get stack trace as string
     *
     * @param exception the exception
     * @return stack trace as string, empty for null
     */
    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * Short single line description of an exception: its message, or its simple class
     * name when it carries none.
     */
    public static String describe(Throwable exception) {
        if (exception == null) {
            return "no exception";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    private static String format(String message, Object... args) {
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
