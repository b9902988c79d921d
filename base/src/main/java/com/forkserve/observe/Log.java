package com.forkserve.observe;

/**
 * Static logging entry points, meant for {@code import static}.
 *
 * The logger is picked from the calling class, so call sites read like
 * {@code info("Worker {} listening on port {}", id, port)}. Nothing from
 * SLF4J or OpenTelemetry leaks through this class; see {@link LogImpl}.
 */
public final class Log {

    private static final LogImpl IMPL = new LogImpl();

    private Log() {}

    public static void info(String format, Object... args) {
        IMPL.log(LogImpl.Level.INFO, format, args);
    }

    public static void warn(String format, Object... args) {
        IMPL.log(LogImpl.Level.WARN, format, args);
    }

    public static void error(String format, Object... args) {
        IMPL.log(LogImpl.Level.ERROR, format, args);
    }

    /**
     * Error with stack trace.
     */
    public static void error(String message, Throwable t) {
        IMPL.log(LogImpl.Level.ERROR, message, t);
    }

    public static void debug(String format, Object... args) {
        IMPL.log(LogImpl.Level.DEBUG, format, args);
    }

    /**
     * Run {@code work} inside a span named {@code operation}, with entry and
     * exit debug lines. Outside investigation mode this is a plain call.
     */
    public static void traced(String operation, Runnable work) {
        IMPL.traced(operation, work);
    }

    /**
     * Turn on investigation mode for the calling thread.
     */
    public static void enableInvestigation() {
        InvestigationContext.enable();
    }

    public static void disableInvestigation() {
        InvestigationContext.disable();
    }

    public static boolean isInvestigating() {
        return InvestigationContext.isActive();
    }
}
