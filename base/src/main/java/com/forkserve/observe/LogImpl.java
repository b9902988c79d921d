package com.forkserve.observe;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * The only place that touches SLF4J and OpenTelemetry types.
 */
final class LogImpl {

    enum Level { DEBUG, INFO, WARN, ERROR }

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private static final Set<Class<?>> FACADE = Set.of(Log.class, LogImpl.class);

    private final ConcurrentMap<Class<?>, Logger> loggers = new ConcurrentHashMap<>();
    private final Tracer tracer = GlobalOpenTelemetry.get().getTracer("forkserve");

    void log(Level level, String format, Object... args) {
        Logger logger = callerLogger();
        switch (level) {
            case DEBUG -> logger.debug(format, args);
            case INFO -> logger.info(format, args);
            case WARN -> logger.warn(format, args);
            case ERROR -> logger.error(format, args);
        }
    }

    void traced(String operation, Runnable work) {
        if (!InvestigationContext.isActive()) {
            work.run();
            return;
        }

        Logger logger = callerLogger();
        long started = System.nanoTime();
        logger.debug("-> {}", operation);

        Span span = tracer.spanBuilder(operation).setSpanKind(SpanKind.SERVER).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            work.run();
            logger.debug("<- {} ({}ms)", operation, elapsedMillis(started));
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? "" : e.getMessage());
            logger.debug("x {} ({}ms): {}", operation, elapsedMillis(started), e.toString());
            throw e;
        } finally {
            span.end();
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private Logger callerLogger() {
        Class<?> caller = WALKER.walk(frames -> frames
                .map(StackWalker.StackFrame::getDeclaringClass)
                .filter(c -> !FACADE.contains(c))
                .findFirst()
                .orElse(LogImpl.class));
        return loggers.computeIfAbsent(caller, LoggerFactory::getLogger);
    }
}
