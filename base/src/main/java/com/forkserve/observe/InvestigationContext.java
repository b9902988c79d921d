package com.forkserve.observe;

/**
 * Per-thread investigation flag, raised for the dispatch of a request that
 * carries {@code X-Debug: true}.
 */
final class InvestigationContext {

    private static final ThreadLocal<Boolean> ACTIVE = new ThreadLocal<>();

    private InvestigationContext() {}

    static void enable() {
        ACTIVE.set(Boolean.TRUE);
    }

    static void disable() {
        ACTIVE.remove();
    }

    static boolean isActive() {
        return ACTIVE.get() != null;
    }
}
