package com.aegis.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys so every log statement on the thread carries
 * them; clearing removes them. Servlet threads are pooled, so the filter that sets the
 * context must clear it in a finally block.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Records the authenticated principal on the current context. No-op when no context is
     * set (e.g. calls made outside an HTTP request).
     */
    public static void bindPrincipal(String userId, String tenantId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withPrincipal(userId, tenantId));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Runs {@code runnable} with {@code context} set, then restores whatever was there before.
     * Used to carry a request's context onto another thread.
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        putOrRemove(CorrelationContext.MDC_USER_ID, ctx.userId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
