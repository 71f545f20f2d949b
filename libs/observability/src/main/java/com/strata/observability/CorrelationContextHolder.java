package com.strata.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for the current {@link CorrelationContext}, mirrored into the SLF4J MDC.
 *
 * <p>Servlet containers reuse request threads, so whoever calls {@link #set} owns the matching
 * {@link #clear()} in a {@code finally} block.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Binds the context to the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT_ID, context.tenantId());
        putOrRemove(CorrelationContext.MDC_USER_ID, context.userId());
        putOrRemove(CorrelationContext.MDC_REQUEST_PATH, context.requestPath());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Re-binds the current context to an authenticated principal. No-op when no context is set
     * (e.g. a handler invoked outside the servlet filter chain).
     */
    public static void bindPrincipal(String userId, String tenantId) {
        get().ifPresent(ctx -> set(ctx.withPrincipal(userId, tenantId)));
    }

    /**
     * Removes the context and every MDC key it populated.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_PATH);
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
