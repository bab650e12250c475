package io.agentgovernor.observability;

import org.slf4j.MDC;

import java.security.SecureRandom;

/**
 * Thread-scoped correlation id, mirrored into the SLF4J MDC under {@link #MDC_KEY}.
 */
public final class CorrelationContext {
    public static final String MDC_KEY = "correlationId";
    private static final String PREFIX = "corr_";
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String get() {
        return CURRENT.get();
    }

    public static void set(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            clear();
            return;
        }
        CURRENT.set(correlationId);
        MDC.put(MDC_KEY, correlationId);
    }

    public static String generate() {
        String correlationId = newCorrelationId();
        set(correlationId);
        return correlationId;
    }

    /**
     * The bound correlation id, or a fresh one when none is bound. Never binds, so pooled
     * threads do not carry an implicit id into unrelated work.
     */
    public static String currentOrNew() {
        String current = CURRENT.get();
        return current == null ? newCorrelationId() : current;
    }

    public static void clear() {
        CURRENT.remove();
        MDC.remove(MDC_KEY);
    }

    /**
     * Binds {@code correlationId} for the duration of a try-with-resources block and restores
     * whatever was bound before.
     */
    public static Scope open(String correlationId) {
        String previous = CURRENT.get();
        set(correlationId);
        return () -> set(previous);
    }

    public static String newCorrelationId() {
        return PREFIX + randomHex(8); // 8 bytes => 16 hex chars
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
