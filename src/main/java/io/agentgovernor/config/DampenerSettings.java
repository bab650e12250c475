package io.agentgovernor.config;

import java.time.Duration;
import java.util.Map;

/**
 * @param dedupWindow          identical events inside this window are dropped
 * @param rateLimits           event type to max events per {@code rateWindow}; types that are
 *                             absent are not rate limited
 * @param rateWindow           duration of each per-type accounting window
 * @param cascadeThreshold     max events ever delivered for one correlation id
 * @param cascadeFanoutRatio   max ratio of a correlation's events to its type's window volume
 * @param correlationRetention opt-in; correlation counters idle longer than this are dropped
 *                             by cleanup, which lifts the cascade bound for them. Null, the
 *                             default, keeps them for the process lifetime
 */
public record DampenerSettings(
        Duration dedupWindow,
        Map<String, Integer> rateLimits,
        Duration rateWindow,
        int cascadeThreshold,
        double cascadeFanoutRatio,
        Duration correlationRetention
) {
    public DampenerSettings {
        if (dedupWindow == null || dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must be >= 0");
        }
        if (rateWindow == null || rateWindow.isZero() || rateWindow.isNegative()) {
            throw new IllegalArgumentException("rateWindow must be > 0");
        }
        if (cascadeThreshold < 1) {
            throw new IllegalArgumentException("cascadeThreshold must be >= 1: " + cascadeThreshold);
        }
        if (!(cascadeFanoutRatio > 0.0d)) {
            throw new IllegalArgumentException("cascadeFanoutRatio must be > 0: " + cascadeFanoutRatio);
        }
        if (correlationRetention != null && (correlationRetention.isZero() || correlationRetention.isNegative())) {
            throw new IllegalArgumentException("correlationRetention must be > 0 when set");
        }
        rateLimits = rateLimits == null ? Map.of() : Map.copyOf(rateLimits);
        for (Map.Entry<String, Integer> entry : rateLimits.entrySet()) {
            if (entry.getValue() < 0) {
                throw new IllegalArgumentException("Rate limit for " + entry.getKey() + " must be >= 0");
            }
        }
    }

    public static DampenerSettings defaults() {
        return new DampenerSettings(
                Duration.ofSeconds(30),
                Map.of(),
                Duration.ofMinutes(1),
                100,
                10.0d,
                null
        );
    }

    public DampenerSettings withRateLimits(Map<String, Integer> value) {
        return new DampenerSettings(dedupWindow, value, rateWindow, cascadeThreshold, cascadeFanoutRatio, correlationRetention);
    }

    public DampenerSettings withCascade(int threshold, double fanoutRatio) {
        return new DampenerSettings(dedupWindow, rateLimits, rateWindow, threshold, fanoutRatio, correlationRetention);
    }

    public DampenerSettings withCorrelationRetention(Duration value) {
        return new DampenerSettings(dedupWindow, rateLimits, rateWindow, cascadeThreshold, cascadeFanoutRatio, value);
    }

    public DampenerSettings withDedupWindow(Duration value) {
        return new DampenerSettings(value, rateLimits, rateWindow, cascadeThreshold, cascadeFanoutRatio, correlationRetention);
    }
}
