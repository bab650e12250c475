package io.agentgovernor.config;

import java.time.Duration;

/**
 * @param failureThreshold consecutive failures, or failures inside {@code window}, that trip
 *                         a closed circuit
 * @param successThreshold consecutive half-open successes that close the circuit again
 * @param window           failure counting window; counters reset once it passes without a
 *                         new failure
 * @param cooldown         time an open circuit waits before admitting half-open probes
 * @param maxOpenDuration  upper bound on time spent open, applied when shorter than cooldown
 */
public record CircuitBreakerSettings(
        int failureThreshold,
        int successThreshold,
        Duration window,
        Duration cooldown,
        Duration maxOpenDuration
) {
    public CircuitBreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1: " + successThreshold);
        }
        requirePositive(window, "window");
        requirePositive(cooldown, "cooldown");
        requirePositive(maxOpenDuration, "maxOpenDuration");
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(
                5,
                2,
                Duration.ofSeconds(60),
                Duration.ofSeconds(60),
                Duration.ofSeconds(300)
        );
    }

    public CircuitBreakerSettings withThresholds(int failures, int successes) {
        return new CircuitBreakerSettings(failures, successes, window, cooldown, maxOpenDuration);
    }

    public CircuitBreakerSettings withCooldown(Duration value) {
        return new CircuitBreakerSettings(failureThreshold, successThreshold, window, value, maxOpenDuration);
    }

    public CircuitBreakerSettings withWindow(Duration value) {
        return new CircuitBreakerSettings(failureThreshold, successThreshold, value, cooldown, maxOpenDuration);
    }

    /**
     * Time after tripping at which an open circuit is promoted to half-open.
     */
    public Duration effectiveOpenDuration() {
        return cooldown.compareTo(maxOpenDuration) <= 0 ? cooldown : maxOpenDuration;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
