package io.agentgovernor.circuit;

import java.time.Instant;

/**
 * Snapshot of one circuit. {@code windowFailures} counts failures since the failure window
 * last lapsed; {@code totalFailures} and {@code totalSuccesses} are lifetime counters.
 */
public record CircuitRecord(
        String circuitId,
        CircuitState state,
        String tripReason,
        Instant trippedAt,
        Instant lastFailureAt,
        Instant lastSuccessAt,
        long totalFailures,
        long totalSuccesses,
        int windowFailures,
        int consecutiveFailures,
        int consecutiveSuccesses
) {
}
