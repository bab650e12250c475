package io.agentgovernor.circuit;

import io.agentgovernor.config.CircuitBreakerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Per-key circuit breaker: {@code CLOSED -> OPEN} on trip, {@code OPEN -> HALF_OPEN} once
 * the cooldown has elapsed, {@code HALF_OPEN -> CLOSED} after enough consecutive successes
 * and {@code HALF_OPEN -> OPEN} on any failure.
 *
 * <p>There is no timer. Time-based transitions (cooldown promotion, failure-window expiry)
 * are applied lazily by every operation on a circuit, including {@link #canProceed} and
 * {@link #getState}. Each circuit is guarded by its own monitor.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final ConcurrentMap<String, Circuit> circuits = new ConcurrentHashMap<>();

    public CircuitBreaker(CircuitBreakerSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public CircuitBreaker(CircuitBreakerSettings settings, Clock clock) {
        this.settings = settings == null ? CircuitBreakerSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        log.info("Circuit breaker initialized (failureThreshold={}, successThreshold={}, window={}, cooldown={})",
                this.settings.failureThreshold(), this.settings.successThreshold(),
                this.settings.window(), this.settings.cooldown());
    }

    public boolean canProceed(String circuitId) {
        return withCircuit(circuitId, circuit -> {
            refresh(circuit, clock.instant());
            if (circuit.state == CircuitState.OPEN) {
                log.warn("Circuit OPEN: {} - blocking operation", circuit.id);
                return false;
            }
            return true;
        });
    }

    public CircuitState recordSuccess(String circuitId) {
        return withCircuit(circuitId, circuit -> {
            Instant now = clock.instant();
            refresh(circuit, now);
            circuit.lastSuccessAt = now;
            circuit.totalSuccesses++;
            circuit.consecutiveSuccesses++;
            circuit.consecutiveFailures = 0;
            if (circuit.state == CircuitState.HALF_OPEN
                    && circuit.consecutiveSuccesses >= settings.successThreshold()) {
                close(circuit);
            }
            log.debug("Circuit success: {} (consecutive={})", circuit.id, circuit.consecutiveSuccesses);
            return circuit.state;
        });
    }

    public CircuitState recordFailure(String circuitId) {
        return recordFailure(circuitId, null);
    }

    /**
     * Records a failed operation and returns the resulting state.
     */
    public CircuitState recordFailure(String circuitId, String reason) {
        return withCircuit(circuitId, circuit -> {
            Instant now = clock.instant();
            refresh(circuit, now);
            circuit.lastFailureAt = now;
            circuit.totalFailures++;
            circuit.windowFailures++;
            circuit.consecutiveFailures++;
            circuit.consecutiveSuccesses = 0;
            log.warn("Circuit failure: {} (consecutive={}, reason={})", circuit.id, circuit.consecutiveFailures, reason);
            if (circuit.state == CircuitState.CLOSED && shouldTrip(circuit)) {
                open(circuit, reason == null ? "Failure threshold reached" : reason, now);
            } else if (circuit.state == CircuitState.HALF_OPEN) {
                open(circuit, "Failed during recovery", now);
            }
            return circuit.state;
        });
    }

    /**
     * Opens the circuit regardless of its counters, e.g. after a detected loop.
     */
    public void trip(String circuitId, String reason) {
        withCircuit(circuitId, circuit -> {
            open(circuit, reason, clock.instant());
            log.error("Circuit manually tripped: {} - {}", circuit.id, reason);
            return null;
        });
    }

    /**
     * Closes a known circuit and clears its window counters. Returns false for unknown ids.
     */
    public boolean reset(String circuitId) {
        Circuit existing = circuitId == null ? null : circuits.get(circuitId);
        if (existing == null) {
            log.warn("Reset requested for unknown circuit: {}", circuitId);
            return false;
        }
        return withCircuit(circuitId, circuit -> {
            close(circuit);
            circuit.consecutiveSuccesses = 0;
            log.info("Circuit manually reset: {}", circuit.id);
            return true;
        });
    }

    public CircuitState getState(String circuitId) {
        return withCircuit(circuitId, circuit -> {
            refresh(circuit, clock.instant());
            return circuit.state;
        });
    }

    public Optional<CircuitRecord> getRecord(String circuitId) {
        Circuit circuit = circuitId == null ? null : circuits.get(circuitId);
        if (circuit == null) {
            return Optional.empty();
        }
        synchronized (circuit) {
            refresh(circuit, clock.instant());
            return Optional.of(circuit.snapshot());
        }
    }

    public List<CircuitRecord> listCircuits() {
        List<CircuitRecord> out = new ArrayList<>();
        Instant now = clock.instant();
        for (Circuit circuit : circuits.values()) {
            synchronized (circuit) {
                if (!circuit.retired) {
                    refresh(circuit, now);
                    out.add(circuit.snapshot());
                }
            }
        }
        out.sort(Comparator.comparing(CircuitRecord::circuitId));
        return out;
    }

    public Map<CircuitState, Integer> countByState() {
        Map<CircuitState, Integer> out = new EnumMap<>(CircuitState.class);
        for (CircuitState state : CircuitState.values()) {
            out.put(state, 0);
        }
        for (CircuitRecord record : listCircuits()) {
            out.merge(record.state(), 1, Integer::sum);
        }
        return out;
    }

    /**
     * Drops closed circuits with no activity for longer than {@code maxAge}.
     */
    public int cleanupIdle(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be >= 0");
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (Circuit circuit : circuits.values()) {
            synchronized (circuit) {
                refresh(circuit, clock.instant());
                if (circuit.state == CircuitState.CLOSED && circuit.lastActivity().isBefore(cutoff)) {
                    circuit.retired = true;
                    circuits.remove(circuit.id, circuit);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} idle circuits", removed);
        }
        return removed;
    }

    public CircuitBreakerSettings settings() {
        return settings;
    }

    private <T> T withCircuit(String circuitId, Function<Circuit, T> action) {
        if (circuitId == null || circuitId.isBlank()) {
            throw new IllegalArgumentException("circuitId must not be blank");
        }
        while (true) {
            Circuit circuit = circuits.computeIfAbsent(circuitId, id -> new Circuit(id, clock.instant()));
            synchronized (circuit) {
                if (!circuit.retired) {
                    return action.apply(circuit);
                }
            }
        }
    }

    private void refresh(Circuit circuit, Instant now) {
        if (circuit.state == CircuitState.OPEN && circuit.trippedAt != null) {
            Duration open = Duration.between(circuit.trippedAt, now);
            if (open.compareTo(settings.effectiveOpenDuration()) >= 0) {
                circuit.state = CircuitState.HALF_OPEN;
                circuit.consecutiveSuccesses = 0;
                log.info("Circuit entering HALF_OPEN: {}", circuit.id);
            }
        }
        if (circuit.lastFailureAt != null
                && Duration.between(circuit.lastFailureAt, now).compareTo(settings.window()) >= 0) {
            circuit.windowFailures = 0;
            circuit.consecutiveFailures = 0;
        }
    }

    private boolean shouldTrip(Circuit circuit) {
        return circuit.consecutiveFailures >= settings.failureThreshold()
                || circuit.windowFailures >= settings.failureThreshold();
    }

    private void open(Circuit circuit, String reason, Instant now) {
        circuit.state = CircuitState.OPEN;
        circuit.trippedAt = now;
        circuit.tripReason = reason;
        log.error("Circuit TRIPPED: {} - {} (failures={})", circuit.id, reason, circuit.windowFailures);
    }

    private void close(Circuit circuit) {
        circuit.state = CircuitState.CLOSED;
        circuit.trippedAt = null;
        circuit.tripReason = null;
        circuit.windowFailures = 0;
        circuit.consecutiveFailures = 0;
        log.info("Circuit CLOSED: {} (successes={})", circuit.id, circuit.totalSuccesses);
    }

    private static final class Circuit {
        private final String id;
        private final Instant createdAt;
        private CircuitState state = CircuitState.CLOSED;
        private String tripReason;
        private Instant trippedAt;
        private Instant lastFailureAt;
        private Instant lastSuccessAt;
        private long totalFailures;
        private long totalSuccesses;
        private int windowFailures;
        private int consecutiveFailures;
        private int consecutiveSuccesses;
        private boolean retired;

        private Circuit(String id, Instant createdAt) {
            this.id = id;
            this.createdAt = createdAt;
        }

        private Instant lastActivity() {
            Instant latest = createdAt;
            for (Instant candidate : new Instant[]{trippedAt, lastFailureAt, lastSuccessAt}) {
                if (candidate != null && candidate.isAfter(latest)) {
                    latest = candidate;
                }
            }
            return latest;
        }

        private CircuitRecord snapshot() {
            return new CircuitRecord(
                    id,
                    state,
                    tripReason,
                    trippedAt,
                    lastFailureAt,
                    lastSuccessAt,
                    totalFailures,
                    totalSuccesses,
                    windowFailures,
                    consecutiveFailures,
                    consecutiveSuccesses
            );
        }
    }
}
