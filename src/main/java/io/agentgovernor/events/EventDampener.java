package io.agentgovernor.events;

import io.agentgovernor.config.DampenerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gates events through, in order: TTL expiry, content deduplication, per-type rate limits and
 * correlation-level cascade detection. An event that passes every check is recorded in the
 * same critical section, so concurrent publishers cannot both slip under a limit.
 */
public final class EventDampener {
    private static final Logger log = LoggerFactory.getLogger(EventDampener.class);

    private final DampenerSettings settings;
    private final Clock clock;
    private final Map<String, Instant> recentHashes = new HashMap<>();
    private final Map<String, EventWindow> windows = new HashMap<>();
    private final Map<String, CorrelationCount> correlations = new HashMap<>();
    private final Map<EmitDecision.Rejection, Long> rejections = new EnumMap<>(EmitDecision.Rejection.class);
    private long allowed;

    public EventDampener(DampenerSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public EventDampener(DampenerSettings settings, Clock clock) {
        this.settings = settings == null ? DampenerSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        log.info("Event dampener initialized (dedupWindow={}, cascadeThreshold={}, rateLimits={})",
                this.settings.dedupWindow(), this.settings.cascadeThreshold(), this.settings.rateLimits());
    }

    public synchronized EmitDecision shouldEmit(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        Instant now = clock.instant();
        if (event.expired(now)) {
            log.debug("Event expired before emission: {} ({})", event.eventType(), event.eventId());
            return reject(EmitDecision.Rejection.EXPIRED, "Event expired (ttl=" + event.ttl() + ")");
        }

        String hash = event.contentHash();
        Instant lastSeen = recentHashes.get(hash);
        if (lastSeen != null && !lastSeen.isBefore(now.minus(settings.dedupWindow()))) {
            log.debug("Event deduplicated: {}", event.eventType());
            return reject(EmitDecision.Rejection.DUPLICATE, "Duplicate event within dedup window");
        }

        EventWindow window = windowFor(event.eventType(), now);
        Integer limit = settings.rateLimits().get(event.eventType());
        if (limit != null && window.count() >= limit) {
            log.warn("Event rate limited: {} ({} per {})", event.eventType(), limit, settings.rateWindow());
            return reject(EmitDecision.Rejection.RATE_LIMITED, "Rate limit exceeded for " + event.eventType());
        }

        CorrelationCount correlation = correlations.get(event.correlationId());
        long correlationCount = correlation == null ? 0L : correlation.count;
        if (correlationCount >= settings.cascadeThreshold()) {
            log.error("Cascade threshold exceeded: {} ({} events)", event.correlationId(), correlationCount);
            return reject(EmitDecision.Rejection.CASCADE,
                    "Event cascade detected for correlation " + event.correlationId());
        }
        if (window.count() > 0) {
            double fanout = correlationCount / Math.max(1.0d, window.count() / 10.0d);
            if (fanout > settings.cascadeFanoutRatio()) {
                log.warn("High fan-out detected: {} (ratio={})", event.correlationId(), String.format(Locale.ROOT, "%.2f", fanout));
                return reject(EmitDecision.Rejection.CASCADE,
                        "Event cascade detected for correlation " + event.correlationId());
            }
        }

        recentHashes.put(hash, now);
        window.record(hash);
        if (correlation == null) {
            correlation = new CorrelationCount();
            correlations.put(event.correlationId(), correlation);
        }
        correlation.count++;
        correlation.lastSeenAt = now;
        allowed++;
        return EmitDecision.allow();
    }

    /**
     * Drops dedup entries older than the dedup window and, when a retention is configured,
     * correlation counters idle longer than it. Returns the number of dedup entries removed.
     */
    public synchronized int cleanupOldEvents() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(settings.dedupWindow());
        int cleaned = 0;
        Iterator<Instant> hashes = recentHashes.values().iterator();
        while (hashes.hasNext()) {
            if (hashes.next().isBefore(cutoff)) {
                hashes.remove();
                cleaned++;
            }
        }
        int correlationsDropped = 0;
        Duration retention = settings.correlationRetention();
        if (retention != null) {
            Instant correlationCutoff = now.minus(retention);
            Iterator<CorrelationCount> counts = correlations.values().iterator();
            while (counts.hasNext()) {
                if (counts.next().lastSeenAt.isBefore(correlationCutoff)) {
                    counts.remove();
                    correlationsDropped++;
                }
            }
        }
        if (cleaned > 0 || correlationsDropped > 0) {
            log.debug("Cleaned up {} old event records and {} idle correlations", cleaned, correlationsDropped);
        }
        return cleaned;
    }

    public synchronized long correlationCount(String correlationId) {
        CorrelationCount correlation = correlationId == null ? null : correlations.get(correlationId);
        return correlation == null ? 0L : correlation.count;
    }

    public synchronized DampenerStats stats() {
        Map<String, WindowStats> windowStats = new TreeMap<>();
        for (EventWindow window : windows.values()) {
            windowStats.put(window.eventType(), new WindowStats(window.count(), window.uniqueCount(), window.windowStart()));
        }
        Map<String, Long> rejectedByReason = new LinkedHashMap<>();
        for (EmitDecision.Rejection rejection : EmitDecision.Rejection.values()) {
            rejectedByReason.put(rejection.name().toLowerCase(Locale.ROOT), rejections.getOrDefault(rejection, 0L));
        }
        return new DampenerStats(
                allowed,
                rejectedByReason,
                recentHashes.size(),
                windows.size(),
                correlations.size(),
                windowStats
        );
    }

    public DampenerSettings settings() {
        return settings;
    }

    private EventWindow windowFor(String eventType, Instant now) {
        EventWindow window = windows.computeIfAbsent(eventType, type -> new EventWindow(type, settings.rateWindow(), now));
        window.roll(now);
        return window;
    }

    private EmitDecision reject(EmitDecision.Rejection rejection, String reason) {
        rejections.merge(rejection, 1L, Long::sum);
        return EmitDecision.reject(rejection, reason);
    }

    private static final class CorrelationCount {
        private long count;
        private Instant lastSeenAt;
    }

    public record WindowStats(int count, int unique, Instant windowStart) {
    }

    public record DampenerStats(
            long allowed,
            Map<String, Long> rejected,
            int uniqueEventHashes,
            int activeWindows,
            int activeCorrelations,
            Map<String, WindowStats> windows
    ) {
    }
}
