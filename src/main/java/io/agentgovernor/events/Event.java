package io.agentgovernor.events;

import io.agentgovernor.model.Priority;
import io.agentgovernor.observability.CorrelationContext;
import io.agentgovernor.util.Fingerprints;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Signal emitted by an agent. Missing event ids are generated and missing correlation ids are
 * taken from the current {@link CorrelationContext}; a null timestamp is stamped by the bus
 * at publish time.
 *
 * @param target optional addressee; informational only, delivery is always by event type
 * @param ttl    optional time to live measured from {@code timestamp}
 */
public record Event(
        String eventId,
        String eventType,
        String correlationId,
        Map<String, Object> payload,
        String source,
        String target,
        Priority priority,
        Instant timestamp,
        Duration ttl,
        Map<String, Object> metadata
) {
    public Event {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        eventType = eventType.trim();
        eventId = eventId == null || eventId.isBlank() ? "evt_" + UUID.randomUUID() : eventId.trim();
        correlationId = correlationId == null || correlationId.isBlank()
                ? CorrelationContext.currentOrNew()
                : correlationId.trim();
        payload = copy(payload);
        metadata = copy(metadata);
        source = source == null ? "" : source;
        target = target == null || target.isBlank() ? null : target;
        priority = priority == null ? Priority.NORMAL : priority;
    }

    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    /**
     * Deduplication key over type, source and the sorted payload.
     */
    public String contentHash() {
        return Fingerprints.event(eventType, source, payload);
    }

    public boolean expired(Instant now) {
        if (ttl == null || timestamp == null) {
            return false;
        }
        return now.isAfter(timestamp.plus(ttl));
    }

    public Event withTimestamp(Instant value) {
        return new Event(eventId, eventType, correlationId, payload, source, target, priority, value, ttl, metadata);
    }

    private static Map<String, Object> copy(Map<String, Object> values) {
        return values == null || values.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static final class Builder {
        private final String eventType;
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String eventId;
        private String correlationId;
        private String source;
        private String target;
        private Priority priority = Priority.NORMAL;
        private Instant timestamp;
        private Duration ttl;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        public Builder eventId(String value) {
            this.eventId = value;
            return this;
        }

        public Builder correlationId(String value) {
            this.correlationId = value;
            return this;
        }

        public Builder payload(String key, Object value) {
            this.payload.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder payload(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::payload);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder source(String value) {
            this.source = value;
            return this;
        }

        public Builder target(String value) {
            this.target = value;
            return this;
        }

        public Builder priority(Priority value) {
            this.priority = value;
            return this;
        }

        public Builder timestamp(Instant value) {
            this.timestamp = value;
            return this;
        }

        public Builder ttl(Duration value) {
            this.ttl = value;
            return this;
        }

        public Event build() {
            return new Event(eventId, eventType, correlationId, payload, source, target, priority, timestamp, ttl, metadata);
        }
    }
}
