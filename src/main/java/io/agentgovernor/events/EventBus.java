package io.agentgovernor.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process publish/subscribe with dampening. Every event is offered to the
 * {@link EventDampener} first; accepted events are delivered synchronously on the publishing
 * thread to the handlers registered for its type and then to the {@link #WILDCARD} handlers.
 * A handler that throws is logged and skipped; the remaining handlers still receive the event.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final String WILDCARD = "*";

    private final EventDampener dampener;
    private final Clock clock;
    private final ConcurrentMap<String, List<EventHandler>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong deliveries = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();

    public EventBus(EventDampener dampener) {
        this(dampener, Clock.systemUTC());
    }

    public EventBus(EventDampener dampener, Clock clock) {
        if (dampener == null) {
            throw new IllegalArgumentException("dampener must not be null");
        }
        this.dampener = dampener;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        log.info("Event bus initialized");
    }

    public void subscribe(String eventType, EventHandler handler) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        subscribers.computeIfAbsent(eventType.trim(), key -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Subscribed to {}", eventType);
    }

    public boolean unsubscribe(String eventType, EventHandler handler) {
        List<EventHandler> handlers = eventType == null ? null : subscribers.get(eventType.trim());
        if (handlers == null || !handlers.remove(handler)) {
            log.warn("Unsubscribe requested for unknown handler on {}", eventType);
            return false;
        }
        log.debug("Unsubscribed from {}", eventType);
        return true;
    }

    public int subscriberCount(String eventType) {
        List<EventHandler> handlers = eventType == null ? null : subscribers.get(eventType.trim());
        return handlers == null ? 0 : handlers.size();
    }

    public PublishOutcome publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        Event stamped = event.timestamp() == null ? event.withTimestamp(clock.instant()) : event;
        EmitDecision decision = dampener.shouldEmit(stamped);
        if (!decision.allowed()) {
            rejected.incrementAndGet();
            return PublishOutcome.rejected(stamped, decision);
        }
        published.incrementAndGet();

        List<EventHandler> handlers = new ArrayList<>(subscribers.getOrDefault(stamped.eventType(), List.of()));
        if (!WILDCARD.equals(stamped.eventType())) {
            handlers.addAll(subscribers.getOrDefault(WILDCARD, List.of()));
        }
        if (handlers.isEmpty()) {
            log.debug("No subscribers for event type: {}", stamped.eventType());
            return PublishOutcome.delivered(stamped, 0, 0);
        }

        int delivered = 0;
        int failed = 0;
        for (EventHandler handler : handlers) {
            try {
                handler.handle(stamped);
                delivered++;
            } catch (Exception e) {
                failed++;
                log.error("Event handler failed for {} ({}): {}", stamped.eventType(), stamped.eventId(), e.getMessage(), e);
            }
        }
        deliveries.addAndGet(delivered);
        handlerFailures.addAndGet(failed);
        log.debug("Event published: {} (delivered to {} subscribers, {} failed)", stamped.eventType(), delivered, failed);
        return PublishOutcome.delivered(stamped, delivered, failed);
    }

    public BusStats stats() {
        Map<String, Integer> counts = new TreeMap<>();
        subscribers.forEach((type, handlers) -> counts.put(type, handlers.size()));
        return new BusStats(published.get(), rejected.get(), deliveries.get(), handlerFailures.get(), counts);
    }

    public EventDampener dampener() {
        return dampener;
    }

    public record PublishOutcome(
            boolean accepted,
            String eventId,
            String correlationId,
            EmitDecision.Rejection rejection,
            String reason,
            int delivered,
            int failed
    ) {
        static PublishOutcome rejected(Event event, EmitDecision decision) {
            return new PublishOutcome(false, event.eventId(), event.correlationId(),
                    decision.rejection(), decision.reason(), 0, 0);
        }

        static PublishOutcome delivered(Event event, int delivered, int failed) {
            return new PublishOutcome(true, event.eventId(), event.correlationId(), null, null, delivered, failed);
        }
    }

    public record BusStats(
            long published,
            long rejected,
            long deliveries,
            long handlerFailures,
            Map<String, Integer> subscribers
    ) {
    }
}
