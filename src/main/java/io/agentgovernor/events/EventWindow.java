package io.agentgovernor.events;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Per event-type accounting bucket. Not thread-safe; owned by {@link EventDampener}.
 */
final class EventWindow {
    private final String eventType;
    private final Duration duration;
    private final Set<String> hashes = new HashSet<>();
    private Instant windowStart;
    private int count;

    EventWindow(String eventType, Duration duration, Instant windowStart) {
        this.eventType = eventType;
        this.duration = duration;
        this.windowStart = windowStart;
    }

    /**
     * Starts a fresh window when the current one has elapsed.
     */
    void roll(Instant now) {
        if (!now.isBefore(windowStart.plus(duration))) {
            windowStart = now;
            count = 0;
            hashes.clear();
        }
    }

    void record(String hash) {
        count++;
        hashes.add(hash);
    }

    String eventType() {
        return eventType;
    }

    Instant windowStart() {
        return windowStart;
    }

    int count() {
        return count;
    }

    int uniqueCount() {
        return hashes.size();
    }
}
