package io.agentgovernor.circuit;

import io.agentgovernor.config.LoopDetectorSettings;
import io.agentgovernor.model.CausalityGuard;
import io.agentgovernor.model.LoopCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the ordered task ids seen under each correlation id and flags repeats (cycles)
 * and chains that reach the configured depth.
 *
 * <p>Chains are kept in least-recently-touched order. When more than {@code maxChains}
 * correlations are tracked, the oldest 10% are evicted; {@link #cleanupStaleChains}
 * additionally drops chains untouched for longer than a given age.
 */
public final class FeedbackLoopDetector implements CausalityGuard {
    private static final Logger log = LoggerFactory.getLogger(FeedbackLoopDetector.class);

    private final LoopDetectorSettings settings;
    private final Clock clock;
    private final LinkedHashMap<String, Chain> chains = new LinkedHashMap<>(16, 0.75f, true);

    public FeedbackLoopDetector(LoopDetectorSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public FeedbackLoopDetector(LoopDetectorSettings settings, Clock clock) {
        this.settings = settings == null ? LoopDetectorSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public synchronized LoopCheck checkCausalityChain(String correlationId, String taskId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be blank");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        Instant now = clock.instant();
        Chain chain = chains.get(correlationId);
        if (chain == null) {
            chain = new Chain();
            chains.put(correlationId, chain);
            evictIfNeeded();
        }
        chain.lastTouchedAt = now;

        if (chain.seen.contains(taskId)) {
            log.error("Feedback loop detected: task {} repeats in chain {}", taskId, correlationId);
            return LoopCheck.detected("Task " + taskId + " creates cycle in causality chain");
        }
        if (chain.taskIds.size() >= settings.maxChainDepth()) {
            log.error("Causality chain too deep: {} (depth={})", correlationId, chain.taskIds.size());
            return LoopCheck.detected("Causality chain exceeds max depth (" + settings.maxChainDepth() + ")");
        }
        chain.taskIds.add(taskId);
        chain.seen.add(taskId);
        return LoopCheck.clear();
    }

    /**
     * Task ids recorded under {@code correlationId}, oldest first. Does not count as a touch.
     */
    public synchronized List<String> getChain(String correlationId) {
        Chain chain = correlationId == null ? null : peek(correlationId);
        return chain == null ? List.of() : List.copyOf(chain.taskIds);
    }

    public synchronized int chainCount() {
        return chains.size();
    }

    public synchronized int cleanupStaleChains(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be >= 0");
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        Iterator<Chain> it = chains.values().iterator();
        while (it.hasNext()) {
            if (it.next().lastTouchedAt.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} stale causality chains", removed);
        }
        return removed;
    }

    public int cleanupStaleChains() {
        return cleanupStaleChains(settings.chainMaxAge());
    }

    public LoopDetectorSettings settings() {
        return settings;
    }

    private Chain peek(String correlationId) {
        // get() on an access-ordered map reorders it
        for (Map.Entry<String, Chain> entry : chains.entrySet()) {
            if (entry.getKey().equals(correlationId)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private void evictIfNeeded() {
        if (chains.size() <= settings.maxChains()) {
            return;
        }
        int toEvict = Math.max(1, chains.size() / 10);
        List<String> victims = new ArrayList<>(toEvict);
        for (String key : chains.keySet()) {
            if (victims.size() >= toEvict) {
                break;
            }
            victims.add(key);
        }
        for (String key : victims) {
            chains.remove(key);
        }
        log.info("Evicted {} least recently used causality chains", victims.size());
    }

    private static final class Chain {
        private final List<String> taskIds = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();
        private Instant lastTouchedAt;
    }
}
