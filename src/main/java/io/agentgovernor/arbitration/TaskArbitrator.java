package io.agentgovernor.arbitration;

import io.agentgovernor.config.ArbitratorSettings;
import io.agentgovernor.model.CausalityGuard;
import io.agentgovernor.model.LoopCheck;
import io.agentgovernor.model.TaskRecord;
import io.agentgovernor.model.TaskStatus;
import io.agentgovernor.model.TaskSubmission;
import io.agentgovernor.observability.CorrelationContext;
import io.agentgovernor.util.Fingerprints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Decides whether a task submission may run and registers the ones that may. Checks run in
 * a fixed order and the first failing check determines the rejection reason.
 *
 * <p>Records are indexed by id, by fingerprint and by actor. All reads and writes of those
 * indices happen under the instance monitor, so a check and the registration that follows
 * it are atomic with respect to concurrent submitters.
 */
public final class TaskArbitrator {
    private static final Logger log = LoggerFactory.getLogger(TaskArbitrator.class);

    private final ArbitratorSettings settings;
    private final CausalityGuard causalityGuard;
    private final Clock clock;
    private final Map<String, TaskRecord> records = new HashMap<>();
    private final Map<String, List<String>> idsByFingerprint = new HashMap<>();
    private final Map<String, Set<String>> activeByActor = new HashMap<>();
    private final Map<String, Integer> activeByCorrelation = new HashMap<>();

    public TaskArbitrator(ArbitratorSettings settings) {
        this(settings, null, Clock.systemUTC());
    }

    /**
     * @param causalityGuard optional chain tracker consulted after the built-in correlation
     *                       concurrency check; null disables chain tracking
     */
    public TaskArbitrator(ArbitratorSettings settings, CausalityGuard causalityGuard, Clock clock) {
        this.settings = settings == null ? ArbitratorSettings.defaults() : settings;
        this.causalityGuard = causalityGuard;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        log.info("Task arbitrator initialized (dedupWindow={}, maxTasksPerActor={}, loopDetection={}, loopThreshold={})",
                this.settings.dedupWindow(), this.settings.maxTasksPerActor(),
                this.settings.loopDetectionEnabled(), this.settings.loopThreshold());
    }

    public synchronized SubmitOutcome submit(TaskSubmission submission) {
        if (submission == null) {
            throw new IllegalArgumentException("submission must not be null");
        }
        Instant now = clock.instant();
        String fingerprint = Fingerprints.task(submission.description(), submission.context());
        String correlationId = submission.correlationId() == null
                ? CorrelationContext.currentOrNew()
                : submission.correlationId();
        String actorId = submission.actorId();

        TaskRecord duplicate = findDuplicate(fingerprint, actorId, now);
        if (duplicate != null) {
            log.info("Task deduplicated for actor {} (duplicate of {})", actorId, duplicate.taskId());
            return SubmitOutcome.duplicate(duplicate);
        }

        int active = activeByActor.getOrDefault(actorId, Set.of()).size();
        if (active >= settings.maxTasksPerActor()) {
            log.warn("Actor {} exceeded task limit ({})", actorId, settings.maxTasksPerActor());
            return SubmitOutcome.rejected("Actor task limit exceeded (" + settings.maxTasksPerActor() + ")");
        }

        String taskId = submission.taskId() == null ? "tsk_" + UUID.randomUUID() : submission.taskId();
        if (records.containsKey(taskId)) {
            log.warn("Task id {} already registered, rejecting resubmission from {}", taskId, actorId);
            return SubmitOutcome.rejected("Task id already registered: " + taskId);
        }

        if (settings.loopDetectionEnabled()) {
            int underCorrelation = activeByCorrelation.getOrDefault(correlationId, 0);
            if (underCorrelation >= settings.loopThreshold()) {
                log.error("Feedback loop detected for correlation {} ({} active tasks)", correlationId, underCorrelation);
                return SubmitOutcome.rejected("Feedback loop detected (correlation: " + correlationId + ")");
            }
            if (causalityGuard != null) {
                LoopCheck chain = causalityGuard.checkCausalityChain(correlationId, taskId);
                if (chain.loopDetected()) {
                    log.error("Causality loop detected for correlation {}: {}", correlationId, chain.reason());
                    return SubmitOutcome.rejected(
                            "Feedback loop detected (correlation: " + correlationId + "): " + chain.reason());
                }
            }
        }

        Instant submittedAt = submission.submittedAt() == null ? now : submission.submittedAt();
        TaskRecord record = TaskRecord.pending(
                taskId,
                fingerprint,
                actorId,
                correlationId,
                submission.priority(),
                submittedAt,
                submission.timeout()
        );
        register(record);
        log.info("Task accepted: {} (actor={}, priority={}, correlation={})",
                taskId, actorId, submission.priority().label(), correlationId);
        return SubmitOutcome.accepted(record);
    }

    /**
     * Moves a pending task to running. Returns false for unknown ids and for tasks that are
     * not pending.
     */
    public synchronized boolean start(String taskId) {
        TaskRecord record = taskId == null ? null : records.get(taskId);
        if (record == null) {
            log.warn("Task not found: {}", taskId);
            return false;
        }
        if (record.status() != TaskStatus.PENDING) {
            log.warn("Task {} cannot start from {}", taskId, record.status());
            return false;
        }
        records.put(taskId, record.started(clock.instant()));
        log.info("Task started: {}", taskId);
        return true;
    }

    /**
     * Finishes an active task as completed, or as failed when {@code error} is non-blank.
     */
    public synchronized boolean complete(String taskId, Object result, String error, double budgetUsed) {
        if (budgetUsed < 0.0d || Double.isNaN(budgetUsed)) {
            throw new IllegalArgumentException("budgetUsed must be >= 0: " + budgetUsed);
        }
        TaskRecord record = taskId == null ? null : records.get(taskId);
        if (record == null) {
            log.warn("Task not found: {}", taskId);
            return false;
        }
        if (!record.active()) {
            log.warn("Task {} already terminal ({})", taskId, record.status());
            return false;
        }
        TaskRecord finished = record.finished(clock.instant(), result, error, budgetUsed);
        records.put(taskId, finished);
        releaseActive(finished);
        log.info("Task {}: {} (duration={}, budget={})",
                finished.status() == TaskStatus.COMPLETED ? "completed" : "failed",
                taskId, finished.runDuration(), String.format(Locale.ROOT, "%.4f", budgetUsed));
        return true;
    }

    /**
     * Withdraws a pending task that a later admission stage refused. Returns false for unknown
     * ids and for tasks that already left pending.
     */
    public synchronized boolean reject(String taskId, String reason) {
        TaskRecord record = taskId == null ? null : records.get(taskId);
        if (record == null) {
            log.warn("Task not found: {}", taskId);
            return false;
        }
        if (record.status() != TaskStatus.PENDING) {
            log.warn("Task {} cannot be rejected from {}", taskId, record.status());
            return false;
        }
        TaskRecord rejected = record.rejected(clock.instant(), reason);
        records.put(taskId, rejected);
        releaseActive(rejected);
        log.info("Task rejected: {} ({})", taskId, reason);
        return true;
    }

    public synchronized Optional<TaskRecord> getTask(String taskId) {
        return Optional.ofNullable(taskId == null ? null : records.get(taskId));
    }

    /**
     * Active (pending or running) records of an actor in submission order.
     */
    public synchronized List<TaskRecord> getActorTasks(String actorId) {
        List<TaskRecord> out = new ArrayList<>();
        for (String id : activeByActor.getOrDefault(actorId, Set.of())) {
            TaskRecord record = records.get(id);
            if (record != null) {
                out.add(record);
            }
        }
        return out;
    }

    public synchronized int activeCount(String actorId) {
        return activeByActor.getOrDefault(actorId, Set.of()).size();
    }

    public synchronized int activeUnderCorrelation(String correlationId) {
        return activeByCorrelation.getOrDefault(correlationId, 0);
    }

    public synchronized Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> out = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            out.put(status, 0);
        }
        for (TaskRecord record : records.values()) {
            out.merge(record.status(), 1, Integer::sum);
        }
        return out;
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Removes terminal records that completed more than {@code maxAge} ago from every index.
     */
    public synchronized int cleanup(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be >= 0");
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        Iterator<Map.Entry<String, TaskRecord>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            TaskRecord record = it.next().getValue();
            if (record.active() || record.completedAt() == null || !record.completedAt().isBefore(cutoff)) {
                continue;
            }
            it.remove();
            List<String> ids = idsByFingerprint.get(record.fingerprint());
            if (ids != null) {
                ids.remove(record.taskId());
                if (ids.isEmpty()) {
                    idsByFingerprint.remove(record.fingerprint());
                }
            }
            Set<String> active = activeByActor.get(record.actorId());
            if (active != null) {
                active.remove(record.taskId());
                if (active.isEmpty()) {
                    activeByActor.remove(record.actorId());
                }
            }
            removed++;
        }
        if (removed > 0) {
            log.info("Cleaned up {} old task records", removed);
        }
        return removed;
    }

    public ArbitratorSettings settings() {
        return settings;
    }

    private TaskRecord findDuplicate(String fingerprint, String actorId, Instant now) {
        List<String> ids = idsByFingerprint.get(fingerprint);
        if (ids == null) {
            return null;
        }
        Instant cutoff = now.minus(settings.dedupWindow());
        for (String id : ids) {
            TaskRecord candidate = records.get(id);
            if (candidate != null
                    && candidate.actorId().equals(actorId)
                    && candidate.active()
                    && !candidate.submittedAt().isBefore(cutoff)) {
                return candidate;
            }
        }
        return null;
    }

    private void register(TaskRecord record) {
        records.put(record.taskId(), record);
        idsByFingerprint.computeIfAbsent(record.fingerprint(), k -> new ArrayList<>()).add(record.taskId());
        activeByActor.computeIfAbsent(record.actorId(), k -> new LinkedHashSet<>()).add(record.taskId());
        activeByCorrelation.merge(record.correlationId(), 1, Integer::sum);
    }

    private void releaseActive(TaskRecord record) {
        Set<String> active = activeByActor.get(record.actorId());
        if (active != null) {
            active.remove(record.taskId());
            if (active.isEmpty()) {
                activeByActor.remove(record.actorId());
            }
        }
        activeByCorrelation.computeIfPresent(record.correlationId(), (k, v) -> v <= 1 ? null : v - 1);
    }

    public record SubmitOutcome(boolean accepted, TaskRecord record, String reason) {
        static SubmitOutcome accepted(TaskRecord record) {
            return new SubmitOutcome(true, record, null);
        }

        static SubmitOutcome duplicate(TaskRecord existing) {
            return new SubmitOutcome(false, existing, "Duplicate of task " + existing.taskId());
        }

        static SubmitOutcome rejected(String reason) {
            return new SubmitOutcome(false, null, reason);
        }

        public boolean deduplicated() {
            return !accepted && record != null;
        }
    }
}
