package io.agentgovernor.runtime;

import io.agentgovernor.arbitration.TaskArbitrator;
import io.agentgovernor.budget.BudgetCheck;
import io.agentgovernor.budget.BudgetDimension;
import io.agentgovernor.budget.BudgetEngine;
import io.agentgovernor.budget.BudgetLimit;
import io.agentgovernor.budget.BudgetReservation;
import io.agentgovernor.budget.BudgetUsage;
import io.agentgovernor.circuit.CircuitBreaker;
import io.agentgovernor.circuit.CircuitState;
import io.agentgovernor.circuit.FeedbackLoopDetector;
import io.agentgovernor.config.GovernorConfig;
import io.agentgovernor.config.GovernorSettings;
import io.agentgovernor.events.Event;
import io.agentgovernor.events.EventBus;
import io.agentgovernor.events.EventDampener;
import io.agentgovernor.events.EventHandler;
import io.agentgovernor.model.TaskRecord;
import io.agentgovernor.model.TaskStatus;
import io.agentgovernor.model.TaskSubmission;
import io.agentgovernor.observability.AuditLogger;
import io.agentgovernor.observability.CorrelationContext;
import io.agentgovernor.observability.PrometheusFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public final class GovernorRuntime {
    private static final Logger log = LoggerFactory.getLogger(GovernorRuntime.class);

    public static final Duration DEFAULT_TASK_RETENTION = Duration.ofHours(1);
    public static final Duration DEFAULT_CIRCUIT_IDLE = Duration.ofHours(24);
    private static final String CIRCUIT_PREFIX = "agent:";
    private static final String RESERVATION_PREFIX = "res_";

    private final GovernorConfig config;
    private final GovernorSettings settings;
    private final FeedbackLoopDetector loopDetector;
    private final TaskArbitrator arbitrator;
    private final BudgetEngine budget;
    private final CircuitBreaker circuitBreaker;
    private final EventBus eventBus;
    private final AuditLogger auditLogger;
    private final ConcurrentMap<String, String> reservationsByTask = new ConcurrentHashMap<>();

    private final AtomicLong admittedTotal = new AtomicLong();
    private final AtomicLong deduplicatedTotal = new AtomicLong();
    private final AtomicLong arbitrationRejectedTotal = new AtomicLong();
    private final AtomicLong circuitBlockedTotal = new AtomicLong();
    private final AtomicLong budgetDeniedTotal = new AtomicLong();
    private final AtomicLong completedTotal = new AtomicLong();
    private final AtomicLong failedTotal = new AtomicLong();
    private final AtomicLong circuitTripTotal = new AtomicLong();
    private final AtomicLong maintenanceRunsTotal = new AtomicLong();

    public GovernorRuntime(GovernorConfig config) {
        this(config, GovernorSettings.load(config.settingsFile()), Clock.systemUTC());
    }

    public GovernorRuntime(GovernorConfig config, GovernorSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings == null ? GovernorSettings.defaults() : settings;
        Clock effectiveClock = clock == null ? Clock.systemUTC() : clock;
        this.loopDetector = new FeedbackLoopDetector(this.settings.loop(), effectiveClock);
        this.arbitrator = new TaskArbitrator(this.settings.arbitrator(), loopDetector, effectiveClock);
        this.budget = new BudgetEngine(this.settings.budget(), effectiveClock);
        this.circuitBreaker = new CircuitBreaker(this.settings.circuit(), effectiveClock);
        this.eventBus = new EventBus(new EventDampener(this.settings.dampener(), effectiveClock), effectiveClock);
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile()),
                effectiveClock
        );
        log.info("Governor runtime started (root={})", config.rootDir());
    }

    public static String circuitIdFor(String actorId) {
        return CIRCUIT_PREFIX + actorId;
    }

    public Map<BudgetDimension, BudgetUsage> allocateBudget(String actorId, Collection<BudgetLimit> limits) {
        Map<BudgetDimension, BudgetUsage> usage = budget.createAllocation(actorId, limits);
        Map<String, Object> details = new LinkedHashMap<>();
        for (BudgetLimit limit : limits) {
            details.put(limit.dimension().label(), limit.limit());
        }
        audit("budget.allocate", actorId, "budget/" + actorId, "ok", null, null, details);
        return usage;
    }

    /**
     * Runs a submission through the agent's circuit, the arbitrator and, when the submission
     * carries a budget hint, a COST reservation. A task whose reservation is denied is marked
     * rejected so it does not hold actor capacity.
     */
    public AdmissionOutcome admit(TaskSubmission submission) {
        if (submission == null) {
            throw new IllegalArgumentException("submission must not be null");
        }
        String correlationId = submission.correlationId() == null
                ? CorrelationContext.currentOrNew()
                : submission.correlationId();
        TaskSubmission effective = submission.withCorrelationId(correlationId);
        String actorId = effective.actorId();
        try (CorrelationContext.Scope ignored = CorrelationContext.open(correlationId)) {
            String circuitId = circuitIdFor(actorId);
            if (!circuitBreaker.canProceed(circuitId)) {
                circuitBlockedTotal.incrementAndGet();
                String reason = "Circuit open for " + circuitId;
                audit("task.admit", actorId, circuitId, "rejected", correlationId, null,
                        Map.of("stage", AdmissionStage.CIRCUIT_OPEN.label()));
                return AdmissionOutcome.rejected(AdmissionStage.CIRCUIT_OPEN, correlationId, reason);
            }

            TaskArbitrator.SubmitOutcome submitted = arbitrator.submit(effective);
            if (submitted.deduplicated()) {
                deduplicatedTotal.incrementAndGet();
                String existingId = submitted.record().taskId();
                audit("task.admit", actorId, "task/" + existingId, "deduplicated", correlationId, existingId,
                        Map.of("stage", AdmissionStage.DEDUPLICATED.label()));
                return new AdmissionOutcome(false, AdmissionStage.DEDUPLICATED, existingId, correlationId, null, submitted.reason());
            }
            if (!submitted.accepted()) {
                arbitrationRejectedTotal.incrementAndGet();
                audit("task.admit", actorId, "arbitrator", "rejected", correlationId, null,
                        Map.of("stage", AdmissionStage.ARBITRATION.label(), "reason", submitted.reason()));
                return AdmissionOutcome.rejected(AdmissionStage.ARBITRATION, correlationId, submitted.reason());
            }

            TaskRecord record = submitted.record();
            String reservationId = null;
            Double hint = effective.budgetReserved();
            if (hint != null && hint > 0.0d) {
                reservationId = RESERVATION_PREFIX + record.taskId();
                String denial = reserveCost(actorId, hint, reservationId, effective.timeout());
                if (denial != null) {
                    budgetDeniedTotal.incrementAndGet();
                    arbitrator.reject(record.taskId(), denial);
                    audit("task.admit", actorId, "task/" + record.taskId(), "rejected", correlationId, record.taskId(),
                            Map.of("stage", AdmissionStage.BUDGET.label(), "reason", denial, "amount", hint));
                    return new AdmissionOutcome(false, AdmissionStage.BUDGET, record.taskId(), correlationId, null, denial);
                }
                reservationsByTask.put(record.taskId(), reservationId);
            }

            admittedTotal.incrementAndGet();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("priority", record.priority().label());
            details.put("fingerprint", record.fingerprint());
            if (reservationId != null) {
                details.put("reservation_id", reservationId);
                details.put("amount", hint);
            }
            audit("task.admit", actorId, "task/" + record.taskId(), "accepted", correlationId, record.taskId(), details);
            return new AdmissionOutcome(true, AdmissionStage.ADMITTED, record.taskId(), correlationId, reservationId, null);
        }
    }

    public boolean start(String taskId) {
        boolean started = arbitrator.start(taskId);
        if (started) {
            TaskRecord record = arbitrator.getTask(taskId).orElseThrow();
            audit("task.start", record.actorId(), "task/" + taskId, "ok", record.correlationId(), taskId, Map.of());
        }
        return started;
    }

    /**
     * Finishes a task: settles its reservation (commit on success or when a cost is reported,
     * release otherwise) and reports the outcome to the agent's circuit.
     *
     * @param actualCost cost to charge; null charges the reserved amount on success
     */
    public boolean complete(String taskId, Object result, String error, Double actualCost) {
        Optional<TaskRecord> existing = arbitrator.getTask(taskId);
        if (existing.isEmpty()) {
            log.warn("Completion requested for unknown task: {}", taskId);
            return false;
        }
        TaskRecord before = existing.get();
        boolean failed = error != null && !error.isBlank();
        String reservationId = reservationsByTask.get(taskId);
        double charged = actualCost != null
                ? actualCost
                : (!failed && reservationId != null
                ? budget.getReservation(reservationId).map(BudgetReservation::amount).orElse(0.0d)
                : 0.0d);
        if (!arbitrator.complete(taskId, result, error, charged)) {
            return false;
        }
        reservationsByTask.remove(taskId);
        settleBudget(before.actorId(), reservationId, failed, actualCost);

        String circuitId = circuitIdFor(before.actorId());
        if (failed) {
            failedTotal.incrementAndGet();
            CircuitState previous = circuitBreaker.getState(circuitId);
            CircuitState now = circuitBreaker.recordFailure(circuitId, error);
            if (now == CircuitState.OPEN && previous != CircuitState.OPEN) {
                circuitTripTotal.incrementAndGet();
                audit("circuit.trip", before.actorId(), circuitId, "open", before.correlationId(), taskId,
                        Map.of("reason", error));
            }
        } else {
            completedTotal.incrementAndGet();
            circuitBreaker.recordSuccess(circuitId);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cost", charged);
        if (failed) {
            details.put("error", error);
        }
        audit("task.complete", before.actorId(), "task/" + taskId, failed ? "failed" : "completed",
                before.correlationId(), taskId, details);
        return true;
    }

    public void subscribe(String eventType, EventHandler handler) {
        eventBus.subscribe(eventType, handler);
    }

    public EventBus.PublishOutcome publish(Event event) {
        EventBus.PublishOutcome outcome = eventBus.publish(event);
        if (!outcome.accepted()) {
            audit("event.publish", event.source(), "event/" + event.eventType(), "rejected", outcome.correlationId(), null,
                    Map.of(
                            "event_id", outcome.eventId(),
                            "rejection", outcome.rejection().name().toLowerCase(Locale.ROOT),
                            "reason", outcome.reason()
                    ));
        } else if (outcome.failed() > 0) {
            audit("event.publish", event.source(), "event/" + event.eventType(), "partial", outcome.correlationId(), null,
                    Map.of("event_id", outcome.eventId(), "delivered", outcome.delivered(), "failed", outcome.failed()));
        }
        return outcome;
    }

    /**
     * Cleanup passes of every component. Safe to call from any scheduler.
     */
    public MaintenanceOutcome runMaintenance() {
        return runMaintenance(DEFAULT_TASK_RETENTION);
    }

    public MaintenanceOutcome runMaintenance(Duration taskRetention) {
        int tasksRemoved = arbitrator.cleanup(taskRetention);
        int reservationsExpired = budget.cleanupExpired();
        reservationsByTask.values().removeIf(id -> budget.getReservation(id).isEmpty());
        int chainsRemoved = loopDetector.cleanupStaleChains();
        int eventsCleaned = eventBus.dampener().cleanupOldEvents();
        int circuitsRemoved = circuitBreaker.cleanupIdle(DEFAULT_CIRCUIT_IDLE);
        maintenanceRunsTotal.incrementAndGet();
        MaintenanceOutcome out = new MaintenanceOutcome(
                tasksRemoved, reservationsExpired, chainsRemoved, eventsCleaned, circuitsRemoved);
        if (out.total() > 0) {
            audit("runtime.maintenance", "system", "runtime", "ok", null, null, Map.of(
                    "tasks_removed", tasksRemoved,
                    "reservations_expired", reservationsExpired,
                    "chains_removed", chainsRemoved,
                    "events_cleaned", eventsCleaned,
                    "circuits_removed", circuitsRemoved
            ));
        }
        log.debug("Maintenance finished: {}", out);
        return out;
    }

    public StatsOutcome stats() {
        Map<String, Integer> taskStatus = new LinkedHashMap<>();
        for (Map.Entry<TaskStatus, Integer> e : arbitrator.countByStatus().entrySet()) {
            taskStatus.put(e.getKey().name().toLowerCase(Locale.ROOT), e.getValue());
        }
        Map<String, Integer> circuitState = new LinkedHashMap<>();
        for (Map.Entry<CircuitState, Integer> e : circuitBreaker.countByState().entrySet()) {
            circuitState.put(e.getKey().name().toLowerCase(Locale.ROOT), e.getValue());
        }
        EventDampener.DampenerStats dampenerStats = eventBus.dampener().stats();
        Map<String, Integer> eventsRejected = new LinkedHashMap<>();
        dampenerStats.rejected().forEach((k, v) -> eventsRejected.put(k, v.intValue()));
        EventBus.BusStats busStats = eventBus.stats();
        return new StatsOutcome(
                taskStatus,
                circuitState,
                eventsRejected,
                admittedTotal.get(),
                deduplicatedTotal.get(),
                arbitrationRejectedTotal.get(),
                circuitBlockedTotal.get(),
                budgetDeniedTotal.get(),
                completedTotal.get(),
                failedTotal.get(),
                circuitTripTotal.get(),
                budget.allocationCount(),
                budget.reservationCount(),
                loopDetector.chainCount(),
                busStats.published(),
                busStats.deliveries(),
                busStats.handlerFailures(),
                dampenerStats.activeCorrelations(),
                maintenanceRunsTotal.get()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public AuditLogger.VerifyOutcome verifyAudit() {
        return auditLogger.verify();
    }

    public GovernorConfig config() {
        return config;
    }

    public GovernorSettings settings() {
        return settings;
    }

    public TaskArbitrator arbitrator() {
        return arbitrator;
    }

    public BudgetEngine budget() {
        return budget;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public FeedbackLoopDetector loopDetector() {
        return loopDetector;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    private String reserveCost(String actorId, double amount, String reservationId, Duration timeout) {
        BudgetCheck check = budget.checkBudget(actorId, BudgetDimension.COST, amount);
        if (!check.ok()) {
            return check.reason();
        }
        Duration expiresIn = timeout == null || timeout.isZero() ? null : timeout;
        if (!budget.reserve(actorId, BudgetDimension.COST, amount, reservationId, expiresIn)) {
            return "Budget reservation failed for " + actorId;
        }
        return null;
    }

    private void settleBudget(String actorId, String reservationId, boolean failed, Double actualCost) {
        if (reservationId != null) {
            if (!failed || actualCost != null) {
                if (!budget.commit(reservationId, actualCost) && actualCost != null) {
                    log.warn("Cost of {} for {} exceeds its budget, charging the reserved amount", actualCost, actorId);
                    budget.commit(reservationId, null);
                }
            } else {
                budget.release(reservationId);
            }
        } else if (actualCost != null && actualCost > 0.0d) {
            if (!budget.recordUsage(actorId, BudgetDimension.COST, actualCost)) {
                log.warn("Cost of {} for {} not tracked: no COST allocation", actualCost, actorId);
            }
        }
    }

    private void audit(
            String action,
            String actor,
            String resource,
            String result,
            String correlationId,
            String taskId,
            Map<String, Object> details
    ) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, correlationId, taskId, details));
    }

    public enum AdmissionStage {
        ADMITTED,
        DEDUPLICATED,
        CIRCUIT_OPEN,
        ARBITRATION,
        BUDGET;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * @param taskId        the new task on admission, the existing task for duplicates, the
     *                      failed task for budget denials, otherwise null
     * @param reservationId COST reservation held for the task, if any
     */
    public record AdmissionOutcome(
            boolean admitted,
            AdmissionStage stage,
            String taskId,
            String correlationId,
            String reservationId,
            String reason
    ) {
        static AdmissionOutcome rejected(AdmissionStage stage, String correlationId, String reason) {
            return new AdmissionOutcome(false, stage, null, correlationId, null, reason);
        }
    }

    public record MaintenanceOutcome(
            int tasksRemoved,
            int reservationsExpired,
            int chainsRemoved,
            int eventsCleaned,
            int circuitsRemoved
    ) {
        public int total() {
            return tasksRemoved + reservationsExpired + chainsRemoved + eventsCleaned + circuitsRemoved;
        }
    }

    public record StatsOutcome(
            Map<String, Integer> taskStatus,
            Map<String, Integer> circuitState,
            Map<String, Integer> eventsRejected,
            long admittedTotal,
            long deduplicatedTotal,
            long arbitrationRejectedTotal,
            long circuitBlockedTotal,
            long budgetDeniedTotal,
            long completedTotal,
            long failedTotal,
            long circuitTripTotal,
            int budgetAllocations,
            int activeReservations,
            int trackedChains,
            long eventsPublishedTotal,
            long eventDeliveriesTotal,
            long eventHandlerFailuresTotal,
            int activeCorrelations,
            long maintenanceRunsTotal
    ) {
    }
}
