package io.agentgovernor.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of an admitted task. The arbitrator replaces its stored snapshot on
 * every lifecycle transition, so a reference held by a caller never changes underneath it.
 */
public record TaskRecord(
        String taskId,
        String fingerprint,
        String actorId,
        String correlationId,
        TaskStatus status,
        Priority priority,
        Instant submittedAt,
        Instant startedAt,
        Instant completedAt,
        Object result,
        String error,
        double budgetUsed,
        Duration timeout
) {
    public static TaskRecord pending(
            String taskId,
            String fingerprint,
            String actorId,
            String correlationId,
            Priority priority,
            Instant submittedAt,
            Duration timeout
    ) {
        return new TaskRecord(
                taskId,
                fingerprint,
                actorId,
                correlationId,
                TaskStatus.PENDING,
                priority,
                submittedAt,
                null,
                null,
                null,
                null,
                0.0d,
                timeout
        );
    }

    public TaskRecord started(Instant at) {
        return new TaskRecord(taskId, fingerprint, actorId, correlationId, TaskStatus.RUNNING, priority,
                submittedAt, at, null, null, null, budgetUsed, timeout);
    }

    public TaskRecord finished(Instant at, Object value, String errorText, double cost) {
        TaskStatus next = errorText == null || errorText.isBlank() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        return new TaskRecord(taskId, fingerprint, actorId, correlationId, next, priority,
                submittedAt, startedAt, at, value, errorText, cost, timeout);
    }

    public TaskRecord rejected(Instant at, String reason) {
        return new TaskRecord(taskId, fingerprint, actorId, correlationId, TaskStatus.REJECTED, priority,
                submittedAt, startedAt, at, null, reason, 0.0d, timeout);
    }

    public boolean active() {
        return status.active();
    }

    public Duration runDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }
}
