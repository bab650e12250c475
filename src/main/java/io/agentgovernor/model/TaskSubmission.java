package io.agentgovernor.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request to run one unit of agent work. The description and context are opaque to the
 * governor; they only feed the deduplication fingerprint.
 *
 * <p>{@code taskId} and {@code correlationId} may be null, in which case the arbitrator
 * assigns a fresh task id and the current {@code CorrelationContext} id respectively.
 */
public record TaskSubmission(
        String taskId,
        String description,
        Map<String, Object> context,
        String actorId,
        Priority priority,
        String correlationId,
        Instant submittedAt,
        Double budgetReserved,
        Duration timeout
) {
    public TaskSubmission {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId must not be blank");
        }
        if (budgetReserved != null && (budgetReserved < 0.0d || budgetReserved.isNaN())) {
            throw new IllegalArgumentException("budgetReserved must be >= 0: " + budgetReserved);
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        description = description == null ? "" : description;
        context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        priority = priority == null ? Priority.NORMAL : priority;
        correlationId = correlationId == null || correlationId.isBlank() ? null : correlationId.trim();
        taskId = taskId == null || taskId.isBlank() ? null : taskId.trim();
    }

    public static Builder builder(String actorId, String description) {
        return new Builder(actorId, description);
    }

    public TaskSubmission withCorrelationId(String value) {
        return new TaskSubmission(taskId, description, context, actorId, priority, value, submittedAt, budgetReserved, timeout);
    }

    public static final class Builder {
        private final String actorId;
        private final String description;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private String taskId;
        private Priority priority = Priority.NORMAL;
        private String correlationId;
        private Instant submittedAt;
        private Double budgetReserved;
        private Duration timeout;

        private Builder(String actorId, String description) {
            this.actorId = actorId;
            this.description = description;
        }

        public Builder taskId(String value) {
            this.taskId = value;
            return this;
        }

        public Builder context(String key, Object value) {
            this.context.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder context(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::context);
            }
            return this;
        }

        public Builder priority(Priority value) {
            this.priority = value;
            return this;
        }

        public Builder correlationId(String value) {
            this.correlationId = value;
            return this;
        }

        public Builder submittedAt(Instant value) {
            this.submittedAt = value;
            return this;
        }

        public Builder budgetReserved(double value) {
            this.budgetReserved = value;
            return this;
        }

        public Builder timeout(Duration value) {
            this.timeout = value;
            return this;
        }

        public TaskSubmission build() {
            return new TaskSubmission(
                    taskId,
                    description,
                    context,
                    actorId,
                    priority,
                    correlationId,
                    submittedAt,
                    budgetReserved,
                    timeout
            );
        }
    }
}
