package io.agentgovernor.budget;

import java.time.Instant;

/**
 * Point-in-time view of one dimension of an allocation.
 */
public record BudgetUsage(
        BudgetDimension dimension,
        double limit,
        double used,
        double reserved,
        Instant lastResetAt
) {
    public double available() {
        return Math.max(0.0d, limit - used - reserved);
    }
}
