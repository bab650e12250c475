package io.agentgovernor.budget;

import java.time.Duration;

/**
 * Hard ceiling for one dimension, reset every {@code period}. {@code softLimit}, when set,
 * only produces a warning.
 */
public record BudgetLimit(BudgetDimension dimension, double limit, Duration period, Double softLimit) {
    public BudgetLimit {
        if (dimension == null) {
            throw new IllegalArgumentException("dimension must not be null");
        }
        if (limit < 0.0d || Double.isNaN(limit)) {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        if (softLimit != null && (softLimit < 0.0d || softLimit.isNaN())) {
            throw new IllegalArgumentException("softLimit must be >= 0: " + softLimit);
        }
    }

    public static BudgetLimit of(BudgetDimension dimension, double limit, Duration period) {
        return new BudgetLimit(dimension, limit, period, null);
    }

    public static BudgetLimit unbounded(BudgetDimension dimension, Duration period) {
        return new BudgetLimit(dimension, Double.POSITIVE_INFINITY, period, null);
    }

    public BudgetLimit withSoftLimit(double value) {
        return new BudgetLimit(dimension, limit, period, value);
    }
}
