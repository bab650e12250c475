package io.agentgovernor.config;

import java.time.Duration;

/**
 * @param allowImplicitAllocation when true, an actor without an allocation is treated as
 *                                unlimited and receives an unbounded default allocation on
 *                                first use; when false such actors are denied
 * @param implicitPeriod          reset period of lazily created default limits
 * @param defaultReservationTtl   expiry applied to reservations that do not name one; null
 *                                keeps them until committed or released
 */
public record BudgetSettings(
        boolean allowImplicitAllocation,
        Duration implicitPeriod,
        Duration defaultReservationTtl
) {
    public static final Duration DEFAULT_IMPLICIT_PERIOD = Duration.ofDays(30);

    public BudgetSettings {
        if (implicitPeriod == null || implicitPeriod.isZero() || implicitPeriod.isNegative()) {
            throw new IllegalArgumentException("implicitPeriod must be > 0");
        }
        if (defaultReservationTtl != null && (defaultReservationTtl.isZero() || defaultReservationTtl.isNegative())) {
            throw new IllegalArgumentException("defaultReservationTtl must be > 0 when set");
        }
    }

    public static BudgetSettings defaults() {
        return new BudgetSettings(false, DEFAULT_IMPLICIT_PERIOD, null);
    }

    public static BudgetSettings allowImplicit() {
        return new BudgetSettings(true, DEFAULT_IMPLICIT_PERIOD, null);
    }
}
