package io.agentgovernor.budget;

import java.time.Instant;

public record BudgetReservation(
        String reservationId,
        String actorId,
        BudgetDimension dimension,
        double amount,
        Instant createdAt,
        Instant expiresAt
) {
    public boolean expired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
