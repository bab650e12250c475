package io.agentgovernor.budget;

import io.agentgovernor.config.BudgetSettings;
import io.agentgovernor.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

final class BudgetEngineTest {
    private static final double EPSILON = 1e-9;

    @Test
    void reserveCommitScenarioKeepsLimitInvariant() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), clock);
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)));

        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.COST, 6.0d, "r1"));
        Assertions.assertFalse(engine.reserve("actor", BudgetDimension.COST, 5.0d, "r2"));
        Assertions.assertTrue(engine.commit("r1", 4.0d));

        BudgetUsage usage = engine.getUsage("actor", BudgetDimension.COST).orElseThrow();
        Assertions.assertEquals(4.0d, usage.used(), EPSILON);
        Assertions.assertEquals(0.0d, usage.reserved(), EPSILON);
        Assertions.assertEquals(6.0d, usage.available(), EPSILON);

        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.COST, 5.0d, "r3"));
        Assertions.assertEquals(1.0d, engine.getRemaining("actor", BudgetDimension.COST).orElseThrow(), EPSILON);
        Assertions.assertTrue(engine.getReservation("r3").isPresent());
        Assertions.assertTrue(engine.getReservation("r2").isEmpty());
    }

    @Test
    void releaseRestoresPreReserveState() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.TOKENS, 1_000.0d, Duration.ofDays(1)));
        engine.recordUsage("actor", BudgetDimension.TOKENS, 250.0d);
        BudgetUsage before = engine.getUsage("actor", BudgetDimension.TOKENS).orElseThrow();

        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.TOKENS, 700.0d, "tok-1"));
        Assertions.assertFalse(engine.checkBudget("actor", BudgetDimension.TOKENS, 100.0d).ok());
        Assertions.assertTrue(engine.release("tok-1"));
        Assertions.assertFalse(engine.release("tok-1"));

        BudgetUsage after = engine.getUsage("actor", BudgetDimension.TOKENS).orElseThrow();
        Assertions.assertEquals(before.used(), after.used(), 0.0d);
        Assertions.assertEquals(before.reserved(), after.reserved(), 0.0d);
    }

    @Test
    void randomOperationSequencesNeverOvercommit() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
        double limit = 50.0d;
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.API_CALLS, limit, Duration.ofDays(1)));
        Random random = new Random(42L);
        List<String> open = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            int op = random.nextInt(3);
            if (op == 0 || open.isEmpty()) {
                String id = "res-" + i;
                if (engine.reserve("actor", BudgetDimension.API_CALLS, random.nextInt(12), id)) {
                    open.add(id);
                }
            } else {
                String id = open.remove(random.nextInt(open.size()));
                if (op == 1) {
                    double reserved = engine.getReservation(id).orElseThrow().amount();
                    if (!engine.commit(id, reserved * 1.5d * random.nextDouble())) {
                        Assertions.assertTrue(engine.commit(id, reserved));
                    }
                } else {
                    Assertions.assertTrue(engine.release(id));
                }
            }
            BudgetUsage usage = engine.getUsage("actor", BudgetDimension.API_CALLS).orElseThrow();
            Assertions.assertTrue(usage.used() + usage.reserved() <= limit + EPSILON,
                    "used=" + usage.used() + " reserved=" + usage.reserved());
            Assertions.assertTrue(usage.reserved() >= 0.0d);
        }
    }

    @Test
    void periodElapsedResetsUsageLazily() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), clock);
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)));
        Assertions.assertTrue(engine.recordUsage("actor", BudgetDimension.COST, 8.0d));
        Assertions.assertFalse(engine.checkBudget("actor", BudgetDimension.COST, 3.0d).ok());

        clock.advance(Duration.ofMinutes(59));
        Assertions.assertEquals(2.0d, engine.getRemaining("actor", BudgetDimension.COST).orElseThrow(), EPSILON);

        clock.advance(Duration.ofMinutes(1));
        Assertions.assertTrue(engine.checkBudget("actor", BudgetDimension.COST, 3.0d).ok());
        Assertions.assertEquals(10.0d, engine.getRemaining("actor", BudgetDimension.COST).orElseThrow(), EPSILON);
    }

    @Test
    void actorsWithoutAllocationAreDeniedByDefault() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));

        BudgetCheck check = engine.checkBudget("ghost", BudgetDimension.COST, 1.0d);
        Assertions.assertFalse(check.ok());
        Assertions.assertEquals("No budget allocation for actor ghost", check.reason());
        Assertions.assertFalse(engine.reserve("ghost", BudgetDimension.COST, 1.0d, "g1"));
        Assertions.assertFalse(engine.recordUsage("ghost", BudgetDimension.COST, 1.0d));
        Assertions.assertFalse(engine.hasAllocation("ghost"));
        Assertions.assertTrue(engine.getRemaining("ghost", BudgetDimension.COST).isEmpty());

        engine.createAllocation("ghost", BudgetLimit.of(BudgetDimension.TOKENS, 100.0d, Duration.ofHours(1)));
        Assertions.assertEquals("No cost limit configured for actor ghost",
                engine.checkBudget("ghost", BudgetDimension.COST, 1.0d).reason());
    }

    @Test
    void implicitAllocationCreatesUnboundedDefaults() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.allowImplicit(), MutableClock.startingAt("2026-01-01T00:00:00Z"));

        Assertions.assertTrue(engine.checkBudget("new-agent", BudgetDimension.COST, 1_000_000.0d).ok());
        Assertions.assertTrue(engine.reserve("new-agent", BudgetDimension.COST, 5.0d, "i1"));
        Assertions.assertTrue(engine.hasAllocation("new-agent"));
        Assertions.assertTrue(engine.commit("i1"));
        Assertions.assertTrue(engine.recordUsage("new-agent", BudgetDimension.TOKENS, 300.0d));

        BudgetUsage cost = engine.getUsage("new-agent", BudgetDimension.COST).orElseThrow();
        Assertions.assertEquals(5.0d, cost.used(), EPSILON);
        Assertions.assertEquals(Double.POSITIVE_INFINITY, cost.limit());
        Assertions.assertEquals(300.0d, engine.getUsage("new-agent", BudgetDimension.TOKENS).orElseThrow().used(), EPSILON);
    }

    @Test
    void softLimitFlagsButNeverBlocks() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)).withSoftLimit(8.0d));

        BudgetCheck below = engine.checkBudget("actor", BudgetDimension.COST, 5.0d);
        Assertions.assertTrue(below.ok());
        Assertions.assertFalse(below.softLimitReached());

        BudgetCheck near = engine.checkBudget("actor", BudgetDimension.COST, 9.0d);
        Assertions.assertTrue(near.ok());
        Assertions.assertTrue(near.softLimitReached());
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.COST, 9.0d, "near"));
    }

    @Test
    void expiredReservationsAreSweptBackToThePool() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), clock);
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.CONCURRENCY, 3.0d, Duration.ofDays(1)));
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.CONCURRENCY, 2.0d, "slot-a", Duration.ofMinutes(1)));
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.CONCURRENCY, 1.0d, "slot-b", Duration.ofMinutes(10)));
        Assertions.assertFalse(engine.reserve("actor", BudgetDimension.CONCURRENCY, 1.0d, "slot-c"));

        clock.advance(Duration.ofMinutes(2));
        Assertions.assertEquals(1, engine.cleanupExpired());
        Assertions.assertEquals(1, engine.reservationCount());
        Assertions.assertFalse(engine.commit("slot-a"));
        Assertions.assertEquals(1.0d, engine.getUsage("actor", BudgetDimension.CONCURRENCY).orElseThrow().reserved(), EPSILON);
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.CONCURRENCY, 2.0d, "slot-c"));
    }

    @Test
    void resetKeepsOutstandingReservations() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
        engine.createAllocation("actor",
                BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)),
                BudgetLimit.of(BudgetDimension.TIME, 60.0d, Duration.ofHours(1)));
        engine.recordUsage("actor", BudgetDimension.COST, 4.0d);
        engine.recordUsage("actor", BudgetDimension.TIME, 30.0d);
        engine.reserve("actor", BudgetDimension.COST, 3.0d, "held");

        Assertions.assertTrue(engine.resetBudget("actor", BudgetDimension.COST));
        BudgetUsage cost = engine.getUsage("actor", BudgetDimension.COST).orElseThrow();
        Assertions.assertEquals(0.0d, cost.used(), EPSILON);
        Assertions.assertEquals(3.0d, cost.reserved(), EPSILON);
        Assertions.assertEquals(30.0d, engine.getUsage("actor", BudgetDimension.TIME).orElseThrow().used(), EPSILON);

        Assertions.assertTrue(engine.resetBudget("actor", null));
        Assertions.assertEquals(0.0d, engine.getUsage("actor", BudgetDimension.TIME).orElseThrow().used(), EPSILON);
        Assertions.assertFalse(engine.resetBudget("nobody", null));
    }

    @Test
    void commitAboveReservationMustFitRemainingBudget() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)));
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.COST, 6.0d, "r1"));
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.COST, 4.0d, "r2"));

        Assertions.assertFalse(engine.commit("r1", 9.0d));
        BudgetUsage held = engine.getUsage("actor", BudgetDimension.COST).orElseThrow();
        Assertions.assertEquals(0.0d, held.used(), EPSILON);
        Assertions.assertEquals(10.0d, held.reserved(), EPSILON);
        Assertions.assertTrue(engine.getReservation("r1").isPresent());

        Assertions.assertTrue(engine.release("r2"));
        Assertions.assertTrue(engine.commit("r1", 9.0d));
        BudgetUsage after = engine.getUsage("actor", BudgetDimension.COST).orElseThrow();
        Assertions.assertEquals(9.0d, after.used(), EPSILON);
        Assertions.assertEquals(0.0d, after.reserved(), EPSILON);
        Assertions.assertTrue(after.used() + after.reserved() <= 10.0d + EPSILON);
    }

    @Test
    void droppedDimensionsAreNoLongerTracked() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
        engine.createAllocation("actor",
                BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)),
                BudgetLimit.of(BudgetDimension.TOKENS, 100.0d, Duration.ofHours(1)));
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.TOKENS, 50.0d, "tok"));

        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)));

        Assertions.assertTrue(engine.getReservation("tok").isEmpty());
        Assertions.assertTrue(engine.getUsage("actor", BudgetDimension.TOKENS).isEmpty());
        Assertions.assertFalse(engine.recordUsage("actor", BudgetDimension.TOKENS, 10.0d));
        Assertions.assertFalse(engine.reserve("actor", BudgetDimension.TOKENS, 1_000_000.0d, "big"));
        Assertions.assertTrue(engine.getRemaining("actor", BudgetDimension.TOKENS).isEmpty());
    }

    @Test
    void invalidRequestsAreRejectedAtTheBoundary() {
        BudgetEngine engine = new BudgetEngine(BudgetSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
        engine.createAllocation("actor", BudgetLimit.of(BudgetDimension.COST, 10.0d, Duration.ofHours(1)));

        Assertions.assertThrows(IllegalArgumentException.class, () -> engine.reserve("actor", BudgetDimension.COST, -1.0d, "neg"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> engine.reserve("actor", BudgetDimension.COST, 1.0d, " "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> engine.checkBudget(" ", BudgetDimension.COST, 1.0d));
        Assertions.assertThrows(IllegalArgumentException.class, () -> engine.createAllocation("actor"));
        Assertions.assertTrue(engine.reserve("actor", BudgetDimension.COST, 1.0d, "dup"));
        Assertions.assertFalse(engine.reserve("actor", BudgetDimension.COST, 1.0d, "dup"));
        Assertions.assertFalse(engine.commit("missing"));
    }

    @Test
    void tokenCostUsesPerThousandPricing() {
        Assertions.assertEquals(0.06d, BudgetEngine.tokenCost("gpt-4", 1_000L, 500L), EPSILON);
        Assertions.assertEquals(0.0020d, BudgetEngine.tokenCost("gpt-3.5-turbo", 1_000L, 1_000L), EPSILON);
        Assertions.assertEquals(0.090d, BudgetEngine.tokenCost("claude-3-opus", 1_000L, 1_000L), EPSILON);
        Assertions.assertEquals(BudgetEngine.tokenCost("gpt-4", 2_000L, 0L), BudgetEngine.tokenCost("mystery-model", 2_000L, 0L), EPSILON);
        Assertions.assertFalse(TokenPricing.known("mystery-model"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BudgetEngine.tokenCost("gpt-4", -1L, 0L));
    }
}
