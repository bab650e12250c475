package io.agentgovernor.runtime;

import io.agentgovernor.budget.BudgetDimension;
import io.agentgovernor.budget.BudgetLimit;
import io.agentgovernor.budget.BudgetUsage;
import io.agentgovernor.circuit.CircuitState;
import io.agentgovernor.config.ArbitratorSettings;
import io.agentgovernor.config.BudgetSettings;
import io.agentgovernor.config.CircuitBreakerSettings;
import io.agentgovernor.config.DampenerSettings;
import io.agentgovernor.config.GovernorConfig;
import io.agentgovernor.config.GovernorSettings;
import io.agentgovernor.config.LoopDetectorSettings;
import io.agentgovernor.events.EmitDecision;
import io.agentgovernor.events.Event;
import io.agentgovernor.events.EventBus;
import io.agentgovernor.model.TaskStatus;
import io.agentgovernor.model.TaskSubmission;
import io.agentgovernor.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class GovernorRuntimeTest {

    private static GovernorSettings settingsWithCircuit(CircuitBreakerSettings circuit) {
        return new GovernorSettings(
                ArbitratorSettings.defaults(),
                BudgetSettings.defaults(),
                circuit,
                LoopDetectorSettings.defaults(),
                DampenerSettings.defaults()
        );
    }

    @Test
    void admittedTaskReservesAndCommitsCost() throws Exception {
        Path root = Files.createTempDirectory("governor-runtime-");
        try {
            MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
            GovernorRuntime runtime = new GovernorRuntime(new GovernorConfig(root), GovernorSettings.defaults(), clock);
            runtime.allocateBudget("agent-1", List.of(BudgetLimit.of(BudgetDimension.COST, 1.0d, Duration.ofHours(1))));

            TaskSubmission submission = TaskSubmission.builder("agent-1", "summarize feed")
                    .context("feed", "hn")
                    .correlationId("corr-run")
                    .budgetReserved(0.4d)
                    .build();
            GovernorRuntime.AdmissionOutcome admitted = runtime.admit(submission);
            Assertions.assertTrue(admitted.admitted());
            Assertions.assertEquals(GovernorRuntime.AdmissionStage.ADMITTED, admitted.stage());
            Assertions.assertEquals("res_" + admitted.taskId(), admitted.reservationId());
            Assertions.assertEquals(0.4d, runtime.budget().getUsage("agent-1", BudgetDimension.COST).orElseThrow().reserved(), 1e-9);

            GovernorRuntime.AdmissionOutcome duplicate = runtime.admit(submission);
            Assertions.assertFalse(duplicate.admitted());
            Assertions.assertEquals(GovernorRuntime.AdmissionStage.DEDUPLICATED, duplicate.stage());
            Assertions.assertEquals(admitted.taskId(), duplicate.taskId());

            Assertions.assertTrue(runtime.start(admitted.taskId()));
            clock.advance(Duration.ofSeconds(2));
            Assertions.assertTrue(runtime.complete(admitted.taskId(), "digest", null, 0.3d));
            Assertions.assertFalse(runtime.complete(admitted.taskId(), "digest", null, 0.3d));
            Assertions.assertFalse(runtime.complete("tsk_unknown", null, null, null));

            BudgetUsage usage = runtime.budget().getUsage("agent-1", BudgetDimension.COST).orElseThrow();
            Assertions.assertEquals(0.3d, usage.used(), 1e-9);
            Assertions.assertEquals(0.0d, usage.reserved(), 1e-9);
            Assertions.assertEquals(0.3d, runtime.arbitrator().getTask(admitted.taskId()).orElseThrow().budgetUsed(), 1e-9);

            GovernorRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(1L, stats.admittedTotal());
            Assertions.assertEquals(1L, stats.deduplicatedTotal());
            Assertions.assertEquals(1L, stats.completedTotal());
            Assertions.assertEquals(1, stats.taskStatus().get("completed"));
            Assertions.assertEquals(0, stats.activeReservations());
            Assertions.assertTrue(runtime.verifyAudit().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deniedBudgetRejectsTheTaskAndFreesCapacity() throws Exception {
        Path root = Files.createTempDirectory("governor-runtime-");
        try {
            GovernorRuntime runtime = new GovernorRuntime(
                    new GovernorConfig(root), GovernorSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
            runtime.allocateBudget("agent-1", List.of(BudgetLimit.of(BudgetDimension.COST, 0.5d, Duration.ofHours(1))));

            Assertions.assertTrue(runtime.admit(TaskSubmission.builder("agent-1", "first")
                    .correlationId("c1").budgetReserved(0.4d).build()).admitted());
            GovernorRuntime.AdmissionOutcome denied = runtime.admit(TaskSubmission.builder("agent-1", "second")
                    .correlationId("c2").budgetReserved(0.4d).build());

            Assertions.assertFalse(denied.admitted());
            Assertions.assertEquals(GovernorRuntime.AdmissionStage.BUDGET, denied.stage());
            Assertions.assertNotNull(denied.taskId());
            Assertions.assertTrue(denied.reason().startsWith("Insufficient cost budget"));
            Assertions.assertEquals(TaskStatus.REJECTED, runtime.arbitrator().getTask(denied.taskId()).orElseThrow().status());
            Assertions.assertEquals(1, runtime.arbitrator().activeCount("agent-1"));

            GovernorRuntime.AdmissionOutcome unallocated = runtime.admit(TaskSubmission.builder("agent-2", "paid work")
                    .correlationId("c3").budgetReserved(0.1d).build());
            Assertions.assertEquals("No budget allocation for actor agent-2", unallocated.reason());
            Assertions.assertTrue(runtime.admit(TaskSubmission.builder("agent-2", "free work").correlationId("c4").build()).admitted());
            Assertions.assertEquals(2L, runtime.stats().budgetDeniedTotal());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void repeatedFailuresOpenTheAgentCircuit() throws Exception {
        Path root = Files.createTempDirectory("governor-runtime-");
        try {
            MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
            GovernorRuntime runtime = new GovernorRuntime(
                    new GovernorConfig(root),
                    settingsWithCircuit(CircuitBreakerSettings.defaults().withThresholds(2, 1)),
                    clock
            );
            for (int i = 0; i < 2; i++) {
                GovernorRuntime.AdmissionOutcome out = runtime.admit(
                        TaskSubmission.builder("flaky", "attempt " + i).correlationId("corr-" + i).build());
                Assertions.assertTrue(out.admitted());
                runtime.complete(out.taskId(), null, "upstream timeout", null);
            }

            GovernorRuntime.AdmissionOutcome blocked = runtime.admit(
                    TaskSubmission.builder("flaky", "attempt 2").correlationId("corr-2").build());
            Assertions.assertFalse(blocked.admitted());
            Assertions.assertEquals(GovernorRuntime.AdmissionStage.CIRCUIT_OPEN, blocked.stage());
            Assertions.assertEquals("Circuit open for agent:flaky", blocked.reason());
            Assertions.assertEquals(1L, runtime.stats().circuitTripTotal());
            Assertions.assertEquals(CircuitState.OPEN, runtime.circuitBreaker().getState(GovernorRuntime.circuitIdFor("flaky")));
            Assertions.assertTrue(runtime.admit(
                    TaskSubmission.builder("steady", "attempt").correlationId("corr-s").build()).admitted());

            clock.advance(Duration.ofSeconds(60));
            GovernorRuntime.AdmissionOutcome probe = runtime.admit(
                    TaskSubmission.builder("flaky", "attempt 3").correlationId("corr-3").build());
            Assertions.assertTrue(probe.admitted());
            Assertions.assertTrue(runtime.complete(probe.taskId(), "ok", null, null));
            GovernorRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(2, stats.circuitState().get("closed"));
            Assertions.assertEquals(0, stats.circuitState().get("open"));
            Assertions.assertEquals(2L, stats.failedTotal());

            String audit = Files.readString(runtime.config().auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("\"action\":\"circuit.trip\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void publishedEventsAreDampenedAndAudited() throws Exception {
        Path root = Files.createTempDirectory("governor-runtime-");
        try {
            GovernorRuntime runtime = new GovernorRuntime(
                    new GovernorConfig(root), GovernorSettings.defaults(), MutableClock.startingAt("2026-01-01T00:00:00Z"));
            List<String> seen = new ArrayList<>();
            runtime.subscribe("task.completed", event -> seen.add(event.eventId()));
            Assertions.assertEquals(1, runtime.eventBus().subscriberCount("task.completed"));

            Event event = Event.builder("task.completed").correlationId("corr-e").source("agent-1").payload("task_id", "tsk_1").build();
            Assertions.assertEquals(1, runtime.publish(event).delivered());
            EventBus.PublishOutcome again = runtime.publish(
                    Event.builder("task.completed").correlationId("corr-e").source("agent-1").payload("task_id", "tsk_1").build());
            Assertions.assertEquals(EmitDecision.Rejection.DUPLICATE, again.rejection());
            Assertions.assertEquals(1, seen.size());

            GovernorRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(1L, stats.eventsPublishedTotal());
            Assertions.assertEquals(1, stats.eventsRejected().get("duplicate"));

            String metrics = runtime.metricsText();
            Assertions.assertTrue(metrics.contains("governor_events_rejected_total{reason=\"duplicate\"} 1"));
            Assertions.assertTrue(metrics.contains("governor_events_published_total 1"));
            Assertions.assertTrue(metrics.contains("# TYPE governor_admissions_total gauge"));

            String audit = Files.readString(runtime.config().auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("\"action\":\"event.publish\""));
            Assertions.assertTrue(runtime.verifyAudit().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void maintenanceSweepsEveryComponent() throws Exception {
        Path root = Files.createTempDirectory("governor-runtime-");
        try {
            MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
            GovernorRuntime runtime = new GovernorRuntime(new GovernorConfig(root), GovernorSettings.defaults(), clock);
            runtime.allocateBudget("agent-1", List.of(BudgetLimit.of(BudgetDimension.COST, 5.0d, Duration.ofDays(1))));
            GovernorRuntime.AdmissionOutcome done = runtime.admit(
                    TaskSubmission.builder("agent-1", "done").correlationId("c-done").build());
            runtime.complete(done.taskId(), "ok", null, null);
            GovernorRuntime.AdmissionOutcome hanging = runtime.admit(TaskSubmission.builder("agent-1", "hanging")
                    .correlationId("c-hang").budgetReserved(1.0d).timeout(Duration.ofMinutes(10)).build());
            Assertions.assertTrue(hanging.admitted());
            runtime.publish(Event.builder("tick").correlationId("c-done").build());

            clock.advance(Duration.ofHours(2));
            GovernorRuntime.MaintenanceOutcome out = runtime.runMaintenance();
            Assertions.assertEquals(1, out.tasksRemoved());
            Assertions.assertEquals(1, out.reservationsExpired());
            Assertions.assertEquals(2, out.chainsRemoved());
            Assertions.assertEquals(0, runtime.loopDetector().chainCount());
            Assertions.assertEquals(1, out.eventsCleaned());
            Assertions.assertEquals(0, out.circuitsRemoved());
            Assertions.assertEquals(0.0d, runtime.budget().getUsage("agent-1", BudgetDimension.COST).orElseThrow().reserved(), 1e-9);
            Assertions.assertEquals(1L, runtime.stats().maintenanceRunsTotal());
            Assertions.assertTrue(runtime.arbitrator().getTask(hanging.taskId()).isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
