package io.agentgovernor.cli;

import io.agentgovernor.budget.BudgetDimension;
import io.agentgovernor.budget.BudgetLimit;
import io.agentgovernor.budget.TokenPricing;
import io.agentgovernor.config.GovernorConfig;
import io.agentgovernor.config.GovernorSettings;
import io.agentgovernor.events.Event;
import io.agentgovernor.events.EventBus;
import io.agentgovernor.model.TaskSubmission;
import io.agentgovernor.observability.AuditLogger;
import io.agentgovernor.observability.CorrelationContext;
import io.agentgovernor.runtime.GovernorRuntime;
import io.agentgovernor.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "agent-governor",
        mixinStandardHelpOptions = true,
        description = "Admission control for autonomous agents",
        subcommands = {
                GovernorCommand.SettingsCommand.class,
                GovernorCommand.TokenCostCommand.class,
                GovernorCommand.AuditVerifyCommand.class,
                GovernorCommand.SimulateCommand.class
        }
)
public final class GovernorCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = GovernorConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: settings | token-cost | audit-verify | simulate");
    }

    GovernorConfig config() {
        return GovernorConfig.fromRoot(root);
    }

    GovernorRuntime runtime() {
        return new GovernorRuntime(config());
    }

    @Command(name = "settings", description = "Print effective settings (defaults merged with governor-settings.json)")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        GovernorCommand parent;

        @Override
        public Integer call() {
            GovernorConfig config = parent.config();
            GovernorSettings settings = GovernorSettings.load(config.settingsFile());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("settingsFile", config.settingsFile().toString());
            out.put("settings", settings.toView());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "token-cost", description = "Price a model call in USD")
    static final class TokenCostCommand implements Callable<Integer> {
        @ParentCommand
        GovernorCommand parent;

        @Option(names = {"--model"}, required = true, description = "Model name, e.g. gpt-4")
        String model;

        @Option(names = {"--prompt-tokens"}, defaultValue = "0", description = "Prompt token count")
        long promptTokens;

        @Option(names = {"--completion-tokens"}, defaultValue = "0", description = "Completion token count")
        long completionTokens;

        @Override
        public Integer call() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("model", model);
            out.put("knownModel", TokenPricing.known(model));
            out.put("promptTokens", promptTokens);
            out.put("completionTokens", completionTokens);
            out.put("cost", TokenPricing.tokenCost(model, promptTokens, completionTokens));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        GovernorCommand parent;

        @Override
        public Integer call() {
            GovernorConfig config = parent.config();
            AuditLogger auditLogger = new AuditLogger(
                    config.auditFile(),
                    AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile()),
                    null
            );
            AuditLogger.VerifyOutcome out = auditLogger.verify();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "simulate", description = "Run an in-process admission scenario and print every decision")
    static final class SimulateCommand implements Callable<Integer> {
        @ParentCommand
        GovernorCommand parent;

        @Option(names = {"--actor"}, defaultValue = "agent-1", description = "Actor id")
        String actor;

        @Option(names = {"--tasks"}, defaultValue = "5", description = "Number of distinct tasks to submit")
        int tasks;

        @Option(names = {"--repeat"}, defaultValue = "1", description = "Submissions per task; repeats are deduplicated")
        int repeat;

        @Option(names = {"--budget"}, defaultValue = "1.0", description = "COST limit for the actor")
        double budget;

        @Option(names = {"--cost"}, defaultValue = "0.25", description = "COST reserved and charged per task")
        double cost;

        @Option(names = {"--fail-every"}, defaultValue = "0", description = "Fail every Nth admitted task; 0 never fails")
        int failEvery;

        @Option(names = {"--metrics"}, description = "Print Prometheus metrics instead of JSON stats")
        boolean metrics;

        @Override
        public Integer call() {
            if (tasks < 0 || repeat < 1) {
                throw new IllegalArgumentException("--tasks must be >= 0 and --repeat >= 1");
            }
            GovernorRuntime runtime = parent.runtime();
            runtime.allocateBudget(actor, List.of(BudgetLimit.of(BudgetDimension.COST, budget, Duration.ofHours(1))));

            List<GovernorRuntime.AdmissionOutcome> admissions = new ArrayList<>();
            List<EventBus.PublishOutcome> events = new ArrayList<>();
            int admitted = 0;
            for (int i = 0; i < tasks; i++) {
                String correlationId = CorrelationContext.newCorrelationId();
                GovernorRuntime.AdmissionOutcome first = null;
                for (int r = 0; r < repeat; r++) {
                    GovernorRuntime.AdmissionOutcome out = runtime.admit(TaskSubmission.builder(actor, "simulated task")
                            .context("index", i)
                            .correlationId(correlationId)
                            .budgetReserved(cost)
                            .build());
                    admissions.add(out);
                    if (r == 0) {
                        first = out;
                    }
                }
                if (first == null || !first.admitted()) {
                    continue;
                }
                admitted++;
                runtime.start(first.taskId());
                boolean fail = failEvery > 0 && admitted % failEvery == 0;
                runtime.complete(first.taskId(), null, fail ? "simulated failure" : null, cost);
                events.add(runtime.publish(Event.builder(fail ? "task.failed" : "task.completed")
                        .correlationId(first.correlationId())
                        .source(actor)
                        .payload("task_id", first.taskId())
                        .build()));
            }

            if (metrics) {
                System.out.print(runtime.metricsText());
                return 0;
            }
            System.out.println(Jsons.toJson(new SimulationOutcome(admissions, events, runtime.stats())));
            return 0;
        }
    }

    public record SimulationOutcome(
            List<GovernorRuntime.AdmissionOutcome> admissions,
            List<EventBus.PublishOutcome> events,
            GovernorRuntime.StatsOutcome stats
    ) {
    }
}
