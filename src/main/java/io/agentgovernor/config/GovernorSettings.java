package io.agentgovernor.config;

import io.agentgovernor.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective settings of all four governance components.
 *
 * <p>{@link #load(Path)} reads an optional JSON file. Every field is optional; absent values
 * keep their defaults and numeric values are clamped to the smallest value that still makes
 * sense, so a half-written file never produces an invalid component.
 */
public record GovernorSettings(
        ArbitratorSettings arbitrator,
        BudgetSettings budget,
        CircuitBreakerSettings circuit,
        LoopDetectorSettings loop,
        DampenerSettings dampener
) {
    public static GovernorSettings defaults() {
        return new GovernorSettings(
                ArbitratorSettings.defaults(),
                BudgetSettings.defaults(),
                CircuitBreakerSettings.defaults(),
                LoopDetectorSettings.defaults(),
                DampenerSettings.defaults()
        );
    }

    public static GovernorSettings load(Path file) {
        GovernorSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load governor settings: " + file, e);
        }
    }

    static GovernorSettings fromFile(SettingsFile file, GovernorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new GovernorSettings(
                arbitrator(file.arbitrator(), defaults.arbitrator()),
                budget(file.budget(), defaults.budget()),
                circuit(file.circuit(), defaults.circuit()),
                loop(file.loop(), defaults.loop()),
                dampener(file.dampener(), defaults.dampener())
        );
    }

    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("arbitrator", Map.of(
                "dedupWindowMs", arbitrator.dedupWindow().toMillis(),
                "maxTasksPerActor", arbitrator.maxTasksPerActor(),
                "loopDetectionEnabled", arbitrator.loopDetectionEnabled(),
                "loopThreshold", arbitrator.loopThreshold()
        ));
        Map<String, Object> budgetView = new LinkedHashMap<>();
        budgetView.put("allowImplicitAllocation", budget.allowImplicitAllocation());
        budgetView.put("implicitPeriodMs", budget.implicitPeriod().toMillis());
        budgetView.put("defaultReservationTtlMs",
                budget.defaultReservationTtl() == null ? null : budget.defaultReservationTtl().toMillis());
        view.put("budget", budgetView);
        view.put("circuit", Map.of(
                "failureThreshold", circuit.failureThreshold(),
                "successThreshold", circuit.successThreshold(),
                "windowMs", circuit.window().toMillis(),
                "cooldownMs", circuit.cooldown().toMillis(),
                "maxOpenDurationMs", circuit.maxOpenDuration().toMillis()
        ));
        view.put("loop", Map.of(
                "maxChainDepth", loop.maxChainDepth(),
                "maxChains", loop.maxChains(),
                "chainMaxAgeMs", loop.chainMaxAge().toMillis()
        ));
        Map<String, Object> dampenerView = new LinkedHashMap<>();
        dampenerView.put("dedupWindowMs", dampener.dedupWindow().toMillis());
        dampenerView.put("rateLimits", dampener.rateLimits());
        dampenerView.put("rateWindowMs", dampener.rateWindow().toMillis());
        dampenerView.put("cascadeThreshold", dampener.cascadeThreshold());
        dampenerView.put("cascadeFanoutRatio", dampener.cascadeFanoutRatio());
        dampenerView.put("correlationRetentionMs",
                dampener.correlationRetention() == null ? null : dampener.correlationRetention().toMillis());
        view.put("dampener", dampenerView);
        return view;
    }

    private static ArbitratorSettings arbitrator(ArbitratorFile file, ArbitratorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new ArbitratorSettings(
                sanitizeDuration(file.dedupWindowMs(), defaults.dedupWindow(), 0L),
                sanitizeInt(file.maxTasksPerActor(), defaults.maxTasksPerActor(), 1),
                sanitizeBoolean(file.loopDetectionEnabled(), defaults.loopDetectionEnabled()),
                sanitizeInt(file.loopThreshold(), defaults.loopThreshold(), 1)
        );
    }

    private static BudgetSettings budget(BudgetFile file, BudgetSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Duration ttl = file.defaultReservationTtlMs() == null || file.defaultReservationTtlMs() <= 0L
                ? defaults.defaultReservationTtl()
                : Duration.ofMillis(file.defaultReservationTtlMs());
        return new BudgetSettings(
                sanitizeBoolean(file.allowImplicitAllocation(), defaults.allowImplicitAllocation()),
                sanitizeDuration(file.implicitPeriodMs(), defaults.implicitPeriod(), 1_000L),
                ttl
        );
    }

    private static CircuitBreakerSettings circuit(CircuitFile file, CircuitBreakerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new CircuitBreakerSettings(
                sanitizeInt(file.failureThreshold(), defaults.failureThreshold(), 1),
                sanitizeInt(file.successThreshold(), defaults.successThreshold(), 1),
                sanitizeDuration(file.windowMs(), defaults.window(), 1L),
                sanitizeDuration(file.cooldownMs(), defaults.cooldown(), 1L),
                sanitizeDuration(file.maxOpenDurationMs(), defaults.maxOpenDuration(), 1L)
        );
    }

    private static LoopDetectorSettings loop(LoopFile file, LoopDetectorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new LoopDetectorSettings(
                sanitizeInt(file.maxChainDepth(), defaults.maxChainDepth(), 1),
                sanitizeInt(file.maxChains(), defaults.maxChains(), 10),
                sanitizeDuration(file.chainMaxAgeMs(), defaults.chainMaxAge(), 1_000L)
        );
    }

    private static DampenerSettings dampener(DampenerFile file, DampenerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Map<String, Integer> rateLimits = new LinkedHashMap<>();
        if (file.rateLimits() != null) {
            file.rateLimits().forEach((type, limit) -> {
                if (type != null && !type.isBlank() && limit != null) {
                    rateLimits.put(type.trim(), Math.max(0, limit));
                }
            });
        } else {
            rateLimits.putAll(defaults.rateLimits());
        }
        double ratio = file.cascadeFanoutRatio() == null || !(file.cascadeFanoutRatio() > 0.0d)
                ? defaults.cascadeFanoutRatio()
                : file.cascadeFanoutRatio();
        Duration retention = file.correlationRetentionMs() == null
                ? defaults.correlationRetention()
                : file.correlationRetentionMs() <= 0L ? null : Duration.ofMillis(file.correlationRetentionMs());
        return new DampenerSettings(
                sanitizeDuration(file.dedupWindowMs(), defaults.dedupWindow(), 0L),
                rateLimits,
                sanitizeDuration(file.rateWindowMs(), defaults.rateWindow(), 1L),
                sanitizeInt(file.cascadeThreshold(), defaults.cascadeThreshold(), 1),
                ratio,
                retention
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static Duration sanitizeDuration(Long rawMs, Duration fallback, long minMs) {
        if (rawMs == null) {
            return fallback;
        }
        return Duration.ofMillis(Math.max(minMs, rawMs));
    }

    record SettingsFile(
            ArbitratorFile arbitrator,
            BudgetFile budget,
            CircuitFile circuit,
            LoopFile loop,
            DampenerFile dampener
    ) {
    }

    record ArbitratorFile(Long dedupWindowMs, Integer maxTasksPerActor, Boolean loopDetectionEnabled, Integer loopThreshold) {
    }

    record BudgetFile(Boolean allowImplicitAllocation, Long implicitPeriodMs, Long defaultReservationTtlMs) {
    }

    record CircuitFile(
            Integer failureThreshold,
            Integer successThreshold,
            Long windowMs,
            Long cooldownMs,
            Long maxOpenDurationMs
    ) {
    }

    record LoopFile(Integer maxChainDepth, Integer maxChains, Long chainMaxAgeMs) {
    }

    record DampenerFile(
            Long dedupWindowMs,
            Map<String, Integer> rateLimits,
            Long rateWindowMs,
            Integer cascadeThreshold,
            Double cascadeFanoutRatio,
            Long correlationRetentionMs
    ) {
    }
}
