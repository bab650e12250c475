package io.agentgovernor.config;

import java.time.Duration;

public record ArbitratorSettings(
        Duration dedupWindow,
        int maxTasksPerActor,
        boolean loopDetectionEnabled,
        int loopThreshold
) {
    public static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_TASKS_PER_ACTOR = 100;
    public static final int DEFAULT_LOOP_THRESHOLD = 10;

    public ArbitratorSettings {
        if (dedupWindow == null || dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must be >= 0");
        }
        if (maxTasksPerActor < 1) {
            throw new IllegalArgumentException("maxTasksPerActor must be >= 1: " + maxTasksPerActor);
        }
        if (loopThreshold < 1) {
            throw new IllegalArgumentException("loopThreshold must be >= 1: " + loopThreshold);
        }
    }

    public static ArbitratorSettings defaults() {
        return new ArbitratorSettings(DEFAULT_DEDUP_WINDOW, DEFAULT_MAX_TASKS_PER_ACTOR, true, DEFAULT_LOOP_THRESHOLD);
    }

    public ArbitratorSettings withMaxTasksPerActor(int value) {
        return new ArbitratorSettings(dedupWindow, value, loopDetectionEnabled, loopThreshold);
    }

    public ArbitratorSettings withLoopDetection(boolean enabled, int threshold) {
        return new ArbitratorSettings(dedupWindow, maxTasksPerActor, enabled, threshold);
    }

    public ArbitratorSettings withDedupWindow(Duration value) {
        return new ArbitratorSettings(value, maxTasksPerActor, loopDetectionEnabled, loopThreshold);
    }
}
