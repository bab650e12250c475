package io.agentgovernor.config;

import java.time.Duration;

public record LoopDetectorSettings(
        int maxChainDepth,
        int maxChains,
        Duration chainMaxAge
) {
    public LoopDetectorSettings {
        if (maxChainDepth < 1) {
            throw new IllegalArgumentException("maxChainDepth must be >= 1: " + maxChainDepth);
        }
        if (maxChains < 10) {
            throw new IllegalArgumentException("maxChains must be >= 10: " + maxChains);
        }
        if (chainMaxAge == null || chainMaxAge.isZero() || chainMaxAge.isNegative()) {
            throw new IllegalArgumentException("chainMaxAge must be > 0");
        }
    }

    public static LoopDetectorSettings defaults() {
        return new LoopDetectorSettings(20, 1_000, Duration.ofHours(1));
    }
}
