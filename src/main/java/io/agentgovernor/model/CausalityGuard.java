package io.agentgovernor.model;

/**
 * Causality-chain check consulted by admission control. Implementations record
 * {@code taskId} in the chain of {@code correlationId} when they report no loop.
 */
@FunctionalInterface
public interface CausalityGuard {
    LoopCheck checkCausalityChain(String correlationId, String taskId);
}
