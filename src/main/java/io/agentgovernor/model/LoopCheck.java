package io.agentgovernor.model;

public record LoopCheck(boolean loopDetected, String reason) {
    private static final LoopCheck CLEAR = new LoopCheck(false, null);

    public static LoopCheck clear() {
        return CLEAR;
    }

    public static LoopCheck detected(String reason) {
        return new LoopCheck(true, reason);
    }
}
