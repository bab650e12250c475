package io.agentgovernor.events;

/**
 * Result of {@link EventDampener#shouldEmit}. {@code rejection} and {@code reason} are null
 * for allowed events.
 */
public record EmitDecision(boolean allowed, Rejection rejection, String reason) {
    private static final EmitDecision ALLOWED = new EmitDecision(true, null, null);

    public static EmitDecision allow() {
        return ALLOWED;
    }

    public static EmitDecision reject(Rejection rejection, String reason) {
        return new EmitDecision(false, rejection, reason);
    }

    public enum Rejection {
        EXPIRED,
        DUPLICATE,
        RATE_LIMITED,
        CASCADE
    }
}
