package io.agentgovernor.circuit;

public enum CircuitState {
    /** Normal operation. */
    CLOSED,
    /** Tripped; operations are blocked until the cooldown elapses. */
    OPEN,
    /** Probing; successes close the circuit, any failure reopens it. */
    HALF_OPEN
}
