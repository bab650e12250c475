package io.agentgovernor.model;

public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    REJECTED;

    public boolean active() {
        return this == PENDING || this == RUNNING;
    }
}
