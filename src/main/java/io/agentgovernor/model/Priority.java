package io.agentgovernor.model;

/**
 * Ordered priority shared by task submissions and events. {@link #weight()} keeps the
 * numeric scale agents already use when they serialize priorities.
 */
public enum Priority {
    LOW("low", 1),
    NORMAL("normal", 5),
    HIGH("high", 8),
    CRITICAL("critical", 10);

    private final String label;
    private final int weight;

    Priority(String label, int weight) {
        this.label = label;
        this.weight = weight;
    }

    public String label() {
        return label;
    }

    public int weight() {
        return weight;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        String value = raw.trim();
        for (Priority priority : values()) {
            if (priority.name().equalsIgnoreCase(value)
                    || priority.label.equalsIgnoreCase(value)
                    || String.valueOf(priority.weight).equals(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
