package io.agentgovernor.budget;

public enum BudgetDimension {
    /** Monetary cost in USD. */
    COST("cost"),
    /** Model tokens. */
    TOKENS("tokens"),
    /** Wall-clock execution time in seconds. */
    TIME("time"),
    /** Concurrent operations. */
    CONCURRENCY("concurrency"),
    /** Outbound API calls. */
    API_CALLS("api_calls");

    private final String label;

    BudgetDimension(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static BudgetDimension fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Budget dimension must not be blank");
        }
        for (BudgetDimension value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown budget dimension: " + raw);
    }
}
