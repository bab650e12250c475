package io.agentgovernor.budget;

/**
 * @param softLimitReached true when the request would cross the dimension's soft threshold;
 *                         informational only, it never turns {@code ok} false
 */
public record BudgetCheck(boolean ok, String reason, boolean softLimitReached) {
    private static final BudgetCheck OK = new BudgetCheck(true, null, false);

    public static BudgetCheck allowed() {
        return OK;
    }

    public static BudgetCheck allowedNearLimit() {
        return new BudgetCheck(true, null, true);
    }

    public static BudgetCheck denied(String reason) {
        return new BudgetCheck(false, reason, false);
    }
}
