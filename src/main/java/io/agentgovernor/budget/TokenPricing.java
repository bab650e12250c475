package io.agentgovernor.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Approximate USD prices per 1000 tokens, used to turn model token usage into the
 * {@link BudgetDimension#COST} dimension.
 */
public final class TokenPricing {
    private static final Logger log = LoggerFactory.getLogger(TokenPricing.class);

    public static final String DEFAULT_TIER = "gpt-4";

    private static final Map<String, Rate> RATES = Map.of(
            "gpt-4", new Rate(0.03d, 0.06d),
            "gpt-4-turbo", new Rate(0.01d, 0.03d),
            "gpt-3.5-turbo", new Rate(0.0005d, 0.0015d),
            "claude-3-opus", new Rate(0.015d, 0.075d),
            "claude-3-sonnet", new Rate(0.003d, 0.015d)
    );

    private TokenPricing() {
    }

    public static double tokenCost(String model, long promptTokens, long completionTokens) {
        if (promptTokens < 0L || completionTokens < 0L) {
            throw new IllegalArgumentException("Token counts must be >= 0");
        }
        Rate rate = rateFor(model);
        return (promptTokens / 1000.0d) * rate.prompt() + (completionTokens / 1000.0d) * rate.completion();
    }

    public static boolean known(String model) {
        return model != null && RATES.containsKey(model.trim().toLowerCase(Locale.ROOT));
    }

    public static Rate rateFor(String model) {
        Rate rate = model == null ? null : RATES.get(model.trim().toLowerCase(Locale.ROOT));
        if (rate == null) {
            log.warn("Unknown model {}, using {} pricing", model, DEFAULT_TIER);
            return RATES.get(DEFAULT_TIER);
        }
        return rate;
    }

    public record Rate(double prompt, double completion) {
    }
}
