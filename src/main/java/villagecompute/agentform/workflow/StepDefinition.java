package villagecompute.agentform.workflow;

import java.util.Objects;

/**
 * One entry in a workflow's ordered step list.
 *
 * <p>
 * Gates are optional:
 * <ul>
 * <li>{@code creditAccountId}: paid step; skipped (not failed) when the account is below the credit floor</li>
 * <li>{@code rateLimitKey}: acquires a slot from the tenant's rolling window before the body runs; a denied slot fails
 * the attempt as {@code rate_limited}</li>
 * <li>{@code retryPolicy}: inline retries within the same run (default: none)</li>
 * </ul>
 *
 * @param rateLimit
 *            per-window limit for {@code rateLimitKey}; {@code 0} uses the tenant default
 */
public record StepDefinition(String name, boolean required, StepAction action, RetryPolicy retryPolicy,
        String creditAccountId, String rateLimitKey, int rateLimit) {

    public StepDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(action, "action is required");
        retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
    }

    public static StepDefinition required(String name, StepAction action) {
        return new StepDefinition(name, true, action, null, null, null, 0);
    }

    public static StepDefinition optional(String name, StepAction action) {
        return new StepDefinition(name, false, action, null, null, null, 0);
    }

    public StepDefinition withRetry(RetryPolicy policy) {
        return new StepDefinition(name, required, action, policy, creditAccountId, rateLimitKey, rateLimit);
    }

    public StepDefinition paidBy(String userId) {
        return new StepDefinition(name, required, action, retryPolicy, userId, rateLimitKey, rateLimit);
    }

    public StepDefinition rateLimited(String tenantKey, int limit) {
        return new StepDefinition(name, required, action, retryPolicy, creditAccountId, tenantKey, limit);
    }

    public boolean isPaid() {
        return creditAccountId != null;
    }

    public boolean isRateLimited() {
        return rateLimitKey != null;
    }
}
