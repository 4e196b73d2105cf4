package villagecompute.agentform.workflow;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative retry rules for a step (inline retries) or a job type (outer retries).
 *
 * <p>
 * <b>Evaluation order</b> for {@link #decide(ErrorCategory, int)}:
 * <ol>
 * <li>Category in {@code fatalCategories}: give up, whatever the attempt number</li>
 * <li>{@code rate_limited}: defer by {@code rateLimitDelay} without consuming an attempt</li>
 * <li>{@code circuit_open}: defer by {@code circuitOpenDelay} without consuming an attempt</li>
 * <li>Per-category override present: its attempt limit, base delay and backoff apply</li>
 * <li>{@code unknown} without an override: fixed backoff, at most {@value #UNKNOWN_ATTEMPT_CAP} attempts</li>
 * <li>Otherwise retry while {@code attempt < maxAttempts} and the category is retryable (an empty
 * {@code retryableCategories} set means every non-fatal category is retryable)</li>
 * </ol>
 *
 * <p>
 * Delays are deterministic; no jitter is applied.
 *
 * <p>
 * Instances are immutable and thread-safe. Build with {@link #builder()}.
 */
public final class RetryPolicy {

    static final int UNKNOWN_ATTEMPT_CAP = 3;

    private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(5);
    private static final Duration DEFAULT_RATE_LIMIT_DELAY = Duration.ofMinutes(5);
    private static final Duration DEFAULT_CIRCUIT_OPEN_DELAY = Duration.ofSeconds(60);

    private static final RetryPolicy NONE = builder().maxAttempts(1).build();

    /**
     * Attempt limit, delay and backoff that replace the policy defaults for one category.
     */
    public record CategoryOverride(int maxAttempts, Duration baseDelay, BackoffStrategy backoff) {
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final BackoffStrategy backoff;
    private final Set<ErrorCategory> retryableCategories;
    private final Set<ErrorCategory> fatalCategories;
    private final Map<ErrorCategory, CategoryOverride> overrides;
    private final Duration rateLimitDelay;
    private final Duration circuitOpenDelay;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.backoff = builder.backoff;
        this.retryableCategories = Collections.unmodifiableSet(EnumSet.copyOf(builder.retryable));
        this.fatalCategories = Collections.unmodifiableSet(EnumSet.copyOf(builder.fatal));
        this.overrides = Collections.unmodifiableMap(new EnumMap<>(builder.overrides));
        this.rateLimitDelay = builder.rateLimitDelay;
        this.circuitOpenDelay = builder.circuitOpenDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Single attempt, no retries. Deferrals are still reported so the host can reschedule.
     */
    public static RetryPolicy none() {
        return NONE;
    }

    /**
     * Decides what to do after attempt {@code attemptNumber} (1-indexed) failed with {@code category}.
     */
    public RetryDecision decide(ErrorCategory category, int attemptNumber) {
        Objects.requireNonNull(category, "category is required");
        if (fatalCategories.contains(category)) {
            return RetryDecision.giveUp();
        }
        if (category == ErrorCategory.RATE_LIMITED) {
            return RetryDecision.defer(rateLimitDelay);
        }
        if (category == ErrorCategory.CIRCUIT_OPEN) {
            return RetryDecision.defer(circuitOpenDelay);
        }

        CategoryOverride override = overrides.get(category);
        if (override != null) {
            if (attemptNumber < override.maxAttempts()) {
                return RetryDecision.retry(override.backoff().delayFor(override.baseDelay(), attemptNumber));
            }
            return RetryDecision.giveUp();
        }

        if (!retryableCategories.isEmpty() && !retryableCategories.contains(category)) {
            return RetryDecision.giveUp();
        }

        if (category == ErrorCategory.UNKNOWN) {
            int cap = Math.min(maxAttempts, UNKNOWN_ATTEMPT_CAP);
            return attemptNumber < cap ? RetryDecision.retry(BackoffStrategy.FIXED.delayFor(baseDelay, attemptNumber))
                    : RetryDecision.giveUp();
        }

        if (attemptNumber < maxAttempts) {
            return RetryDecision.retry(backoff.delayFor(baseDelay, attemptNumber));
        }
        return RetryDecision.giveUp();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public BackoffStrategy getBackoff() {
        return backoff;
    }

    public Set<ErrorCategory> getRetryableCategories() {
        return retryableCategories;
    }

    public Set<ErrorCategory> getFatalCategories() {
        return fatalCategories;
    }

    public Map<ErrorCategory, CategoryOverride> getOverrides() {
        return overrides;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + ", backoff=" + backoff
                + ", retryable=" + retryableCategories + ", fatal=" + fatalCategories + ", overrides=" + overrides
                + '}';
    }

    public static final class Builder {

        private int maxAttempts = 1;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private BackoffStrategy backoff = BackoffStrategy.EXPONENTIAL;
        private final Set<ErrorCategory> retryable = EnumSet.noneOf(ErrorCategory.class);
        private final Set<ErrorCategory> fatal = EnumSet.of(ErrorCategory.VALIDATION);
        private final Map<ErrorCategory, CategoryOverride> overrides = new EnumMap<>(ErrorCategory.class);
        private Duration rateLimitDelay = DEFAULT_RATE_LIMIT_DELAY;
        private Duration circuitOpenDelay = DEFAULT_CIRCUIT_OPEN_DELAY;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay is required");
            return this;
        }

        public Builder backoff(BackoffStrategy backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff is required");
            return this;
        }

        /**
         * Restricts retries to these categories. Leaving the set empty retries every non-fatal category.
         */
        public Builder retryOn(ErrorCategory... categories) {
            retryable.clear();
            Collections.addAll(retryable, categories);
            return this;
        }

        /**
         * Replaces the fatal set (default: {@code validation}).
         */
        public Builder fatal(ErrorCategory... categories) {
            fatal.clear();
            Collections.addAll(fatal, categories);
            return this;
        }

        public Builder override(ErrorCategory category, int attempts, Duration delay, BackoffStrategy strategy) {
            if (attempts < 1) {
                throw new IllegalArgumentException("override attempts must be >= 1");
            }
            overrides.put(category, new CategoryOverride(attempts, delay, strategy));
            return this;
        }

        public Builder rateLimitDelay(Duration delay) {
            this.rateLimitDelay = Objects.requireNonNull(delay, "delay is required");
            return this;
        }

        public Builder circuitOpenDelay(Duration delay) {
            this.circuitOpenDelay = Objects.requireNonNull(delay, "delay is required");
            return this;
        }

        public RetryPolicy build() {
            for (ErrorCategory category : overrides.keySet()) {
                if (fatal.contains(category)) {
                    throw new IllegalArgumentException("Category " + category + " is both fatal and overridden");
                }
            }
            return new RetryPolicy(this);
        }
    }
}
