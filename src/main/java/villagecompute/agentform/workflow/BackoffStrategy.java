package villagecompute.agentform.workflow;

import java.time.Duration;

/**
 * Delay formulas for retries. Attempt numbers are 1-indexed: the delay for attempt {@code n} is the wait after the
 * {@code n}-th attempt failed.
 */
public enum BackoffStrategy {

    /** {@code base} */
    FIXED("fixed") {
        @Override
        public Duration delayFor(Duration base, int attempt) {
            return base;
        }
    },

    /** {@code base * 2^(attempt - 1)}: 5s, 10s, 20s for a 5s base. */
    EXPONENTIAL("exponential") {
        @Override
        public Duration delayFor(Duration base, int attempt) {
            int exponent = Math.min(Math.max(attempt, 1) - 1, 30);
            return base.multipliedBy(1L << exponent);
        }
    },

    /** {@code base * attempt^2} */
    POLYNOMIAL("polynomial") {
        @Override
        public Duration delayFor(Duration base, int attempt) {
            long n = Math.max(attempt, 1);
            return base.multipliedBy(n * n);
        }
    };

    private final String wireName;

    BackoffStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public abstract Duration delayFor(Duration base, int attempt);
}
