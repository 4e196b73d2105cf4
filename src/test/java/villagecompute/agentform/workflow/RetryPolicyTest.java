package villagecompute.agentform.workflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    @Test
    void testExponentialBackoff_doublesDelay() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(4).baseDelay(Duration.ofSeconds(2))
                .backoff(BackoffStrategy.EXPONENTIAL).build();

        assertEquals(Duration.ofSeconds(2), policy.decide(ErrorCategory.TIMEOUT, 1).delay());
        assertEquals(Duration.ofSeconds(4), policy.decide(ErrorCategory.TIMEOUT, 2).delay());
        assertEquals(Duration.ofSeconds(8), policy.decide(ErrorCategory.TIMEOUT, 3).delay());
        assertEquals(RetryDecision.Action.GIVE_UP, policy.decide(ErrorCategory.TIMEOUT, 4).action());
    }

    @Test
    void testPolynomialBackoff_squaresAttempt() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).baseDelay(Duration.ofSeconds(5))
                .backoff(BackoffStrategy.POLYNOMIAL).build();

        assertEquals(Duration.ofSeconds(5), policy.decide(ErrorCategory.EXTERNAL_API_ERROR, 1).delay());
        assertEquals(Duration.ofSeconds(20), policy.decide(ErrorCategory.EXTERNAL_API_ERROR, 2).delay());
    }

    @Test
    void testValidation_isFatalByDefault() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(5).build();

        assertNeverRetries(policy, ErrorCategory.VALIDATION);
    }

    @Test
    void testFatalCategories_neverRetryAtAnyAttempt() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(4).backoff(BackoffStrategy.EXPONENTIAL)
                .fatal(ErrorCategory.VALIDATION, ErrorCategory.NOT_FOUND, ErrorCategory.EXTERNAL_API_ERROR).build();

        for (ErrorCategory category : policy.getFatalCategories()) {
            assertNeverRetries(policy, category);
        }
        assertTrue(policy.decide(ErrorCategory.TIMEOUT, 1).shouldRetry());
    }

    @Test
    void testRateLimited_defersWithoutConsumingAttempt() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(1).rateLimitDelay(Duration.ofMinutes(5)).build();

        RetryDecision decision = policy.decide(ErrorCategory.RATE_LIMITED, 1);

        assertEquals(RetryDecision.Action.DEFER, decision.action());
        assertEquals(Duration.ofMinutes(5), decision.delay());
        assertTrue(decision.shouldRetry());
        assertFalse(decision.consumesAttempt());
    }

    @Test
    void testCircuitOpen_defers() {
        RetryPolicy policy = RetryPolicy.builder().circuitOpenDelay(Duration.ofSeconds(30)).build();

        assertEquals(RetryDecision.Action.DEFER, policy.decide(ErrorCategory.CIRCUIT_OPEN, 3).action());
        assertEquals(RetryDecision.Action.DEFER, RetryPolicy.none().decide(ErrorCategory.CIRCUIT_OPEN, 1).action());
    }

    @Test
    void testOverride_replacesAttemptsAndDelay() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(2).backoff(BackoffStrategy.POLYNOMIAL)
                .override(ErrorCategory.NOT_FOUND, 3, Duration.ofSeconds(5), BackoffStrategy.FIXED).build();

        assertEquals(RetryDecision.retry(Duration.ofSeconds(5)), policy.decide(ErrorCategory.NOT_FOUND, 1));
        assertEquals(RetryDecision.retry(Duration.ofSeconds(5)), policy.decide(ErrorCategory.NOT_FOUND, 2));
        assertEquals(RetryDecision.Action.GIVE_UP, policy.decide(ErrorCategory.NOT_FOUND, 3).action());
    }

    @Test
    void testRetryOn_restrictsCategories() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).retryOn(ErrorCategory.TIMEOUT).build();

        assertEquals(RetryDecision.Action.RETRY, policy.decide(ErrorCategory.TIMEOUT, 1).action());
        assertEquals(RetryDecision.Action.GIVE_UP, policy.decide(ErrorCategory.EXTERNAL_API_ERROR, 1).action());
    }

    @Test
    void testUnknown_cappedWithFixedDelay() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(10).baseDelay(Duration.ofSeconds(3)).build();

        assertEquals(RetryDecision.retry(Duration.ofSeconds(3)), policy.decide(ErrorCategory.UNKNOWN, 2));
        assertEquals(RetryDecision.Action.GIVE_UP, policy.decide(ErrorCategory.UNKNOWN, 3).action());
    }

    @Test
    void testNone_neverRetries() {
        assertEquals(RetryDecision.Action.GIVE_UP, RetryPolicy.none().decide(ErrorCategory.TIMEOUT, 1).action());
    }

    @Test
    void testBuilder_rejectsFatalOverride() {
        RetryPolicy.Builder builder = RetryPolicy.builder().override(ErrorCategory.VALIDATION, 2,
                Duration.ofSeconds(1), BackoffStrategy.FIXED);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void testBuilder_rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
    }

    private static void assertNeverRetries(RetryPolicy policy, ErrorCategory category) {
        for (int attempt = 0; attempt <= policy.getMaxAttempts() + 5; attempt++) {
            RetryDecision decision = policy.decide(category, attempt);
            assertEquals(RetryDecision.Action.GIVE_UP, decision.action(), category + " at attempt " + attempt);
            assertFalse(decision.shouldRetry(), category + " at attempt " + attempt);
        }
    }
}
