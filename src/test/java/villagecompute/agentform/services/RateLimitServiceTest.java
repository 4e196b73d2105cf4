package villagecompute.agentform.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.agentform.observability.ObservabilityMetrics;
import villagecompute.agentform.testing.Concurrently;
import villagecompute.agentform.testing.MutableClock;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link RateLimitService}.
 */
class RateLimitServiceTest {

    @Mock
    ObservabilityMetrics observabilityMetrics;

    private RateLimitService rateLimitService;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = MutableClock.at("2025-03-01T10:00:30Z");
        rateLimitService = new RateLimitService();
        rateLimitService.clock = clock;
        rateLimitService.observabilityMetrics = observabilityMetrics;
        rateLimitService.defaultLimit = 10;
        rateLimitService.windowSeconds = 60;
        rateLimitService.rescheduleSeconds = 300;
    }

    @Test
    void testTryAcquire_deniesOnceLimitReached() {
        String bucket = RateLimitService.aiBucketKey("form-1");

        assertTrue(rateLimitService.tryAcquire(bucket, 2));
        assertTrue(rateLimitService.tryAcquire(bucket, 2));
        assertFalse(rateLimitService.tryAcquire(bucket, 2));

        verify(observabilityMetrics).incrementRateLimitCheck(bucket, false);
    }

    @Test
    void testTryAcquire_windowRollsFromFirstAcquisition() {
        String bucket = "ai_rate_limit:form-1";
        rateLimitService.tryAcquire(bucket, 1);

        // Crossing a clock minute does not reset a rolling window
        clock.advance(Duration.ofSeconds(45));
        assertFalse(rateLimitService.tryAcquire(bucket, 1));

        clock.advance(Duration.ofSeconds(15));
        assertTrue(rateLimitService.tryAcquire(bucket, 1));
    }

    @Test
    void testTryAcquire_tenPerMinute() {
        String bucket = RateLimitService.aiBucketKey("form-1");

        for (int i = 0; i < 10; i++) {
            assertTrue(rateLimitService.tryAcquire(bucket, 10), "call " + (i + 1));
        }
        assertFalse(rateLimitService.tryAcquire(bucket, 10));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(rateLimitService.tryAcquire(bucket, 10));
    }

    @Test
    void testTryAcquire_concurrentCallersNeverExceedLimit() throws Exception {
        String bucket = RateLimitService.aiBucketKey("form-1");

        List<Boolean> grants = Concurrently.run(200, () -> rateLimitService.tryAcquire(bucket, 10));

        assertEquals(10, grants.stream().filter(Boolean::booleanValue).count());
        assertEquals(0, rateLimitService.getRemaining(bucket));
    }

    @Test
    void testTryAcquire_bucketsAreIndependent() {
        assertTrue(rateLimitService.tryAcquire("ai_rate_limit:form-1", 1));
        assertTrue(rateLimitService.tryAcquire("ai_rate_limit:form-2", 1));
    }

    @Test
    void testCheckLimit_reportsRemaining() {
        RateLimitService.RateLimitResult result = rateLimitService.checkLimit("bucket", 3);

        assertTrue(result.allowed());
        assertEquals(2, result.remaining());
        assertEquals(60, result.windowSeconds());
        assertEquals(9, rateLimitService.getRemaining("bucket"));
    }

    @Test
    void testCheckLimit_invalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> rateLimitService.checkLimit("bucket", 0));
    }

    @Test
    void testTenantLimit_overridesDefault() {
        assertEquals(10, rateLimitService.limitFor("bucket"));

        rateLimitService.setTenantLimit("bucket", 1);

        assertEquals(1, rateLimitService.limitFor("bucket"));
        assertTrue(rateLimitService.tryAcquire("bucket"));
        assertFalse(rateLimitService.tryAcquire("bucket"));
        assertEquals(0, rateLimitService.getRemaining("bucket"));
    }

    @Test
    void testGetRescheduleDelay() {
        assertEquals(Duration.ofMinutes(5), rateLimitService.getRescheduleDelay());
    }
}
