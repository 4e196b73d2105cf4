package villagecompute.agentform.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.agentform.data.models.RateWindow;
import villagecompute.agentform.observability.LoggingConfig;
import villagecompute.agentform.observability.ObservabilityMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-tenant rate limiting for outbound AI calls, backed by a Caffeine cache of {@link RateWindow} counters.
 *
 * <p>
 * <b>Window semantics:</b> rolling from the first acquisition. A tenant's window opens on the first
 * {@link #tryAcquire} and expires {@code window-seconds} later; it is not aligned to clock minutes. Within a window the
 * first {@code limit} acquisitions succeed and the rest are denied; the first call after expiry opens a fresh window.
 *
 * <p>
 * <b>Thread Safety:</b> check-and-increment runs inside {@code asMap().compute}, so concurrent callers for the same
 * tenant never exceed the limit.
 *
 * <p>
 * Cache entries are evicted on wall-clock time only to bound memory; window expiry itself is decided against the
 * injected {@link Clock}.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    /** Bucket prefix for AI workflow calls, keyed per form. */
    public static final String AI_BUCKET_PREFIX = "ai_rate_limit:";

    @ConfigProperty(
            name = "orchestrator.rate-limit.default-per-minute",
            defaultValue = "10")
    int defaultLimit;

    @ConfigProperty(
            name = "orchestrator.rate-limit.window-seconds",
            defaultValue = "60")
    int windowSeconds;

    @ConfigProperty(
            name = "orchestrator.rate-limit.reschedule-seconds",
            defaultValue = "300")
    long rescheduleSeconds;

    @Inject
    Clock clock;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    private final Cache<String, RateWindow> windows = Caffeine.newBuilder().expireAfterWrite(30, TimeUnit.MINUTES)
            .maximumSize(100_000).build();

    /**
     * Tenant-specific limits that override {@code default-per-minute}.
     */
    private final ConcurrentMap<String, Integer> tenantLimits = new ConcurrentHashMap<>();

    /**
     * Rate limit check result with remaining attempts.
     */
    public record RateLimitResult(boolean allowed, int limitCount, int remaining, int windowSeconds) {

        public static RateLimitResult allowed(int limitCount, int remaining, int windowSeconds) {
            return new RateLimitResult(true, limitCount, remaining, windowSeconds);
        }

        public static RateLimitResult denied(int limitCount, int windowSeconds) {
            return new RateLimitResult(false, limitCount, 0, windowSeconds);
        }
    }

    public static String aiBucketKey(String formId) {
        return AI_BUCKET_PREFIX + formId;
    }

    /**
     * Acquires one slot for {@code tenantKey} under {@code limit}.
     *
     * @return true if allowed; false if the window is exhausted and the caller must back off
     */
    public boolean tryAcquire(String tenantKey, int limit) {
        return checkLimit(tenantKey, limit).allowed();
    }

    /**
     * Acquires one slot under the tenant's configured limit.
     */
    public boolean tryAcquire(String tenantKey) {
        return tryAcquire(tenantKey, limitFor(tenantKey));
    }

    public RateLimitResult checkLimit(String tenantKey, int limit) {
        Objects.requireNonNull(tenantKey, "tenantKey is required");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }

        Instant now = clock.instant();
        Duration window = Duration.ofSeconds(windowSeconds);
        AtomicBoolean allowed = new AtomicBoolean(false);

        RateWindow updated = windows.asMap().compute(tenantKey, (key, existing) -> {
            RateWindow current = existing == null || existing.isExpired(now, window) ? RateWindow.open(key, now, limit)
                    : existing;
            if (current.count() >= limit) {
                return current;
            }
            allowed.set(true);
            return new RateWindow(key, current.windowStart(), current.count() + 1, limit);
        });

        LoggingConfig.setRateLimitBucket(tenantKey);
        observabilityMetrics.incrementRateLimitCheck(tenantKey, allowed.get());

        if (!allowed.get()) {
            LOG.warnf("Rate limit exceeded: bucket=%s limit=%d resetsAt=%s", tenantKey, limit,
                    updated.resetsAt(window));
            return RateLimitResult.denied(limit, windowSeconds);
        }
        return RateLimitResult.allowed(limit, updated.remaining(), windowSeconds);
    }

    /**
     * Remaining acquisitions in the tenant's current window (the full limit if no window is open).
     */
    public int getRemaining(String tenantKey) {
        RateWindow window = windows.getIfPresent(tenantKey);
        int limit = limitFor(tenantKey);
        if (window == null || window.isExpired(clock.instant(), Duration.ofSeconds(windowSeconds))) {
            return limit;
        }
        return Math.max(0, limit - window.count());
    }

    public int limitFor(String tenantKey) {
        return tenantLimits.getOrDefault(tenantKey, defaultLimit);
    }

    /**
     * Overrides the per-window limit for one tenant (form-level AI configuration).
     */
    public void setTenantLimit(String tenantKey, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        tenantLimits.put(tenantKey, limit);
        LOG.infof("Updated tenant rate limit: bucket=%s limit=%d", tenantKey, limit);
    }

    /**
     * Delay before a rate-limited run is retried.
     */
    public Duration getRescheduleDelay() {
        return Duration.ofSeconds(rescheduleSeconds);
    }
}
