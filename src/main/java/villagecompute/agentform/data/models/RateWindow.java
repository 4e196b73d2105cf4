package villagecompute.agentform.data.models;

import java.time.Duration;
import java.time.Instant;

/**
 * Rolling rate-limit window for one tenant. The window opens on the first acquisition and expires a fixed duration
 * later; it is not aligned to clock minutes.
 *
 * @param tenantKey
 *            bucket key (e.g. {@code ai_rate_limit:form-42})
 * @param windowStart
 *            time of the first acquisition in this window
 * @param count
 *            acquisitions granted in this window
 * @param limit
 *            acquisitions allowed per window
 */
public record RateWindow(String tenantKey, Instant windowStart, int count, int limit) {

    public static RateWindow open(String tenantKey, Instant now, int limit) {
        return new RateWindow(tenantKey, now, 0, limit);
    }

    public boolean isExpired(Instant now, Duration length) {
        return !now.isBefore(windowStart.plus(length));
    }

    public boolean isExhausted() {
        return count >= limit;
    }

    public RateWindow increment() {
        return new RateWindow(tenantKey, windowStart, count + 1, limit);
    }

    public int remaining() {
        return Math.max(0, limit - count);
    }

    public Instant resetsAt(Duration length) {
        return windowStart.plus(length);
    }
}
