package villagecompute.agentform.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Time-windowed duplicate suppression for side-effecting steps.
 *
 * <p>
 * A marker records when a key was processed and how long it stays valid. {@link #shouldProcess} returns false while a
 * marker exists that is younger than both the caller's window and the marker's own window.
 */
@ApplicationScoped
public class IdempotencyGuard {

    private static final Logger LOG = Logger.getLogger(IdempotencyGuard.class);

    @Inject
    Clock clock;

    private final Cache<String, Marker> markers = Caffeine.newBuilder().expireAfterWrite(1, TimeUnit.DAYS)
            .maximumSize(100_000).build();

    record Marker(Instant markedAt, Duration validFor) {
    }

    /**
     * Marker key for one step of one work unit.
     */
    public static String key(String workUnitId, String stepName) {
        return workUnitId + ":" + stepName;
    }

    public boolean shouldProcess(String key, long windowSeconds) {
        Marker marker = markers.getIfPresent(key);
        if (marker == null) {
            return true;
        }
        Duration age = Duration.between(marker.markedAt(), clock.instant());
        boolean fresh = age.compareTo(Duration.ofSeconds(windowSeconds)) < 0 && age.compareTo(marker.validFor()) < 0;
        if (fresh) {
            LOG.debugf("Suppressing duplicate processing of %s (marked %ds ago)", key, age.toSeconds());
        }
        return !fresh;
    }

    public void markProcessed(String key, long windowSeconds) {
        markers.put(key, new Marker(clock.instant(), Duration.ofSeconds(windowSeconds)));
    }
}
