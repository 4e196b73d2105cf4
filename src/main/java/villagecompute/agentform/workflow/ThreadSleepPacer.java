package villagecompute.agentform.workflow;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;

/**
 * Default {@link Pacer}: blocks the worker thread for the retry delay. Inline retries are short (seconds); longer waits
 * go through the job scheduler instead.
 */
@ApplicationScoped
public class ThreadSleepPacer implements Pacer {

    @Override
    public void pause(Duration delay) throws InterruptedException {
        if (!delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
