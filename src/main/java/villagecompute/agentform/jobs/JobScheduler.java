package villagecompute.agentform.jobs;

import java.time.Duration;

/**
 * Runs tasks on a queue family's workers after a delay.
 */
public interface JobScheduler {

    void schedule(JobQueue queue, Duration delay, Runnable task);
}
