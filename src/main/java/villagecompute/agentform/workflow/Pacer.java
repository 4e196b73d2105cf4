package villagecompute.agentform.workflow;

import java.time.Duration;

/**
 * Waits between inline retry attempts of a step.
 */
@FunctionalInterface
public interface Pacer {

    void pause(Duration delay) throws InterruptedException;
}
