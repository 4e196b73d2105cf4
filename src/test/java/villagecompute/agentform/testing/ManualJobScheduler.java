package villagecompute.agentform.testing;

import villagecompute.agentform.jobs.JobQueue;
import villagecompute.agentform.jobs.JobScheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Collects scheduled tasks and runs them on the test thread, in submission order.
 */
public class ManualJobScheduler implements JobScheduler {

    private static final int MAX_TASKS_PER_DRAIN = 1_000;

    public record ScheduledTask(JobQueue queue, Duration delay, Runnable task) {
    }

    private final Deque<ScheduledTask> pending = new ArrayDeque<>();
    private final List<ScheduledTask> history = new ArrayList<>();

    @Override
    public synchronized void schedule(JobQueue queue, Duration delay, Runnable task) {
        ScheduledTask scheduled = new ScheduledTask(queue, delay, task);
        pending.addLast(scheduled);
        history.add(scheduled);
    }

    /**
     * Runs the oldest pending task.
     *
     * @return false if nothing was pending
     */
    public boolean runNext() {
        ScheduledTask next;
        synchronized (this) {
            next = pending.pollFirst();
        }
        if (next == null) {
            return false;
        }
        next.task().run();
        return true;
    }

    /**
     * Runs pending tasks, including ones scheduled while draining, until none are left.
     *
     * @return number of tasks run
     */
    public int runAll() {
        int count = 0;
        while (runNext()) {
            if (++count > MAX_TASKS_PER_DRAIN) {
                throw new IllegalStateException("Scheduler did not drain after " + MAX_TASKS_PER_DRAIN + " tasks");
            }
        }
        return count;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Every task ever scheduled, including those already run.
     */
    public synchronized List<ScheduledTask> history() {
        return List.copyOf(history);
    }
}
