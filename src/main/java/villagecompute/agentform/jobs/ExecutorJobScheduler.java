package villagecompute.agentform.jobs;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link JobScheduler} backed by one {@link ScheduledExecutorService} per {@link JobQueue}.
 *
 * <p>
 * Pool sizes come from {@code orchestrator.jobs.workers.*}. Pending tasks are dropped on shutdown.
 */
@ApplicationScoped
public class ExecutorJobScheduler implements JobScheduler {

    private static final Logger LOG = Logger.getLogger(ExecutorJobScheduler.class);

    @ConfigProperty(
            name = "orchestrator.jobs.workers.default",
            defaultValue = "4")
    int defaultWorkers;

    @ConfigProperty(
            name = "orchestrator.jobs.workers.ai-processing",
            defaultValue = "2")
    int aiProcessingWorkers;

    @ConfigProperty(
            name = "orchestrator.jobs.workers.integrations",
            defaultValue = "4")
    int integrationWorkers;

    private final Map<JobQueue, ScheduledExecutorService> executors = new EnumMap<>(JobQueue.class);

    @PostConstruct
    void startWorkers() {
        for (JobQueue queue : JobQueue.values()) {
            int workers = workersFor(queue);
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(workers,
                    new ThreadFactoryBuilder().setNameFormat("job-" + queue.name().toLowerCase() + "-%d")
                            .setDaemon(true).build());
            executor.setRemoveOnCancelPolicy(true);
            executors.put(queue, executor);
            LOG.infof("Started %d workers for queue %s", workers, queue);
        }
    }

    @Override
    public void schedule(JobQueue queue, Duration delay, Runnable task) {
        ScheduledExecutorService executor = executors.get(queue);
        if (executor == null) {
            throw new IllegalStateException("No workers for queue " + queue);
        }
        executor.schedule(task, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void shutdown() {
        executors.forEach((queue, executor) -> {
            int pending = executor.shutdownNow().size();
            if (pending > 0) {
                LOG.warnf("Dropped %d pending jobs from queue %s on shutdown", pending, queue);
            }
        });
    }

    private int workersFor(JobQueue queue) {
        return switch (queue) {
            case AI_PROCESSING -> aiProcessingWorkers;
            case INTEGRATIONS -> integrationWorkers;
            default -> defaultWorkers;
        };
    }
}
