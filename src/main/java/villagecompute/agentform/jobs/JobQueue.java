package villagecompute.agentform.jobs;

/**
 * Queue families for async job processing.
 *
 * <p>Each family gets its own worker pool (see {@link ExecutorJobScheduler}), so slow AI calls never starve
 * completion workflows or outbound integrations.
 *
 * @see JobType for job-to-queue assignments
 */
public enum JobQueue {

    /**
     * DEFAULT queue - form completion workflows.
     * <p><b>Concurrency:</b> {@code orchestrator.jobs.workers.default} (default 4)
     */
    DEFAULT(5, "Standard priority for completion workflows"),

    /**
     * AI_PROCESSING queue - LLM-backed analysis and question generation.
     * <p><b>Concurrency:</b> {@code orchestrator.jobs.workers.ai-processing} (default 2); also bounded by per-form
     * rate limits and the {@code llm_workflow} circuit breaker
     */
    AI_PROCESSING(8, "AI workloads with credit and rate controls"),

    /**
     * INTEGRATIONS queue - outbound webhook, Slack and CRM deliveries.
     * <p><b>Concurrency:</b> {@code orchestrator.jobs.workers.integrations} (default 4)
     */
    INTEGRATIONS(3, "Outbound integration deliveries");

    private final int priority;
    private final String description;

    JobQueue(int priority, String description) {
        this.priority = priority;
        this.description = description;
    }

    /**
     * Returns the execution priority (lower values = higher priority).
     */
    public int getPriority() {
        return priority;
    }

    /**
     * Returns a human-readable description of the queue's purpose.
     */
    public String getDescription() {
        return description;
    }
}
