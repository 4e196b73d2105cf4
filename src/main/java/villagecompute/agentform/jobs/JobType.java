package villagecompute.agentform.jobs;

import villagecompute.agentform.data.models.EventType;

/**
 * Async job types, one per upstream event, with their queue assignments.
 *
 * <p>
 * Each job type maps to exactly one {@link JobQueue} family and one {@link EventType}. Handler implementations register
 * themselves with the corresponding job type for CDI discovery.
 *
 * @see JobQueue for queue family descriptions
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Post-completion workflow: analytics, integrations, AI analysis fan-out, notifications.
     * <p>
     * <b>Handler:</b> CompletionWorkflowJobHandler
     */
    COMPLETION_WORKFLOW(JobQueue.DEFAULT, EventType.FORM_COMPLETED, "Form completion workflow"),

    /**
     * AI analysis of a single answer: sentiment, quality, insights, follow-up recommendation.
     * <p>
     * <b>Handler:</b> ResponseAnalysisJobHandler
     */
    RESPONSE_ANALYSIS(JobQueue.AI_PROCESSING, EventType.RESPONSE_ANALYZED, "Answer analysis"),

    /**
     * Generates a follow-up question from a source answer.
     * <p>
     * <b>Handler:</b> DynamicQuestionJobHandler
     */
    DYNAMIC_QUESTION_GENERATION(JobQueue.AI_PROCESSING, EventType.DYNAMIC_QUESTION_REQUESTED,
            "Dynamic question generation"),

    /**
     * Delivers a form event to the form's configured integrations.
     * <p>
     * <b>Handler:</b> IntegrationTriggerJobHandler
     */
    INTEGRATION_TRIGGER(JobQueue.INTEGRATIONS, EventType.INTEGRATION_TRIGGERED, "Integration delivery");

    private final JobQueue queue;
    private final EventType eventType;
    private final String description;

    JobType(JobQueue queue, EventType eventType, String description) {
        this.queue = queue;
        this.eventType = eventType;
        this.description = description;
    }

    public JobQueue getQueue() {
        return queue;
    }

    public EventType getEventType() {
        return eventType;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the job type that processes {@code eventType}.
     */
    public static JobType forEvent(EventType eventType) {
        for (JobType type : values()) {
            if (type.eventType == eventType) {
                return type;
            }
        }
        throw new IllegalArgumentException("No job type for event " + eventType);
    }
}
