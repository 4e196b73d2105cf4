package villagecompute.agentform.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;
import villagecompute.agentform.data.models.WorkUnit;

/**
 * Standard MDC field names and helpers for structured logging of orchestration runs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier for distributed tracing</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code work_unit_id} - Work unit being processed (e.g. form response id)</li>
 * <li>{@code event_type} - Triggering event ({@code form_completed}, {@code response_analyzed}, ...)</li>
 * <li>{@code job_queue} - Queue family the run was dispatched on</li>
 * <li>{@code attempt} - Outer attempt number (1-indexed)</li>
 * <li>{@code step_name} - Workflow step currently executing</li>
 * <li>{@code user_id} - Form owner whose credits and limits apply</li>
 * <li>{@code rate_limit_bucket} - Rate limiting bucket key</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the job runtime:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setWorkUnit(workUnit);
 * LoggingConfig.setAttempt(attempt);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Worker threads are reused,
 * so every run must clear MDC when it ends.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_WORK_UNIT_ID = "work_unit_id";

    public static final String MDC_EVENT_TYPE = "event_type";

    public static final String MDC_JOB_QUEUE = "job_queue";

    public static final String MDC_ATTEMPT = "attempt";

    public static final String MDC_STEP_NAME = "step_name";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_RATE_LIMIT_BUCKET = "rate_limit_bucket";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Empty strings are used when no span is active
     * so the log format stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setWorkUnit(WorkUnit workUnit) {
        if (workUnit != null) {
            MDC.put(MDC_WORK_UNIT_ID, workUnit.id());
            MDC.put(MDC_EVENT_TYPE, workUnit.eventType().getWireName());
        }
    }

    public static void setJobQueue(String queue) {
        if (queue != null) {
            MDC.put(MDC_JOB_QUEUE, queue);
        }
    }

    public static void setAttempt(int attempt) {
        MDC.put(MDC_ATTEMPT, Integer.toString(attempt));
    }

    public static void setStepName(String stepName) {
        if (stepName != null) {
            MDC.put(MDC_STEP_NAME, stepName);
        }
    }

    public static void clearStepName() {
        MDC.remove(MDC_STEP_NAME);
    }

    public static void setUserId(String userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId);
        }
    }

    public static void setRateLimitBucket(String rateLimitBucket) {
        if (rateLimitBucket != null) {
            MDC.put(MDC_RATE_LIMIT_BUCKET, rateLimitBucket);
        }
    }

    /**
     * Clears all orchestration MDC fields.
     *
     * <p>
     * <b>Critical:</b> Failure to clear MDC can cause logs from one run to carry stale context from a previous run on
     * the same worker thread.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_WORK_UNIT_ID);
        MDC.remove(MDC_EVENT_TYPE);
        MDC.remove(MDC_JOB_QUEUE);
        MDC.remove(MDC_ATTEMPT);
        MDC.remove(MDC_STEP_NAME);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_RATE_LIMIT_BUCKET);
    }
}
