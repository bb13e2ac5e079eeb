/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching engine logs with contextual metadata.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - User whose reputation, score or claim is being processed</li>
 * <li>{@code campaign_id} - Incentive campaign of a claim</li>
 * <li>{@code job_id} - Background job run identifier</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(runId);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers clear MDC at the
 * end of processing to prevent context leakage across pooled threads.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_CAMPAIGN_ID = "campaign_id";

    /**
     * Background job run identifier (for example {@code reputation-sync-1718000000000}).
     */
    public static final String MDC_JOB_ID = "job_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Without an active span the fields
     * are set to empty strings to keep the log structure stable.
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

    public static void setUserId(String userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId);
        }
    }

    public static void setCampaignId(String campaignId) {
        if (campaignId != null) {
            MDC.put(MDC_CAMPAIGN_ID, campaignId);
        }
    }

    public static void setJobId(String jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
    }

    /**
     * Clears all engine MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_CAMPAIGN_ID);
        MDC.remove(MDC_JOB_ID);
    }
}
