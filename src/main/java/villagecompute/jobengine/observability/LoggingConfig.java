package villagecompute.jobengine.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;
import villagecompute.jobengine.tenancy.TenantContext;

/**
 * Central definition of MDC fields for structured job-engine logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code tenant_id} - Owning tenant of the job, schedule or HTTP request ({@code system} for platform
 * schedules)</li>
 * <li>{@code job_id} - Job primary key while a worker executes it</li>
 * <li>{@code cron_job_id} - Schedule primary key while the tick fires it</li>
 * <li>{@code request_origin} - HTTP path, {@code job:<type>} or {@code tick}</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the worker pool:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setTenantId(job.tenantId);
 * LoggingConfig.setJobId(job.id);
 * LoggingConfig.setRequestOrigin("job:" + job.jobType);
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which is thread-local. Worker threads are pooled, so every
 * execution must end with {@link #clearMDC()}.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_TENANT_ID = "tenant_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_CRON_JOB_ID = "cron_job_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active so the log format stays stable.
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

    /**
     * Sets the tenant key; null tenants are logged as {@code system}.
     */
    public static void setTenantId(String tenantId) {
        MDC.put(MDC_TENANT_ID, TenantContext.keyOf(tenantId));
    }

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setCronJobId(Long cronJobId) {
        if (cronJobId != null) {
            MDC.put(MDC_CRON_JOB_ID, cronJobId.toString());
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all job-engine MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_TENANT_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_CRON_JOB_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
