package villagecompute.detector.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching logs with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier for distributed tracing</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP method and path, or {@code batch} for batch workers</li>
 * <li>{@code request_id} - Per-request correlation id (client {@code X-Request-Id} header or generated UUID)</li>
 * <li>{@code detector_model} - Effective model identifier for the detection being logged</li>
 * </ul>
 *
 * <p>
 * <b>Usage in HTTP Filters:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRequestOrigin("POST /detect-country");
 * LoggingConfig.setRequestId(requestId);
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Batch worker threads make
 * their item span current, call {@link #enrichWithTraceContext()}, copy the caller's request id with
 * {@link #setRequestId(String)} and clear everything when the item completes.
 *
 * @see LoggingEnricher for automatic HTTP request enrichment
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * HTTP method and path (e.g., "POST /batch-detect").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    /**
     * Correlation id shared by every log line of one HTTP request, including its batch items.
     */
    public static final String MDC_REQUEST_ID = "request_id";

    /**
     * Effective model identifier (e.g., "claude-3-5-haiku-20241022").
     */
    public static final String MDC_MODEL = "detector_model";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. If no active span exists, the fields
     * are set to empty strings to maintain consistent log structure.
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

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setRequestId(String requestId) {
        if (requestId != null) {
            MDC.put(MDC_REQUEST_ID, requestId);
        }
    }

    /**
     * Returns the request id of the current thread, or null outside a request.
     */
    public static String getRequestId() {
        Object value = MDC.get(MDC_REQUEST_ID);
        return value != null ? value.toString() : null;
    }

    public static void setModel(String model) {
        if (model != null) {
            MDC.put(MDC_MODEL, model);
        }
    }

    /**
     * Clears all observability-related MDC fields. Must be called at the end of every request to prevent context
     * leakage across thread reuse.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_REQUEST_ID);
        MDC.remove(MDC_MODEL);
    }
}
