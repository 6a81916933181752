package villagecompute.detector.observability;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.ext.Provider;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.UUID;

/**
 * Populates MDC for every HTTP request and records request metrics when the response is written.
 *
 * <p>
 * The request id is taken from the {@code X-Request-Id} header when present, otherwise generated, and echoed back on
 * the response. Metrics are tagged with {@code ResourceClass.method} so path parameters do not multiply series.
 *
 * @see LoggingConfig for field definitions
 * @see DetectionMetrics#recordRequest
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 100)
public class LoggingEnricher implements ContainerRequestFilter, ContainerResponseFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final String START_NANOS_PROPERTY = "villagecompute.detector.startNanos";

    @Inject
    DetectionMetrics detectionMetrics;

    @Context
    ResourceInfo resourceInfo;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        requestContext.setProperty(START_NANOS_PROPERTY, System.nanoTime());

        String requestId = requestContext.getHeaderString(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestId(requestId);
        String path = requestContext.getUriInfo().getRequestUri().getPath();
        LoggingConfig.setRequestOrigin(requestContext.getMethod() + " " + path);
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        try {
            String requestId = LoggingConfig.getRequestId();
            if (requestId != null) {
                responseContext.getHeaders().putSingle(REQUEST_ID_HEADER, requestId);
            }
            Object start = requestContext.getProperty(START_NANOS_PROPERTY);
            if (start instanceof Long startNanos) {
                detectionMetrics.recordRequest(endpoint(), responseContext.getStatus(),
                        Duration.ofNanos(System.nanoTime() - startNanos));
            }
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private String endpoint() {
        Method method = resourceInfo != null ? resourceInfo.getResourceMethod() : null;
        if (method == null) {
            return "unmatched";
        }
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
