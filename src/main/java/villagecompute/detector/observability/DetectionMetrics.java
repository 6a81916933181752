package villagecompute.detector.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.detector.services.ResultCache;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers and records the detector's custom metrics.
 *
 * <p>
 * All metrics follow the naming convention {@code detector_<metric>} and are exported in Prometheus format at
 * {@code /q/metrics}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code detector_requests_total{endpoint,status}} - HTTP requests by endpoint and status
 * code</li>
 * <li><b>Timers:</b> {@code detector_request_duration{endpoint}} - HTTP request latency</li>
 * <li><b>Counters:</b> {@code detector_outcomes_total{outcome}} - Detection outcomes: {@code cache}, {@code model},
 * {@code heuristic}, or a lower-cased error code</li>
 * <li><b>Counters:</b> {@code detector_cache_hits_total}, {@code detector_cache_misses_total} - Result cache
 * lookups</li>
 * <li><b>Counters:</b> {@code detector_ai_calls_total{custom}} - Model invocations, split by caller override</li>
 * <li><b>Gauges:</b> {@code detector_cache_size} - Current result cache occupancy</li>
 * </ul>
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class DetectionMetrics {

    private static final Logger LOG = Logger.getLogger(DetectionMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    ResultCache resultCache;

    /**
     * Request counters indexed by endpoint:status.
     */
    private final Map<String, Counter> requestCounters = new ConcurrentHashMap<>();

    /**
     * Request timers indexed by endpoint.
     */
    private final Map<String, Timer> requestTimers = new ConcurrentHashMap<>();

    /**
     * Outcome counters indexed by outcome.
     */
    private final Map<String, Counter> outcomeCounters = new ConcurrentHashMap<>();

    /**
     * Registers gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        Gauge.builder("detector_cache_size", resultCache, ResultCache::size)
                .description("Number of detection results currently cached").register(registry);
        LOG.debug("Registered gauge: detector_cache_size");
    }

    /**
     * Records one completed HTTP request.
     *
     * @param endpoint
     *            resource method, e.g. "DetectionResource.detect"
     * @param status
     *            HTTP status code
     * @param duration
     *            time spent serving the request
     */
    public void recordRequest(String endpoint, int status, Duration duration) {
        String statusTag = String.valueOf(status);
        requestCounters.computeIfAbsent(endpoint + ":" + statusTag,
                k -> Counter.builder("detector_requests_total").description("Total HTTP requests served")
                        .tags(List.of(Tag.of("endpoint", endpoint), Tag.of("status", statusTag))).register(registry))
                .increment();
        requestTimers.computeIfAbsent(endpoint, k -> Timer.builder("detector_request_duration")
                .description("HTTP request latency").tag("endpoint", endpoint).register(registry)).record(duration);
    }

    /**
     * Increments the outcome counter for one detection.
     *
     * @param outcome
     *            "cache", "model", "heuristic", or a lower-cased error code
     */
    public void incrementOutcome(String outcome) {
        outcomeCounters.computeIfAbsent(outcome,
                k -> Counter.builder("detector_outcomes_total").description("Detection outcomes by source or error")
                        .tag("outcome", outcome).register(registry))
                .increment();
    }

    public void incrementCacheHit() {
        Counter.builder("detector_cache_hits_total").description("Result cache hits").register(registry).increment();
    }

    public void incrementCacheMiss() {
        Counter.builder("detector_cache_misses_total").description("Result cache misses").register(registry)
                .increment();
    }

    /**
     * Increments the model invocation counter.
     *
     * @param custom
     *            true when the call used a caller-supplied model and credential
     */
    public void incrementAiCall(boolean custom) {
        Counter.builder("detector_ai_calls_total").description("Model invocations")
                .tag("custom", String.valueOf(custom)).register(registry).increment();
    }
}
