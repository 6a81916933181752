package villagecompute.detector.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.detector.services.ResultCache;

import java.time.Duration;

/**
 * Unit tests for {@link DetectionMetrics} against an in-memory registry.
 */
class DetectionMetricsTest {

    private SimpleMeterRegistry registry;
    private DetectionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DetectionMetrics();
        metrics.registry = registry;
        metrics.resultCache = new ResultCache();
    }

    @Test
    void testRecordRequest_countsByEndpointAndStatus() {
        metrics.recordRequest("DetectionResource.detect", 200, Duration.ofMillis(12));
        metrics.recordRequest("DetectionResource.detect", 200, Duration.ofMillis(8));
        metrics.recordRequest("DetectionResource.detect", 400, Duration.ofMillis(1));

        assertEquals(2.0, registry.get("detector_requests_total").tag("endpoint", "DetectionResource.detect")
                .tag("status", "200").counter().count());
        assertEquals(1.0, registry.get("detector_requests_total").tag("status", "400").counter().count());
        assertEquals(3, registry.get("detector_request_duration").tag("endpoint", "DetectionResource.detect").timer()
                .count());
    }

    @Test
    void testIncrementOutcome() {
        metrics.incrementOutcome("model");
        metrics.incrementOutcome("model");
        metrics.incrementOutcome("auth_error");

        assertEquals(2.0, registry.get("detector_outcomes_total").tag("outcome", "model").counter().count());
        assertEquals(1.0, registry.get("detector_outcomes_total").tag("outcome", "auth_error").counter().count());
    }

    @Test
    void testCacheAndModelCounters() {
        metrics.incrementCacheHit();
        metrics.incrementCacheMiss();
        metrics.incrementCacheMiss();
        metrics.incrementAiCall(false);
        metrics.incrementAiCall(true);

        assertEquals(1.0, registry.get("detector_cache_hits_total").counter().count());
        assertEquals(2.0, registry.get("detector_cache_misses_total").counter().count());
        assertEquals(1.0, registry.get("detector_ai_calls_total").tag("custom", "true").counter().count());
    }

    @Test
    void testCacheSizeGauge() {
        metrics.registerMetrics(new Object());

        assertEquals(0.0, registry.get("detector_cache_size").gauge().value());
    }
}
