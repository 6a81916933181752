/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import org.jboss.logging.Logger;

/**
 * Produces the bounded executor batch items are dispatched on.
 *
 * <p>
 * A fixed pool of {@code detector.batch.max-concurrency} daemon threads named {@code detector-batch-N}. The pool is
 * shut down when the application stops.
 */
@ApplicationScoped
public class DetectionExecutorConfig {

    private static final Logger LOG = Logger.getLogger(DetectionExecutorConfig.class);

    public static final String EXECUTOR_NAME = "detectionExecutor";

    @Inject
    DetectorConfig detectorConfig;

    @Produces
    @ApplicationScoped
    @Named(EXECUTOR_NAME)
    public ExecutorService detectionExecutor() {
        int threads = detectorConfig.batchMaxConcurrency();
        LOG.infof("Creating batch detection executor: threads=%d", threads);
        return Executors.newFixedThreadPool(threads, threadFactory());
    }

    void shutdown(@Disposes @Named(EXECUTOR_NAME) ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Batch detection executor did not terminate in 10s, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "detector-batch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
