/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.app;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.config.PipelineFactory;
import com.intuitivedesigns.pollkernel.core.PollOrchestrator;
import com.intuitivedesigns.pollkernel.core.PollOutcome;
import com.intuitivedesigns.pollkernel.core.ShutdownSignal;
import com.intuitivedesigns.pollkernel.metrics.MetricsFactory;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.metrics.MetricsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

public final class PollKernelApp {

    private static final Logger log = LoggerFactory.getLogger(PollKernelApp.class);

    // --- Config Keys ---
    static final String CFG_PIPELINES = "pipelines";
    static final String CFG_PIPELINE_PREFIX = "pipelines.";
    private static final String CFG_STOP_TIMEOUT_SECONDS = "app.stop.timeout.seconds";

    // --- Defaults ---
    static final String DEFAULT_PIPELINE = "default";
    private static final int DEFAULT_STOP_TIMEOUT_SECONDS = 30;

    private PollKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting PollKernel ===");

        int status;
        try {
            status = run(PipelineConfig.get());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for pipelines");
            status = 1;
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            status = 1;
        }

        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Build, start and await every configured pipeline.
     *
     * @return process exit status: {@code 1} if any pipeline failed
     */
    static int run(PipelineConfig config) throws InterruptedException {
        PipelineFactory.logAvailablePlugins();

        final MetricsRuntime metrics = MetricsFactory.init(MetricsSettings.from(config));
        final Duration stopTimeout = Duration.ofSeconds(
                Math.max(1, config.getInt(CFG_STOP_TIMEOUT_SECONDS, DEFAULT_STOP_TIMEOUT_SECONDS)));

        Thread hook = null;
        try {
            // 1. Assemble everything before starting anything
            final List<PollOrchestrator> pipelines = new ArrayList<>();
            for (Map.Entry<String, PipelineConfig> e : pipelineConfigs(config).entrySet()) {
                pipelines.add(PipelineFactory.createPipeline(e.getKey(), e.getValue(), metrics, new ShutdownSignal()));
            }

            // 2. Shutdown hook
            final AtomicBoolean shutdownStarted = new AtomicBoolean(false);
            hook = new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) return;
                log.info("Shutdown signal received.");
                stopAll(pipelines, stopTimeout);
            }, "pk-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            // 3. Launch
            for (PollOrchestrator p : pipelines) {
                p.start();
            }

            // 4. Await
            boolean anyFailed = false;
            for (PollOrchestrator p : pipelines) {
                final PollOutcome outcome = p.completion().join();
                if (outcome.failed()) {
                    anyFailed = true;
                    log.error("Pipeline '{}' FAILED after {} ticks: {}", p.name(), outcome.ticks(),
                            (outcome.failure() != null ? outcome.failure().getMessage() : "unknown"));
                } else {
                    log.info("Pipeline '{}' {} (ticks={}, records={})", p.name(), outcome.status(),
                            outcome.ticks(), outcome.recordsEmitted());
                }
            }
            return anyFailed ? 1 : 0;
        } finally {
            removeHook(hook);
            closeQuietly(metrics);
        }
    }

    /**
     * {@code pipelines=a,b} gives each name its own {@code pipelines.<name>.} key space;
     * without it the whole file describes one pipeline.
     */
    static Map<String, PipelineConfig> pipelineConfigs(PipelineConfig config) {
        final Map<String, PipelineConfig> out = new LinkedHashMap<>();
        final List<String> names = config.getList(CFG_PIPELINES);
        if (names.isEmpty()) {
            out.put(DEFAULT_PIPELINE, config);
            return out;
        }
        for (String name : names) {
            if (out.put(name, config.scoped(CFG_PIPELINE_PREFIX + name + ".")) != null) {
                log.warn("Pipeline '{}' listed twice in '{}'; using it once", name, CFG_PIPELINES);
            }
        }
        return out;
    }

    // --- Helpers ---

    private static void stopAll(List<PollOrchestrator> pipelines, Duration timeout) {
        // Stop each pipeline concurrently; a stuck query in one must not delay the others
        final List<Thread> stoppers = new ArrayList<>(pipelines.size());
        for (PollOrchestrator p : pipelines) {
            final Thread t = new Thread(() -> {
                try {
                    p.stop(timeout);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }, "pk-stop-" + p.name());
            stoppers.add(t);
            t.start();
        }
        for (Thread t : stoppers) {
            try {
                t.join(timeout.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static void removeHook(Thread hook) {
        if (hook == null) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; hook stays registered");
        }
    }

    private static void closeQuietly(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", c.getClass().getSimpleName(), e);
        }
    }
}
