/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.schedule.CronSchedule;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Drives one pipeline: wait for the next fire time (or shutdown), run one tick
 * against the source, hand the resulting record to the sink, repeat.
 *
 * <p>States: {@link PollState#WAITING} → {@link PollState#QUERYING} →
 * {@link PollState#EMITTING} → back to WAITING, until {@link PollState#SHUTTING_DOWN}.</p>
 *
 * <ul>
 * <li>Single worker thread; ticks never overlap and records reach the sink in tick order.</li>
 * <li>The next fire time is always computed from the current time, so late ticks are dropped, not replayed.</li>
 * <li>Without a schedule the loop runs one tick immediately and completes.</li>
 * <li>Shutdown is observed while waiting and at the top of every iteration. An in-flight
 * query is allowed to finish.</li>
 * <li>The orchestrator owns the source and the sink and closes both when the loop ends.</li>
 * </ul>
 */
public final class PollOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PollOrchestrator.class);

    // Metric names
    static final String METRIC_TICKS = "poll.ticks";
    static final String METRIC_ROWS = "poll.rows";
    static final String METRIC_RECORDS = "poll.records.emitted";
    static final String METRIC_FAILURES = "poll.tick.failures";
    static final String METRIC_QUERY_LATENCY = "poll.query.latency";

    // Core Components
    private final String name;
    private final SourceConnector source;
    private final OutputSink<GenericValue> sink;
    private final CronSchedule schedule;
    private final ShutdownSignal shutdown;
    private final MetricsRuntime metrics;
    private final FailurePolicy failurePolicy;
    private final Clock clock;
    private final TickWaiter waiter;

    // Runtime State
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<PollOutcome> completion = new CompletableFuture<>();
    private volatile PollState state = PollState.WAITING;

    // Counters
    private final LongAdder ticks = new LongAdder();
    private final LongAdder recordsEmitted = new LongAdder();
    private final LongAdder failedTicks = new LongAdder();

    /**
     * @param schedule {@code null} runs the statement exactly once
     */
    public PollOrchestrator(String name,
                            SourceConnector source,
                            OutputSink<GenericValue> sink,
                            CronSchedule schedule,
                            ShutdownSignal shutdown,
                            MetricsRuntime metrics,
                            FailurePolicy failurePolicy) {
        this(name, source, sink, schedule, shutdown, metrics, failurePolicy, Clock.systemUTC(), null);
    }

    PollOrchestrator(String name,
                     SourceConnector source,
                     OutputSink<GenericValue> sink,
                     CronSchedule schedule,
                     ShutdownSignal shutdown,
                     MetricsRuntime metrics,
                     FailurePolicy failurePolicy,
                     Clock clock,
                     TickWaiter waiter) {
        this.name = (name != null && !name.isBlank()) ? name.trim() : "default";
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.schedule = schedule;
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
        this.metrics = Objects.requireNonNull(metrics, "metrics").tagged("pipeline", this.name);
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.waiter = (waiter != null) ? waiter : shutdown::await;
    }

    // --- Lifecycle ---

    /**
     * Run the loop on a dedicated thread named {@code poll-<name>}.
     */
    public void start() {
        markStarted();
        final Thread t = new Thread(() -> completion.complete(runLoop()), "poll-" + name);
        t.start();
    }

    /**
     * Run the loop on the calling thread until it ends.
     */
    public PollOutcome run() {
        markStarted();
        final PollOutcome outcome = runLoop();
        completion.complete(outcome);
        return outcome;
    }

    /**
     * Raise the shutdown signal and wait up to {@code timeout} for the loop to end.
     * A query in flight is allowed to finish first.
     *
     * @return {@code true} if the loop ended within the timeout
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        log.info("Stop requested for pipeline '{}' (state={})", name, state);
        shutdown.raise();
        if (!started.get()) return true;
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Pipeline '{}' did not stop within {} (state={})", name, timeout, state);
            return false;
        } catch (ExecutionException e) {
            // runLoop() never completes exceptionally
            throw new IllegalStateException("Poll loop for '" + name + "' failed unexpectedly", e.getCause());
        }
    }

    public CompletableFuture<PollOutcome> completion() {
        return completion;
    }

    public String name() {
        return name;
    }

    public PollState state() {
        return state;
    }

    public long ticks() {
        return ticks.sum();
    }

    public long recordsEmitted() {
        return recordsEmitted.sum();
    }

    public long failedTicks() {
        return failedTicks.sum();
    }

    // --- Loop ---

    private void markStarted() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline '" + name + "' already started");
        }
    }

    private PollOutcome runLoop() {
        log.info("Pipeline '{}' starting: schedule={} source={} sink={} acknowledgements={}",
                name, (schedule != null ? schedule : "<run once>"), source.type(), sink.id(),
                source.canAcknowledge() ? "supported" : "unsupported");

        try {
            source.connect();
            return loop();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.info("Pipeline '{}' interrupted", name);
            return outcome(PollOutcome.Status.STOPPED, null);
        } catch (RuntimeException e) {
            log.error("Pipeline '{}' crashed", name, e);
            return outcome(PollOutcome.Status.FAILED, e);
        } finally {
            state = PollState.SHUTTING_DOWN;
            safeClose(sink, "sink");
            safeDisconnectSource();
            log.info("Pipeline '{}' stopped. ticks={} records={} failedTicks={}",
                    name, ticks.sum(), recordsEmitted.sum(), failedTicks.sum());
        }
    }

    private PollOutcome loop() throws InterruptedException {
        int consecutiveFailures = 0;

        while (true) {
            if (shutdown.isRaised()) {
                log.debug("Shutdown observed by pipeline '{}'", name);
                return outcome(PollOutcome.Status.STOPPED, null);
            }

            // 1. WAITING
            if (schedule != null) {
                state = PollState.WAITING;
                final Instant now = clock.instant();
                final Instant fireAt = schedule.nextFireTime(now);
                final Duration delay = Duration.between(now, fireAt);
                log.debug("Pipeline '{}' sleeping {}s until {}", name, delay.toSeconds(), fireAt);

                if (waiter.awaitShutdown(delay)) {
                    log.debug("Shutting down pipeline '{}' while waiting", name);
                    return outcome(PollOutcome.Status.STOPPED, null);
                }
            }

            // 2. QUERYING
            state = PollState.QUERYING;
            ticks.increment();
            metrics.increment(METRIC_TICKS);

            final long startNs = System.nanoTime();
            final List<GenericValue> rows;
            try {
                rows = source.poll();
            } catch (SourceException e) {
                failedTicks.increment();
                metrics.increment(METRIC_FAILURES);
                consecutiveFailures++;

                if (failurePolicy.failFast()) {
                    log.error("Pipeline '{}' tick failed (Fail-Fast)", name, e);
                    return outcome(PollOutcome.Status.FAILED, e);
                }
                if (consecutiveFailures >= failurePolicy.maxConsecutiveFailures()) {
                    log.error("Pipeline '{}' giving up after {} consecutive failed ticks", name, consecutiveFailures, e);
                    return outcome(PollOutcome.Status.FAILED, e);
                }

                final long backoffMs = failurePolicy.backoffMillis(consecutiveFailures);
                log.error("Pipeline '{}' tick failed ({} in a row), resuming in {}ms", name, consecutiveFailures, backoffMs, e);
                if (backoffMs > 0 && waiter.awaitShutdown(Duration.ofMillis(backoffMs))) {
                    return outcome(PollOutcome.Status.STOPPED, null);
                }
                continue;
            }
            consecutiveFailures = 0;
            metrics.record(METRIC_QUERY_LATENCY, Duration.ofNanos(System.nanoTime() - startNs));
            metrics.count(METRIC_ROWS, rows.size());

            // 3. EMITTING
            state = PollState.EMITTING;
            final PipelinePayload<GenericValue> record = EventRecords.of(clock.instant(), rows, source.type(), name);
            try {
                sink.writeBatch(List.of(record));
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                log.error("Pipeline '{}' sink hand-off failed id={}", name, record.id(), e);
                return outcome(PollOutcome.Status.FAILED, e);
            }
            recordsEmitted.increment();
            metrics.increment(METRIC_RECORDS);
            log.debug("Pipeline '{}' emitted record id={} rows={}", name, record.id(), rows.size());

            if (schedule == null) {
                log.info("Pipeline '{}' has no schedule; single run complete", name);
                return outcome(PollOutcome.Status.COMPLETED, null);
            }
        }
    }

    // --- Helpers ---

    private PollOutcome outcome(PollOutcome.Status status, Throwable failure) {
        return new PollOutcome(status, ticks.sum(), recordsEmitted.sum(), failure);
    }

    private void safeClose(AutoCloseable c, String what) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {} of pipeline '{}'", what, name, e);
        }
    }

    private void safeDisconnectSource() {
        try {
            source.disconnect();
        } catch (RuntimeException e) {
            log.warn("Error disconnecting source of pipeline '{}'", name, e);
        }
    }
}
