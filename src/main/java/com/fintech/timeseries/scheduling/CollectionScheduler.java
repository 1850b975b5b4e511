package com.fintech.timeseries.scheduling;

import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.ingestion.CollectionResult;
import com.fintech.timeseries.ingestion.CollectionStatus;
import com.fintech.timeseries.ingestion.CollectorStatusRegistry;
import com.fintech.timeseries.ingestion.SourceCollector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs every collector once per fixed interval, concurrently and in
 * isolation: a failing, slow or hung source never blocks the others.
 *
 * <p>Each collector task has a deadline measured from the moment it starts
 * running. A task that misses its deadline is cancelled and reported as
 * {@link CollectionStatus#TIMED_OUT}; the next cycle attempts it again. A
 * source whose previous task is still running is reported as
 * {@link CollectionStatus#SKIPPED} rather than run twice.
 */
public class CollectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(CollectionScheduler.class);

    public enum State {
        IDLE,
        CYCLE_RUNNING,
        STOPPED
    }

    private final List<SourceCollector> collectors;
    private final TimeSeriesProperties.Scheduler config;
    private final CollectorStatusRegistry statusRegistry;
    private final Clock clock;
    private final Timer cycleTimer;

    private final ExecutorService workers;
    private final ScheduledExecutorService ticker;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicReference<CycleSummary> lastSummary = new AtomicReference<>();
    private final AtomicLong cycles = new AtomicLong(0);
    private final AtomicLong failedTasks = new AtomicLong(0);

    public CollectionScheduler(
            List<SourceCollector> collectors,
            TimeSeriesProperties.Scheduler config,
            CollectorStatusRegistry statusRegistry,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.collectors = List.copyOf(collectors);
        this.config = config;
        requireCycleFitsInterval(this.collectors, config);
        this.statusRegistry = statusRegistry;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), named("collector"));
        this.ticker = Executors.newSingleThreadScheduledExecutor(named("collection-scheduler"));

        this.cycleTimer = meterRegistry.timer("timeseries.scheduler.cycle.time");
        meterRegistry.gauge("timeseries.scheduler.cycles", cycles);
        meterRegistry.gauge("timeseries.scheduler.tasks.failed", failedTasks);
    }

    /**
     * Rejects timings where a cycle could outlast the interval. Queued tasks
     * get their full timeout from the moment they start, so collectors beyond
     * the pool size run in further waves.
     *
     * @throws IllegalStateException if the worst-case cycle reaches the interval
     */
    static void requireCycleFitsInterval(List<SourceCollector> collectors, TimeSeriesProperties.Scheduler config) {
        if (collectors.isEmpty()) {
            return;
        }
        Duration longest = Duration.ZERO;
        for (SourceCollector collector : collectors) {
            Duration timeout = effectiveTimeout(collector, config);
            if (timeout.compareTo(config.getInterval()) >= 0) {
                throw new IllegalStateException("Task timeout " + timeout + " of source " + collector.getSourceId()
                    + " must be shorter than the scheduler interval " + config.getInterval());
            }
            if (timeout.compareTo(longest) > 0) {
                longest = timeout;
            }
        }
        int workers = Math.max(1, config.getWorkerThreads());
        int waves = (collectors.size() + workers - 1) / workers;
        Duration worstCase = longest.multipliedBy(waves);
        if (worstCase.compareTo(config.getInterval()) >= 0) {
            throw new IllegalStateException(collectors.size() + " sources on " + workers + " workers can take "
                + worstCase + ", which is not shorter than the scheduler interval " + config.getInterval()
                + "; add worker-threads or lower task-timeout");
        }
    }

    private static Duration effectiveTimeout(SourceCollector collector, TimeSeriesProperties.Scheduler config) {
        return collector.getTaskTimeout() != null ? collector.getTaskTimeout() : config.getTaskTimeout();
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Collection scheduler disabled; {} collectors registered", collectors.size());
            return;
        }
        ticker.scheduleAtFixedRate(this::runScheduledCycle,
            config.getInitialDelay().toMillis(), config.getInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Collection scheduler started: {} collectors every {} ({} workers, task timeout {})",
            collectors.size(), config.getInterval(), config.getWorkerThreads(), config.getTaskTimeout());
    }

    @PreDestroy
    public void stop() {
        if (state.getAndSet(State.STOPPED) == State.STOPPED) {
            return;
        }
        log.info("Stopping collection scheduler after {} cycles", cycles.get());
        ticker.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Collector workers did not terminate within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            // Never let an exception cancel the fixed-rate schedule
            log.error("Collection cycle failed", e);
        }
    }

    /**
     * Runs one cycle and waits for every collector to finish or time out.
     *
     * @return The cycle summary, or null if the scheduler is stopped or a
     *         cycle is already running
     */
    public CycleSummary runCycle() {
        if (!state.compareAndSet(State.IDLE, State.CYCLE_RUNNING)) {
            log.warn("Cycle not started, scheduler is {}", state.get());
            return null;
        }
        try {
            long cycle = cycles.incrementAndGet();
            Instant startedAt = clock.instant();
            long startNanos = System.nanoTime();

            Map<String, CollectionResult> results = new LinkedHashMap<>();
            Map<SourceCollector, Task> tasks = new LinkedHashMap<>();
            for (SourceCollector collector : collectors) {
                String sourceId = collector.getSourceId();
                if (!inFlight.add(sourceId)) {
                    results.put(sourceId, CollectionResult.failure(sourceId, CollectionStatus.SKIPPED,
                        "Previous run still in flight"));
                    continue;
                }
                try {
                    tasks.put(collector, submit(collector));
                } catch (RejectedExecutionException e) {
                    inFlight.remove(sourceId);
                    results.put(sourceId, CollectionResult.failure(sourceId, CollectionStatus.FAILED,
                        "Rejected by worker pool"));
                }
            }

            for (Map.Entry<SourceCollector, Task> entry : tasks.entrySet()) {
                SourceCollector collector = entry.getKey();
                results.put(collector.getSourceId(), await(collector, entry.getValue()));
            }

            for (SourceCollector collector : collectors) {
                CollectionResult result = results.get(collector.getSourceId());
                statusRegistry.record(result);
                if (result.isFailure()) {
                    failedTasks.incrementAndGet();
                }
            }

            CycleSummary summary = new CycleSummary(cycle, startedAt,
                Duration.ofNanos(System.nanoTime() - startNanos), results);
            lastSummary.set(summary);
            cycleTimer.record(summary.elapsed());
            log.info("cycle={} sources={} failed={} appended={} elapsedMs={} outcomes=[{}]",
                cycle, results.size(), summary.failureCount(), summary.totalAppended(),
                summary.elapsed().toMillis(), summary.describe());
            return summary;
        } finally {
            state.compareAndSet(State.CYCLE_RUNNING, State.IDLE);
        }
    }

    private Task submit(SourceCollector collector) {
        AtomicLong startedNanos = new AtomicLong(0);
        Future<CollectionResult> future = workers.submit(() -> {
            startedNanos.set(System.nanoTime());
            try {
                return collector.run();
            } finally {
                inFlight.remove(collector.getSourceId());
            }
        });
        return new Task(future, System.nanoTime(), startedNanos);
    }

    private CollectionResult await(SourceCollector collector, Task task) {
        String sourceId = collector.getSourceId();
        Duration timeout = effectiveTimeout(collector, config);
        long timeoutNanos = timeout.toNanos();
        try {
            while (true) {
                long started = task.startedNanos().get();
                long now = System.nanoTime();
                long remaining = (started == 0 ? task.submittedNanos() : started) + timeoutNanos - now;
                if (remaining <= 0) {
                    break;
                }
                try {
                    return task.future().get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    // Re-evaluate against the actual start time
                }
            }
        } catch (ExecutionException e) {
            log.error("Collector {} threw", sourceId, e.getCause());
            return CollectionResult.failure(sourceId, CollectionStatus.FAILED, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.future().cancel(true);
            return CollectionResult.failure(sourceId, CollectionStatus.FAILED, "Scheduler interrupted");
        }

        task.future().cancel(true);
        if (task.startedNanos().get() == 0) {
            // Never ran, so the task body will not clear the flag
            inFlight.remove(sourceId);
        }
        log.error("Collector {} exceeded its {} deadline and was cancelled", sourceId, timeout);
        return CollectionResult.failure(sourceId, CollectionStatus.TIMED_OUT, "Exceeded " + timeout);
    }

    public State getState() {
        return state.get();
    }

    public CycleSummary getLastSummary() {
        return lastSummary.get();
    }

    public boolean isInFlight(String sourceId) {
        return inFlight.contains(sourceId);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Task(Future<CollectionResult> future, long submittedNanos, AtomicLong startedNanos) {
    }
}
