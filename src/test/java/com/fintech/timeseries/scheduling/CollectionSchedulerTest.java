package com.fintech.timeseries.scheduling;

import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.ingestion.CollectionResult;
import com.fintech.timeseries.ingestion.CollectionStatus;
import com.fintech.timeseries.ingestion.CollectorStatus;
import com.fintech.timeseries.ingestion.CollectorStatusRegistry;
import com.fintech.timeseries.ingestion.SourceCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("CollectionScheduler Tests")
class CollectionSchedulerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-10T00:00:00Z"), ZoneOffset.UTC);

    private TimeSeriesProperties.Scheduler config;
    private CollectorStatusRegistry registry;
    private CollectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new TimeSeriesProperties.Scheduler();
        config.setEnabled(false);
        config.setWorkerThreads(4);
        config.setTaskTimeout(Duration.ofMillis(300));
        registry = new CollectorStatusRegistry(CLOCK);
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    @DisplayName("Should run every collector once per cycle and record outcomes")
    void testCycle() {
        SourceCollector prices = collector("prices", CollectionResult.success("prices", 5, 0, 1000L));
        SourceCollector flows = collector("flows", CollectionResult.noNewData("flows", 0, 900L));
        scheduler = newScheduler(prices, flows);

        CycleSummary summary = scheduler.runCycle();

        assertThat(summary.cycle()).isEqualTo(1);
        assertThat(summary.statusOf("prices")).isEqualTo(CollectionStatus.SUCCESS);
        assertThat(summary.statusOf("flows")).isEqualTo(CollectionStatus.NO_NEW_DATA);
        assertThat(summary.totalAppended()).isEqualTo(5);
        assertThat(summary.describe()).isEqualTo("flows=NO_NEW_DATA prices=SUCCESS(+5)");
        assertThat(registry.get("prices")).map(CollectorStatus::watermark).hasValue(1000L);
        assertThat(scheduler.getLastSummary()).isSameAs(summary);
        assertThat(scheduler.getState()).isEqualTo(CollectionScheduler.State.IDLE);
    }

    @Test
    @DisplayName("A failing collector does not affect the others")
    void testFailureIsolation() {
        SourceCollector broken = mock(SourceCollector.class);
        when(broken.getSourceId()).thenReturn("broken");
        when(broken.run()).thenThrow(new IllegalStateException("boom"));
        SourceCollector healthy = collector("healthy", CollectionResult.success("healthy", 3, 0, 1000L));
        scheduler = newScheduler(broken, healthy);

        CycleSummary summary = scheduler.runCycle();

        assertThat(summary.statusOf("broken")).isEqualTo(CollectionStatus.FAILED);
        assertThat(summary.statusOf("healthy")).isEqualTo(CollectionStatus.SUCCESS);
        assertThat(registry.get("broken")).map(CollectorStatus::consecutiveFailures).hasValue(1);
        assertThat(scheduler.isInFlight("broken")).isFalse();
    }

    @Test
    @DisplayName("A hung collector is cancelled at its deadline while the others complete")
    void testHungCollectorTimesOut() {
        SourceCollector hung = mock(SourceCollector.class);
        when(hung.getSourceId()).thenReturn("hung");
        when(hung.run()).thenAnswer(invocation -> {
            Thread.sleep(30_000);
            return CollectionResult.success("hung", 1, 0, 1L);
        });
        SourceCollector healthy = collector("healthy", CollectionResult.success("healthy", 3, 0, 1000L));
        scheduler = newScheduler(hung, healthy);

        CycleSummary summary = scheduler.runCycle();

        assertThat(summary.statusOf("hung")).isEqualTo(CollectionStatus.TIMED_OUT);
        assertThat(summary.statusOf("healthy")).isEqualTo(CollectionStatus.SUCCESS);
        assertThat(summary.elapsed()).isLessThan(Duration.ofSeconds(10));
        await().atMost(Duration.ofSeconds(5)).until(() -> !scheduler.isInFlight("hung"));

        CycleSummary next = scheduler.runCycle();

        assertThat(next.statusOf("hung")).isEqualTo(CollectionStatus.TIMED_OUT);
        assertThat(next.statusOf("healthy")).isEqualTo(CollectionStatus.SUCCESS);
        verify(hung, times(2)).run();
    }

    @Test
    @DisplayName("A source still running from the previous cycle is skipped, then retried once free")
    void testSkipsInFlightSource() {
        AtomicBoolean released = new AtomicBoolean(false);
        SourceCollector stubborn = mock(SourceCollector.class);
        when(stubborn.getSourceId()).thenReturn("stubborn");
        when(stubborn.run()).thenAnswer(invocation -> {
            while (!released.get()) {
                try {
                    Thread.sleep(10);
                } catch (InterruptedException ignored) {
                    // keeps running after cancellation
                }
            }
            return CollectionResult.noNewData("stubborn", 0, null);
        });
        scheduler = newScheduler(stubborn);

        assertThat(scheduler.runCycle().statusOf("stubborn")).isEqualTo(CollectionStatus.TIMED_OUT);
        assertThat(scheduler.isInFlight("stubborn")).isTrue();
        assertThat(scheduler.runCycle().statusOf("stubborn")).isEqualTo(CollectionStatus.SKIPPED);

        released.set(true);
        await().atMost(Duration.ofSeconds(5)).until(() -> !scheduler.isInFlight("stubborn"));

        assertThat(scheduler.runCycle().statusOf("stubborn")).isEqualTo(CollectionStatus.NO_NEW_DATA);
        assertThat(registry.get("stubborn")).map(CollectorStatus::errorCount).hasValue(2L);
    }

    @Test
    @DisplayName("Should honour a per-source task timeout over the default")
    void testPerSourceTimeout() {
        SourceCollector slow = mock(SourceCollector.class);
        when(slow.getSourceId()).thenReturn("slow");
        when(slow.getTaskTimeout()).thenReturn(Duration.ofSeconds(5));
        when(slow.run()).thenAnswer(invocation -> {
            Thread.sleep(600);
            return CollectionResult.success("slow", 2, 0, 10L);
        });
        scheduler = newScheduler(slow);

        assertThat(scheduler.runCycle().statusOf("slow")).isEqualTo(CollectionStatus.SUCCESS);
    }

    @Test
    @DisplayName("Should not run cycles after stop")
    void testStop() {
        SourceCollector collector = collector("prices", CollectionResult.noNewData("prices", 0, null));
        scheduler = newScheduler(collector);

        scheduler.stop();

        assertThat(scheduler.getState()).isEqualTo(CollectionScheduler.State.STOPPED);
        assertThat(scheduler.runCycle()).isNull();
        verify(collector, never()).run();
    }

    @Test
    @DisplayName("Should reject a task timeout that is not shorter than the interval")
    void testTimeoutLongerThanInterval() {
        config.setInterval(Duration.ofMinutes(5));
        SourceCollector slow = collector("rooftop", CollectionResult.noNewData("rooftop", 0, 0L));
        when(slow.getTaskTimeout()).thenReturn(Duration.ofMinutes(6));
        SourceCollector prices = collector("prices", CollectionResult.noNewData("prices", 0, 0L));

        assertThatThrownBy(() -> newScheduler(prices, slow))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("rooftop")
            .hasMessageContaining("shorter than the scheduler interval");
    }

    @Test
    @DisplayName("Should reject more sources than workers when queued waves can outlast the interval")
    void testQueuedWavesLongerThanInterval() {
        config.setInterval(Duration.ofMinutes(5));
        config.setTaskTimeout(Duration.ofMinutes(2));
        config.setWorkerThreads(1);
        SourceCollector a = collector("a", CollectionResult.noNewData("a", 0, 0L));
        SourceCollector b = collector("b", CollectionResult.noNewData("b", 0, 0L));
        SourceCollector c = collector("c", CollectionResult.noNewData("c", 0, 0L));

        assertThatThrownBy(() -> newScheduler(a, b, c))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("worker-threads");

        config.setWorkerThreads(2);
        scheduler = newScheduler(a, b, c);
        assertThat(scheduler.runCycle().results()).hasSize(3);
    }

    private CollectionScheduler newScheduler(SourceCollector... collectors) {
        return new CollectionScheduler(List.of(collectors), config, registry, CLOCK, new SimpleMeterRegistry());
    }

    private static SourceCollector collector(String id, CollectionResult result) {
        SourceCollector collector = mock(SourceCollector.class);
        when(collector.getSourceId()).thenReturn(id);
        when(collector.run()).thenReturn(result);
        return collector;
    }
}
