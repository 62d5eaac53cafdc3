package com.di.statsrollup.util;

import com.di.statsrollup.exception.RollupErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for rollup runs: run outcomes and duration, containers rolled up, skipped and failed.
 */
@Slf4j
@Component
public class RollupMetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Counter runSuccessCounter;
    private final Counter runFailureCounter;
    private final Timer runTimer;
    private final Counter containersRolledUpCounter;
    private final Counter containersSkippedCounter;
    private final DistributionSummary samplesPerWindow;

    public RollupMetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runSuccessCounter = Counter.builder("statsrollup.run.total")
                .description("Total number of rollup runs")
                .tag("status", "success")
                .register(meterRegistry);

        this.runFailureCounter = Counter.builder("statsrollup.run.total")
                .description("Total number of rollup runs")
                .tag("status", "error")
                .register(meterRegistry);

        this.runTimer = Timer.builder("statsrollup.run.duration")
                .description("Time taken by one run, fetch to delivery")
                .register(meterRegistry);

        this.containersRolledUpCounter = Counter.builder("statsrollup.containers.rolledup")
                .description("Containers summarised into a report")
                .register(meterRegistry);

        this.containersSkippedCounter = Counter.builder("statsrollup.containers.skipped")
                .description("Containers not matched by the selector")
                .register(meterRegistry);

        this.samplesPerWindow = DistributionSummary.builder("statsrollup.window.samples")
                .description("Samples received per container window")
                .baseUnit("samples")
                .register(meterRegistry);
    }

    public void recordRunSuccess(long durationMs) {
        runSuccessCounter.increment();
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailure(long durationMs, RollupErrorCategory category) {
        runFailureCounter.increment();
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded run failure: category={}, durationMs={}", category, durationMs);
    }

    public void recordContainerRolledUp(int sampleCount) {
        containersRolledUpCounter.increment();
        samplesPerWindow.record(sampleCount);
    }

    public void recordContainerSkipped() {
        containersSkippedCounter.increment();
    }

    /** Failures are tagged by category; the counter is registered lazily per category. */
    public void recordContainerFailure(RollupErrorCategory category) {
        Counter.builder("statsrollup.containers.failed")
                .description("Containers whose rollup failed")
                .tag("category", category.tag())
                .register(meterRegistry)
                .increment();
    }
}
