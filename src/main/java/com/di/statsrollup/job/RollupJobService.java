package com.di.statsrollup.job;

import com.di.statsrollup.config.RollupProperties;
import com.di.statsrollup.exception.RollupErrorCategory;
import com.di.statsrollup.model.ContainerInfo;
import com.di.statsrollup.model.ContainerSummary;
import com.di.statsrollup.model.ContainerWindow;
import com.di.statsrollup.model.Report;
import com.di.statsrollup.report.ReportAssembler;
import com.di.statsrollup.rollup.ContainerRollupService;
import com.di.statsrollup.selector.ContainerSelector;
import com.di.statsrollup.sink.ReportSink;
import com.di.statsrollup.source.ContainerStatsSource;
import com.di.statsrollup.source.MachineInfoSource;
import com.di.statsrollup.util.MdcPropagation;
import com.di.statsrollup.util.RollupMetricsCollector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One rollup run: fetch every container's window, keep the ones the selector matches, roll
 * them up, attach host metadata and deliver the report.
 *
 * <h3>Error handling</h3>
 * A failing container (empty window, malformed sample, counter reset under FAIL) is logged,
 * counted and left out; the others still make it into the report. Failing to read the source
 * or to deliver the report aborts the run and propagates to the caller. Nothing is retried.
 *
 * <h3>Concurrency</h3>
 * Windows are rolled up on a fixed pool of {@code statsrollup.rollup.parallelism} threads,
 * created and shut down per run. Summaries keep the source's container order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollupJobService {

    private final ContainerStatsSource statsSource;
    private final MachineInfoSource machineInfoSource;
    private final ContainerSelector containerSelector;
    private final ContainerRollupService rollupService;
    private final ReportAssembler reportAssembler;
    private final ReportSink reportSink;
    private final RollupMetricsCollector metricsCollector;
    private final RollupProperties props;
    private final ObjectMapper objectMapper;

    /**
     * @throws com.di.statsrollup.exception.SourceUnavailableException if stats or machine info cannot be fetched
     * @throws com.di.statsrollup.exception.SinkRejectedException      if the collector does not accept the report
     */
    public RollupRunResult runOnce() {
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MdcPropagation.RUN_ID, runId);
        long startMs = System.currentTimeMillis();
        try {
            log.info("[JOB] Starting rollup run: matchType={} windowSeconds={}",
                    containerSelector.getMatchType(), props.getWindowSeconds());

            List<ContainerInfo> containers = statsSource.fetchContainers();
            List<ContainerWindow> windows = selectWindows(containers);
            int skipped = containers.size() - windows.size();

            List<ContainerFailure> failures = new ArrayList<>();
            List<ContainerSummary> summaries = rollupAll(windows, failures);

            JsonNode machine = machineInfoSource.fetchMachineInfo();
            Report report = reportAssembler.assemble(summaries, props.getWindowSeconds(), machine);
            logReport(report);
            reportSink.send(report);

            long durationMs = System.currentTimeMillis() - startMs;
            metricsCollector.recordRunSuccess(durationMs);
            log.info("[JOB] Run complete: seen={} skipped={} reported={} failed={} durationMs={}",
                    containers.size(), skipped, summaries.size(), failures.size(), durationMs);

            return RollupRunResult.builder()
                    .runId(runId)
                    .report(report)
                    .containersSeen(containers.size())
                    .containersSkipped(skipped)
                    .failures(List.copyOf(failures))
                    .durationMs(durationMs)
                    .build();
        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - startMs;
            RollupErrorCategory category = RollupErrorCategory.categorize(e);
            metricsCollector.recordRunFailure(durationMs, category);
            log.error("[JOB] Run failed: category={} message={}", category, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(MdcPropagation.RUN_ID);
        }
    }

    private List<ContainerWindow> selectWindows(List<ContainerInfo> containers) {
        List<ContainerWindow> windows = new ArrayList<>(containers.size());
        for (ContainerInfo container : containers) {
            Optional<String> name = containerSelector.select(container.aliases());
            if (name.isEmpty()) {
                metricsCollector.recordContainerSkipped();
                log.debug("[JOB] Skipping container {} (aliases={})", container.name(), container.aliases());
                continue;
            }
            windows.add(new ContainerWindow(name.get(), container.stats()));
        }
        return windows;
    }

    private List<ContainerSummary> rollupAll(List<ContainerWindow> windows, List<ContainerFailure> failures) {
        if (windows.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(props.getRollup().getParallelism(), windows.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, rollupThreadFactory());

        try {
            List<CompletableFuture<ContainerOutcome>> futures = new ArrayList<>(windows.size());
            for (ContainerWindow window : windows) {
                CompletableFuture<ContainerOutcome> f = CompletableFuture
                        .supplyAsync(MdcPropagation.wrapSupplier(() -> rollupOne(window)), executor)
                        // a thrown rollup becomes a failed outcome so join() below never throws
                        .exceptionally(ex -> ContainerOutcome.failed(window, ex));
                futures.add(f);
            }

            List<ContainerSummary> summaries = new ArrayList<>(windows.size());
            for (CompletableFuture<ContainerOutcome> f : futures) {
                ContainerOutcome outcome = f.join();
                if (outcome.summary() != null) {
                    summaries.add(outcome.summary());
                } else {
                    failures.add(outcome.failure());
                    metricsCollector.recordContainerFailure(outcome.failure().category());
                }
            }
            return summaries;
        } finally {
            executor.shutdown();
        }
    }

    private ContainerOutcome rollupOne(ContainerWindow window) {
        MDC.put(MdcPropagation.CONTAINER, window.name());
        try {
            ContainerSummary summary = rollupService.rollup(window);
            metricsCollector.recordContainerRolledUp(window.size());
            return new ContainerOutcome(summary, null);
        } catch (RuntimeException e) {
            ContainerOutcome outcome = ContainerOutcome.failed(window, e);
            log.warn("[ROLLUP] Container {} left out of report: category={} message={}",
                    window.name(), outcome.failure().category(), e.getMessage());
            return outcome;
        } finally {
            MDC.remove(MdcPropagation.CONTAINER);
        }
    }

    private void logReport(Report report) {
        if (!log.isDebugEnabled()) {
            return;
        }
        try {
            log.debug("[JOB] Report: {}", objectMapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            log.debug("[JOB] Report could not be rendered for logging: {}", e.getOriginalMessage());
        }
    }

    private static ThreadFactory rollupThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "rollup-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record ContainerOutcome(ContainerSummary summary, ContainerFailure failure) {

        static ContainerOutcome failed(ContainerWindow window, Throwable ex) {
            RollupErrorCategory category = RollupErrorCategory.categorize(ex);
            return new ContainerOutcome(null, new ContainerFailure(window.name(), category, ex.getMessage()));
        }
    }
}
