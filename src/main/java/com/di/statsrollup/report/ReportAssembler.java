package com.di.statsrollup.report;

import com.di.statsrollup.model.ContainerSummary;
import com.di.statsrollup.model.Report;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Builds the per-run {@link Report}: wall-clock timestamp, window length, summaries in the order
 * they were produced, and host metadata passed through as received. Never fails; an empty
 * summary list yields a report for a window with no qualifying containers.
 */
@Slf4j
@Component
public class ReportAssembler {

    private final Clock clock;

    public ReportAssembler(Clock clock) {
        this.clock = clock;
    }

    public Report assemble(List<ContainerSummary> summaries, long windowSeconds, JsonNode hostMetadata) {
        long timestamp = clock.instant().getEpochSecond();
        Report report = new Report(timestamp, windowSeconds, summaries, hostMetadata);
        log.debug("[REPORT] Assembled report timestamp={} interval={}s containers={}",
                timestamp, windowSeconds, report.stats().size());
        return report;
    }
}
