package com.di.statsrollup.job;

import com.di.statsrollup.model.Report;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one successful run: the report that was delivered plus bookkeeping about
 * the containers that did not make it in.
 */
@Value
@Builder
public class RollupRunResult {
    String runId;
    Report report;
    /** Containers returned by the source. */
    int containersSeen;
    /** Containers the selector did not match. */
    int containersSkipped;
    /** Containers selected but whose rollup failed; not part of the report. */
    List<ContainerFailure> failures;
    long durationMs;

    public int getContainersReported() {
        return report != null ? report.stats().size() : 0;
    }
}
