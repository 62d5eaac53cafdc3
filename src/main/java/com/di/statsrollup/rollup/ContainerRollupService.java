package com.di.statsrollup.rollup;

import com.di.statsrollup.exception.EmptyWindowException;
import com.di.statsrollup.exception.MalformedRecordException;
import com.di.statsrollup.model.ContainerStats;
import com.di.statsrollup.model.ContainerSummary;
import com.di.statsrollup.model.ContainerWindow;
import com.di.statsrollup.model.CpuSummary;
import com.di.statsrollup.model.DiskIoSummary;
import com.di.statsrollup.model.GaugeSummary;
import com.di.statsrollup.model.NetworkSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Reduces one container window to one {@link ContainerSummary}.
 *
 * <p>Gauges (memory, CPU load, the four network counters as sampled) are tracked with one
 * {@link RunningAggregate} each over the whole window and reported as average/min/max, the
 * average dividing by the window's actual sample count. Cumulative counters (CPU usage total,
 * disk I/O bytes per category) are reported as the delta between the first and last sample.
 *
 * <p>Stateless; every call works on its own trackers, so windows can be rolled up concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContainerRollupService {

    static final long BYTES_PER_KILOBYTE = 1024L;

    private final DiskIoReducer diskIoReducer;
    private final CounterDelta counterDelta;

    /**
     * @throws EmptyWindowException     if the window has no samples
     * @throws MalformedRecordException if a sample lacks a section the rollup reads
     * @throws com.di.statsrollup.exception.MissingCategoryException if a disk entry lacks a category
     * @throws com.di.statsrollup.exception.CounterResetException    if a counter went backwards under the FAIL policy
     */
    public ContainerSummary rollup(ContainerWindow window) {
        if (window == null || window.isEmpty()) {
            throw new EmptyWindowException(window != null ? window.name() : null);
        }
        int n = window.size();

        RunningAggregate memory = RunningAggregate.empty();
        RunningAggregate load = RunningAggregate.empty();
        RunningAggregate txBytes = RunningAggregate.empty();
        RunningAggregate rxBytes = RunningAggregate.empty();
        RunningAggregate txPackets = RunningAggregate.empty();
        RunningAggregate rxPackets = RunningAggregate.empty();

        int index = 0;
        for (ContainerStats sample : window.samples()) {
            requireSections(window.name(), index++, sample);
            memory = memory.update(sample.memory().usage() / BYTES_PER_KILOBYTE);
            load = load.update(sample.cpu().loadAverage());
            txBytes = txBytes.update(sample.network().txBytes());
            rxBytes = rxBytes.update(sample.network().rxBytes());
            txPackets = txPackets.update(sample.network().txPackets());
            rxPackets = rxPackets.update(sample.network().rxPackets());
        }

        ContainerStats first = window.first();
        ContainerStats last = window.last();

        long cpuUsage = counterDelta.delta(window.name() + ".cpu.usage",
                cpuTotal(window.name(), first), cpuTotal(window.name(), last));

        DiskIoSummary diskio = new DiskIoSummary(
                diskDelta(window.name(), first, last, DiskIoCategory.ASYNC),
                diskDelta(window.name(), first, last, DiskIoCategory.SYNC),
                diskDelta(window.name(), first, last, DiskIoCategory.READ),
                diskDelta(window.name(), first, last, DiskIoCategory.WRITE));

        ContainerSummary summary = ContainerSummary.builder()
                .name(window.name())
                .ts(windowStart(window))
                .cpu(new CpuSummary(cpuUsage, gauge(load, n)))
                .memory(gauge(memory, n))
                .network(new NetworkSummary(
                        gauge(txBytes, n),
                        gauge(rxBytes, n),
                        gauge(txPackets, n),
                        gauge(rxPackets, n)))
                .diskio(diskio)
                .build();

        log.debug("[ROLLUP] Rolled up container={} samples={} cpuUsage={} memoryAveKb={}",
                window.name(), n, cpuUsage, summary.memory().ave());
        return summary;
    }

    private long diskDelta(String name, ContainerStats first, ContainerStats last, DiskIoCategory category) {
        long start = diskIoReducer.sumCategory(first.diskio(), category);
        long end = diskIoReducer.sumCategory(last.diskio(), category);
        return counterDelta.delta(name + ".diskio." + category.getKey().toLowerCase(Locale.ROOT), start, end);
    }

    private static GaugeSummary gauge(RunningAggregate aggregate, int sampleCount) {
        return new GaugeSummary(
                aggregate.average(sampleCount),
                aggregate.getMin().orElseThrow(),
                aggregate.getMax().orElseThrow());
    }

    private static long cpuTotal(String name, ContainerStats sample) {
        if (sample.cpu().usage() == null) {
            throw new MalformedRecordException("Sample of '" + name + "' has no cpu.usage section");
        }
        return sample.cpu().usage().total();
    }

    private static long windowStart(ContainerWindow window) {
        try {
            return window.windowStartEpochSeconds();
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(e.getMessage(), e);
        }
    }

    private static void requireSections(String name, int index, ContainerStats sample) {
        if (sample == null) {
            throw new MalformedRecordException("Sample #" + index + " of '" + name + "' is null");
        }
        if (sample.memory() == null || sample.cpu() == null || sample.network() == null) {
            throw new MalformedRecordException("Sample #" + index + " of '" + name
                    + "' is missing its memory, cpu or network section");
        }
    }
}
