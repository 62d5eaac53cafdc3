package com.di.statsrollup.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Propagates SLF4J MDC (e.g. {@code runId} set by {@link com.di.statsrollup.job.RollupJobService})
 * to worker threads so that per-container rollup logs carry the run they belong to.
 * <p>
 * MDC is thread-local; without propagation, logs from an {@code ExecutorService} or
 * {@code CompletableFuture} lose the run's correlation ID.
 * <p>
 * Usage: {@code CompletableFuture.supplyAsync(MdcPropagation.wrapSupplier(() -> rollup(w)), executor)}
 */
public final class MdcPropagation {

    public static final String RUN_ID = "runId";
    public static final String CONTAINER = "container";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Supplier that sets it for the duration of the task
     * and removes it in {@code finally}. Meant for {@code CompletableFuture.supplyAsync}.
     */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.get();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     *
     * @return copy of MDC context; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
