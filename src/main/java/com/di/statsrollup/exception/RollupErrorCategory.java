package com.di.statsrollup.exception;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Stable categories for rollup and run failures, used as the {@code category} tag on failure
 * metrics and in {@code [ROLLUP]}/{@code [JOB]} log lines.
 * <p>Usage: {@code RollupErrorCategory category = RollupErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum RollupErrorCategory {

    EMPTY_WINDOW("Empty window", "Container window contained no samples"),
    MISSING_CATEGORY("Missing disk I/O category", "A per-device disk I/O entry lacked a requested category"),
    MALFORMED_RECORD("Malformed record", "A sample lacked structure the rollup depends on"),
    COUNTER_RESET("Counter reset", "A cumulative counter went backwards within the window"),
    SOURCE_UNAVAILABLE("Source unavailable", "Stats or host metadata could not be fetched"),
    SINK_REJECTED("Sink rejected", "Collector refused or could not receive the report"),
    VALIDATION_ERROR("Validation error", "Input validation failure"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    RollupErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. Subclasses must come before their parents. */
    private static final Map<Predicate<Throwable>, RollupErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof EmptyWindowException, EMPTY_WINDOW);
        MATCHERS.put(t -> t instanceof MissingCategoryException, MISSING_CATEGORY);
        MATCHERS.put(t -> t instanceof MalformedRecordException, MALFORMED_RECORD);
        MATCHERS.put(t -> t instanceof CounterResetException, COUNTER_RESET);
        MATCHERS.put(t -> t instanceof SourceUnavailableException, SOURCE_UNAVAILABLE);
        MATCHERS.put(t -> t instanceof SinkRejectedException, SINK_REJECTED);
        MATCHERS.put(RollupErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static RollupErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        Throwable target = unwrap(exception);
        for (Map.Entry<Predicate<Throwable>, RollupErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(target)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /** Looks through the wrappers added by {@code CompletableFuture} so the real cause is classified. */
    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof java.util.concurrent.CompletionException
                || current instanceof java.util.concurrent.ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    /** Lower-case form used as a metric tag value. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return name();
    }
}
