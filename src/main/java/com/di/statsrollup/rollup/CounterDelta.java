package com.di.statsrollup.rollup;

import com.di.statsrollup.exception.CounterResetException;
import lombok.extern.slf4j.Slf4j;

/**
 * Window contribution of a monotonic counter: {@code last - first}.
 * A negative result is handled according to the configured {@link CounterResetPolicy}.
 */
@Slf4j
public final class CounterDelta {

    private final CounterResetPolicy policy;

    public CounterDelta(CounterResetPolicy policy) {
        this.policy = policy != null ? policy : CounterResetPolicy.PASS_THROUGH;
    }

    /** Plain difference, no policy applied. */
    public static long between(long first, long last) {
        return last - first;
    }

    /**
     * @param counter name used in the log line and exception, e.g. {@code cpu.usage}
     * @throws CounterResetException under {@link CounterResetPolicy#FAIL} when the counter went backwards
     */
    public long delta(String counter, long first, long last) {
        long delta = between(first, last);
        if (delta >= 0) {
            return delta;
        }
        switch (policy) {
            case CLAMP_TO_ZERO:
                log.warn("[ROLLUP] Counter {} went backwards (first={}, last={}); clamping delta to 0", counter, first, last);
                return 0L;
            case FAIL:
                throw new CounterResetException(counter, first, last);
            case PASS_THROUGH:
            default:
                log.warn("[ROLLUP] Counter {} went backwards (first={}, last={}); reporting delta {}", counter, first, last, delta);
                return delta;
        }
    }

    public CounterResetPolicy getPolicy() {
        return policy;
    }
}
