package com.di.statsrollup.rollup;

import com.di.statsrollup.exception.CounterResetException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for CounterDelta.
 */
@DisplayName("CounterDelta Tests")
class CounterDeltaTest {

    @Test
    @DisplayName("Delta should be last minus first")
    void testBetween() {
        assertEquals(120L, CounterDelta.between(100L, 220L));
        assertEquals(-20L, CounterDelta.between(120L, 100L));
    }

    @ParameterizedTest
    @EnumSource(CounterResetPolicy.class)
    @DisplayName("Constant counter should give zero under every policy")
    void testConstantCounter(CounterResetPolicy policy) {
        assertEquals(0L, new CounterDelta(policy).delta("c", 500L, 500L));
    }

    @ParameterizedTest
    @EnumSource(CounterResetPolicy.class)
    @DisplayName("Increasing counter should give a positive delta under every policy")
    void testIncreasingCounter(CounterResetPolicy policy) {
        assertEquals(70L, new CounterDelta(policy).delta("c", 150L, 220L));
    }

    @Test
    @DisplayName("PASS_THROUGH should report a negative delta unchanged")
    void testPassThrough() {
        assertEquals(-900L, new CounterDelta(CounterResetPolicy.PASS_THROUGH).delta("cpu.usage", 1000L, 100L));
    }

    @Test
    @DisplayName("CLAMP_TO_ZERO should report zero for a negative delta")
    void testClampToZero() {
        assertEquals(0L, new CounterDelta(CounterResetPolicy.CLAMP_TO_ZERO).delta("cpu.usage", 1000L, 100L));
    }

    @Test
    @DisplayName("FAIL should throw on a negative delta")
    void testFail() {
        CounterDelta delta = new CounterDelta(CounterResetPolicy.FAIL);
        CounterResetException ex = assertThrows(CounterResetException.class,
                () -> delta.delta("diskio.read", 1000L, 100L));
        assertTrue(ex.getMessage().contains("diskio.read"));
    }

    @Test
    @DisplayName("Null policy should default to PASS_THROUGH")
    void testNullPolicy() {
        assertEquals(CounterResetPolicy.PASS_THROUGH, new CounterDelta(null).getPolicy());
    }
}
