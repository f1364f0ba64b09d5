package com.framepipe.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AsyncAssertion functionality.
 */
class AsyncAssertionTest {

    @Test
    void shouldWaitForConditionToBecomeTrue() {
        AtomicBoolean flag = new AtomicBoolean(false);

        new Thread(() -> {
            try {
                Thread.sleep(100);
                flag.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }).start();

        AsyncAssertion.eventually(flag::get, Duration.ofSeconds(1));

        assertTrue(flag.get());
    }

    @Test
    void shouldThrowIfConditionNeverBecomesTrue() {
        assertThrows(AssertionError.class, () -> AsyncAssertion.eventually(() -> false, Duration.ofMillis(200)));
    }

    @Test
    void shouldReportLastErrorFromCondition() {
        AssertionError error = assertThrows(AssertionError.class, () ->
                AsyncAssertion.eventually(() -> {
                    throw new IllegalStateException("boom");
                }, Duration.ofMillis(100)));

        assertTrue(error.getMessage().contains("boom"));
    }

    @Test
    void shouldAwaitValue() {
        AtomicInteger counter = new AtomicInteger(0);

        new Thread(() -> {
            try {
                Thread.sleep(100);
                counter.set(42);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }).start();

        int result = AsyncAssertion.awaitValue(counter::get, 42, Duration.ofSeconds(1));

        assertEquals(42, result);
    }

    @Test
    void shouldIncludeValueHistoryOnTimeout() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.awaitValue(() -> 1, 2, Duration.ofMillis(100)));

        assertTrue(error.getMessage().contains("Value history: [1]"), error.getMessage());
    }
}
