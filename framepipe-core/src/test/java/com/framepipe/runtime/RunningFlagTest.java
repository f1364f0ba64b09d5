package com.framepipe.runtime;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunningFlagTest {

    @Test
    void testStartsRunning() {
        assertTrue(new RunningFlag().isRunning());
    }

    @Test
    void testStopIsMonotonic() {
        RunningFlag flag = new RunningFlag();

        assertTrue(flag.stop());
        assertFalse(flag.isRunning());
        assertFalse(flag.stop(), "second stop should not report a transition");
        assertFalse(flag.isRunning());
    }

    @Test
    void testExactlyOneConcurrentStopWins() throws Exception {
        RunningFlag flag = new RunningFlag();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> results = new ArrayList<>();

        for (int i = 0; i < 8; i++) {
            results.add(executor.submit(() -> {
                go.await();
                return flag.stop();
            }));
        }
        go.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get()) {
                winners++;
            }
        }

        assertEquals(1, winners);
        executor.shutdown();
        assertTrue(executor.awaitTermination(1, TimeUnit.SECONDS));
    }
}
