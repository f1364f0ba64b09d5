package com.framepipe.test;

import com.framepipe.frame.OutputLocation;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Output location that only counts how often it was prepared.
 */
public class RecordingOutputLocation implements OutputLocation {

    private final AtomicInteger prepareCalls = new AtomicInteger();

    @Override
    public void prepare() {
        prepareCalls.incrementAndGet();
    }

    public int prepareCalls() {
        return prepareCalls.get();
    }

    public boolean wasPrepared() {
        return prepareCalls.get() > 0;
    }
}
