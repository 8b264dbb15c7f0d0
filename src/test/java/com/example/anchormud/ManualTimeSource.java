package com.example.anchormud;

import com.example.anchormud.util.TimeSource;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Time source advanced by hand.
 */
public class ManualTimeSource implements TimeSource {

    private final AtomicLong now = new AtomicLong(1_000_000L);

    @Override
    public long currentMillis() {
        return now.get();
    }

    public void advance(long millis) {
        now.addAndGet(millis);
    }
}
